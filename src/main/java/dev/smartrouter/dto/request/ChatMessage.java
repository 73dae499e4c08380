package dev.smartrouter.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Set;

/**
 * One chat message. {@code content} is either a string or an array of typed parts
 * ({@code text}, {@code image_url}, ...), so it is kept as a tree.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(String role, JsonNode content) {

    private static final Set<String> IMAGE_PARTS = Set.of("image_url", "image", "input_image");

    public static ChatMessage of(String role, String text) {
        return new ChatMessage(role, JsonNodeFactory.instance.textNode(text));
    }

    public boolean hasRole(String expected) {
        return expected.equals(role);
    }

    /** Concatenated text of the message; non-text parts contribute nothing. */
    public String text() {
        if (content == null || content.isNull()) return "";
        if (content.isTextual()) return content.asText();
        if (!content.isArray()) return "";
        StringBuilder sb = new StringBuilder();
        for (JsonNode part : content) {
            if ("text".equals(part.path("type").asText()) && part.hasNonNull("text")) {
                if (sb.length() > 0) sb.append('\n');
                sb.append(part.get("text").asText());
            }
        }
        return sb.toString();
    }

    public boolean hasImage() {
        if (content == null || !content.isArray()) return false;
        for (JsonNode part : content) {
            if (IMAGE_PARTS.contains(part.path("type").asText())) return true;
        }
        return false;
    }
}
