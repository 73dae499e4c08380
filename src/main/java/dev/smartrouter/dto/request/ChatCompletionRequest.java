package dev.smartrouter.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The parts of an OpenAI-style chat-completion request that routing looks at.
 * Everything else in the body is ignored here and passed through by the proxy layer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatCompletionRequest(String model, List<ChatMessage> messages,
                                    List<JsonNode> tools, List<JsonNode> functions, Boolean stream) {

    public ChatCompletionRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
        functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public static ChatCompletionRequest of(List<ChatMessage> messages) {
        return new ChatCompletionRequest(null, messages, null, null, null);
    }

    public int turnCount() {
        return messages.size();
    }

    public String fullText() {
        return joinText(m -> true);
    }

    public String systemText() {
        return joinText(m -> m.hasRole("system"));
    }

    /** Text of the most recent user message, empty when there is none. */
    public String lastUserText() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).hasRole("user")) return messages.get(i).text();
        }
        return "";
    }

    public String userText() {
        return joinText(m -> m.hasRole("user"));
    }

    public boolean hasSystemPrompt() {
        return messages.stream().anyMatch(m -> m.hasRole("system"));
    }

    public boolean hasImages() {
        return messages.stream().anyMatch(ChatMessage::hasImage);
    }

    /**
     * Number of distinct declared tools across {@code tools} and legacy {@code functions},
     * keyed by function name. Unnamed declarations count individually.
     */
    public int distinctToolCount() {
        Set<String> names = new HashSet<>();
        int unnamed = 0;
        for (JsonNode tool : Stream.concat(tools.stream(), functions.stream()).toList()) {
            String name = tool.path("function").path("name").asText(null);
            if (name == null) name = tool.path("name").asText(null);
            if (name == null) unnamed++;
            else names.add(name);
        }
        return names.size() + unnamed;
    }

    private String joinText(Predicate<ChatMessage> filter) {
        return messages.stream().filter(filter).map(ChatMessage::text).collect(Collectors.joining("\n"));
    }
}
