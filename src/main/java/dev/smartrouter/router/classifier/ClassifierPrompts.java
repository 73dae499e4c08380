package dev.smartrouter.router.classifier;

import dev.smartrouter.domain.enums.ModelTier;
import dev.smartrouter.dto.request.ChatCompletionRequest;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prompt construction and answer parsing for the tier classifier.
 */
public final class ClassifierPrompts {

    private static final Pattern TIER_TOKEN = Pattern.compile("\\b(SMALL|MEDIUM|LARGE)\\b", Pattern.CASE_INSENSITIVE);

    private static final String INSTRUCTIONS = """
            You are a request router. Decide how capable a language model must be to answer the request below well.
            Reply with exactly one word on the first line: SMALL, MEDIUM or LARGE.
            SMALL: short factual questions, translation, reformatting, simple lookups.
            MEDIUM: explanations, summaries of longer text, ordinary code edits, multi-part questions.
            LARGE: deep analysis, multi-step reasoning, architecture or design work, large code changes.
            You may add one short sentence of justification on the second line.""";

    private ClassifierPrompts() {}

    /**
     * Instructions + request context + the last user message, capped at {@code maxChars}.
     */
    public static String build(ChatCompletionRequest request, int maxChars) {
        String text = request.lastUserText();
        boolean truncated = text.length() > maxChars;
        if (truncated) {
            int end = maxChars;
            // keep surrogate pairs whole
            if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) end--;
            text = text.substring(0, end);
        }

        var sb = new StringBuilder(INSTRUCTIONS);
        sb.append("\n\nContext: %d messages in the conversation, %d tools declared%s."
                .formatted(request.turnCount(), request.distinctToolCount(),
                        request.hasImages() ? ", includes images" : ""));
        sb.append("\n\n--- REQUEST ---\n")
          .append(text);
        if (truncated) sb.append("\n[truncated]");
        sb.append("\n--- END REQUEST ---");
        return sb.toString();
    }

    /** First tier label in the answer, case-insensitive. */
    public static Optional<ModelTier> parseTier(String answer) {
        if (answer == null || answer.isBlank()) return Optional.empty();
        Matcher m = TIER_TOKEN.matcher(answer);
        return m.find() ? Optional.of(ModelTier.valueOf(m.group(1).toUpperCase(Locale.ROOT))) : Optional.empty();
    }
}
