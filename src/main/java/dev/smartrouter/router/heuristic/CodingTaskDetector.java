package dev.smartrouter.router.heuristic;

import dev.smartrouter.config.ScoringProperties;
import dev.smartrouter.dto.request.ChatCompletionRequest;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Flags requests that look like programming work: code fences, language keywords and
 * snippets, or phrasing such as "write code", "debug", "refactor". Only user messages count.
 */
@Component
public class CodingTaskDetector {

    private final Pattern codingPatterns;

    public CodingTaskDetector(ScoringProperties scoring) {
        this.codingPatterns = KeywordPatterns.wordStart(scoring.codingPatterns());
    }

    public boolean isCodingTask(ChatCompletionRequest request) {
        String text = request.userText();
        return !text.isEmpty() && codingPatterns.matcher(text).find();
    }
}
