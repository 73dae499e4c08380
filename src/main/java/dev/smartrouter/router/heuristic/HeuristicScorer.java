package dev.smartrouter.router.heuristic;

import dev.smartrouter.config.ScoringProperties;
import dev.smartrouter.domain.valueobject.HeuristicResult;
import dev.smartrouter.domain.valueobject.ScoreBand;
import dev.smartrouter.dto.request.ChatCompletionRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based complexity score from request content alone, 0.0 (trivial) to 1.0 (very complex).
 *
 * <p>Signals, in evaluation order:
 * <pre>
 *  token count        0.0 - 0.5   all messages, ~4 chars per token
 *  conversation depth 0.0 - 0.15  message count
 *  tools              0.1 - 0.2   distinct declared tools
 *  system prompt      0.0 - 0.15  system message tokens
 *  code fences        0.05 - 0.15
 *  images             0.1
 *  complex vocabulary 0.3 - 0.6   last user message, scales with match count
 *  simple vocabulary  -0.15       last user message, only without complex matches
 * </pre>
 * The sum is clamped to [0, 1] and rounded to three decimals. No model or network call.
 */
@Component
public class HeuristicScorer {

    private static final Pattern CODE_FENCE = Pattern.compile("```[\\s\\S]*?```");
    private static final int CHARS_PER_TOKEN = 4;

    private final Pattern complexKeywords;
    private final Pattern simpleKeywords;
    private final int deepTurnThreshold;
    private final int multiTurnThreshold;

    public HeuristicScorer(ScoringProperties scoring) {
        this.complexKeywords = KeywordPatterns.wholeWords(scoring.complexKeywords());
        this.simpleKeywords = KeywordPatterns.wholeWords(scoring.simpleKeywords());
        this.deepTurnThreshold = scoring.deepTurnThreshold();
        this.multiTurnThreshold = scoring.multiTurnThreshold();
    }

    public HeuristicResult score(ChatCompletionRequest request, ScoreBand band) {
        List<String> reasons = new ArrayList<>();
        String fullText = request.fullText();

        double score = scoreLength(estimateTokens(fullText), reasons)
                + scoreDepth(request.turnCount(), reasons)
                + scoreTools(request.distinctToolCount(), reasons)
                + scoreSystemPrompt(request, reasons)
                + scoreCodeBlocks(fullText, reasons)
                + scoreImages(request, reasons)
                + scoreVocabulary(request.lastUserText(), reasons);

        score = Math.max(0.0, Math.min(1.0, score));
        score = Math.round(score * 1000.0) / 1000.0;
        return new HeuristicResult(score, reasons, band.confidenceOf(score));
    }

    static int estimateTokens(String text) {
        return text.length() / CHARS_PER_TOKEN;
    }

    private double scoreLength(int tokens, List<String> reasons) {
        if (tokens < 50) {
            reasons.add("very short (%d est. tokens)".formatted(tokens));
            return 0.0;
        }
        if (tokens < 200) {
            reasons.add("short (%d est. tokens)".formatted(tokens));
            return 0.1;
        }
        if (tokens < 800) {
            reasons.add("medium length (%d est. tokens)".formatted(tokens));
            return 0.25;
        }
        if (tokens < 2000) {
            reasons.add("long (%d est. tokens)".formatted(tokens));
            return 0.4;
        }
        reasons.add("very long (%d est. tokens)".formatted(tokens));
        return 0.5;
    }

    private double scoreDepth(int turns, List<String> reasons) {
        if (turns > deepTurnThreshold) {
            reasons.add("deep conversation (%d turns)".formatted(turns));
            return 0.15;
        }
        if (turns > multiTurnThreshold) {
            reasons.add("multi-turn (%d turns)".formatted(turns));
            return 0.08;
        }
        return 0.0;
    }

    private double scoreTools(int toolCount, List<String> reasons) {
        if (toolCount > 3) {
            reasons.add("many tools (%d)".formatted(toolCount));
            return 0.2;
        }
        if (toolCount > 0) {
            reasons.add("tool use (%d tools)".formatted(toolCount));
            return 0.1;
        }
        return 0.0;
    }

    private double scoreSystemPrompt(ChatCompletionRequest request, List<String> reasons) {
        if (!request.hasSystemPrompt()) return 0.0;
        int tokens = estimateTokens(request.systemText());
        if (tokens > 500) {
            reasons.add("complex system prompt (%d est. tokens)".formatted(tokens));
            return 0.15;
        }
        if (tokens > 100) {
            reasons.add("system prompt (%d est. tokens)".formatted(tokens));
            return 0.05;
        }
        return 0.0;
    }

    private double scoreCodeBlocks(String text, List<String> reasons) {
        int blocks = 0;
        Matcher m = CODE_FENCE.matcher(text);
        while (m.find()) blocks++;
        if (blocks > 2) {
            reasons.add("multiple code blocks (%d)".formatted(blocks));
            return 0.15;
        }
        if (blocks > 0) {
            reasons.add("code block (%d)".formatted(blocks));
            return 0.05;
        }
        return 0.0;
    }

    private double scoreImages(ChatCompletionRequest request, List<String> reasons) {
        if (!request.hasImages()) return 0.0;
        reasons.add("contains images");
        return 0.1;
    }

    private double scoreVocabulary(String lastUserText, List<String> reasons) {
        List<String> complex = matches(complexKeywords, lastUserText);
        if (!complex.isEmpty()) {
            // 1 match = 0.3, 2 = 0.45, 3+ = 0.6
            double keywordScore = Math.min(0.6, 0.15 + 0.15 * complex.size());
            reasons.add("complex keywords (%d): %s".formatted(complex.size(), sample(complex)));
            return keywordScore;
        }
        List<String> simple = matches(simpleKeywords, lastUserText);
        if (!simple.isEmpty()) {
            reasons.add("simple keywords: " + sample(simple));
            return -0.15;
        }
        return 0.0;
    }

    private static List<String> matches(Pattern pattern, String text) {
        List<String> found = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) found.add(m.group());
        return found;
    }

    /** Up to three distinct matched terms, lower-cased, in order of appearance. */
    private static String sample(List<String> matched) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String term : matched) {
            if (distinct.size() == 3) break;
            distinct.add(term.toLowerCase(Locale.ROOT));
        }
        return String.join(", ", distinct);
    }
}
