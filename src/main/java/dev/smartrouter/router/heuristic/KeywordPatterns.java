package dev.smartrouter.router.heuristic;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Compiles configured vocabulary fragments into one alternation.
 */
final class KeywordPatterns {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
            | Pattern.UNICODE_CHARACTER_CLASS;

    private KeywordPatterns() {}

    /** Whole-word match: the term may not start or end inside a word. */
    static Pattern wholeWords(List<String> fragments) {
        return Pattern.compile("(?<!\\w)(?:" + String.join("|", fragments) + ")(?!\\w)", FLAGS);
    }

    /** Match starting on a word boundary, any continuation. */
    static Pattern wordStart(List<String> fragments) {
        return Pattern.compile("(?<!\\w)(?:" + String.join("|", fragments) + ")", FLAGS);
    }
}
