package dev.smartrouter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Vocabulary and thresholds for the heuristic scorer and the coding-task detector.
 * Entries are regular-expression fragments matched case-insensitively on word boundaries.
 * Gaps inside a fragment must be bounded ({@code [^\n]{0,80}?}, never {@code .*}): the
 * fragments run over whole user messages on the request thread.
 * Read once at startup.
 */
@ConfigurationProperties(prefix = "smartrouter.scoring")
public record ScoringProperties(List<String> complexKeywords, List<String> simpleKeywords,
                                List<String> codingPatterns,
                                int deepTurnThreshold, int multiTurnThreshold) {

    public static final List<String> DEFAULT_COMPLEX_KEYWORDS = List.of(
            // English
            "analy[sz]e", "compare", "contrast", "explain\\s+in\\s+detail", "step[- ]by[- ]step",
            "implement", "architect", "design", "refactor", "optimi[sz]e", "debug",
            "write\\s+(?:a\\s+)?(?:complete|full|entire)",
            "multi[- ]step", "comprehensive", "thorough", "in[- ]depth",
            "trade[- ]?offs?", "pros?\\s+and\\s+cons?", "advantages?\\s+and\\s+disadvantages?",
            // German
            "analysiere", "vergleiche", "erkl[äa]r[e ][^\\n]{0,80}?im\\s+detail", "Schritt\\s+f[üu]r\\s+Schritt",
            "implementiere", "entwirf", "entwerfe", "optimiere", "debugge",
            "schreib[e ][^\\n]{0,80}?(?:komplett|vollst[äa]ndig|ganz)\\w*",
            "umfassend\\w*", "gr[üu]ndlich\\w*", "ausf[üu]hrlich\\w*", "detailliert\\w*", "tiefgehend\\w*",
            "Vor-?\\s*und\\s+Nachteile", "Abw[äa]gung", "Pro\\s+und\\s+Contra",
            "mehrschrittig", "mehrstufig", "Architektur", "Konzept\\s+erstell\\w*");

    public static final List<String> DEFAULT_SIMPLE_KEYWORDS = List.of(
            // English
            "translate", "summari[sz]e", "tldr", "tl;dr",
            "yes\\s+or\\s+no", "true\\s+or\\s+false",
            "what\\s+is", "who\\s+is", "when\\s+did", "where\\s+is",
            "define", "list", "name", "count",
            "fix\\s+(?:this|the)\\s+(?:typo|spelling|grammar)",
            "convert", "format", "reformat",
            // German
            "[üu]bersetz\\w*", "zusammenfass\\w*", "fass[e ][^\\n]{0,80}?zusammen",
            "ja\\s+oder\\s+nein", "richtig\\s+oder\\s+falsch",
            "was\\s+ist", "wer\\s+ist", "wann\\s+war", "wo\\s+ist", "wie\\s+hei[ßs]t",
            "definiere", "z[äa]hl[e ]", "nenne", "auflisten",
            "korrigiere\\s+(?:den|die|das)\\s+(?:Tippfehler|Rechtschreibung|Grammatik)",
            "konvertiere", "formatiere", "umwandeln");

    public static final List<String> DEFAULT_CODING_PATTERNS = List.of(
            "```",
            "write\\s+(?:some\\s+|a\\s+|the\\s+)?(?:code|function|script|class|method|program)",
            "debug", "refactor", "stack\\s*trace", "unit\\s+tests?", "regex", "compile\\s+error",
            "def\\s+\\w+\\s*\\(", "class\\s+\\w+\\s*[:{(]", "function\\s+\\w+\\s*\\(", "public\\s+static",
            "#include", "import\\s+[\\w.]+;", "select\\s+[^\\n]{1,200}?\\s+from",
            "python", "java", "javascript", "typescript", "golang", "rust", "c\\+\\+", "kotlin", "sql",
            "schreib\\w*\\s+(?:einen\\s+|eine\\s+)?(?:code|funktion|skript|klasse)", "programmier\\w*");

    public ScoringProperties {
        if (complexKeywords == null || complexKeywords.isEmpty()) complexKeywords = DEFAULT_COMPLEX_KEYWORDS;
        if (simpleKeywords == null || simpleKeywords.isEmpty()) simpleKeywords = DEFAULT_SIMPLE_KEYWORDS;
        if (codingPatterns == null || codingPatterns.isEmpty()) codingPatterns = DEFAULT_CODING_PATTERNS;
        if (deepTurnThreshold <= 0) deepTurnThreshold = 10;
        if (multiTurnThreshold <= 0) multiTurnThreshold = 4;
    }

    public static ScoringProperties defaults() {
        return new ScoringProperties(null, null, null, 0, 0);
    }
}
