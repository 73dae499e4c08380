package dev.smartrouter.domain.valueobject;

import dev.smartrouter.domain.enums.Confidence;
import dev.smartrouter.domain.enums.ModelTier;

/**
 * The uncertain band of the heuristic score. Closed on both ends: {@code low <= s <= high} is
 * LOW confidence. The same two values map a score to a tier: below {@code low} is SMALL, above
 * {@code high} is LARGE, everything else (bounds included) is MEDIUM.
 */
public record ScoreBand(double low, double high) {

    public static final ScoreBand DEFAULT = new ScoreBand(0.3, 0.7);

    public ScoreBand {
        if (low < 0.0 || high > 1.0 || low >= high)
            throw new IllegalArgumentException("Uncertain band must satisfy 0 <= low < high <= 1, got [%s, %s]"
                    .formatted(low, high));
    }

    public Confidence confidenceOf(double score) {
        return score >= low && score <= high ? Confidence.LOW : Confidence.HIGH;
    }

    public ModelTier tierFor(double score) {
        if (score < low) return ModelTier.SMALL;
        if (score > high) return ModelTier.LARGE;
        return ModelTier.MEDIUM;
    }
}
