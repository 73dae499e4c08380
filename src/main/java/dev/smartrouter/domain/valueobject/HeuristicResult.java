package dev.smartrouter.domain.valueobject;

import dev.smartrouter.domain.enums.Confidence;

import java.util.List;

/**
 * Outcome of content-only scoring.
 *
 * @param score      complexity estimate in [0, 1]
 * @param reasons    one entry per triggered signal, in evaluation order
 * @param confidence LOW when the score falls inside the uncertain band
 */
public record HeuristicResult(double score, List<String> reasons, Confidence confidence) {

    public HeuristicResult {
        reasons = List.copyOf(reasons);
    }

    public boolean isConfident() {
        return confidence == Confidence.HIGH;
    }
}
