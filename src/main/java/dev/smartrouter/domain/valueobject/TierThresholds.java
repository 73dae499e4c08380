package dev.smartrouter.domain.valueobject;

import dev.smartrouter.domain.enums.ModelTier;

/**
 * Upper bounds (inclusive, billions of total parameters) for the SMALL and MEDIUM tiers.
 * Anything above {@code mediumMaxParams} is LARGE.
 */
public record TierThresholds(double smallMaxParams, double mediumMaxParams) {

    public TierThresholds {
        if (smallMaxParams <= 0 || mediumMaxParams <= 0)
            throw new IllegalArgumentException("Tier thresholds must be positive");
        if (smallMaxParams >= mediumMaxParams)
            throw new IllegalArgumentException("SMALL threshold (%s) must be below MEDIUM threshold (%s)"
                    .formatted(smallMaxParams, mediumMaxParams));
    }

    public ModelTier tierFor(double totalParams) {
        if (totalParams <= smallMaxParams) return ModelTier.SMALL;
        if (totalParams <= mediumMaxParams) return ModelTier.MEDIUM;
        return ModelTier.LARGE;
    }
}
