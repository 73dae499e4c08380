package dev.smartrouter.router.classifier;

import dev.smartrouter.domain.enums.ModelTier;

/**
 * Classifier outcome. When {@code classified} is false the tier is the heuristic score's own
 * tier and {@code reason} says why the classifier could not be used.
 */
public record ClassifierResult(ModelTier tier, boolean classified, String reason) {

    public static ClassifierResult classified(ModelTier tier, String modelId) {
        return new ClassifierResult(tier, true, "classifier %s chose %s".formatted(modelId, tier));
    }

    public static ClassifierResult unavailable(ModelTier fallbackTier, String cause) {
        return new ClassifierResult(fallbackTier, false,
                "classifier unavailable (%s), using heuristic tier %s".formatted(cause, fallbackTier));
    }
}
