package dev.smartrouter.exception;

import dev.smartrouter.domain.enums.ModelTier;

/**
 * No model is eligible in any tier, so the request cannot be routed.
 */
public class NoEligibleModelException extends RuntimeException {

    private final ModelTier requestedTier;

    public NoEligibleModelException() {
        super("No eligible model in any tier");
        this.requestedTier = null;
    }

    public NoEligibleModelException(ModelTier requestedTier) {
        super("No eligible model in any tier (requested " + requestedTier + ")");
        this.requestedTier = requestedTier;
    }

    /** Tier being looked up when the registry came up empty, {@code null} if routing never got that far. */
    public ModelTier getRequestedTier() {
        return requestedTier;
    }
}
