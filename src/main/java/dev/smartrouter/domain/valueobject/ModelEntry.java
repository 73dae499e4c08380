package dev.smartrouter.domain.valueobject;

import dev.smartrouter.domain.enums.ModelTier;

import java.util.Comparator;

/**
 * A routable model with its effective tier.
 */
public record ModelEntry(String id, ModelCapability capability, ModelTier tier, boolean tierOverridden) {

    /** Registry group order: largest first, then id. */
    public static final Comparator<ModelEntry> LARGEST_FIRST =
            Comparator.comparingDouble((ModelEntry e) -> e.capability().totalParams()).reversed()
                    .thenComparing(ModelEntry::id);

    /** Smallest first, then id. Used for classifier and coder picks. */
    public static final Comparator<ModelEntry> SMALLEST_FIRST =
            Comparator.comparingDouble((ModelEntry e) -> e.capability().totalParams())
                    .thenComparing(ModelEntry::id);

    public boolean isCoder() {
        return capability.coder();
    }
}
