package dev.smartrouter.domain.enums;

import java.util.ArrayList;
import java.util.List;

/**
 * Model capability tiers ordered by size.
 *
 * SMALL = cheap and fast | MEDIUM = general purpose | LARGE = strongest reasoning
 */
public enum ModelTier {
    SMALL(0), MEDIUM(1), LARGE(2);

    private final int rank;
    ModelTier(int rank) { this.rank = rank; }

    /**
     * Lookup order used when this tier has no eligible model: the tier itself,
     * every larger tier ascending, then every smaller tier descending.
     */
    public List<ModelTier> fallbackOrder() {
        ModelTier[] all = values();
        List<ModelTier> order = new ArrayList<>(all.length);
        for (int i = rank; i < all.length; i++) order.add(all[i]);
        for (int i = rank - 1; i >= 0; i--) order.add(all[i]);
        return List.copyOf(order);
    }
}
