package dev.smartrouter.domain.valueobject;

import dev.smartrouter.domain.enums.FilterMode;

import java.util.Collection;
import java.util.Set;

/**
 * Allow/deny list applied to discovered model ids. Matching is exact.
 */
public record FilterPolicy(FilterMode mode, Set<String> models) {

    public static final FilterPolicy NONE = new FilterPolicy(FilterMode.NONE, Set.of());

    public FilterPolicy {
        if (mode == null) mode = FilterMode.NONE;
        models = models == null ? Set.of() : Set.copyOf(models);
    }

    public static FilterPolicy allow(Collection<String> ids) {
        return new FilterPolicy(FilterMode.ALLOW, Set.copyOf(ids));
    }

    public static FilterPolicy deny(Collection<String> ids) {
        return new FilterPolicy(FilterMode.DENY, Set.copyOf(ids));
    }

    public boolean admits(String modelId) {
        return switch (mode) {
            case NONE -> true;
            case ALLOW -> models.contains(modelId);
            case DENY -> !models.contains(modelId);
        };
    }
}
