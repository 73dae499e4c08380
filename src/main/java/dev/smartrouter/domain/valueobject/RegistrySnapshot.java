package dev.smartrouter.domain.valueobject;

import dev.smartrouter.domain.enums.ModelTier;
import dev.smartrouter.exception.NoEligibleModelException;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Immutable view of the eligible models grouped by tier, together with the thresholds that
 * were in force when it was built. A routing decision reads exactly one snapshot, so models
 * and thresholds always come from the same generation.
 *
 * <p>Excluded and filtered-out models never appear in {@link #groups()}.
 */
public record RegistrySnapshot(
        long generation,
        Instant builtAt,
        Map<ModelTier, List<ModelEntry>> groups,
        List<String> rawModelIds,
        TierThresholds thresholds,
        ScoreBand band,
        String classifierModel,
        boolean stale,
        String lastError
) {

    public RegistrySnapshot {
        EnumMap<ModelTier, List<ModelEntry>> copy = new EnumMap<>(ModelTier.class);
        for (ModelTier tier : ModelTier.values()) {
            List<ModelEntry> group = groups != null ? groups.get(tier) : null;
            copy.put(tier, group != null ? List.copyOf(group) : List.of());
        }
        groups = Collections.unmodifiableMap(copy);
        rawModelIds = rawModelIds != null ? List.copyOf(rawModelIds) : List.of();
    }

    /** Snapshot with no models. Every lookup on it fails. */
    public static RegistrySnapshot empty(TierThresholds thresholds, ScoreBand band) {
        return new RegistrySnapshot(0, Instant.now(), Map.of(), List.of(), thresholds, band,
                null, false, null);
    }

    /** Copy stamped with the publication metadata assigned by the registry. */
    public RegistrySnapshot published(long generation, boolean stale, String lastError) {
        return new RegistrySnapshot(generation, builtAt, groups, rawModelIds, thresholds, band,
                classifierModel, stale, lastError);
    }

    public List<ModelEntry> group(ModelTier tier) {
        return groups.get(tier);
    }

    public Stream<ModelEntry> entries() {
        return groups.values().stream().flatMap(List::stream);
    }

    public int size() {
        return groups.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public Optional<ModelEntry> find(String modelId) {
        if (modelId == null) return Optional.empty();
        return entries().filter(e -> e.id().equals(modelId)).findFirst();
    }

    /**
     * First non-empty group in {@link ModelTier#fallbackOrder()} of the requested tier.
     *
     * @throws NoEligibleModelException if every tier is empty
     */
    public Resolved resolve(ModelTier requested) {
        for (ModelTier candidate : requested.fallbackOrder()) {
            List<ModelEntry> group = groups.get(candidate);
            if (!group.isEmpty()) return new Resolved(requested, candidate, group);
        }
        throw new NoEligibleModelException(requested);
    }

    public ModelEntry lookup(ModelTier requested) {
        return resolve(requested).entries().get(0);
    }

    /**
     * Model used for classification: the pinned id when it is eligible, otherwise the globally
     * smallest model by total parameters (ties broken by id).
     */
    public ModelEntry pickClassifierModel() {
        if (classifierModel != null) {
            Optional<ModelEntry> pinned = find(classifierModel);
            if (pinned.isPresent()) return pinned.get();
        }
        return entries().min(ModelEntry.SMALLEST_FIRST)
                .orElseThrow(NoEligibleModelException::new);
    }

    /** A lookup result: the tier asked for, the tier actually served, and its ordered group. */
    public record Resolved(ModelTier requested, ModelTier served, List<ModelEntry> entries) {
        public boolean isFallback() {
            return requested != served;
        }
    }
}
