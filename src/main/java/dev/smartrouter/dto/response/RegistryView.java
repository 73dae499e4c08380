package dev.smartrouter.dto.response;

import dev.smartrouter.domain.enums.ModelTier;
import dev.smartrouter.domain.valueobject.ModelEntry;
import dev.smartrouter.domain.valueobject.RegistrySnapshot;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record RegistryView(
        long generation, Instant builtAt, boolean stale, String lastError,
        double smallMaxParams, double mediumMaxParams, double uncertainLow, double uncertainHigh,
        String classifierModel, Map<ModelTier, List<ModelView>> tiers
) {
    public record ModelView(String id, double totalParams, Double activeParams, boolean coder,
                            boolean tierOverridden, boolean parseDegraded) {
        static ModelView of(ModelEntry entry) {
            return new ModelView(entry.id(), entry.capability().totalParams(), entry.capability().activeParams(),
                    entry.isCoder(), entry.tierOverridden(), entry.capability().parseDegraded());
        }
    }

    public static RegistryView of(RegistrySnapshot snapshot) {
        Map<ModelTier, List<ModelView>> tiers = new EnumMap<>(ModelTier.class);
        for (ModelTier tier : ModelTier.values()) {
            tiers.put(tier, snapshot.group(tier).stream().map(ModelView::of).toList());
        }
        return new RegistryView(
                snapshot.generation(), snapshot.builtAt(), snapshot.stale(), snapshot.lastError(),
                snapshot.thresholds().smallMaxParams(), snapshot.thresholds().mediumMaxParams(),
                snapshot.band().low(), snapshot.band().high(),
                snapshot.isEmpty() ? null : snapshot.pickClassifierModel().id(),
                tiers);
    }
}
