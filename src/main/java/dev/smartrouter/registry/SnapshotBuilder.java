package dev.smartrouter.registry;

import dev.smartrouter.config.RouterSettings;
import dev.smartrouter.domain.enums.ModelTier;
import dev.smartrouter.domain.valueobject.FilterPolicy;
import dev.smartrouter.domain.valueobject.ModelCapability;
import dev.smartrouter.domain.valueobject.ModelEntry;
import dev.smartrouter.domain.valueobject.RegistrySnapshot;
import dev.smartrouter.domain.valueobject.ScoreBand;
import dev.smartrouter.domain.valueobject.TierThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Turns a raw model listing into a {@link RegistrySnapshot}:
 *
 * <pre>
 *  1. extract capability per id
 *  2. drop excluded models
 *  3. apply the allow/deny filter
 *  4. tier by total parameters
 *  5. apply per-id tier overrides
 *  6. group by tier, largest first then by id
 * </pre>
 *
 * Pure: the same listing and settings always give the same groups.
 */
public class SnapshotBuilder {

    private static final Logger log = LoggerFactory.getLogger(SnapshotBuilder.class);

    private final TierThresholds thresholds;
    private final ScoreBand band;
    private final ParameterExtractor extractor;
    private final String classifierModel;

    public SnapshotBuilder(TierThresholds thresholds, ScoreBand band, ParameterExtractor extractor,
                           String classifierModel) {
        this.thresholds = thresholds;
        this.band = band;
        this.extractor = extractor;
        this.classifierModel = classifierModel;
    }

    public static SnapshotBuilder from(RouterSettings settings) {
        return new SnapshotBuilder(
                settings.routing().thresholds(),
                settings.routing().band(),
                ParameterExtractor.from(settings.routing(), settings.registry()),
                settings.routing().classifierModel());
    }

    public RegistrySnapshot build(Collection<String> rawModelIds, FilterPolicy filterPolicy,
                                  Map<String, ModelTier> tierOverrides) {
        Map<ModelTier, List<ModelEntry>> groups = new EnumMap<>(ModelTier.class);
        for (ModelTier tier : ModelTier.values()) groups.put(tier, new ArrayList<>());

        List<String> distinctIds = List.copyOf(new LinkedHashSet<>(rawModelIds));
        for (String id : distinctIds) {
            ModelCapability capability = extractor.extract(id);
            if (capability.excluded()) {
                log.debug("Excluding {} (non-chat model family)", id);
                continue;
            }
            if (!filterPolicy.admits(id)) {
                log.debug("Filtering out {} ({} policy)", id, filterPolicy.mode());
                continue;
            }
            if (capability.parseDegraded()) {
                log.warn("No parameter count in '{}', sizing it as {}B", id, capability.totalParams());
            }

            ModelTier computed = thresholds.tierFor(capability.totalParams());
            ModelTier override = tierOverrides.get(id);
            ModelTier effective = override != null ? override : computed;
            log.debug("Model {} → {} ({}B total{})", id, effective, capability.totalParams(),
                    override != null ? ", overridden from " + computed : "");

            groups.get(effective).add(new ModelEntry(id, capability, effective, override != null));
        }

        groups.values().forEach(group -> group.sort(ModelEntry.LARGEST_FIRST));

        if (classifierModel != null
                && groups.values().stream().flatMap(List::stream).noneMatch(e -> e.id().equals(classifierModel))) {
            log.warn("Pinned classifier model '{}' is not eligible, the smallest model will be used", classifierModel);
        }

        return new RegistrySnapshot(0, Instant.now(), groups, distinctIds, thresholds, band,
                classifierModel, false, null);
    }
}
