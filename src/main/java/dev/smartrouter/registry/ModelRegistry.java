package dev.smartrouter.registry;

import dev.smartrouter.config.RouterSettings;
import dev.smartrouter.config.RouterSettingsLoader;
import dev.smartrouter.domain.enums.ModelTier;
import dev.smartrouter.domain.valueobject.RegistrySnapshot;
import dev.smartrouter.infrastructure.discovery.DiscoveredModel;
import dev.smartrouter.infrastructure.discovery.ModelDiscoveryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the current {@link RegistrySnapshot}.
 *
 * <p>Readers call {@link #current()} once per decision and work on that generation only;
 * the read path takes no lock. {@link #reload()} re-reads settings, re-fetches the model
 * listing, builds a complete new snapshot and publishes it with a single reference swap.
 *
 * <p>When discovery fails the registry rebuilds from the previous raw listing (so new
 * settings still take effect), marks the snapshot stale and keeps routing.
 */
@Component
public class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final ModelDiscoveryClient discoveryClient;
    private final RouterSettingsLoader settingsLoader;
    private final AtomicReference<RegistrySnapshot> current;

    public ModelRegistry(ModelDiscoveryClient discoveryClient, RouterSettingsLoader settingsLoader) {
        this.discoveryClient = discoveryClient;
        this.settingsLoader = settingsLoader;
        RouterSettings initial = settingsLoader.load();
        this.current = new AtomicReference<>(
                RegistrySnapshot.empty(initial.routing().thresholds(), initial.routing().band()));
    }

    public RegistrySnapshot current() {
        return current.get();
    }

    /**
     * Rebuilds and publishes a snapshot. Serialised between writers; safe to run while
     * decisions are in flight.
     *
     * @throws IllegalArgumentException if the re-read settings are invalid; the current
     *                                  snapshot is left untouched
     */
    public synchronized RegistrySnapshot reload() {
        RouterSettings settings = settingsLoader.load();
        RegistrySnapshot previous = current.get();

        List<String> rawIds;
        boolean stale = false;
        String error = null;
        try {
            rawIds = discoveryClient.listModels().stream().map(DiscoveredModel::id).toList();
        } catch (RuntimeException e) {
            log.warn("Model discovery unavailable, keeping last known listing of {} models: {}",
                    previous.rawModelIds().size(), e.getMessage());
            rawIds = previous.rawModelIds();
            stale = true;
            error = e.getMessage();
        }

        RegistrySnapshot next = SnapshotBuilder.from(settings)
                .build(rawIds, settings.registry().filterPolicy(), settings.registry().tierOverrides())
                .published(previous.generation() + 1, stale, error);
        current.set(next);

        log.info("Published registry generation {}: SMALL={} MEDIUM={} LARGE={}{}",
                next.generation(),
                next.group(ModelTier.SMALL).size(),
                next.group(ModelTier.MEDIUM).size(),
                next.group(ModelTier.LARGE).size(),
                stale ? " (stale)" : "");
        return next;
    }

    @Scheduled(fixedDelayString = "${smartrouter.registry.refresh-interval:PT5M}")
    public void scheduledRefresh() {
        try {
            reload();
        } catch (RuntimeException e) {
            log.error("Scheduled registry refresh failed, keeping generation {}: {}",
                    current.get().generation(), e.getMessage());
        }
    }
}
