package dev.smartrouter.registry;

import dev.smartrouter.domain.enums.ModelTier;
import dev.smartrouter.domain.valueobject.RegistrySnapshot;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Registry health: DOWN with no routable model, DEGRADED while discovery is failing and
 * routing runs on a stale listing, UP otherwise.
 */
@Component("registry")
public class RegistryHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Model discovery unavailable, routing on stale data");

    private final ModelRegistry registry;

    public RegistryHealthIndicator(ModelRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        RegistrySnapshot snapshot = registry.current();
        Health.Builder builder;
        if (snapshot.isEmpty()) {
            builder = Health.down();
        } else if (snapshot.stale()) {
            builder = Health.status(DEGRADED);
        } else {
            builder = Health.up();
        }
        builder.withDetail("generation", snapshot.generation())
                .withDetail("builtAt", snapshot.builtAt().toString());
        for (ModelTier tier : ModelTier.values()) {
            builder.withDetail(tier.name().toLowerCase(Locale.ROOT), snapshot.group(tier).size());
        }
        if (snapshot.lastError() != null) builder.withDetail("lastError", snapshot.lastError());
        return builder.build();
    }
}
