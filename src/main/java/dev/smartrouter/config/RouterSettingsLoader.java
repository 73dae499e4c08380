package dev.smartrouter.config;

import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Re-binds the routing and registry sections from the live {@link Environment}. Binding runs
 * the records' validation, so a bad edit fails the reload instead of reaching a snapshot.
 */
@Component
public class RouterSettingsLoader {

    private final Environment environment;

    public RouterSettingsLoader(Environment environment) {
        this.environment = environment;
    }

    public RouterSettings load() {
        Binder binder = Binder.get(environment);
        RouterProperties routing = binder.bindOrCreate("smartrouter.routing", RouterProperties.class);
        RegistryProperties registry = binder.bindOrCreate("smartrouter.registry", RegistryProperties.class);
        // fail here rather than at snapshot build time
        routing.thresholds();
        routing.band();
        return new RouterSettings(routing, registry);
    }
}
