package dev.smartrouter.config;

/**
 * The reloadable part of the configuration, read as one unit.
 */
public record RouterSettings(RouterProperties routing, RegistryProperties registry) {

    public static RouterSettings defaults() {
        return new RouterSettings(RouterProperties.defaults(), RegistryProperties.defaults());
    }
}
