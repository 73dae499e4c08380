package dev.smartrouter.infrastructure.discovery;

import dev.smartrouter.exception.DiscoveryUnavailableException;

import java.util.List;

/**
 * Lists the models the backend currently serves.
 * Implementations throw {@link DiscoveryUnavailableException} rather than returning an empty
 * list on failure, so the registry can keep its last good view.
 */
public interface ModelDiscoveryClient {

    List<DiscoveredModel> listModels();
}
