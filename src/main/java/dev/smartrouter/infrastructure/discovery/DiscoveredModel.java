package dev.smartrouter.infrastructure.discovery;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the backend's model listing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiscoveredModel(String id, @JsonProperty("owned_by") String ownedBy, Long created) {

    public static DiscoveredModel of(String id) {
        return new DiscoveredModel(id, null, null);
    }
}
