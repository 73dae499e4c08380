package dev.smartrouter.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a routing decision was reached.
 */
public enum RoutingPath {
    EXPLICIT("explicit"), HEURISTIC("heuristic"), CLASSIFIER("classifier");

    private final String label;
    RoutingPath(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }
}
