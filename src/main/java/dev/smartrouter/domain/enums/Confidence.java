package dev.smartrouter.domain.enums;

/**
 * Whether the heuristic score alone is decisive. LOW sends the request to the classifier.
 */
public enum Confidence {
    LOW, HIGH
}
