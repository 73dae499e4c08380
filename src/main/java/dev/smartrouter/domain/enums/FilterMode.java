package dev.smartrouter.domain.enums;

/**
 * Registry filter policy. NONE keeps every discovered model, ALLOW keeps only the listed ids,
 * DENY drops the listed ids.
 */
public enum FilterMode {
    NONE, ALLOW, DENY
}
