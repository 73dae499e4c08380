package dev.smartrouter.domain.valueobject;

/**
 * Capability descriptor derived from a model identifier. Parameter counts are in billions.
 *
 * @param totalParams   declared total size; the configured default when nothing could be parsed
 * @param activeParams  active size for mixture-of-experts names, otherwise {@code null}
 * @param coder         id carries a coder-family marker
 * @param excluded      embedding/OCR/TTS-style model that never receives routed traffic
 * @param parseDegraded no parameter figure was found in the id
 */
public record ModelCapability(double totalParams, Double activeParams, boolean coder,
                              boolean excluded, boolean parseDegraded) {

    public boolean isMixtureOfExperts() {
        return activeParams != null;
    }
}
