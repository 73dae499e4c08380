package dev.smartrouter.domain.valueobject;

import dev.smartrouter.domain.enums.ModelTier;
import dev.smartrouter.domain.enums.RoutingPath;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Final routing output. {@code tier} is the tier the request was judged to need; when the
 * registry had to serve it from another tier the reasons say so.
 */
public record RoutingDecision(
        ModelTier tier,
        String selectedModel,
        RoutingPath routingPath,
        Double score,
        List<String> reasons,
        boolean preferCoder,
        long snapshotGeneration
) {

    public static final String HEADER_TIER = "X-Router-Tier";
    public static final String HEADER_MODEL = "X-Router-Model";
    public static final String HEADER_PATH = "X-Router-Path";
    public static final String HEADER_SCORE = "X-Router-Score";
    public static final String HEADER_CODER = "X-Router-Coder";
    public static final String HEADER_REASONS = "X-Router-Reasons";

    public RoutingDecision {
        reasons = List.copyOf(reasons);
    }

    /** Decision metadata flattened for response headers. */
    public Map<String, String> toHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HEADER_TIER, tier.name());
        headers.put(HEADER_MODEL, selectedModel);
        headers.put(HEADER_PATH, routingPath.label());
        if (score != null) headers.put(HEADER_SCORE, String.format(Locale.ROOT, "%.3f", score));
        headers.put(HEADER_CODER, Boolean.toString(preferCoder));
        if (!reasons.isEmpty()) headers.put(HEADER_REASONS, headerSafe(String.join("; ", reasons)));
        return headers;
    }

    // matched keywords can carry user text; header values stay printable ASCII
    private static String headerSafe(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        value.codePoints().forEach(cp -> sb.append(cp >= 0x20 && cp < 0x7f ? (char) cp : '?'));
        return sb.toString();
    }
}
