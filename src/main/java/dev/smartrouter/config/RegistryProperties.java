package dev.smartrouter.config;

import dev.smartrouter.domain.enums.FilterMode;
import dev.smartrouter.domain.enums.ModelTier;
import dev.smartrouter.domain.valueobject.FilterPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry config: filter policy, per-model tier overrides and the id markers used by the
 * parameter extractor. Model ids containing dots or colons need bracketed keys in YAML,
 * e.g. {@code "[qwen2.5:7b]": LARGE}.
 */
@ConfigurationProperties(prefix = "smartrouter.registry")
public record RegistryProperties(FilterMode filterMode, List<String> filterModels,
                                 Map<String, ModelTier> tierOverrides,
                                 List<String> excludedMarkers, List<String> coderMarkers,
                                 Duration refreshInterval) {

    public static final List<String> DEFAULT_EXCLUDED_MARKERS =
            List.of("embed", "rerank", "ocr", "tts", "whisper", "speech", "clip", "diffusion");
    public static final List<String> DEFAULT_CODER_MARKERS = List.of("coder", "code", "devstral");

    public RegistryProperties {
        if (filterMode == null) filterMode = FilterMode.NONE;
        filterModels = filterModels == null ? List.of() : List.copyOf(filterModels);
        tierOverrides = tierOverrides == null ? Map.of() : Map.copyOf(tierOverrides);
        if (excludedMarkers == null || excludedMarkers.isEmpty()) excludedMarkers = DEFAULT_EXCLUDED_MARKERS;
        if (coderMarkers == null || coderMarkers.isEmpty()) coderMarkers = DEFAULT_CODER_MARKERS;
        if (refreshInterval == null) refreshInterval = Duration.ofMinutes(5);
    }

    public static RegistryProperties defaults() {
        return new RegistryProperties(null, null, null, null, null, null);
    }

    public FilterPolicy filterPolicy() {
        return new FilterPolicy(filterMode, Set.copyOf(filterModels));
    }
}
