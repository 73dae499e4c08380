package dev.smartrouter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * OpenAI-compatible backend that serves the models. The same base URL feeds Spring AI's client.
 */
@ConfigurationProperties(prefix = "smartrouter.backend")
public record BackendProperties(String baseUrl, String apiKey, String modelsPath,
                                Duration connectTimeout, Duration responseTimeout) {
    public BackendProperties {
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://localhost:8000";
        if (apiKey != null && apiKey.isBlank()) apiKey = null;
        if (modelsPath == null || modelsPath.isBlank()) modelsPath = "/v1/models";
        if (connectTimeout == null) connectTimeout = Duration.ofSeconds(5);
        if (responseTimeout == null) responseTimeout = Duration.ofSeconds(15);
    }
}
