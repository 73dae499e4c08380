package dev.smartrouter.infrastructure.discovery;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.smartrouter.config.BackendProperties;
import dev.smartrouter.exception.DiscoveryUnavailableException;
import io.netty.channel.ChannelOption;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.List;
import java.util.Objects;

/**
 * Reads {@code GET /v1/models} from an OpenAI-compatible backend (vLLM, llama.cpp server,
 * Ollama, LiteLLM). Uses WebClient with .block(): discovery runs on the scheduler thread.
 */
@Component
public class OpenAiModelDiscoveryClient implements ModelDiscoveryClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiModelDiscoveryClient.class);
    private final WebClient webClient;
    private final BackendProperties backend;

    public OpenAiModelDiscoveryClient(WebClient.Builder builder, BackendProperties backend) {
        this.backend = backend;
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(backend.responseTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) backend.connectTimeout().toMillis());
        WebClient.Builder configured = builder.baseUrl(backend.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (backend.apiKey() != null) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + backend.apiKey());
        }
        this.webClient = configured.build();
    }

    @Override
    @CircuitBreaker(name = "model-discovery")
    public List<DiscoveredModel> listModels() {
        ModelList response;
        try {
            response = webClient.get()
                    .uri(backend.modelsPath())
                    .retrieve()
                    .bodyToMono(ModelList.class)
                    .block();
        } catch (Exception e) {
            throw new DiscoveryUnavailableException(
                    "Model listing from " + backend.baseUrl() + " failed: " + e.getMessage(), e);
        }

        if (response == null || response.data() == null) {
            throw new DiscoveryUnavailableException("Model listing from " + backend.baseUrl() + " had no data");
        }

        List<DiscoveredModel> models = response.data().stream()
                .filter(Objects::nonNull)
                .filter(m -> m.id() != null && !m.id().isBlank())
                .toList();
        log.debug("Discovered {} models at {}", models.size(), backend.baseUrl());
        return models;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModelList(List<DiscoveredModel> data) {}
}
