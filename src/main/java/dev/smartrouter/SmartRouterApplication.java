package dev.smartrouter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * SmartRouter: complexity-aware model routing for OpenAI-compatible backends.
 *
 * <p>Architecture overview:
 * <pre>
 * chat request → RouterOrchestrator → HeuristicScorer → (uncertain) ClassifierFallback
 *   → ModelRegistry snapshot lookup → RoutingDecision (X-Router-* metadata)
 *
 * backend /v1/models → ModelRegistry.reload() (scheduled + manual) → new snapshot
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>Immutable registry snapshots swapped atomically: no locks on the routing path</li>
 *   <li>Content heuristics first; a small model is only asked when the score is inconclusive</li>
 *   <li>Every soft failure degrades to a deterministic fallback and is listed in the reasons</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class SmartRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmartRouterApplication.class, args);
    }
}
