package dev.smartrouter.router.orchestrator;

import dev.smartrouter.domain.enums.ModelTier;
import dev.smartrouter.domain.enums.RoutingPath;
import dev.smartrouter.domain.valueobject.HeuristicResult;
import dev.smartrouter.domain.valueobject.ModelEntry;
import dev.smartrouter.domain.valueobject.RegistrySnapshot;
import dev.smartrouter.domain.valueobject.RoutingDecision;
import dev.smartrouter.domain.valueobject.ScoreBand;
import dev.smartrouter.dto.request.ChatCompletionRequest;
import dev.smartrouter.exception.NoEligibleModelException;
import dev.smartrouter.registry.ModelRegistry;
import dev.smartrouter.router.classifier.ClassifierFallback;
import dev.smartrouter.router.classifier.ClassifierResult;
import dev.smartrouter.router.heuristic.CodingTaskDetector;
import dev.smartrouter.router.heuristic.HeuristicScorer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the backend model for a chat-completion request.
 *
 * <p>One pass per request, no retries, no backtracking:
 *
 * <pre>
 *  1. Take the current registry snapshot (read once, used for everything below)
 *  2. Explicit model named and present → done
 *  3. Heuristic score; decisive → tier from the score band
 *  4. Inconclusive → classifier call, soft fallback to the score band
 *  5. Coding task and the tier's group has coder models → smallest coder model
 *  6. Otherwise the group's first model (largest, then by id)
 * </pre>
 *
 * <p>An empty registry is the only fatal outcome ({@link NoEligibleModelException}).
 * Soft failures end up as entries in the decision's reasons.
 */
@Component
public class RouterOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RouterOrchestrator.class);

    static final String AUTO_MODEL = "auto";
    static final int MAX_ECHOED_ID_LENGTH = 64;

    private final ModelRegistry registry;
    private final HeuristicScorer scorer;
    private final ClassifierFallback classifier;
    private final CodingTaskDetector codingTaskDetector;
    private final MeterRegistry meterRegistry;
    private final Timer routingTimer;

    public RouterOrchestrator(ModelRegistry registry,
                              HeuristicScorer scorer,
                              ClassifierFallback classifier,
                              CodingTaskDetector codingTaskDetector,
                              MeterRegistry meterRegistry) {
        this.registry = registry;
        this.scorer = scorer;
        this.classifier = classifier;
        this.codingTaskDetector = codingTaskDetector;
        this.meterRegistry = meterRegistry;
        this.routingTimer = Timer.builder("smartrouter.routing.duration")
                .description("Time to reach a routing decision, classifier wait included")
                .register(meterRegistry);
    }

    public RoutingDecision route(ChatCompletionRequest request) {
        Timer.Sample timerSample = Timer.start(meterRegistry);
        try {
            RoutingDecision decision = decide(request, registry.current());

            Counter.builder("smartrouter.routing.decisions")
                    .tag("tier", decision.tier().name())
                    .tag("path", decision.routingPath().label())
                    .tag("coder", Boolean.toString(decision.preferCoder()))
                    .register(meterRegistry)
                    .increment();
            log.info("Routed to {} (tier={}, path={}, score={}, coder={}, generation={})",
                    decision.selectedModel(), decision.tier(), decision.routingPath().label(),
                    decision.score(), decision.preferCoder(), decision.snapshotGeneration());
            return decision;
        } catch (NoEligibleModelException e) {
            log.error("Routing failed: {}", e.getMessage());
            throw e;
        } finally {
            timerSample.stop(routingTimer);
        }
    }

    RoutingDecision decide(ChatCompletionRequest request, RegistrySnapshot snapshot) {
        if (snapshot.isEmpty()) throw new NoEligibleModelException();

        List<String> reasons = new ArrayList<>();
        if (snapshot.stale()) reasons.add("registry stale: model discovery unavailable");

        // Step 1: explicit model
        String requested = request.model();
        if (isNamed(requested)) {
            Optional<ModelEntry> explicit = snapshot.find(requested);
            if (explicit.isPresent()) {
                ModelEntry entry = explicit.get();
                reasons.add("explicit model requested");
                return new RoutingDecision(entry.tier(), entry.id(), RoutingPath.EXPLICIT, null,
                        reasons, false, snapshot.generation());
            }
            reasons.add("requested model '%s' not available, routing by content".formatted(displayId(requested)));
        }

        // Step 2: heuristic score
        ScoreBand band = snapshot.band();
        HeuristicResult heuristic = scorer.score(request, band);
        reasons.addAll(heuristic.reasons());

        ModelTier tier;
        RoutingPath path;
        if (heuristic.isConfident()) {
            tier = band.tierFor(heuristic.score());
            path = RoutingPath.HEURISTIC;
        } else {
            // Step 3: classifier for the uncertain band
            reasons.add(String.format(Locale.ROOT, "score %.3f in uncertain band [%.2f, %.2f]",
                    heuristic.score(), band.low(), band.high()));
            ModelEntry classifierModel = snapshot.pickClassifierModel();
            ClassifierResult result = classifier.classify(request, classifierModel, heuristic.score(), band);
            reasons.add(result.reason());
            tier = result.tier();
            path = result.classified() ? RoutingPath.CLASSIFIER : RoutingPath.HEURISTIC;
        }

        // Step 4: selection, coder preference applied within the served group
        RegistrySnapshot.Resolved group = snapshot.resolve(tier);
        if (group.isFallback()) {
            reasons.add("no %s model available, served from %s".formatted(tier, group.served()));
        }

        ModelEntry selected = group.entries().get(0);
        boolean preferCoder = false;
        if (codingTaskDetector.isCodingTask(request)) {
            Optional<ModelEntry> coder = group.entries().stream()
                    .filter(ModelEntry::isCoder)
                    .min(ModelEntry.SMALLEST_FIRST);
            if (coder.isPresent()) {
                selected = coder.get();
                preferCoder = true;
                reasons.add("coding task, preferring coder model");
            }
        }

        if (selected.capability().parseDegraded()) {
            reasons.add("parameter count unknown for %s, sized by default".formatted(selected.id()));
        }

        return new RoutingDecision(tier, selected.id(), path, heuristic.score(), reasons,
                preferCoder, snapshot.generation());
    }

    /**
     * Caller-supplied id as it may appear in reasons, which also travel as a response header:
     * printable ASCII only, at most {@link #MAX_ECHOED_ID_LENGTH} characters.
     */
    static String displayId(String id) {
        StringBuilder sb = new StringBuilder(Math.min(id.length(), MAX_ECHOED_ID_LENGTH + 3));
        int i = 0;
        while (i < id.length() && sb.length() < MAX_ECHOED_ID_LENGTH) {
            int cp = id.codePointAt(i);
            sb.append(cp >= 0x20 && cp < 0x7f ? (char) cp : '?');
            i += Character.charCount(cp);
        }
        if (i < id.length()) sb.append("...");
        return sb.toString();
    }

    private static boolean isNamed(String model) {
        return model != null && !model.isBlank() && !AUTO_MODEL.equalsIgnoreCase(model.trim());
    }
}
