package dev.smartrouter.router.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.smartrouter.config.RegistryProperties;
import dev.smartrouter.config.RouterProperties;
import dev.smartrouter.config.RouterSettings;
import dev.smartrouter.config.ScoringProperties;
import dev.smartrouter.domain.enums.ModelTier;
import dev.smartrouter.domain.enums.RoutingPath;
import dev.smartrouter.domain.valueobject.FilterPolicy;
import dev.smartrouter.domain.valueobject.ModelEntry;
import dev.smartrouter.domain.valueobject.RegistrySnapshot;
import dev.smartrouter.domain.valueobject.RoutingDecision;
import dev.smartrouter.domain.valueobject.ScoreBand;
import dev.smartrouter.domain.valueobject.TierThresholds;
import dev.smartrouter.dto.request.ChatCompletionRequest;
import dev.smartrouter.dto.request.ChatMessage;
import dev.smartrouter.exception.NoEligibleModelException;
import dev.smartrouter.registry.ModelRegistry;
import dev.smartrouter.registry.SnapshotBuilder;
import dev.smartrouter.router.classifier.ClassifierFallback;
import dev.smartrouter.router.classifier.ClassifierResult;
import dev.smartrouter.router.heuristic.CodingTaskDetector;
import dev.smartrouter.router.heuristic.HeuristicScorer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RouterOrchestratorTest {

    private static final List<String> LISTING = List.of(
            "llama3.2:3b", "llama3.1:8b", "qwen2.5-coder:7b",
            "qwen2.5:14b", "qwen2.5-coder:14b", "gemma3:27b",
            "llama3.3:70b", "nomic-embed-text");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ModelRegistry registry;
    private ClassifierFallback classifier;
    private SimpleMeterRegistry meterRegistry;
    private RouterOrchestrator orchestrator;
    private RegistrySnapshot snapshot;

    @BeforeEach
    void setUp() {
        registry = mock(ModelRegistry.class);
        classifier = mock(ClassifierFallback.class);
        meterRegistry = new SimpleMeterRegistry();
        ScoringProperties scoring = ScoringProperties.defaults();
        orchestrator = new RouterOrchestrator(registry, new HeuristicScorer(scoring), classifier,
                new CodingTaskDetector(scoring), meterRegistry);
        snapshot = build(RouterSettings.defaults(), LISTING);
    }

    @Nested
    @DisplayName("end-to-end scenarios")
    class Scenarios {

        @Test
        @DisplayName("A: trivial question goes to SMALL by heuristic")
        void trivialQuestion() {
            RoutingDecision decision = orchestrator.decide(user("What is 2+2?"), snapshot);

            assertThat(decision.routingPath()).isEqualTo(RoutingPath.HEURISTIC);
            assertThat(decision.tier()).isEqualTo(ModelTier.SMALL);
            assertThat(decision.selectedModel()).isEqualTo("llama3.1:8b");
            assertThat(decision.score()).isEqualTo(0.0);
            assertThat(decision.preferCoder()).isFalse();
            verifyNoInteractions(classifier);
        }

        @Test
        @DisplayName("B: heavy agentic request goes to LARGE by heuristic")
        void heavyRequest() {
            List<ChatMessage> messages = new ArrayList<>();
            messages.add(ChatMessage.of("system", "You are a careful assistant for a large codebase. ".repeat(45)));
            for (int i = 0; i < 6; i++) {
                messages.add(ChatMessage.of("user", "Here is part " + i + " of the context."));
                messages.add(ChatMessage.of("assistant", "Noted."));
            }
            messages.add(ChatMessage.of("user", "Now analyze the trade-offs and implement a step-by-step plan."));
            ChatCompletionRequest request = new ChatCompletionRequest(null, messages,
                    List.of(tool("search"), tool("read_file"), tool("write_file")), null, null);

            RoutingDecision decision = orchestrator.decide(request, snapshot);

            assertThat(decision.routingPath()).isEqualTo(RoutingPath.HEURISTIC);
            assertThat(decision.tier()).isEqualTo(ModelTier.LARGE);
            assertThat(decision.selectedModel()).isEqualTo("llama3.3:70b");
            assertThat(decision.score()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("C: uncertain score resolved by the classifier")
        void classifierDecides() {
            when(classifier.classify(any(), any(), anyDouble(), any()))
                    .thenReturn(ClassifierResult.classified(ModelTier.MEDIUM, "llama3.2:3b"));

            RoutingDecision decision = orchestrator.decide(midScoreRequest(), snapshot);

            assertThat(decision.score()).isEqualTo(0.5);
            assertThat(decision.routingPath()).isEqualTo(RoutingPath.CLASSIFIER);
            assertThat(decision.tier()).isEqualTo(ModelTier.MEDIUM);
            assertThat(decision.selectedModel()).isEqualTo("gemma3:27b");
            assertThat(decision.reasons()).contains(
                    "score 0.500 in uncertain band [0.30, 0.70]",
                    "classifier llama3.2:3b chose MEDIUM");
            verify(classifier).classify(any(), argThat(m -> m.id().equals("llama3.2:3b")), eq(0.5), eq(ScoreBand.DEFAULT));
        }

        @Test
        @DisplayName("D: classifier timeout falls back to the heuristic tier")
        void classifierTimeout() {
            when(classifier.classify(any(), any(), anyDouble(), any()))
                    .thenReturn(ClassifierResult.unavailable(ModelTier.MEDIUM, "timed out after 5000ms"));

            RoutingDecision decision = orchestrator.decide(midScoreRequest(), snapshot);

            assertThat(decision.routingPath()).isEqualTo(RoutingPath.HEURISTIC);
            assertThat(decision.tier()).isEqualTo(ModelTier.MEDIUM);
            assertThat(decision.reasons()).anyMatch(r -> r.startsWith("classifier unavailable (timed out"));
        }

        @Test
        @DisplayName("E: a known explicit model wins regardless of content")
        void explicitModel() {
            ChatCompletionRequest request = new ChatCompletionRequest("qwen2.5:14b",
                    List.of(ChatMessage.of("user", "Analyze, compare and refactor everything")), null, null, null);

            RoutingDecision decision = orchestrator.decide(request, snapshot);

            assertThat(decision.routingPath()).isEqualTo(RoutingPath.EXPLICIT);
            assertThat(decision.selectedModel()).isEqualTo("qwen2.5:14b");
            assertThat(decision.tier()).isEqualTo(ModelTier.MEDIUM);
            assertThat(decision.score()).isNull();
            verifyNoInteractions(classifier);
        }
    }

    @Nested
    @DisplayName("explicit model handling")
    class ExplicitModel {

        @Test
        void unknownModelRoutesByContent() {
            ChatCompletionRequest request = new ChatCompletionRequest("gpt-4o",
                    List.of(ChatMessage.of("user", "What is 2+2?")), null, null, null);

            RoutingDecision decision = orchestrator.decide(request, snapshot);

            assertThat(decision.routingPath()).isEqualTo(RoutingPath.HEURISTIC);
            assertThat(decision.reasons()).first()
                    .isEqualTo("requested model 'gpt-4o' not available, routing by content");
        }

        @Test
        void echoedModelIdIsBoundedAscii() {
            String requested = "\u6a21\u578b-" + "x".repeat(5_000) + "\r\nX-Injected: 1";
            ChatCompletionRequest request = new ChatCompletionRequest(requested,
                    List.of(ChatMessage.of("user", "What is 2+2?")), null, null, null);

            RoutingDecision decision = orchestrator.decide(request, snapshot);

            String reason = decision.reasons().get(0);
            assertThat(reason)
                    .startsWith("requested model '??-xxx")
                    .endsWith("...' not available, routing by content")
                    .hasSizeLessThan(RouterOrchestrator.MAX_ECHOED_ID_LENGTH + 60);
            assertThat(decision.toHeaders().get(RoutingDecision.HEADER_REASONS))
                    .matches("[\\x20-\\x7e]*");
        }

        @Test
        void reasonsHeaderKeepsMatchedTextAscii() {
            when(classifier.classify(any(), any(), anyDouble(), any()))
                    .thenReturn(ClassifierResult.classified(ModelTier.MEDIUM, "llama3.2:3b"));
            ChatCompletionRequest request = ChatCompletionRequest.of(List.of(
                    ChatMessage.of("user", "Erkl\u00e4re mir die \u00c4nderung im Detail")));

            RoutingDecision decision = orchestrator.decide(request, snapshot);

            assertThat(decision.reasons()).anyMatch(r -> r.contains("erkl\u00e4re mir die \u00e4nderung im detail"));
            assertThat(decision.toHeaders().get(RoutingDecision.HEADER_REASONS))
                    .contains("erkl?re mir die ?nderung im detail")
                    .matches("[\\x20-\\x7e]*");
        }

        @Test
        void excludedModelIsNotExplicitlyRoutable() {
            ChatCompletionRequest request = new ChatCompletionRequest("nomic-embed-text",
                    List.of(ChatMessage.of("user", "What is 2+2?")), null, null, null);

            assertThat(orchestrator.decide(request, snapshot).routingPath()).isEqualTo(RoutingPath.HEURISTIC);
        }

        @Test
        void autoMeansNoPreference() {
            ChatCompletionRequest request = new ChatCompletionRequest("auto",
                    List.of(ChatMessage.of("user", "What is 2+2?")), null, null, null);

            RoutingDecision decision = orchestrator.decide(request, snapshot);

            assertThat(decision.routingPath()).isEqualTo(RoutingPath.HEURISTIC);
            assertThat(decision.reasons()).noneMatch(r -> r.startsWith("requested model"));
        }
    }

    @Nested
    @DisplayName("model selection")
    class Selection {

        @Test
        @DisplayName("coding tasks prefer the smallest coder model of the tier")
        void coderPreference() {
            RoutingDecision decision = orchestrator.decide(user("Write a Python function to sort a list"), snapshot);

            assertThat(decision.tier()).isEqualTo(ModelTier.SMALL);
            assertThat(decision.selectedModel()).isEqualTo("qwen2.5-coder:7b");
            assertThat(decision.preferCoder()).isTrue();
            assertThat(decision.reasons()).contains("coding task, preferring coder model");
        }

        @Test
        @DisplayName("coding task without a coder model in the tier keeps the default pick")
        void noCoderInTier() {
            when(classifier.classify(any(), any(), anyDouble(), any()))
                    .thenReturn(ClassifierResult.classified(ModelTier.LARGE, "llama3.2:3b"));

            RoutingDecision decision = orchestrator.decide(
                    user("Refactor and optimize this Python module step-by-step"), snapshot);

            assertThat(decision.tier()).isEqualTo(ModelTier.LARGE);
            assertThat(decision.selectedModel()).isEqualTo("llama3.3:70b");
            assertThat(decision.preferCoder()).isFalse();
        }

        @Test
        @DisplayName("empty tier is served from the next tier up and the reasons say so")
        void upwardFallback() {
            RegistrySnapshot sparse = build(RouterSettings.defaults(), List.of("llama3.2:3b", "llama3.3:70b"));
            when(classifier.classify(any(), any(), anyDouble(), any()))
                    .thenReturn(ClassifierResult.classified(ModelTier.MEDIUM, "llama3.2:3b"));

            RoutingDecision decision = orchestrator.decide(midScoreRequest(), sparse);

            assertThat(decision.tier()).isEqualTo(ModelTier.MEDIUM);
            assertThat(decision.selectedModel()).isEqualTo("llama3.3:70b");
            assertThat(decision.reasons()).contains("no MEDIUM model available, served from LARGE");
        }

        @Test
        @DisplayName("models without a parameter figure are flagged when selected")
        void degradedModelFlagged() {
            RegistrySnapshot onlyUnsized = build(RouterSettings.defaults(), List.of("phi3"));

            RoutingDecision decision = orchestrator.decide(user("What is 2+2?"), onlyUnsized);

            assertThat(decision.selectedModel()).isEqualTo("phi3");
            assertThat(decision.reasons()).contains("parameter count unknown for phi3, sized by default");
        }
    }

    @Nested
    @DisplayName("snapshot handling")
    class SnapshotHandling {

        @Test
        @DisplayName("empty registry is the only fatal outcome")
        void emptyRegistry() {
            RegistrySnapshot empty = RegistrySnapshot.empty(new TierThresholds(10, 40), ScoreBand.DEFAULT);

            assertThatThrownBy(() -> orchestrator.decide(user("What is 2+2?"), empty))
                    .isInstanceOf(NoEligibleModelException.class);
            verifyNoInteractions(classifier);
        }

        @Test
        @DisplayName("stale snapshot still routes and is flagged")
        void staleSnapshot() {
            RegistrySnapshot stale = snapshot.published(7, true, "connection refused");

            RoutingDecision decision = orchestrator.decide(user("What is 2+2?"), stale);

            assertThat(decision.selectedModel()).isEqualTo("llama3.1:8b");
            assertThat(decision.snapshotGeneration()).isEqualTo(7);
            assertThat(decision.reasons()).first().isEqualTo("registry stale: model discovery unavailable");
        }

        @Test
        @DisplayName("uncertain band is taken from the snapshot")
        void bandFromSnapshot() {
            RouterProperties narrowBand = new RouterProperties(0, 0, 0, 0.1, 0.2, null, null, 0, 0);
            RegistrySnapshot custom = build(new RouterSettings(narrowBand, RegistryProperties.defaults()), LISTING);

            RoutingDecision decision = orchestrator.decide(user("Compare cats and dogs"), custom);

            assertThat(decision.score()).isEqualTo(0.3);
            assertThat(decision.routingPath()).isEqualTo(RoutingPath.HEURISTIC);
            assertThat(decision.tier()).isEqualTo(ModelTier.LARGE);
            verifyNoInteractions(classifier);
        }
    }

    @Nested
    @DisplayName("route")
    class Route {

        @Test
        @DisplayName("reads the current snapshot and records metrics")
        void recordsMetrics() {
            when(registry.current()).thenReturn(snapshot);

            orchestrator.route(user("What is 2+2?"));
            orchestrator.route(user("What is 2+2?"));

            assertThat(meterRegistry.get("smartrouter.routing.decisions")
                    .tags("tier", "SMALL", "path", "heuristic", "coder", "false")
                    .counter().count()).isEqualTo(2.0);
            assertThat(meterRegistry.get("smartrouter.routing.duration").timer().count()).isEqualTo(2);
        }

        @Test
        @DisplayName("times failed decisions too")
        void failureStillTimed() {
            when(registry.current()).thenReturn(
                    RegistrySnapshot.empty(new TierThresholds(10, 40), ScoreBand.DEFAULT));

            assertThatThrownBy(() -> orchestrator.route(user("Hi"))).isInstanceOf(NoEligibleModelException.class);
            assertThat(meterRegistry.get("smartrouter.routing.duration").timer().count()).isEqualTo(1);
            assertThat(meterRegistry.find("smartrouter.routing.decisions").counter()).isNull();
        }
    }

    /** Short text, one tool and one complex keyword: 0.1 + 0.1 + 0.3. */
    private static ChatCompletionRequest midScoreRequest() {
        String text = "Compare the two options below. " + "lorem ".repeat(40);
        return new ChatCompletionRequest(null, List.of(ChatMessage.of("user", text)),
                List.of(tool("lookup")), null, null);
    }

    private static ChatCompletionRequest user(String text) {
        return ChatCompletionRequest.of(List.of(ChatMessage.of("user", text)));
    }

    private static JsonNode tool(String name) {
        return MAPPER.createObjectNode()
                .put("type", "function")
                .set("function", MAPPER.createObjectNode().put("name", name));
    }

    private static RegistrySnapshot build(RouterSettings settings, List<String> ids) {
        return SnapshotBuilder.from(settings)
                .build(ids, FilterPolicy.NONE, Map.of())
                .published(1, false, null);
    }
}
