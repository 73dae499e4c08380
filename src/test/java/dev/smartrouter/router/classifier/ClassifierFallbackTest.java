package dev.smartrouter.router.classifier;

import dev.smartrouter.config.RouterProperties;
import dev.smartrouter.domain.enums.ModelTier;
import dev.smartrouter.domain.valueobject.ModelCapability;
import dev.smartrouter.domain.valueobject.ModelEntry;
import dev.smartrouter.domain.valueobject.ScoreBand;
import dev.smartrouter.dto.request.ChatCompletionRequest;
import dev.smartrouter.dto.request.ChatMessage;
import dev.smartrouter.infrastructure.ai.ModelInvoker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClassifierFallbackTest {

    private static final ModelEntry CLASSIFIER_MODEL = new ModelEntry("llama3.2:3b",
            new ModelCapability(3, null, false, false, false), ModelTier.SMALL, false);
    private static final ChatCompletionRequest REQUEST = ChatCompletionRequest.of(
            List.of(ChatMessage.of("user", "Compare cats and dogs")));

    private ModelInvoker invoker;
    private ExecutorService executor;
    private ClassifierFallback fallback;

    @BeforeEach
    void setUp() {
        invoker = mock(ModelInvoker.class);
        executor = Executors.newCachedThreadPool();
        RouterProperties properties = new RouterProperties(0, 0, 0, null, null, null,
                Duration.ofMillis(200), 0, 0);
        fallback = new ClassifierFallback(invoker, properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("classifier answer decides the tier")
    void classifierAnswerWins() {
        when(invoker.complete(anyString(), anyString(), anyInt())).thenReturn("MEDIUM");

        ClassifierResult result = fallback.classify(REQUEST, CLASSIFIER_MODEL, 0.5, ScoreBand.DEFAULT);

        assertThat(result.classified()).isTrue();
        assertThat(result.tier()).isEqualTo(ModelTier.MEDIUM);
        assertThat(result.reason()).isEqualTo("classifier llama3.2:3b chose MEDIUM");
        verify(invoker).complete(eq("llama3.2:3b"), contains("Compare cats and dogs"), eq(16));
    }

    @Test
    @DisplayName("classifier may move the tier away from the score band")
    void classifierOverridesBand() {
        when(invoker.complete(anyString(), anyString(), anyInt())).thenReturn("LARGE\nMulti-step reasoning.");

        ClassifierResult result = fallback.classify(REQUEST, CLASSIFIER_MODEL, 0.3, ScoreBand.DEFAULT);

        assertThat(result.tier()).isEqualTo(ModelTier.LARGE);
    }

    @Test
    @DisplayName("timeout degrades to the score's own tier")
    void timeoutFallsBack() {
        CountDownLatch release = new CountDownLatch(1);
        when(invoker.complete(anyString(), anyString(), anyInt())).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return "LARGE";
        });

        long start = System.nanoTime();
        ClassifierResult result = fallback.classify(REQUEST, CLASSIFIER_MODEL, 0.5, ScoreBand.DEFAULT);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        release.countDown();

        assertThat(result.classified()).isFalse();
        assertThat(result.tier()).isEqualTo(ModelTier.MEDIUM);
        assertThat(result.reason()).contains("timed out after 200ms");
        assertThat(elapsedMillis).isLessThan(2000);
    }

    @ParameterizedTest(name = "score {0} → {1}")
    @CsvSource({"0.3, MEDIUM", "0.5, MEDIUM", "0.7, MEDIUM"})
    @DisplayName("call failure degrades to the score's own tier")
    void failureFallsBack(double score, ModelTier expected) {
        when(invoker.complete(anyString(), anyString(), anyInt()))
                .thenThrow(new IllegalStateException("connection reset"));

        ClassifierResult result = fallback.classify(REQUEST, CLASSIFIER_MODEL, score, ScoreBand.DEFAULT);

        assertThat(result.classified()).isFalse();
        assertThat(result.tier()).isEqualTo(expected);
        assertThat(result.reason()).isEqualTo(
                "classifier unavailable (call failed: IllegalStateException), using heuristic tier MEDIUM");
    }

    @Test
    @DisplayName("answer without a tier label degrades to the score's own tier")
    void unparseableAnswer() {
        when(invoker.complete(anyString(), anyString(), anyInt())).thenReturn("It depends.");

        ClassifierResult result = fallback.classify(REQUEST, CLASSIFIER_MODEL, 0.5, ScoreBand.DEFAULT);

        assertThat(result.classified()).isFalse();
        assertThat(result.reason()).contains("unparseable answer");
    }

    @Test
    @DisplayName("a saturated executor degrades instead of failing the request")
    void rejectedDispatch() {
        executor.shutdown();

        ClassifierResult result = fallback.classify(REQUEST, CLASSIFIER_MODEL, 0.5, ScoreBand.DEFAULT);

        assertThat(result.classified()).isFalse();
        assertThat(result.reason()).contains(RejectedExecutionException.class.getSimpleName());
    }

    @Test
    @DisplayName("interrupting the waiting thread abandons the decision")
    void interruptCancels() throws Exception {
        CountDownLatch callStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(invoker.complete(anyString(), anyString(), anyInt())).thenAnswer(inv -> {
            callStarted.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "LARGE";
        });
        RouterProperties patient = new RouterProperties(0, 0, 0, null, null, null,
                Duration.ofSeconds(10), 0, 0);
        ClassifierFallback slow = new ClassifierFallback(invoker, patient, executor);

        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AtomicReference<Boolean> interruptFlag = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                slow.classify(REQUEST, CLASSIFIER_MODEL, 0.5, ScoreBand.DEFAULT);
            } catch (Throwable t) {
                thrown.set(t);
            }
            interruptFlag.set(Thread.currentThread().isInterrupted());
        });
        caller.start();
        assertThat(callStarted.await(5, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        caller.join(5000);
        release.countDown();

        assertThat(thrown.get()).isInstanceOf(CancellationException.class);
        assertThat(interruptFlag.get()).isTrue();
    }
}
