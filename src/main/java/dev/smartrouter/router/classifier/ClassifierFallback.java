package dev.smartrouter.router.classifier;

import dev.smartrouter.config.RouterProperties;
import dev.smartrouter.domain.enums.ModelTier;
import dev.smartrouter.domain.valueobject.ModelEntry;
import dev.smartrouter.domain.valueobject.ScoreBand;
import dev.smartrouter.dto.request.ChatCompletionRequest;
import dev.smartrouter.infrastructure.ai.ModelInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves an inconclusive heuristic score with one classification call to a small model.
 *
 * <p>Failure policy:
 * <ul>
 *   <li>One attempt, no retry, bounded by {@code smartrouter.routing.classifier-timeout}.</li>
 *   <li>Timeout, call failure or an answer without a tier label degrade to the heuristic
 *       score's own tier. Nothing is thrown to the caller.</li>
 *   <li>If the waiting thread is interrupted the decision is abandoned with a
 *       {@link CancellationException}; the call itself keeps running and its result is dropped.</li>
 * </ul>
 */
@Component
public class ClassifierFallback {

    private static final Logger log = LoggerFactory.getLogger(ClassifierFallback.class);

    private final ModelInvoker modelInvoker;
    private final Executor executor;
    private final Duration timeout;
    private final int maxChars;
    private final int maxTokens;

    public ClassifierFallback(ModelInvoker modelInvoker,
                              RouterProperties routerProperties,
                              @Qualifier("classifierExecutor") Executor executor) {
        this.modelInvoker = modelInvoker;
        this.executor = executor;
        this.timeout = routerProperties.classifierTimeout();
        this.maxChars = routerProperties.classifierMaxChars();
        this.maxTokens = routerProperties.classifierMaxTokens();
    }

    public ClassifierResult classify(ChatCompletionRequest request, ModelEntry classifierModel,
                                     double heuristicScore, ScoreBand band) {
        ModelTier fallbackTier = band.tierFor(heuristicScore);
        String prompt = ClassifierPrompts.build(request, maxChars);

        String answer;
        try {
            CompletableFuture<String> call = CompletableFuture.supplyAsync(
                    () -> modelInvoker.complete(classifierModel.id(), prompt, maxTokens), executor);
            answer = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Routing abandoned while waiting for classifier " + classifierModel.id());
        } catch (TimeoutException e) {
            log.warn("Classifier {} timed out after {}ms, falling back to {}",
                    classifierModel.id(), timeout.toMillis(), fallbackTier);
            return ClassifierResult.unavailable(fallbackTier, "timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Classifier {} failed, falling back to {}: {}", classifierModel.id(), fallbackTier, cause.getMessage());
            return ClassifierResult.unavailable(fallbackTier, "call failed: " + cause.getClass().getSimpleName());
        } catch (RuntimeException e) {
            log.warn("Classifier {} could not be dispatched, falling back to {}: {}",
                    classifierModel.id(), fallbackTier, e.getMessage());
            return ClassifierResult.unavailable(fallbackTier, "dispatch failed: " + e.getClass().getSimpleName());
        }

        log.debug("Classifier {} answered: {}", classifierModel.id(), answer);
        Optional<ModelTier> tier = ClassifierPrompts.parseTier(answer);
        if (tier.isEmpty()) {
            log.warn("Classifier {} gave no tier label, falling back to {}", classifierModel.id(), fallbackTier);
            return ClassifierResult.unavailable(fallbackTier, "unparseable answer");
        }
        return ClassifierResult.classified(tier.get(), classifierModel.id());
    }
}
