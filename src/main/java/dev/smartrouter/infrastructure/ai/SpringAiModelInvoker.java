package dev.smartrouter.infrastructure.ai;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;

/**
 * Calls a backend model through Spring AI's {@link ChatModel}. The model id is set per call,
 * so one client serves every model the registry knows about.
 */
@Component
public class SpringAiModelInvoker implements ModelInvoker {

    private static final Logger log = LoggerFactory.getLogger(SpringAiModelInvoker.class);

    private final ChatModel chatModel;

    public SpringAiModelInvoker(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    @CircuitBreaker(name = "backend")
    public String complete(String modelId, String prompt, int maxTokens) {
        log.debug("Completing with {} (maxTokens={})", modelId, maxTokens);
        ChatOptions options = ChatOptions.builder()
                .model(modelId)
                .temperature(0.0)
                .maxTokens(maxTokens)
                .build();
        ChatResponse response = chatModel.call(new Prompt(prompt, options));
        if (response == null || response.getResult() == null) {
            throw new IllegalStateException("Empty response from " + modelId);
        }
        return response.getResult().getOutput().getText();
    }
}
