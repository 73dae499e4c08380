package dev.smartrouter.infrastructure.ai;

/**
 * Single non-streaming completion against a named backend model.
 */
public interface ModelInvoker {

    /**
     * @return the generated text
     * @throws RuntimeException on any transport or backend failure
     */
    String complete(String modelId, String prompt, int maxTokens);
}
