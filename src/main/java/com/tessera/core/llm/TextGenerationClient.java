package com.tessera.core.llm;

import java.time.Duration;

/**
 * Black-box request/response text generation service.
 */
public interface TextGenerationClient {

    /**
     * Sends a prompt and blocks for the reply, at most for {@code timeout}.
     *
     * @param prompt    full prompt text
     * @param maxTokens upper bound on reply length
     * @param timeout   how long to wait before giving up
     * @return the reply text, never blank
     * @throws GenerationFailureException on timeout, empty reply or upstream error
     */
    String generate(String prompt, int maxTokens, Duration timeout);
}
