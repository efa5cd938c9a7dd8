package com.mathide.llm;

/**
 * LLMClient - the single entry point the engines use to reach the model.
 *
 * Implementations honour a bounded-retry contract: rate limiting and connection
 * failures are retried with backoff up to a fixed ceiling, everything else
 * propagates at once as a {@link com.mathide.exception.CompletionException}.
 */
public interface LLMClient {

    /**
     * @return a response with non-empty content
     * @throws com.mathide.exception.CompletionException once retries are exhausted or on a
     *         non-retriable failure
     */
    CompletionResponse complete(CompletionRequest request);

    /**
     * Convenience for the common system + user shape at the role's canonical temperature.
     * Implementations only need {@link #complete}.
     */
    default String completeText(ModelRole role, String systemPrompt, String userPrompt) {
        return complete(CompletionRequest.of(role, systemPrompt, userPrompt)).getContent();
    }
}
