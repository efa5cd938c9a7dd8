package com.mathide.llm;

/**
 * One attempt at a completion, with no retrying.
 *
 * Failures are reported as {@link com.mathide.exception.CompletionException} carrying the
 * failure kind, so the caller can decide whether another attempt is worthwhile. Timeouts
 * surface as {@code CONNECTION}.
 */
public interface CompletionTransport {

    CompletionResponse send(CompletionRequest request);
}
