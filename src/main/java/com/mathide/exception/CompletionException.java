package com.mathide.exception;

import java.util.Map;

/**
 * Failure talking to the model-completion service.
 *
 * RATE_LIMITED and CONNECTION are transient and retried by
 * {@link com.mathide.llm.RetryingLLMClient}; INVALID_RESPONSE and OTHER
 * propagate on the first occurrence.
 */
public class CompletionException extends MathIdeException {

    public enum FailureKind {
        RATE_LIMITED,
        CONNECTION,
        INVALID_RESPONSE,
        OTHER
    }

    private final FailureKind kind;

    public CompletionException(FailureKind kind, String message) {
        super(MathIdeErrorCode.LLM_ERROR, message, Map.of("kind", kind));
        this.kind = kind;
    }

    public CompletionException(FailureKind kind, String message, Throwable cause) {
        super(MathIdeErrorCode.LLM_ERROR, message, Map.of("kind", kind), cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == FailureKind.RATE_LIMITED || kind == FailureKind.CONNECTION;
    }
}
