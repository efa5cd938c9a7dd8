package com.mathide.exception;

/**
 * Stable error codes carried by every {@link MathIdeException}.
 * Suitable for logs and for the HTTP shell's error bodies.
 */
public enum MathIdeErrorCode {
    UNKNOWN,
    INVALID_ARGUMENT,
    NOT_FOUND,
    LLM_ERROR,
    PAYLOAD_NOT_FOUND,
    PARSE_FAILURE,
    MISSING_FIELD
}
