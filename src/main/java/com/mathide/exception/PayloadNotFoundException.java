package com.mathide.exception;

import java.util.Map;

/**
 * The model text contains no bracketed JSON payload at all.
 * Raised before any decode stage runs.
 */
public class PayloadNotFoundException extends MathIdeException {

    private final String originalText;

    public PayloadNotFoundException(String message, String originalText) {
        super(MathIdeErrorCode.PAYLOAD_NOT_FOUND, message,
                Map.of("length", originalText == null ? 0 : originalText.length()));
        this.originalText = originalText;
    }

    public String getOriginalText() {
        return originalText;
    }
}
