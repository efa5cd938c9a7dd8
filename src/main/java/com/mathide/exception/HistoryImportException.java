package com.mathide.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An exported history record is structurally incomplete and cannot be loaded.
 */
public class HistoryImportException extends MathIdeException {

    public HistoryImportException(String field, int stepIndex, String message) {
        super(MathIdeErrorCode.INVALID_ARGUMENT, message, context(field, stepIndex));
    }

    private static Map<String, Object> context(String field, int stepIndex) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("field", field);
        if (stepIndex >= 0) ctx.put("step", stepIndex);
        return ctx;
    }
}
