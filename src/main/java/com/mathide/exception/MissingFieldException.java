package com.mathide.exception;

import java.util.Map;

/**
 * A decoded response lacks a required field, or the field has the wrong JSON type.
 */
public class MissingFieldException extends MathIdeException {

    private final String field;

    public MissingFieldException(String field, String message) {
        super(MathIdeErrorCode.MISSING_FIELD, message, Map.of("field", field));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
