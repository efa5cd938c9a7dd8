package com.mathide.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception with a stable {@link MathIdeErrorCode} and optional diagnostic context.
 *
 * The context map is copied on construction and exposed read-only.
 */
public class MathIdeException extends RuntimeException {

    private final MathIdeErrorCode    code;
    private final Map<String, Object> context;

    public MathIdeException(MathIdeErrorCode code, String message) {
        this(code, message, Collections.emptyMap(), null);
    }

    public MathIdeException(MathIdeErrorCode code, String message, Throwable cause) {
        this(code, message, Collections.emptyMap(), cause);
    }

    public MathIdeException(MathIdeErrorCode code, String message, Map<String, ?> context) {
        this(code, message, context, null);
    }

    public MathIdeException(MathIdeErrorCode code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code    = Objects.requireNonNull(code, "code");
        this.context = copy(context);
    }

    public MathIdeErrorCode getCode() {
        return code;
    }

    /** Additional key/value details that help diagnosing the error. */
    public Map<String, Object> getContext() {
        return context;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) return Collections.emptyMap();
        Map<String, Object> m = new LinkedHashMap<>();
        input.forEach(m::put);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{code=" + code
                + ", message=" + getMessage()
                + (context.isEmpty() ? "" : ", context=" + context)
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + '}';
    }
}
