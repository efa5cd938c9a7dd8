package com.mathide.core.candidate;

import java.util.Locale;

/**
 * Kind of value a parameterized candidate asks the user for.
 */
public enum ParameterType {
    NUMBER,
    TEXT,
    CHOICE,
    EXPRESSION;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses the lower-case wire name; unknown names yield null. */
    public static ParameterType fromWire(String value) {
        if (value == null) return null;
        for (ParameterType t : values()) {
            if (t.wireName().equalsIgnoreCase(value.trim())) return t;
        }
        return null;
    }
}
