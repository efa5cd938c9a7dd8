package com.mathide.core.candidate;

/**
 * A concrete value bound to a parameter name.
 */
public final class CandidateParameter {

    private final String        name;
    private final String        value;
    private final ParameterType type;

    public CandidateParameter(String name, String value, ParameterType type) {
        this.name  = name;
        this.value = value;
        this.type  = type != null ? type : ParameterType.TEXT;
    }

    public String        getName()  { return name; }
    public String        getValue() { return value; }
    public ParameterType getType()  { return type; }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
