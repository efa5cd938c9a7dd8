package com.mathide.core.engine;

import java.util.List;

/**
 * What the model produced when applying a candidate.
 */
public final class ApplyResult {

    private final String       resultExpression;
    private final boolean      valid;
    private final String       explanation;
    private final List<String> errors;

    public ApplyResult(String resultExpression, boolean valid, String explanation, List<String> errors) {
        this.resultExpression = resultExpression;
        this.valid            = valid;
        this.explanation      = explanation != null ? explanation : "";
        this.errors           = errors != null ? List.copyOf(errors) : List.of();
    }

    public String       getResultExpression() { return resultExpression; }
    public boolean      isValid()             { return valid; }
    public String       getExplanation()      { return explanation; }
    public List<String> getErrors()           { return errors; }
}
