package com.mathide.core.engine;

import java.util.List;

/**
 * Verdict on whether the task is solved.
 */
public final class CheckResult {

    private final boolean      solved;
    private final double       confidence;
    private final String       explanation;
    private final String       category;
    private final List<String> nextSteps;

    public CheckResult(boolean solved, double confidence, String explanation, String category, List<String> nextSteps) {
        this.solved      = solved;
        this.confidence  = confidence;
        this.explanation = explanation;
        this.category    = category;
        this.nextSteps   = nextSteps != null ? List.copyOf(nextSteps) : List.of();
    }

    public boolean      isSolved()       { return solved; }
    public double       getConfidence()  { return confidence; }
    public String       getExplanation() { return explanation; }
    public String       getCategory()    { return category; }
    public List<String> getNextSteps()   { return nextSteps; }
}
