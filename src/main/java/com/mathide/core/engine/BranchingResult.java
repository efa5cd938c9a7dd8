package com.mathide.core.engine;

import com.mathide.core.history.Branch;

import java.util.List;

/**
 * Whether an expression decomposes into a system, cases or alternatives, and the arms if so.
 */
public final class BranchingResult {

    public static final String SYSTEM       = "system";
    public static final String CASES        = "cases";
    public static final String ALTERNATIVES = "alternatives";

    private final boolean      requiresBranching;
    private final String       solutionType;
    private final String       explanation;
    private final List<Branch> branches;

    public BranchingResult(boolean requiresBranching, String solutionType, String explanation, List<Branch> branches) {
        this.requiresBranching = requiresBranching;
        this.solutionType      = solutionType;
        this.explanation       = explanation != null ? explanation : "";
        this.branches          = branches != null ? List.copyOf(branches) : List.of();
    }

    public boolean      isRequiresBranching() { return requiresBranching; }
    public String       getSolutionType()     { return solutionType; }
    public String       getExplanation()      { return explanation; }
    public List<Branch> getBranches()         { return branches; }
}
