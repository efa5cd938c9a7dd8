package com.mathide.core.history;

import java.util.List;

/**
 * Display projection of a {@link StepHistory}. Exposes no registry ids.
 */
public final class HistorySummary {

    /** One row per step. */
    public static final class StepSummary {

        private final int     ordinal;
        private final String  expression;
        private final boolean hasChosenCandidate;
        private final String  chosenDescription;
        private final String  chosenKind;
        private final boolean hasResult;
        private final String  resultExpression;
        private final String  timestamp;
        private final int     branchCount;

        StepSummary(Step step) {
            this.ordinal            = step.getOrdinal();
            this.expression         = step.getExpression();
            this.hasChosenCandidate = step.hasChosenCandidate();
            this.chosenDescription  = step.hasChosenCandidate() ? step.getChosenCandidate().getDescription() : null;
            this.chosenKind         = step.hasChosenCandidate() ? step.getChosenCandidate().getKind() : null;
            this.hasResult          = step.hasResult();
            this.resultExpression   = step.getResultExpression();
            this.timestamp          = step.getCreatedAt().toString();
            this.branchCount        = step.getBranches().size();
        }

        public int     getOrdinal()            { return ordinal; }
        public String  getExpression()         { return expression; }
        public boolean isHasChosenCandidate()  { return hasChosenCandidate; }
        public String  getChosenDescription()  { return chosenDescription; }
        public String  getChosenKind()         { return chosenKind; }
        public boolean isHasResult()           { return hasResult; }
        public String  getResultExpression()   { return resultExpression; }
        public String  getTimestamp()          { return timestamp; }
        public int     getBranchCount()        { return branchCount; }
    }

    private final String            originalTask;
    private final int               stepCount;
    private final int               cursor;
    private final boolean           complete;
    private final List<StepSummary> steps;

    HistorySummary(String originalTask, int cursor, List<StepSummary> steps) {
        this.originalTask = originalTask;
        this.stepCount    = steps.size();
        this.cursor       = cursor;
        this.steps        = List.copyOf(steps);
        this.complete     = !steps.isEmpty() && steps.get(steps.size() - 1).isHasResult();
    }

    public String            getOriginalTask() { return originalTask; }
    public int               getStepCount()    { return stepCount; }
    public int               getCursor()       { return cursor; }
    public boolean           isComplete()      { return complete; }
    public List<StepSummary> getSteps()        { return steps; }
}
