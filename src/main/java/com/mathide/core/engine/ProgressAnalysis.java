package com.mathide.core.engine;

/**
 * Advisory assessment of how a solution is going.
 *
 * A rollback recommendation is only {@link #isActionable() actionable} when it names an
 * earlier step that still exists in the chain. Acting on it is the caller's decision.
 */
public final class ProgressAnalysis {

    private final String  progressAssessment;
    private final double  confidence;
    private final String  analysis;
    private final boolean recommendRollback;
    private final Integer recommendedStep;
    private final String  rollbackReason;
    private final String  suggestionMessage;
    private final boolean actionable;

    public ProgressAnalysis(
            String  progressAssessment,
            double  confidence,
            String  analysis,
            boolean recommendRollback,
            Integer recommendedStep,
            String  rollbackReason,
            String  suggestionMessage,
            boolean actionable
    ) {
        this.progressAssessment = progressAssessment;
        this.confidence         = confidence;
        this.analysis           = analysis != null ? analysis : "";
        this.recommendRollback  = recommendRollback;
        this.recommendedStep    = recommendedStep;
        this.rollbackReason     = rollbackReason;
        this.suggestionMessage  = suggestionMessage;
        this.actionable         = actionable;
    }

    public String  getProgressAssessment() { return progressAssessment; }
    public double  getConfidence()         { return confidence; }
    public String  getAnalysis()           { return analysis; }
    public boolean isRecommendRollback()   { return recommendRollback; }
    public Integer getRecommendedStep()    { return recommendedStep; }
    public String  getRollbackReason()     { return rollbackReason; }
    public String  getSuggestionMessage()  { return suggestionMessage; }
    public boolean isActionable()          { return actionable; }
}
