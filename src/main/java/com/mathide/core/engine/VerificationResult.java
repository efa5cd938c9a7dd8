package com.mathide.core.engine;

import java.util.List;

/**
 * Independent re-check of a claimed transformation result.
 */
public final class VerificationResult {

    private final boolean      correct;
    private final String       correctedResult;
    private final String       explanation;
    private final List<String> errorsFound;
    private final String       stepByStepCheck;
    private final String       userResultAssessment;

    public VerificationResult(
            boolean      correct,
            String       correctedResult,
            String       explanation,
            List<String> errorsFound,
            String       stepByStepCheck,
            String       userResultAssessment
    ) {
        this.correct              = correct;
        this.correctedResult      = correctedResult;
        this.explanation          = explanation != null ? explanation : "";
        this.errorsFound          = errorsFound != null ? List.copyOf(errorsFound) : List.of();
        this.stepByStepCheck      = stepByStepCheck != null ? stepByStepCheck : "";
        this.userResultAssessment = userResultAssessment;
    }

    public boolean      isCorrect()               { return correct; }
    public String       getCorrectedResult()      { return correctedResult; }
    public String       getExplanation()          { return explanation; }
    public List<String> getErrorsFound()          { return errorsFound; }
    public String       getStepByStepCheck()      { return stepByStepCheck; }
    public String       getUserResultAssessment() { return userResultAssessment; }
}
