package com.mathide.orchestrator.dto;

import com.mathide.core.engine.CheckResult;

import java.util.List;

/**
 * Result of applying the selected candidate.
 *
 * APPLIED and SOLVED mean a step was appended. INVALID and MALFORMED_RESPONSE leave the
 * history as it was and keep the selection so the user can choose again.
 */
public class ApplyOutcome {

    public enum Status {
        APPLIED,
        SOLVED,
        INVALID,
        MALFORMED_RESPONSE,
        NOT_ALLOWED
    }

    private final Status       status;
    private final Integer      stepOrdinal;
    private final String       resultExpression;
    private final String       explanation;
    private final List<String> errors;
    private final CheckResult  check;
    private final String       message;

    private ApplyOutcome(Status status, Integer stepOrdinal, String resultExpression, String explanation,
                         List<String> errors, CheckResult check, String message) {
        this.status           = status;
        this.stepOrdinal      = stepOrdinal;
        this.resultExpression = resultExpression;
        this.explanation      = explanation;
        this.errors           = errors != null ? List.copyOf(errors) : List.of();
        this.check            = check;
        this.message          = message;
    }

    public static ApplyOutcome applied(int ordinal, String result, String explanation, CheckResult check, String message) {
        Status status = check != null && check.isSolved() ? Status.SOLVED : Status.APPLIED;
        return new ApplyOutcome(status, ordinal, result, explanation, List.of(), check, message);
    }

    public static ApplyOutcome invalid(String result, String explanation, List<String> errors) {
        return new ApplyOutcome(Status.INVALID, null, result, explanation, errors, null,
                "The model judged the transformation invalid here");
    }

    public static ApplyOutcome malformed(String message) {
        return new ApplyOutcome(Status.MALFORMED_RESPONSE, null, null, null, List.of(), null, message);
    }

    public static ApplyOutcome notAllowed(String message) {
        return new ApplyOutcome(Status.NOT_ALLOWED, null, null, null, List.of(), null, message);
    }

    public Status getStatus()            { return status; }
    public Integer getStepOrdinal()      { return stepOrdinal; }
    public String getResultExpression()  { return resultExpression; }
    public String getExplanation()       { return explanation; }
    public List<String> getErrors()      { return errors; }
    public CheckResult getCheck()        { return check; }
    public String getMessage()           { return message; }

    public boolean isStepAppended() {
        return status == Status.APPLIED || status == Status.SOLVED;
    }
}
