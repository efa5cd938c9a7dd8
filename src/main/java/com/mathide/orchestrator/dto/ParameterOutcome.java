package com.mathide.orchestrator.dto;

import com.mathide.core.candidate.ParameterDefinition;

import java.util.List;

public class ParameterOutcome {

    public enum Status {
        /** Every parameter is bound; the selection is concrete. */
        COMPLETE,
        STILL_MISSING,
        UNKNOWN_PARAMETER,
        INVALID_VALUE,
        NOT_ALLOWED
    }

    private final Status                    status;
    private final OfferedCandidate          candidate;
    private final List<ParameterDefinition> missingParameters;
    private final String                    message;

    private ParameterOutcome(Status status, OfferedCandidate candidate,
                             List<ParameterDefinition> missingParameters, String message) {
        this.status            = status;
        this.candidate         = candidate;
        this.missingParameters = List.copyOf(missingParameters);
        this.message           = message;
    }

    public static ParameterOutcome complete(OfferedCandidate concrete) {
        return new ParameterOutcome(Status.COMPLETE, concrete, List.of(), null);
    }

    public static ParameterOutcome stillMissing(List<ParameterDefinition> missing) {
        return new ParameterOutcome(Status.STILL_MISSING, null, missing, null);
    }

    public static ParameterOutcome rejected(Status status, String message) {
        return new ParameterOutcome(status, null, List.of(), message);
    }

    public Status getStatus()                               { return status; }
    public OfferedCandidate getCandidate()                  { return candidate; }
    public List<ParameterDefinition> getMissingParameters() { return missingParameters; }
    public String getMessage()                              { return message; }
}
