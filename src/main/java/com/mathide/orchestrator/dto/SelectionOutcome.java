package com.mathide.orchestrator.dto;

import com.mathide.core.candidate.ParameterDefinition;

import java.util.List;

public class SelectionOutcome {

    public enum Status {
        /** The selection is concrete and ready to apply. */
        SELECTED,
        AWAITING_PARAMETERS,
        UNKNOWN_CANDIDATE,
        NOT_ALLOWED
    }

    private final Status                    status;
    private final String                    candidateId;
    private final OfferedCandidate          candidate;
    private final List<ParameterDefinition> missingParameters;
    private final String                    message;

    private SelectionOutcome(
            Status status, String candidateId, OfferedCandidate candidate,
            List<ParameterDefinition> missingParameters, String message) {
        this.status            = status;
        this.candidateId       = candidateId;
        this.candidate         = candidate;
        this.missingParameters = List.copyOf(missingParameters);
        this.message           = message;
    }

    public static SelectionOutcome selected(String candidateId, OfferedCandidate candidate) {
        return new SelectionOutcome(Status.SELECTED, candidateId, candidate, List.of(), null);
    }

    public static SelectionOutcome awaitingParameters(
            String candidateId, OfferedCandidate candidate, List<ParameterDefinition> missing) {
        return new SelectionOutcome(Status.AWAITING_PARAMETERS, candidateId, candidate, missing, null);
    }

    public static SelectionOutcome unknownCandidate(String candidateId) {
        return new SelectionOutcome(Status.UNKNOWN_CANDIDATE, candidateId, null, List.of(),
                "Unknown or stale candidate id: " + candidateId);
    }

    public static SelectionOutcome notAllowed(String message) {
        return new SelectionOutcome(Status.NOT_ALLOWED, null, null, List.of(), message);
    }

    public Status getStatus()                               { return status; }
    public String getCandidateId()                          { return candidateId; }
    public OfferedCandidate getCandidate()                  { return candidate; }
    public List<ParameterDefinition> getMissingParameters() { return missingParameters; }
    public String getMessage()                              { return message; }
}
