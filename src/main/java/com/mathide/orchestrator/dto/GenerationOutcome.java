package com.mathide.orchestrator.dto;

import java.util.List;

/**
 * Result of a generation turn. An empty candidate list is a normal outcome.
 */
public class GenerationOutcome {

    public enum Status {
        GENERATED,
        NO_CANDIDATES,
        MALFORMED_RESPONSE,
        NOT_ALLOWED
    }

    private final Status                 status;
    private final List<OfferedCandidate> candidates;
    private final int                    droppedCount;
    private final String                 message;

    private GenerationOutcome(Status status, List<OfferedCandidate> candidates, int droppedCount, String message) {
        this.status       = status;
        this.candidates   = List.copyOf(candidates);
        this.droppedCount = droppedCount;
        this.message      = message;
    }

    public static GenerationOutcome generated(List<OfferedCandidate> candidates, int droppedCount) {
        return new GenerationOutcome(Status.GENERATED, candidates, droppedCount, null);
    }

    public static GenerationOutcome noCandidates(int droppedCount) {
        return new GenerationOutcome(Status.NO_CANDIDATES, List.of(), droppedCount,
                "No usable candidates this turn");
    }

    public static GenerationOutcome malformed(String message) {
        return new GenerationOutcome(Status.MALFORMED_RESPONSE, List.of(), 0, message);
    }

    public static GenerationOutcome notAllowed(String message) {
        return new GenerationOutcome(Status.NOT_ALLOWED, List.of(), 0, message);
    }

    public Status getStatus()                    { return status; }
    public List<OfferedCandidate> getCandidates() { return candidates; }
    public int getDroppedCount()                 { return droppedCount; }
    public String getMessage()                   { return message; }
}
