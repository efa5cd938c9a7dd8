package com.mathide.core.history;

import com.mathide.core.candidate.Candidate;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One link in a session's chain of steps.
 *
 * {@code expression} is what the step started from; when a candidate was applied,
 * {@code chosenCandidate} and {@code resultExpression} record what was done and what came
 * out. The first step of a chain has no parent; every other step's parent is the step
 * before it.
 *
 * Immutable. {@link StepHistory} swaps in a copy when branches are attached.
 */
public final class Step {

    private final String              id;
    private final int                 ordinal;
    private final String              expression;
    private final Candidate           chosenCandidate;
    private final String              resultExpression;
    private final List<String>        availableCandidateIds;
    private final String              parentId;
    private final Instant             createdAt;
    private final List<Branch>        branches;
    private final Map<String, String> metadata;

    public Step(
            String              id,
            int                 ordinal,
            String              expression,
            Candidate           chosenCandidate,
            String              resultExpression,
            List<String>        availableCandidateIds,
            String              parentId,
            Instant             createdAt,
            List<Branch>        branches,
            Map<String, String> metadata
    ) {
        this.id                    = Objects.requireNonNull(id, "id");
        this.ordinal               = ordinal;
        this.expression            = expression != null ? expression : "";
        this.chosenCandidate       = chosenCandidate;
        this.resultExpression      = resultExpression;
        this.availableCandidateIds = availableCandidateIds != null ? List.copyOf(availableCandidateIds) : List.of();
        this.parentId              = parentId;
        this.createdAt             = createdAt != null ? createdAt : Instant.now();
        this.branches              = branches != null ? List.copyOf(branches) : List.of();
        this.metadata              = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    Step withBranches(List<Branch> newBranches, Map<String, String> extraMetadata) {
        Map<String, String> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extraMetadata);
        return new Step(id, ordinal, expression, chosenCandidate, resultExpression,
                availableCandidateIds, parentId, createdAt, newBranches, merged);
    }

    public String getId()                       { return id; }
    public int getOrdinal()                     { return ordinal; }
    public String getExpression()               { return expression; }
    public Candidate getChosenCandidate()       { return chosenCandidate; }
    public String getResultExpression()         { return resultExpression; }
    public List<String> getAvailableCandidateIds() { return availableCandidateIds; }
    public String getParentId()                 { return parentId; }
    public Instant getCreatedAt()               { return createdAt; }
    public List<Branch> getBranches()           { return branches; }
    public Map<String, String> getMetadata()    { return metadata; }

    public boolean hasChosenCandidate() { return chosenCandidate != null; }
    public boolean hasResult()          { return resultExpression != null; }

    /** Where the chain stands after this step: the result if there is one, else the expression. */
    public String currentExpression() {
        return resultExpression != null && !resultExpression.isEmpty() ? resultExpression : expression;
    }

    @Override
    public String toString() {
        return "Step{#" + ordinal + " " + id + ", expression='" + expression + "'"
                + (resultExpression != null ? ", result='" + resultExpression + "'" : "") + "}";
    }
}
