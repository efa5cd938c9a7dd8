package com.mathide.core.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mathide.core.candidate.Candidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * StepHistory - the causal chain of steps for one session.
 *
 * RESPONSIBILITIES:
 * - Append steps, linking each to its predecessor
 * - Roll back by truncation (no redo)
 * - Attach branch annotations to a step
 * - Export to, and rebuild from, the persisted JSON layout
 *
 * INVARIANTS:
 * - steps[i].ordinal == i
 * - steps[0].parentId is null; steps[i].parentId == steps[i-1].id for i > 0
 * - the cursor is always the last step
 *
 * Not thread-safe. The owning session's lock serializes access.
 */
public class StepHistory {

    private static final Logger log = LoggerFactory.getLogger(StepHistory.class);

    private final String     originalTask;
    private final List<Step> steps = new ArrayList<>();

    public StepHistory(String originalTask) {
        this.originalTask = originalTask != null ? originalTask : "";
    }

    // =========================================================================
    // Mutation
    // =========================================================================

    /**
     * Append a step after the current last one. Always succeeds.
     */
    public Step append(
            String       expression,
            List<String> availableCandidateIds,
            Candidate    chosenCandidate,
            String       resultExpression
    ) {
        Step parent = steps.isEmpty() ? null : steps.get(steps.size() - 1);

        Step step = new Step(
                UUID.randomUUID().toString(),
                steps.size(),
                expression,
                chosenCandidate,
                resultExpression,
                availableCandidateIds,
                parent != null ? parent.getId() : null,
                Instant.now(),
                List.of(),
                Map.of()
        );

        steps.add(step);
        log.debug("[History] Appended step #{} ({})", step.getOrdinal(), step.getId());
        return step;
    }

    /**
     * Truncate the chain so that step {@code ordinal} becomes the last one.
     *
     * @return false, leaving the chain untouched, when the ordinal is out of range
     */
    public boolean rollbackToOrdinal(int ordinal) {
        if (ordinal < 0 || ordinal >= steps.size()) {
            log.debug("[History] Rollback to #{} rejected (size={})", ordinal, steps.size());
            return false;
        }

        int discarded = steps.size() - ordinal - 1;
        steps.subList(ordinal + 1, steps.size()).clear();

        log.info("[History] Rolled back to step #{} ({} step(s) discarded)", ordinal, discarded);
        return true;
    }

    public boolean rollbackToId(String stepId) {
        return ordinalOf(stepId)
                .map(this::rollbackToOrdinal)
                .orElse(false);
    }

    /**
     * Ids of the steps a rollback to {@code ordinal} would discard. Empty when the ordinal
     * is out of range.
     */
    public List<String> idsAfter(int ordinal) {
        if (ordinal < 0 || ordinal >= steps.size()) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        for (Step s : steps.subList(ordinal + 1, steps.size())) {
            ids.add(s.getId());
        }
        return ids;
    }

    /**
     * Replace a step's branch annotations and record the decomposition in its metadata.
     *
     * @return false when no step has the given id
     */
    public boolean attachBranches(String stepId, String decompositionKind, String reason, List<Branch> branches) {
        Optional<Integer> ordinal = ordinalOf(stepId);
        if (ordinal.isEmpty()) {
            return false;
        }

        Map<String, String> extra = new LinkedHashMap<>();
        extra.put("decomposition", decompositionKind != null ? decompositionKind : "");
        if (reason != null && !reason.isBlank()) {
            extra.put("decomposition_reason", reason);
        }

        int i = ordinal.get();
        steps.set(i, steps.get(i).withBranches(branches, extra));
        log.info("[History] Attached {} branch(es) of kind '{}' to step #{}", branches.size(), decompositionKind, i);
        return true;
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public Optional<Step> currentStep() {
        return steps.isEmpty() ? Optional.empty() : Optional.of(steps.get(steps.size() - 1));
    }

    /** The expression the next generation works on; empty when nothing has been recorded. */
    public String currentExpression() {
        return currentStep().map(Step::currentExpression).orElse("");
    }

    /** A single step has nothing to revert to. */
    public boolean canRollback() {
        return steps.size() > 1;
    }

    public Optional<Step> stepById(String stepId) {
        return ordinalOf(stepId).map(steps::get);
    }

    public Optional<Step> stepByOrdinal(int ordinal) {
        if (ordinal < 0 || ordinal >= steps.size()) {
            return Optional.empty();
        }
        return Optional.of(steps.get(ordinal));
    }

    public List<Step> steps() {
        return Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public int size()          { return steps.size(); }
    public boolean isEmpty()   { return steps.isEmpty(); }
    public int cursor()        { return steps.size() - 1; }
    public String getOriginalTask() { return originalTask; }

    public HistorySummary summary() {
        List<HistorySummary.StepSummary> rows = new ArrayList<>(steps.size());
        for (Step step : steps) {
            rows.add(new HistorySummary.StepSummary(step));
        }
        return new HistorySummary(originalTask, cursor(), rows);
    }

    private Optional<Integer> ordinalOf(String stepId) {
        if (stepId == null) {
            return Optional.empty();
        }
        for (int i = 0; i < steps.size(); i++) {
            if (stepId.equals(steps.get(i).getId())) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }

    // =========================================================================
    // Export / import
    // =========================================================================

    public ObjectNode export(ObjectMapper mapper) {
        return HistoryCodec.write(this, mapper);
    }

    /**
     * Rebuild a history from its exported form.
     *
     * @throws com.mathide.exception.HistoryImportException naming the first incomplete
     *         field; nothing is built in that case
     */
    public static StepHistory importFrom(JsonNode exported) {
        return HistoryCodec.read(exported);
    }

    static StepHistory restore(String originalTask, List<Step> restored) {
        StepHistory history = new StepHistory(originalTask);
        history.steps.addAll(restored);
        log.info("[History] Imported {} step(s)", restored.size());
        return history;
    }
}
