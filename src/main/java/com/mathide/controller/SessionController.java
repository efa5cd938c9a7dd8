package com.mathide.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mathide.core.engine.BranchingResult;
import com.mathide.core.engine.CheckResult;
import com.mathide.core.engine.ProgressAnalysis;
import com.mathide.core.engine.VerificationResult;
import com.mathide.core.history.HistorySummary;
import com.mathide.orchestrator.SessionOrchestrator;
import com.mathide.orchestrator.dto.AnalysisOutcome;
import com.mathide.orchestrator.dto.ApplyOutcome;
import com.mathide.orchestrator.dto.GenerationOutcome;
import com.mathide.orchestrator.dto.ParameterOutcome;
import com.mathide.orchestrator.dto.SelectionOutcome;
import com.mathide.orchestrator.dto.SessionSnapshot;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thin HTTP shell over {@link SessionOrchestrator}. One session per user id.
 *
 * Calls made in the wrong session state answer 409 with the outcome body.
 */
@RestController
public class SessionController {

    private final SessionOrchestrator orchestrator;

    public SessionController(SessionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    @PostMapping("/sessions/{userId}")
    public ResponseEntity<SessionSnapshot> newSession(
            @PathVariable String userId,
            @RequestBody Map<String, String> request
    ) {
        String task = request.get("task");

        if (task == null || task.trim().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }

        return ResponseEntity.ok(orchestrator.newSession(userId, task));
    }

    @GetMapping("/sessions/{userId}")
    public ResponseEntity<SessionSnapshot> snapshot(@PathVariable String userId) {
        return ResponseEntity.of(orchestrator.snapshot(userId));
    }

    @PostMapping("/sessions/{userId}/cancel")
    public ResponseEntity<SessionSnapshot> cancel(@PathVariable String userId) {
        orchestrator.cancel(userId);
        return ResponseEntity.of(orchestrator.snapshot(userId));
    }

    @DeleteMapping("/sessions/{userId}")
    public ResponseEntity<Void> endSession(@PathVariable String userId) {
        return orchestrator.endSession(userId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    // =========================================================================
    // Loop
    // =========================================================================

    @PostMapping("/sessions/{userId}/generate")
    public ResponseEntity<GenerationOutcome> generate(@PathVariable String userId) {
        GenerationOutcome outcome = orchestrator.generate(userId);
        return respond(outcome, outcome.getStatus() == GenerationOutcome.Status.NOT_ALLOWED);
    }

    @PostMapping("/sessions/{userId}/select/{candidateId}")
    public ResponseEntity<SelectionOutcome> select(@PathVariable String userId, @PathVariable String candidateId) {
        SelectionOutcome outcome = orchestrator.select(userId, candidateId);
        if (outcome.getStatus() == SelectionOutcome.Status.UNKNOWN_CANDIDATE) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(outcome);
        }
        return respond(outcome, outcome.getStatus() == SelectionOutcome.Status.NOT_ALLOWED);
    }

    @PostMapping("/sessions/{userId}/parameters")
    public ResponseEntity<ParameterOutcome> parameters(
            @PathVariable String userId,
            @RequestBody Map<String, String> values
    ) {
        ParameterOutcome outcome = orchestrator.supplyParameters(userId, values);
        return switch (outcome.getStatus()) {
            case UNKNOWN_PARAMETER, INVALID_VALUE -> ResponseEntity.badRequest().body(outcome);
            case NOT_ALLOWED                      -> ResponseEntity.status(HttpStatus.CONFLICT).body(outcome);
            default                               -> ResponseEntity.ok(outcome);
        };
    }

    @PostMapping("/sessions/{userId}/apply")
    public ResponseEntity<ApplyOutcome> apply(@PathVariable String userId) {
        ApplyOutcome outcome = orchestrator.apply(userId);
        return respond(outcome, outcome.getStatus() == ApplyOutcome.Status.NOT_ALLOWED);
    }

    @PostMapping("/sessions/{userId}/check")
    public ResponseEntity<AnalysisOutcome<CheckResult>> check(@PathVariable String userId) {
        return respond(orchestrator.check(userId));
    }

    // =========================================================================
    // History
    // =========================================================================

    @PostMapping("/sessions/{userId}/rollback/{ordinal}")
    public ResponseEntity<Map<String, Object>> rollback(@PathVariable String userId, @PathVariable int ordinal) {
        return rollbackResponse(userId, orchestrator.rollbackToOrdinal(userId, ordinal));
    }

    @PostMapping("/sessions/{userId}/rollback/step/{stepId}")
    public ResponseEntity<Map<String, Object>> rollbackToStep(@PathVariable String userId, @PathVariable String stepId) {
        return rollbackResponse(userId, orchestrator.rollbackToStep(userId, stepId));
    }

    @GetMapping("/sessions/{userId}/history")
    public ResponseEntity<HistorySummary> history(@PathVariable String userId) {
        return ResponseEntity.of(orchestrator.history(userId));
    }

    @GetMapping("/sessions/{userId}/export")
    public ResponseEntity<ObjectNode> export(@PathVariable String userId) {
        return ResponseEntity.of(orchestrator.exportHistory(userId));
    }

    @PostMapping("/sessions/{userId}/import")
    public ResponseEntity<SessionSnapshot> importHistory(@PathVariable String userId, @RequestBody JsonNode exported) {
        return ResponseEntity.ok(orchestrator.importHistory(userId, exported));
    }

    // =========================================================================
    // Side operations
    // =========================================================================

    @PostMapping("/sessions/{userId}/progress")
    public ResponseEntity<AnalysisOutcome<ProgressAnalysis>> progress(@PathVariable String userId) {
        return respond(orchestrator.analyzeProgress(userId));
    }

    @PostMapping("/sessions/{userId}/branches")
    public ResponseEntity<AnalysisOutcome<BranchingResult>> branches(@PathVariable String userId) {
        return respond(orchestrator.analyzeBranching(userId));
    }

    @PostMapping("/verify")
    public ResponseEntity<AnalysisOutcome<VerificationResult>> verify(@RequestBody Map<String, String> request) {
        String expression = request.get("expression");
        String result     = request.get("result");

        if (expression == null || expression.isBlank() || result == null || result.isBlank()) {
            return ResponseEntity.badRequest().build();
        }

        return respond(orchestrator.verify(
                expression,
                request.getOrDefault("description", ""),
                result,
                request.get("userResult")));
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private ResponseEntity<Map<String, Object>> rollbackResponse(String userId, boolean rolledBack) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("rolledBack", rolledBack);
        orchestrator.snapshot(userId).ifPresent(s -> body.put("session", s));

        return rolledBack
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    private static <T> ResponseEntity<T> respond(T outcome, boolean notAllowed) {
        return notAllowed
                ? ResponseEntity.status(HttpStatus.CONFLICT).body(outcome)
                : ResponseEntity.ok(outcome);
    }

    private static <T> ResponseEntity<AnalysisOutcome<T>> respond(AnalysisOutcome<T> outcome) {
        return respond(outcome, outcome.getStatus() == AnalysisOutcome.Status.NOT_ALLOWED);
    }
}
