package com.mathide.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mathide.core.candidate.Candidate;
import com.mathide.core.candidate.CandidateParameter;
import com.mathide.core.candidate.CandidateRegistry;
import com.mathide.core.candidate.ParameterDefinition;
import com.mathide.core.candidate.ParameterType;
import com.mathide.core.engine.ApplyResult;
import com.mathide.core.engine.BranchingAnalyzer;
import com.mathide.core.engine.BranchingResult;
import com.mathide.core.engine.CandidateApplier;
import com.mathide.core.engine.CandidateGenerator;
import com.mathide.core.engine.CheckResult;
import com.mathide.core.engine.GenerationResult;
import com.mathide.core.engine.ProgressAnalysis;
import com.mathide.core.engine.ProgressAnalyzer;
import com.mathide.core.engine.SolutionChecker;
import com.mathide.core.engine.TransformationVerifier;
import com.mathide.core.engine.VerificationResult;
import com.mathide.core.history.HistorySummary;
import com.mathide.core.history.Step;
import com.mathide.core.history.StepHistory;
import com.mathide.core.session.Session;
import com.mathide.core.session.SessionState;
import com.mathide.core.session.SessionStore;
import com.mathide.exception.CompletionException;
import com.mathide.exception.HistoryImportException;
import com.mathide.exception.MathIdeErrorCode;
import com.mathide.exception.MathIdeException;
import com.mathide.exception.MissingFieldException;
import com.mathide.exception.ParseFailureException;
import com.mathide.exception.PayloadNotFoundException;
import com.mathide.orchestrator.dto.AnalysisOutcome;
import com.mathide.orchestrator.dto.ApplyOutcome;
import com.mathide.orchestrator.dto.GenerationOutcome;
import com.mathide.orchestrator.dto.OfferedCandidate;
import com.mathide.orchestrator.dto.ParameterOutcome;
import com.mathide.orchestrator.dto.SelectionOutcome;
import com.mathide.orchestrator.dto.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * SessionOrchestrator - the generate, select, apply, check loop for every user session.
 *
 * State flow:
 *
 *   AWAITING_TASK -> GENERATING_CANDIDATES -> AWAITING_SELECTION -> APPLYING -> SOLVED
 *                                                  |    ^                |
 *                                                  v    |                v
 *                                      AWAITING_PARAMETER_INPUT   GENERATING_CANDIDATES
 *
 * RULES:
 * - Every operation holds the session's lock for its whole duration, model calls included.
 *   Sessions of different users never wait on each other.
 * - A step is appended only after a valid apply. An invalid or unreadable apply reply
 *   returns to AWAITING_SELECTION with the history untouched.
 * - Unreadable model replies become MALFORMED_RESPONSE outcomes. A CompletionException
 *   restores the previous state and propagates so the caller can retry.
 * - Calls made in the wrong state return NOT_ALLOWED outcomes; they never throw.
 * - Progress analysis is advisory. Nothing here rolls back on its own.
 * - Replacing or ending a session waits for an operation still running on the old one.
 *   That operation then discards its result instead of registering or appending it.
 */
@Component
public class SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    private static final Set<SessionState> GENERATION_STATES = EnumSet.of(
            SessionState.GENERATING_CANDIDATES,
            SessionState.AWAITING_SELECTION,
            SessionState.AWAITING_PARAMETER_INPUT);

    private static final Set<SessionState> SELECTION_STATES = EnumSet.of(
            SessionState.AWAITING_SELECTION,
            SessionState.AWAITING_PARAMETER_INPUT);

    private static final String NO_SESSION = "No session for this user; submit a task first";

    private final SessionStore           sessionStore;
    private final CandidateRegistry      registry;
    private final CandidateGenerator     generator;
    private final CandidateApplier       applier;
    private final SolutionChecker        checker;
    private final ProgressAnalyzer       progressAnalyzer;
    private final TransformationVerifier verifier;
    private final BranchingAnalyzer      branchingAnalyzer;
    private final Duration               idleTimeout;
    private final ObjectMapper           objectMapper = new ObjectMapper();

    public SessionOrchestrator(
            SessionStore           sessionStore,
            CandidateRegistry      registry,
            CandidateGenerator     generator,
            CandidateApplier       applier,
            SolutionChecker        checker,
            ProgressAnalyzer       progressAnalyzer,
            TransformationVerifier verifier,
            BranchingAnalyzer      branchingAnalyzer,
            @Value("${mathide.session.idle-timeout-minutes:120}") long idleTimeoutMinutes
    ) {
        this.sessionStore      = sessionStore;
        this.registry          = registry;
        this.generator         = generator;
        this.applier           = applier;
        this.checker           = checker;
        this.progressAnalyzer  = progressAnalyzer;
        this.verifier          = verifier;
        this.branchingAnalyzer = branchingAnalyzer;
        this.idleTimeout       = Duration.ofMinutes(idleTimeoutMinutes);
    }

    // =========================================================================
    // SESSION LIFECYCLE
    // =========================================================================

    /**
     * Start solving a new task, replacing any session the user already had.
     * The task itself becomes step 0.
     */
    public SessionSnapshot newSession(String userId, String task) {
        if (task == null || task.isBlank()) {
            throw new MathIdeException(MathIdeErrorCode.INVALID_ARGUMENT, "Task must not be blank");
        }

        evictIdleSessions();
        Optional<Session> replaced = sessionStore.get(userId);

        SessionSnapshot snapshot;
        Session session = sessionStore.create(userId);
        session.lock().lock();
        try {
            StepHistory history = new StepHistory(task.strip());
            history.append(task.strip(), List.of(), null, null);
            session.setHistory(history);
            session.setState(SessionState.GENERATING_CANDIDATES);

            log.info("[Orchestrator] New session for {}: {}", userId, task.strip());
            snapshot = SessionSnapshot.of(session);
        } finally {
            session.lock().unlock();
        }

        replaced.ifPresent(this::forgetCandidates);
        return snapshot;
    }

    public Optional<SessionSnapshot> snapshot(String userId) {
        return withSession(userId, s -> Optional.of(SessionSnapshot.of(s)), Optional::empty);
    }

    /** Drop the user's task and keep a fresh session awaiting a new one. */
    public boolean cancel(String userId) {
        Optional<Session> discarded = sessionStore.reset(userId);
        discarded.ifPresent(this::forgetCandidates);
        log.info("[Orchestrator] Cancelled session for {}", userId);
        return discarded.isPresent();
    }

    /** Remove the user's session entirely. */
    public boolean endSession(String userId) {
        Optional<Session> removed = sessionStore.evict(userId);
        removed.ifPresent(this::forgetCandidates);
        return removed.isPresent();
    }

    public int evictIdleSessions() {
        List<Session> evicted = sessionStore.evictIdle(idleTimeout);
        evicted.forEach(this::forgetCandidates);
        return evicted.size();
    }

    // =========================================================================
    // GENERATE
    // =========================================================================

    public GenerationOutcome generate(String userId) {
        return withSession(userId, session -> {

            if (!GENERATION_STATES.contains(session.getState())) {
                return GenerationOutcome.notAllowed("Cannot generate candidates in state " + session.getState());
            }

            SessionState previous = session.getState();
            StepHistory  history  = session.getHistory();
            Step         current  = history.currentStep().orElseThrow();

            session.setState(SessionState.GENERATING_CANDIDATES);

            GenerationResult result;
            try {
                result = generator.generate(history.currentExpression());

            } catch (PayloadNotFoundException | ParseFailureException | MissingFieldException e) {
                log.warn("[Orchestrator] Generation reply unusable for {}: {}", userId, e.getMessage());
                session.setState(previous);
                return GenerationOutcome.malformed(e.getMessage());

            } catch (CompletionException e) {
                session.setState(previous);
                throw e;
            }

            if (!isCurrent(session)) {
                log.info("[Orchestrator] Session of {} was replaced during generation; discarding result", userId);
                return GenerationOutcome.notAllowed("The session was replaced while generating");
            }

            session.clearSelection();

            if (result.isEmpty()) {
                session.clearOffer();
                log.info("[Orchestrator] No usable candidates for step #{} of {}", current.getOrdinal(), userId);
                return GenerationOutcome.noCandidates(result.getDroppedCount());
            }

            List<String> ids = registry.register(current.getId(), result.getCandidates());
            session.offer(ids);
            session.setState(SessionState.AWAITING_SELECTION);

            List<OfferedCandidate> offered = new ArrayList<>(ids.size());
            for (int i = 0; i < ids.size(); i++) {
                offered.add(new OfferedCandidate(ids.get(i), result.getCandidates().get(i)));
            }

            log.info("[Orchestrator] Offered {} candidate(s) for step #{} of {}",
                    offered.size(), current.getOrdinal(), userId);
            return GenerationOutcome.generated(offered, result.getDroppedCount());

        }, () -> GenerationOutcome.notAllowed(NO_SESSION));
    }

    // =========================================================================
    // SELECT / PARAMETERS
    // =========================================================================

    public SelectionOutcome select(String userId, String candidateId) {
        return select(userId, candidateId, null);
    }

    /**
     * Select a candidate of the current step. When it needs parameters and a provider is
     * given, each value comes from the provider or, failing that, the definition's default.
     * Whatever is still missing leaves the session awaiting parameter input.
     */
    public SelectionOutcome select(String userId, String candidateId, ParameterValueProvider provider) {
        return withSession(userId, session -> {

            if (!SELECTION_STATES.contains(session.getState())) {
                return SelectionOutcome.notAllowed("Cannot select a candidate in state " + session.getState());
            }

            Step current = session.getHistory().currentStep().orElseThrow();
            if (!registry.idsForStep(current.getId()).contains(candidateId)) {
                return SelectionOutcome.unknownCandidate(candidateId);
            }

            Optional<Candidate> resolved = registry.resolve(candidateId);
            if (resolved.isEmpty()) {
                return SelectionOutcome.unknownCandidate(candidateId);
            }

            Candidate candidate = resolved.get();
            session.select(candidateId, candidate);

            if (!candidate.needsParameters()) {
                session.setState(SessionState.AWAITING_SELECTION);
                log.info("[Orchestrator] {} selected {}", userId, candidateId);
                return SelectionOutcome.selected(candidateId, new OfferedCandidate(candidateId, candidate));
            }

            if (provider != null) {
                for (ParameterDefinition def : candidate.getParameterDefinitions()) {
                    String value = resolveValue(def, provider);
                    if (value != null) {
                        session.getSuppliedParameters().put(def.getName(), value);
                    }
                }
            }

            List<ParameterDefinition> missing = bindOrListMissing(session);
            if (missing.isEmpty()) {
                log.info("[Orchestrator] {} selected {} with all parameters bound", userId, candidateId);
                return SelectionOutcome.selected(candidateId,
                        new OfferedCandidate(candidateId, session.getSelectedCandidate()));
            }

            log.info("[Orchestrator] {} selected {}; awaiting {}", userId, candidateId, names(missing));
            return SelectionOutcome.awaitingParameters(candidateId,
                    new OfferedCandidate(candidateId, candidate), missing);

        }, () -> SelectionOutcome.notAllowed(NO_SESSION));
    }

    public ParameterOutcome supplyParameter(String userId, String name, String value) {
        return supplyParameters(userId, Map.of(name, value));
    }

    /**
     * Bind parameter values of the pending selection. A call naming an unknown parameter
     * or carrying an unacceptable value binds nothing.
     */
    public ParameterOutcome supplyParameters(String userId, Map<String, String> values) {
        return withSession(userId, session -> {

            if (session.getState() != SessionState.AWAITING_PARAMETER_INPUT) {
                return ParameterOutcome.rejected(ParameterOutcome.Status.NOT_ALLOWED,
                        "No selection is waiting for parameters (state " + session.getState() + ")");
            }

            Candidate candidate = session.getSelectedCandidate();
            for (Map.Entry<String, String> e : values.entrySet()) {
                Optional<ParameterDefinition> def = definition(candidate, e.getKey());
                if (def.isEmpty()) {
                    return ParameterOutcome.rejected(ParameterOutcome.Status.UNKNOWN_PARAMETER,
                            "Unknown parameter '" + e.getKey() + "'");
                }
                String problem = validate(def.get(), e.getValue());
                if (problem != null) {
                    return ParameterOutcome.rejected(ParameterOutcome.Status.INVALID_VALUE, problem);
                }
            }

            values.forEach((k, v) -> session.getSuppliedParameters().put(k, v.strip()));

            List<ParameterDefinition> missing = bindOrListMissing(session);
            if (missing.isEmpty()) {
                return ParameterOutcome.complete(
                        new OfferedCandidate(session.getSelectedCandidateId(), session.getSelectedCandidate()));
            }
            return ParameterOutcome.stillMissing(missing);

        }, () -> ParameterOutcome.rejected(ParameterOutcome.Status.NOT_ALLOWED, NO_SESSION));
    }

    /**
     * Substitute the selection's parameters once all are supplied and move back to
     * AWAITING_SELECTION; otherwise stay in AWAITING_PARAMETER_INPUT.
     */
    private List<ParameterDefinition> bindOrListMissing(Session session) {
        Candidate           candidate = session.getSelectedCandidate();
        Map<String, String> supplied  = session.getSuppliedParameters();

        List<ParameterDefinition> missing = new ArrayList<>();
        List<CandidateParameter>  bound   = new ArrayList<>();
        for (ParameterDefinition def : candidate.getParameterDefinitions()) {
            String value = supplied.get(def.getName());
            if (value == null) {
                missing.add(def);
            } else {
                bound.add(new CandidateParameter(def.getName(), value, def.getType()));
            }
        }

        if (!missing.isEmpty()) {
            session.setState(SessionState.AWAITING_PARAMETER_INPUT);
            return missing;
        }

        session.concretizeSelection(candidate.withParameters(bound));
        session.setState(SessionState.AWAITING_SELECTION);
        return List.of();
    }

    private String resolveValue(ParameterDefinition def, ParameterValueProvider provider) {
        try {
            Optional<String> provided = provider.valueFor(def);
            if (provided != null && provided.isPresent() && validate(def, provided.get()) == null) {
                return provided.get().strip();
            }
        } catch (RuntimeException e) {
            log.warn("[Orchestrator] Value provider failed for '{}', using default: {}", def.getName(), e.getMessage());
        }
        String fallback = def.getDefaultValue();
        return fallback != null && !fallback.isBlank() ? fallback : null;
    }

    /** @return why the value is unacceptable, or null */
    static String validate(ParameterDefinition def, String value) {
        if (value == null || value.isBlank()) {
            return "Parameter '" + def.getName() + "' needs a value";
        }
        if (def.getType() == ParameterType.CHOICE
                && !def.getOptions().isEmpty()
                && !def.getOptions().contains(value.strip())) {
            return "Parameter '" + def.getName() + "' must be one of " + def.getOptions();
        }
        if (def.getType() == ParameterType.NUMBER && !isNumeric(value.strip())) {
            return "Parameter '" + def.getName() + "' must be a number";
        }
        return null;
    }

    private static boolean isNumeric(String value) {
        try {
            return Double.isFinite(Double.parseDouble(value));
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static Optional<ParameterDefinition> definition(Candidate candidate, String name) {
        return candidate.getParameterDefinitions().stream()
                .filter(d -> d.getName().equals(name))
                .findFirst();
    }

    private static List<String> names(List<ParameterDefinition> defs) {
        return defs.stream().map(ParameterDefinition::getName).toList();
    }

    // =========================================================================
    // APPLY / CHECK
    // =========================================================================

    /**
     * Apply the concrete selection to the current expression. On a valid result the step
     * is appended and the completion check runs; a failing check does not undo the step.
     */
    public ApplyOutcome apply(String userId) {
        return withSession(userId, session -> {

            Candidate candidate = session.getSelectedCandidate();
            if (session.getState() != SessionState.AWAITING_SELECTION || candidate == null) {
                return ApplyOutcome.notAllowed("Nothing selected to apply (state " + session.getState() + ")");
            }
            if (candidate.needsParameters()) {
                return ApplyOutcome.notAllowed("The selected candidate still needs parameters");
            }

            SessionState previous = session.getState();
            StepHistory  history  = session.getHistory();
            String       before   = history.currentExpression();

            session.setState(SessionState.APPLYING);

            ApplyResult result;
            try {
                result = applier.apply(before, candidate);

            } catch (PayloadNotFoundException | ParseFailureException | MissingFieldException e) {
                log.warn("[Orchestrator] Apply reply unusable for {}: {}", userId, e.getMessage());
                session.setState(SessionState.AWAITING_SELECTION);
                return ApplyOutcome.malformed(e.getMessage());

            } catch (CompletionException e) {
                session.setState(previous);
                throw e;
            }

            if (!isCurrent(session)) {
                log.info("[Orchestrator] Session of {} was replaced during apply; discarding result", userId);
                return ApplyOutcome.notAllowed("The session was replaced while applying");
            }

            if (!result.isValid()) {
                log.info("[Orchestrator] Apply judged invalid for {}: {}", userId, result.getExplanation());
                session.setState(SessionState.AWAITING_SELECTION);
                return ApplyOutcome.invalid(result.getResultExpression(), result.getExplanation(), result.getErrors());
            }

            Step step = history.append(before, session.getOfferedCandidateIds(), candidate, result.getResultExpression());
            session.clearSelection();
            session.clearOffer();

            CheckResult check = null;
            String      note  = null;
            try {
                check = checker.check(step.currentExpression(), history.getOriginalTask());
            } catch (PayloadNotFoundException | ParseFailureException | MissingFieldException e) {
                note = "Completion check reply unusable: " + e.getMessage();
                log.warn("[Orchestrator] {}", note);
            } catch (CompletionException e) {
                note = "Completion check unavailable: " + e.getMessage();
                log.warn("[Orchestrator] {}", note);
            }

            boolean solved = check != null && check.isSolved();
            session.setState(solved ? SessionState.SOLVED : SessionState.GENERATING_CANDIDATES);

            log.info("[Orchestrator] {} applied step #{} -> {}{}", userId, step.getOrdinal(),
                    result.getResultExpression(), solved ? " (solved)" : "");
            return ApplyOutcome.applied(step.getOrdinal(), result.getResultExpression(),
                    result.getExplanation(), check, note);

        }, () -> ApplyOutcome.notAllowed(NO_SESSION));
    }

    /** Run the completion check on demand. A solved verdict ends the session in SOLVED. */
    public AnalysisOutcome<CheckResult> check(String userId) {
        return withSession(userId, session -> {

            if (!session.hasTask() || session.getState() == SessionState.APPLYING) {
                return AnalysisOutcome.<CheckResult>notAllowed("Cannot check in state " + session.getState());
            }

            StepHistory history = session.getHistory();
            try {
                CheckResult result = checker.check(history.currentExpression(), history.getOriginalTask());
                if (result.isSolved()) {
                    session.clearSelection();
                    session.clearOffer();
                    session.setState(SessionState.SOLVED);
                }
                return AnalysisOutcome.ok(result);

            } catch (PayloadNotFoundException | ParseFailureException | MissingFieldException e) {
                return AnalysisOutcome.<CheckResult>malformed(e.getMessage());
            }

        }, () -> AnalysisOutcome.notAllowed(NO_SESSION));
    }

    // =========================================================================
    // ROLLBACK
    // =========================================================================

    /**
     * Truncate the user's chain so step {@code ordinal} is the last one and resume
     * generating from it.
     *
     * @return false, changing nothing, for an out-of-range ordinal or a missing session
     */
    public boolean rollbackToOrdinal(String userId, int ordinal) {
        return withSession(userId, session -> rollback(session, ordinal), () -> false);
    }

    public boolean rollbackToStep(String userId, String stepId) {
        return withSession(userId, session -> {
            if (!session.hasTask()) {
                return false;
            }
            return session.getHistory().stepById(stepId)
                    .map(step -> rollback(session, step.getOrdinal()))
                    .orElse(false);
        }, () -> false);
    }

    private boolean rollback(Session session, int ordinal) {
        if (!session.hasTask() || session.getState() == SessionState.APPLYING) {
            return false;
        }

        StepHistory  history   = session.getHistory();
        List<String> discarded = history.idsAfter(ordinal);

        if (!history.rollbackToOrdinal(ordinal)) {
            return false;
        }

        registry.forgetSteps(discarded);
        session.clearSelection();
        session.clearOffer();
        session.setState(SessionState.GENERATING_CANDIDATES);

        log.info("[Orchestrator] {} rolled back to step #{}", session.getUserId(), ordinal);
        return true;
    }

    // =========================================================================
    // HISTORY
    // =========================================================================

    public Optional<HistorySummary> history(String userId) {
        return withSession(userId,
                s -> s.hasTask() ? Optional.of(s.getHistory().summary()) : Optional.<HistorySummary>empty(),
                Optional::empty);
    }

    public Optional<ObjectNode> exportHistory(String userId) {
        return withSession(userId,
                s -> s.hasTask() ? Optional.of(s.getHistory().export(objectMapper)) : Optional.<ObjectNode>empty(),
                Optional::empty);
    }

    /**
     * Replace the user's chain with an exported one, creating the session if needed.
     *
     * @throws HistoryImportException if the record is incomplete; the session is unchanged
     */
    public SessionSnapshot importHistory(String userId, JsonNode exported) {
        StepHistory imported = StepHistory.importFrom(exported);
        if (imported.isEmpty()) {
            throw new HistoryImportException("steps", -1, "An imported history needs at least one step");
        }

        Session session = sessionStore.get(userId).orElseGet(() -> sessionStore.create(userId));
        session.lock().lock();
        try {
            session.touch();
            if (session.getState() == SessionState.APPLYING) {
                throw new MathIdeException(MathIdeErrorCode.INVALID_ARGUMENT, "Cannot import while applying");
            }

            forgetCandidates(session);
            session.setHistory(imported);
            session.clearSelection();
            session.clearOffer();
            session.setState(SessionState.GENERATING_CANDIDATES);

            log.info("[Orchestrator] Imported {} step(s) for {}", imported.size(), userId);
            return SessionSnapshot.of(session);
        } finally {
            session.lock().unlock();
        }
    }

    // =========================================================================
    // SIDE OPERATIONS
    // =========================================================================

    /** Advisory only; the caller decides whether to roll back. */
    public AnalysisOutcome<ProgressAnalysis> analyzeProgress(String userId) {
        return withSession(userId, session -> {
            if (!session.hasTask()) {
                return AnalysisOutcome.<ProgressAnalysis>notAllowed(NO_SESSION);
            }
            try {
                return AnalysisOutcome.ok(progressAnalyzer.analyze(session.getHistory()));
            } catch (PayloadNotFoundException | ParseFailureException | MissingFieldException e) {
                return AnalysisOutcome.<ProgressAnalysis>malformed(e.getMessage());
            }
        }, () -> AnalysisOutcome.notAllowed(NO_SESSION));
    }

    /**
     * Ask whether the current expression splits into a system, cases or alternatives and,
     * if it does, annotate the current step with the branches.
     */
    public AnalysisOutcome<BranchingResult> analyzeBranching(String userId) {
        return withSession(userId, session -> {
            if (!session.hasTask()) {
                return AnalysisOutcome.<BranchingResult>notAllowed(NO_SESSION);
            }

            StepHistory history = session.getHistory();
            Step        current = history.currentStep().orElseThrow();

            BranchingResult result;
            try {
                result = branchingAnalyzer.analyze(history.currentExpression());
            } catch (PayloadNotFoundException | ParseFailureException | MissingFieldException e) {
                return AnalysisOutcome.<BranchingResult>malformed(e.getMessage());
            }

            if (result.isRequiresBranching() && !result.getBranches().isEmpty()) {
                history.attachBranches(current.getId(), result.getSolutionType(),
                        result.getExplanation(), result.getBranches());
            }
            return AnalysisOutcome.ok(result);

        }, () -> AnalysisOutcome.notAllowed(NO_SESSION));
    }

    /** Stateless re-check of a claimed transformation; touches no session. */
    public AnalysisOutcome<VerificationResult> verify(
            String expression,
            String claimedDescription,
            String claimedResult,
            String userSuggestedResult
    ) {
        try {
            return AnalysisOutcome.ok(verifier.verify(expression, claimedDescription, claimedResult, userSuggestedResult));
        } catch (PayloadNotFoundException | ParseFailureException | MissingFieldException e) {
            return AnalysisOutcome.malformed(e.getMessage());
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private <T> T withSession(String userId, Function<Session, T> action, Supplier<T> missing) {
        Optional<Session> found = sessionStore.get(userId);
        if (found.isEmpty()) {
            return missing.get();
        }

        Session session = found.get();
        session.lock().lock();
        try {
            session.touch();
            return action.apply(session);
        } finally {
            session.lock().unlock();
        }
    }

    /** Waits for any operation still running on the session, so its registrations are dropped too. */
    private void forgetCandidates(Session session) {
        session.lock().lock();
        try {
            if (!session.hasTask()) {
                return;
            }
            List<String> stepIds = session.getHistory().steps().stream().map(Step::getId).toList();
            registry.forgetSteps(stepIds);
        } finally {
            session.lock().unlock();
        }
    }

    private boolean isCurrent(Session session) {
        return sessionStore.get(session.getUserId()).map(s -> s == session).orElse(false);
    }
}
