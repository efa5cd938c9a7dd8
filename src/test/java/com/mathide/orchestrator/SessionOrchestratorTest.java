package com.mathide.orchestrator;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mathide.core.candidate.CandidateRegistry;
import com.mathide.core.candidate.ParameterDefinition;
import com.mathide.core.candidate.ParameterType;
import com.mathide.core.engine.BranchingAnalyzer;
import com.mathide.core.engine.CandidateApplier;
import com.mathide.core.engine.CandidateGenerator;
import com.mathide.core.engine.ProgressAnalyzer;
import com.mathide.core.engine.SolutionChecker;
import com.mathide.core.engine.TransformationVerifier;
import com.mathide.core.history.HistorySummary;
import com.mathide.core.history.Step;
import com.mathide.core.session.InMemorySessionStore;
import com.mathide.core.session.Session;
import com.mathide.core.session.SessionState;
import com.mathide.exception.CompletionException;
import com.mathide.exception.CompletionException.FailureKind;
import com.mathide.exception.HistoryImportException;
import com.mathide.exception.MathIdeException;
import com.mathide.llm.CompletionRequest;
import com.mathide.llm.CompletionResponse;
import com.mathide.llm.LLMClient;
import com.mathide.llm.ModelRole;
import com.mathide.llm.ScriptedLLMClient;
import com.mathide.orchestrator.dto.AnalysisOutcome;
import com.mathide.orchestrator.dto.ApplyOutcome;
import com.mathide.orchestrator.dto.GenerationOutcome;
import com.mathide.orchestrator.dto.OfferedCandidate;
import com.mathide.orchestrator.dto.ParameterOutcome;
import com.mathide.orchestrator.dto.SelectionOutcome;
import com.mathide.orchestrator.dto.SessionSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionOrchestratorTest {

    private static final String USER = "alice";
    private static final String TASK = "2(x+1)=4";

    private static final String TWO_CANDIDATES = """
            [
              {"description": "Expand the brackets", "expression": "2x+2=4", "kind": "expand",
               "metadata": {"usefulness": "good"}},
              {"description": "Divide both sides by 2", "expression": "x+1=2", "kind": "divide",
               "metadata": {"usefulness": "good"}}
            ]
            """;

    private static final String PARAMETERIZED = """
            [
              {"description": "Multiply both sides by {factor}", "expression": "{factor}(x+1)={factor}*2",
               "kind": "multiply", "requires_user_input": true,
               "parameter_definitions": [
                 {"name": "factor", "prompt": "Multiply by?", "param_type": "number", "default_value": "2"},
                 {"name": "side", "prompt": "Which side first?", "param_type": "choice", "options": ["left", "right"]}
               ]}
            ]
            """;

    private static final String NOT_SOLVED =
            "{\"solved\":false,\"confidence\":0.2,\"explanation\":\"x not isolated\",\"category\":\"none\"}";

    private static final String SOLVED =
            "{\"solved\":true,\"confidence\":0.95,\"explanation\":\"x isolated\",\"category\":\"single\"}";

    private ScriptedLLMClient    llm;
    private InMemorySessionStore store;
    private CandidateRegistry    registry;
    private SessionOrchestrator  orchestrator;

    @BeforeEach
    void setUp() {
        llm      = new ScriptedLLMClient();
        store    = new InMemorySessionStore();
        registry = new CandidateRegistry();

        orchestrator = new SessionOrchestrator(
                store,
                registry,
                new CandidateGenerator(llm, 5, false, new Random(5)),
                new CandidateApplier(llm),
                new SolutionChecker(llm),
                new ProgressAnalyzer(llm),
                new TransformationVerifier(llm),
                new BranchingAnalyzer(llm),
                120);
    }

    private static String idOf(GenerationOutcome outcome, String description) {
        return outcome.getCandidates().stream()
                .filter(c -> c.getDescription().equals(description))
                .map(OfferedCandidate::getId)
                .findFirst()
                .orElseThrow();
    }

    private Session session() {
        return store.get(USER).orElseThrow();
    }

    private String selectExpand() {
        orchestrator.newSession(USER, TASK);
        llm.reply(TWO_CANDIDATES);
        GenerationOutcome generated = orchestrator.generate(USER);
        String id = idOf(generated, "Expand the brackets");
        assertEquals(SelectionOutcome.Status.SELECTED, orchestrator.select(USER, id).getStatus());
        return id;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    @Test
    void testNewSessionRecordsTaskAsFirstStep() {
        SessionSnapshot snapshot = orchestrator.newSession(USER, "  " + TASK + " ");

        assertEquals(SessionState.GENERATING_CANDIDATES, snapshot.getState());
        assertEquals(TASK, snapshot.getOriginalTask());
        assertEquals(TASK, snapshot.getCurrentExpression());
        assertEquals(1, snapshot.getStepCount());
        assertFalse(snapshot.isCanRollback());
    }

    @Test
    void testBlankTaskIsRejected() {
        assertThrows(MathIdeException.class, () -> orchestrator.newSession(USER, "   "));
        assertTrue(store.get(USER).isEmpty());
    }

    @Test
    void testCancelAndEndSession() {
        orchestrator.newSession(USER, TASK);

        assertTrue(orchestrator.cancel(USER));
        assertEquals(SessionState.AWAITING_TASK, orchestrator.snapshot(USER).orElseThrow().getState());

        assertTrue(orchestrator.endSession(USER));
        assertFalse(orchestrator.endSession(USER));
        assertTrue(orchestrator.snapshot(USER).isEmpty());
    }

    @Test
    void testOperationsWithoutSessionAreNotAllowed() {
        assertEquals(GenerationOutcome.Status.NOT_ALLOWED, orchestrator.generate("nobody").getStatus());
        assertEquals(SelectionOutcome.Status.NOT_ALLOWED, orchestrator.select("nobody", "x").getStatus());
        assertEquals(ApplyOutcome.Status.NOT_ALLOWED, orchestrator.apply("nobody").getStatus());
        assertFalse(orchestrator.rollbackToOrdinal("nobody", 0));
        assertTrue(orchestrator.history("nobody").isEmpty());
        assertTrue(llm.getRequests().isEmpty());
    }

    @Test
    void testSessionsOfDifferentUsersAreIndependent() {
        orchestrator.newSession("bob", "x + 3 = 5");
        selectExpand();

        assertEquals(SessionState.GENERATING_CANDIDATES, orchestrator.snapshot("bob").orElseThrow().getState());
        assertEquals(SessionState.AWAITING_SELECTION, session().getState());
    }

    // =========================================================================
    // Replacing a session while a model call is in flight
    // =========================================================================

    /** Answers from a script, holding the first call made after {@link #arm()} until released. */
    private static final class GatedLLMClient implements LLMClient {

        private final ScriptedLLMClient script  = new ScriptedLLMClient();
        private final CountDownLatch    entered = new CountDownLatch(1);
        private final CountDownLatch    release = new CountDownLatch(1);
        private volatile boolean        armed;

        void arm() {
            armed = true;
        }

        @Override
        public CompletionResponse complete(CompletionRequest request) {
            if (armed) {
                armed = false;
                entered.countDown();
                try {
                    if (!release.await(5, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("Gate was never released");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
            return script.complete(request);
        }
    }

    private SessionOrchestrator orchestratorWith(LLMClient client) {
        return new SessionOrchestrator(
                store,
                registry,
                new CandidateGenerator(client, 5, false, new Random(5)),
                new CandidateApplier(client),
                new SolutionChecker(client),
                new ProgressAnalyzer(client),
                new TransformationVerifier(client),
                new BranchingAnalyzer(client),
                120);
    }

    private void awaitReplacementOf(Session original) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (store.get(USER).map(s -> s == original).orElse(false)) {
            assertTrue(System.nanoTime() < deadline, "session was never replaced");
            Thread.sleep(10);
        }
    }

    @Test
    void testNewSessionDuringGenerationDiscardsItsCandidates() throws Exception {
        GatedLLMClient      gated = new GatedLLMClient();
        SessionOrchestrator slow  = orchestratorWith(gated);

        slow.newSession(USER, TASK);
        Session original = session();
        gated.script.reply(TWO_CANDIDATES);
        gated.arm();

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<GenerationOutcome> generation = pool.submit(() -> slow.generate(USER));
            assertTrue(gated.entered.await(5, TimeUnit.SECONDS));

            Future<SessionSnapshot> replacement = pool.submit(() -> slow.newSession(USER, "y=2"));
            awaitReplacementOf(original);
            gated.release.countDown();

            assertEquals(GenerationOutcome.Status.NOT_ALLOWED, generation.get(5, TimeUnit.SECONDS).getStatus());
            assertEquals("y=2", replacement.get(5, TimeUnit.SECONDS).getCurrentExpression());
        } finally {
            pool.shutdownNow();
        }

        assertEquals(0, registry.size());
        assertTrue(slow.endSession(USER));
        assertEquals(0, registry.size());
    }

    @Test
    void testEndSessionWaitsForGenerationAndForgetsItsCandidates() throws Exception {
        GatedLLMClient      gated = new GatedLLMClient();
        SessionOrchestrator slow  = orchestratorWith(gated);

        slow.newSession(USER, TASK);
        Session original = session();
        gated.script.reply(TWO_CANDIDATES);
        gated.arm();

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<GenerationOutcome> generation = pool.submit(() -> slow.generate(USER));
            assertTrue(gated.entered.await(5, TimeUnit.SECONDS));

            Future<Boolean> ended = pool.submit(() -> slow.endSession(USER));
            awaitReplacementOf(original);
            gated.release.countDown();

            assertEquals(GenerationOutcome.Status.NOT_ALLOWED, generation.get(5, TimeUnit.SECONDS).getStatus());
            assertTrue(ended.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertTrue(store.get(USER).isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    void testCancelDuringApplyLeavesOldHistoryUntouched() throws Exception {
        GatedLLMClient      gated = new GatedLLMClient();
        SessionOrchestrator slow  = orchestratorWith(gated);

        slow.newSession(USER, TASK);
        gated.script.reply(TWO_CANDIDATES);
        String id = idOf(slow.generate(USER), "Expand the brackets");
        assertEquals(SelectionOutcome.Status.SELECTED, slow.select(USER, id).getStatus());

        Session original = session();
        gated.script.reply("{\"result\":\"2x+2=4\",\"valid\":true}");
        gated.script.reply(NOT_SOLVED);
        gated.arm();

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<ApplyOutcome> applying = pool.submit(() -> slow.apply(USER));
            assertTrue(gated.entered.await(5, TimeUnit.SECONDS));

            Future<Boolean> cancelled = pool.submit(() -> slow.cancel(USER));
            awaitReplacementOf(original);
            gated.release.countDown();

            assertEquals(ApplyOutcome.Status.NOT_ALLOWED, applying.get(5, TimeUnit.SECONDS).getStatus());
            assertTrue(cancelled.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, original.getHistory().size());
        assertEquals(SessionState.AWAITING_TASK, session().getState());
        assertEquals(0, registry.size());
    }

    // =========================================================================
    // Generate / select / apply
    // =========================================================================

    @Test
    void testFullStepAppendsToHistory() {
        selectExpand();
        llm.reply("{\"result\":\"2x+2=4\",\"valid\":true,\"explanation\":\"distribute\"}");
        llm.reply(NOT_SOLVED);

        ApplyOutcome outcome = orchestrator.apply(USER);

        assertEquals(ApplyOutcome.Status.APPLIED, outcome.getStatus());
        assertEquals(1, outcome.getStepOrdinal());
        assertEquals("2x+2=4", outcome.getResultExpression());
        assertFalse(outcome.getCheck().isSolved());
        assertNull(outcome.getMessage());

        List<Step> steps = session().getHistory().steps();
        assertEquals(2, steps.size());
        assertEquals(TASK, steps.get(1).getExpression());
        assertEquals("2x+2=4", steps.get(1).getResultExpression());
        assertEquals("expand", steps.get(1).getChosenCandidate().getKind());
        assertEquals(2, steps.get(1).getAvailableCandidateIds().size());
        assertEquals(steps.get(0).getId(), steps.get(1).getParentId());

        assertEquals(SessionState.GENERATING_CANDIDATES, session().getState());
        assertNull(session().getSelectedCandidate());
        assertEquals(ModelRole.CHECKER, llm.lastRequest().getRole());
        assertEquals(0, llm.remaining());
    }

    @Test
    void testSolvedCheckEndsInSolved() {
        selectExpand();
        llm.reply("{\"result\":\"x=1\",\"valid\":true}");
        llm.reply(SOLVED);

        ApplyOutcome outcome = orchestrator.apply(USER);

        assertEquals(ApplyOutcome.Status.SOLVED, outcome.getStatus());
        assertEquals(SessionState.SOLVED, session().getState());
        assertEquals(GenerationOutcome.Status.NOT_ALLOWED, orchestrator.generate(USER).getStatus());
        assertTrue(orchestrator.history(USER).orElseThrow().isComplete());
    }

    @Test
    void testUnreadableCheckKeepsAppliedStep() {
        selectExpand();
        llm.reply("{\"result\":\"2x+2=4\",\"valid\":true}");
        llm.reply("no verdict today");

        ApplyOutcome outcome = orchestrator.apply(USER);

        assertEquals(ApplyOutcome.Status.APPLIED, outcome.getStatus());
        assertNull(outcome.getCheck());
        assertNotNull(outcome.getMessage());
        assertEquals(2, session().getHistory().size());
        assertEquals(SessionState.GENERATING_CANDIDATES, session().getState());
    }

    @Test
    void testSingleEscapedGenerationIsRecovered() {
        orchestrator.newSession(USER, "\\sin(x) = 0");
        llm.reply("[{\"description\":\"Take arcsin\",\"expression\":\"x = \\arcsin(0)\",\"kind\":\"custom\"}]");

        GenerationOutcome outcome = orchestrator.generate(USER);

        assertEquals(GenerationOutcome.Status.GENERATED, outcome.getStatus());
        assertEquals("x = \\arcsin(0)", outcome.getCandidates().get(0).getExpression());
        assertEquals(SessionState.AWAITING_SELECTION, session().getState());
    }

    @Test
    void testMalformedGenerationLeavesStateUnchanged() {
        orchestrator.newSession(USER, TASK);
        llm.reply("Sorry, I only speak prose.");

        GenerationOutcome outcome = orchestrator.generate(USER);

        assertEquals(GenerationOutcome.Status.MALFORMED_RESPONSE, outcome.getStatus());
        assertEquals(SessionState.GENERATING_CANDIDATES, session().getState());
    }

    @Test
    void testNoUsableCandidates() {
        orchestrator.newSession(USER, TASK);
        llm.reply("[{\"description\":\"missing the rest\"}]");

        GenerationOutcome outcome = orchestrator.generate(USER);

        assertEquals(GenerationOutcome.Status.NO_CANDIDATES, outcome.getStatus());
        assertEquals(1, outcome.getDroppedCount());
    }

    @Test
    void testCompletionFailureRestoresStateAndPropagates() {
        orchestrator.newSession(USER, TASK);
        llm.fail(new CompletionException(FailureKind.CONNECTION, "service down"));

        CompletionException e = assertThrows(CompletionException.class, () -> orchestrator.generate(USER));

        assertEquals(FailureKind.CONNECTION, e.getKind());
        assertEquals(SessionState.GENERATING_CANDIDATES, session().getState());
    }

    @Test
    void testApplyWithMissingValidIsMalformedAndRetryable() {
        selectExpand();
        llm.reply("{\"result\":\"2x+2=4\"}");

        ApplyOutcome outcome = orchestrator.apply(USER);

        assertEquals(ApplyOutcome.Status.MALFORMED_RESPONSE, outcome.getStatus());
        assertFalse(outcome.isStepAppended());
        assertEquals(1, session().getHistory().size());
        assertEquals(SessionState.AWAITING_SELECTION, session().getState());

        llm.reply("{\"result\":\"2x+2=4\",\"valid\":true}");
        llm.reply(NOT_SOLVED);

        assertEquals(ApplyOutcome.Status.APPLIED, orchestrator.apply(USER).getStatus());
        assertEquals(2, session().getHistory().size());
    }

    @Test
    void testInvalidApplyLeavesHistoryUntouched() {
        selectExpand();
        llm.reply("{\"result\":\"2x+1=4\",\"valid\":false,\"errors\":[\"did not distribute\"]}");

        ApplyOutcome outcome = orchestrator.apply(USER);

        assertEquals(ApplyOutcome.Status.INVALID, outcome.getStatus());
        assertEquals(List.of("did not distribute"), outcome.getErrors());
        assertEquals(1, session().getHistory().size());
        assertEquals(SessionState.AWAITING_SELECTION, session().getState());
    }

    @Test
    void testApplyWithoutSelectionIsNotAllowed() {
        orchestrator.newSession(USER, TASK);

        assertEquals(ApplyOutcome.Status.NOT_ALLOWED, orchestrator.apply(USER).getStatus());
        assertTrue(llm.getRequests().isEmpty());
    }

    @Test
    void testUnknownAndStaleCandidates() {
        orchestrator.newSession(USER, TASK);
        llm.reply(TWO_CANDIDATES);
        String stale = idOf(orchestrator.generate(USER), "Expand the brackets");
        llm.reply(TWO_CANDIDATES);
        String fresh = idOf(orchestrator.generate(USER), "Expand the brackets");

        assertEquals(SelectionOutcome.Status.UNKNOWN_CANDIDATE, orchestrator.select(USER, "made-up").getStatus());
        assertEquals(SelectionOutcome.Status.UNKNOWN_CANDIDATE, orchestrator.select(USER, stale).getStatus());
        assertEquals(SelectionOutcome.Status.SELECTED, orchestrator.select(USER, fresh).getStatus());
    }

    // =========================================================================
    // Parameters
    // =========================================================================

    private String generateParameterized() {
        orchestrator.newSession(USER, TASK);
        llm.reply(PARAMETERIZED);
        return orchestrator.generate(USER).getCandidates().get(0).getId();
    }

    @Test
    void testSelectionAwaitsParameters() {
        String id = generateParameterized();

        SelectionOutcome outcome = orchestrator.select(USER, id);

        assertEquals(SelectionOutcome.Status.AWAITING_PARAMETERS, outcome.getStatus());
        assertEquals(2, outcome.getMissingParameters().size());
        assertEquals(SessionState.AWAITING_PARAMETER_INPUT, session().getState());
        assertEquals(ApplyOutcome.Status.NOT_ALLOWED, orchestrator.apply(USER).getStatus());
    }

    @Test
    void testSupplyParametersValidatesBeforeBinding() {
        String id = generateParameterized();
        orchestrator.select(USER, id);

        assertEquals(ParameterOutcome.Status.UNKNOWN_PARAMETER,
                orchestrator.supplyParameter(USER, "bogus", "1").getStatus());
        assertEquals(ParameterOutcome.Status.INVALID_VALUE,
                orchestrator.supplyParameters(USER, Map.of("factor", "3", "side", "middle")).getStatus());
        assertEquals(ParameterOutcome.Status.INVALID_VALUE,
                orchestrator.supplyParameter(USER, "factor", "banana").getStatus());
        assertTrue(session().getSuppliedParameters().isEmpty());

        ParameterOutcome partial = orchestrator.supplyParameter(USER, "factor", "3");
        assertEquals(ParameterOutcome.Status.STILL_MISSING, partial.getStatus());
        assertEquals("side", partial.getMissingParameters().get(0).getName());

        ParameterOutcome complete = orchestrator.supplyParameter(USER, "side", "left");
        assertEquals(ParameterOutcome.Status.COMPLETE, complete.getStatus());
        assertEquals("3(x+1)=3*2", complete.getCandidate().getExpression());
        assertEquals("Multiply both sides by 3", complete.getCandidate().getDescription());
        assertFalse(complete.getCandidate().isRequiresUserInput());
        assertEquals(SessionState.AWAITING_SELECTION, session().getState());
    }

    @Test
    void testProviderValuesAndDefaults() {
        String id = generateParameterized();

        SelectionOutcome outcome = orchestrator.select(USER, id,
                def -> "side".equals(def.getName()) ? Optional.of("right") : Optional.empty());

        assertEquals(SelectionOutcome.Status.SELECTED, outcome.getStatus());
        assertEquals("2(x+1)=2*2", outcome.getCandidate().getExpression());
        assertEquals(SessionState.AWAITING_SELECTION, session().getState());
    }

    @Test
    void testNonNumericProviderValueFallsBackToDefault() {
        String id = generateParameterized();

        SelectionOutcome outcome = orchestrator.select(USER, id,
                def -> Optional.of("factor".equals(def.getName()) ? "banana" : "left"));

        assertEquals(SelectionOutcome.Status.SELECTED, outcome.getStatus());
        assertEquals("2(x+1)=2*2", outcome.getCandidate().getExpression());
    }

    @Test
    void testProviderWithoutDefaultLeavesParameterMissing() {
        String id = generateParameterized();

        SelectionOutcome outcome = orchestrator.select(USER, id, def -> Optional.empty());

        assertEquals(SelectionOutcome.Status.AWAITING_PARAMETERS, outcome.getStatus());
        assertEquals(1, outcome.getMissingParameters().size());
        assertEquals("side", outcome.getMissingParameters().get(0).getName());
    }

    @Test
    void testSupplyParametersOutsideParameterInputIsNotAllowed() {
        selectExpand();

        assertEquals(ParameterOutcome.Status.NOT_ALLOWED,
                orchestrator.supplyParameter(USER, "factor", "2").getStatus());
    }

    @Test
    void testValidate() {
        ParameterDefinition choice = new ParameterDefinition(
                "side", "?", ParameterType.CHOICE, List.of("left", "right"), null, null, null);

        assertNull(SessionOrchestrator.validate(choice, " left "));
        assertNotNull(SessionOrchestrator.validate(choice, "up"));
        assertNotNull(SessionOrchestrator.validate(choice, ""));

        ParameterDefinition number = new ParameterDefinition(
                "k", "?", ParameterType.NUMBER, List.of(), null, null, null);

        assertNull(SessionOrchestrator.validate(number, " -3 "));
        assertNull(SessionOrchestrator.validate(number, "2.5"));
        assertNotNull(SessionOrchestrator.validate(number, "banana"));
        assertNotNull(SessionOrchestrator.validate(number, "NaN"));
    }

    // =========================================================================
    // Rollback / history
    // =========================================================================

    private void applyOneStep() {
        selectExpand();
        llm.reply("{\"result\":\"2x+2=4\",\"valid\":true}");
        llm.reply(NOT_SOLVED);
        orchestrator.apply(USER);
    }

    @Test
    void testRollbackForgetsDiscardedCandidates() {
        applyOneStep();
        llm.reply(TWO_CANDIDATES);
        String laterId = orchestrator.generate(USER).getCandidates().get(0).getId();
        assertTrue(registry.resolve(laterId).isPresent());

        assertFalse(orchestrator.rollbackToOrdinal(USER, 5));
        assertTrue(orchestrator.rollbackToOrdinal(USER, 0));

        assertTrue(registry.resolve(laterId).isEmpty());
        assertEquals(1, session().getHistory().size());
        assertEquals(TASK, session().getHistory().currentExpression());
        assertEquals(SessionState.GENERATING_CANDIDATES, session().getState());
        assertTrue(session().getOfferedCandidateIds().isEmpty());
    }

    @Test
    void testRollbackByStepId() {
        applyOneStep();
        String rootId = session().getHistory().steps().get(0).getId();

        assertFalse(orchestrator.rollbackToStep(USER, "unknown"));
        assertTrue(orchestrator.rollbackToStep(USER, rootId));
        assertEquals(1, session().getHistory().size());
    }

    @Test
    void testHistorySummary() {
        applyOneStep();

        HistorySummary summary = orchestrator.history(USER).orElseThrow();

        assertEquals(2, summary.getStepCount());
        assertEquals("Expand the brackets", summary.getSteps().get(1).getChosenDescription());
    }

    @Test
    void testExportThenImportIntoAnotherUser() {
        applyOneStep();
        ObjectNode exported = orchestrator.exportHistory(USER).orElseThrow();

        SessionSnapshot imported = orchestrator.importHistory("bob", exported);

        assertEquals(2, imported.getStepCount());
        assertEquals("2x+2=4", imported.getCurrentExpression());
        assertEquals(SessionState.GENERATING_CANDIDATES, imported.getState());
        assertTrue(imported.isCanRollback());
    }

    @Test
    void testBrokenImportLeavesSessionUnchanged() {
        applyOneStep();
        ObjectNode exported = orchestrator.exportHistory(USER).orElseThrow();
        exported.remove("original_task");

        assertThrows(HistoryImportException.class, () -> orchestrator.importHistory(USER, exported));
        assertEquals(2, session().getHistory().size());
    }

    // =========================================================================
    // Side operations
    // =========================================================================

    @Test
    void testCheckOnDemand() {
        orchestrator.newSession(USER, "x = 1");
        llm.reply(SOLVED);

        AnalysisOutcome<?> outcome = orchestrator.check(USER);

        assertTrue(outcome.isOk());
        assertEquals(SessionState.SOLVED, session().getState());
    }

    @Test
    void testProgressIsAdvisoryOnly() {
        applyOneStep();
        llm.reply("{\"progress_assessment\":\"poor\",\"recommend_rollback\":true,\"recommended_step\":0}");

        var outcome = orchestrator.analyzeProgress(USER);

        assertTrue(outcome.isOk());
        assertTrue(outcome.getResult().isActionable());
        assertEquals(2, session().getHistory().size());
    }

    @Test
    void testBranchingAnnotatesCurrentStep() {
        orchestrator.newSession(USER, "|x| = 2");
        llm.reply("{\"requires_branching\":true,\"solution_type\":\"cases\",\"branches\":["
                + "{\"name\":\"x >= 0\",\"expression\":\"x = 2\"},{\"name\":\"x < 0\",\"expression\":\"x = -2\"}]}");

        var outcome = orchestrator.analyzeBranching(USER);

        assertTrue(outcome.isOk());
        Step current = session().getHistory().currentStep().orElseThrow();
        assertEquals(2, current.getBranches().size());
        assertEquals("cases", current.getMetadata().get("decomposition"));
        assertEquals(1, session().getHistory().size());
    }

    @Test
    void testMalformedBranchingReply() {
        orchestrator.newSession(USER, "|x| = 2");
        llm.reply("{\"solution_type\":\"cases\"}");

        assertEquals(AnalysisOutcome.Status.MALFORMED_RESPONSE, orchestrator.analyzeBranching(USER).getStatus());
    }

    @Test
    void testVerifyTouchesNoSession() {
        llm.reply("{\"is_correct\":true}");

        var outcome = orchestrator.verify("2(x+1)=4", "Expand", "2x+2=4", null);

        assertTrue(outcome.isOk());
        assertTrue(outcome.getResult().isCorrect());
        assertEquals(0, store.size());
    }
}
