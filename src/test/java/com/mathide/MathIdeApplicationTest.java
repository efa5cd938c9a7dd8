package com.mathide;

import com.mathide.core.history.HistorySummary;
import com.mathide.core.session.SessionState;
import com.mathide.llm.LLMClient;
import com.mathide.llm.RetryingLLMClient;
import com.mathide.orchestrator.SessionOrchestrator;
import com.mathide.orchestrator.dto.ApplyOutcome;
import com.mathide.orchestrator.dto.GenerationOutcome;
import com.mathide.orchestrator.dto.OfferedCandidate;
import com.mathide.orchestrator.dto.SelectionOutcome;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("mock")
class MathIdeApplicationTest {

    @Autowired
    private SessionOrchestrator orchestrator;

    @Autowired
    private LLMClient llmClient;

    private static OfferedCandidate byKind(GenerationOutcome outcome, String kind) {
        return outcome.getCandidates().stream()
                .filter(c -> kind.equals(c.getKind()))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void testContextWiresRetryingClient() {
        assertInstanceOf(RetryingLLMClient.class, llmClient);
        assertEquals(3, ((RetryingLLMClient) llmClient).getMaxAttempts());
    }

    @Test
    void testFullLoopReachesSolved() {
        String user = "context-loop";
        orchestrator.newSession(user, "2x = 2");

        GenerationOutcome generated = orchestrator.generate(user);
        assertEquals(GenerationOutcome.Status.GENERATED, generated.getStatus());
        assertEquals(2, generated.getCandidates().size());

        OfferedCandidate simplify = byKind(generated, "simplify");
        assertEquals("x = 1", simplify.getPreviewResult());

        SelectionOutcome selected = orchestrator.select(user, simplify.getId());
        assertEquals(SelectionOutcome.Status.SELECTED, selected.getStatus());

        ApplyOutcome applied = orchestrator.apply(user);
        assertEquals(ApplyOutcome.Status.SOLVED, applied.getStatus());
        assertEquals("x = 1", applied.getResultExpression());

        HistorySummary history = orchestrator.history(user).orElseThrow();
        assertEquals(2, history.getStepCount());
        assertTrue(history.isComplete());
        assertEquals(SessionState.SOLVED, orchestrator.snapshot(user).orElseThrow().getState());
    }

    @Test
    void testParameterizedCandidateWithDefault() {
        String user = "context-params";
        orchestrator.newSession(user, "x = 1");

        OfferedCandidate multiply = byKind(orchestrator.generate(user), "multiply");
        assertTrue(multiply.isRequiresUserInput());

        SelectionOutcome selected = orchestrator.select(user, multiply.getId(), def -> Optional.empty());

        assertEquals(SelectionOutcome.Status.SELECTED, selected.getStatus());
        assertEquals("2 \\cdot x = 2", selected.getCandidate().getExpression());
        assertEquals("2 \\cdot x = 2", selected.getCandidate().getPreviewResult());

        ApplyOutcome applied = orchestrator.apply(user);
        assertTrue(applied.isStepAppended());
        assertEquals("2 \\cdot x = 2", applied.getResultExpression());
    }
}
