package com.mathide.core.engine;

import com.mathide.core.candidate.Candidate;
import com.mathide.core.history.Branch;
import com.mathide.core.history.StepHistory;
import com.mathide.exception.MissingFieldException;
import com.mathide.llm.ModelRole;
import com.mathide.llm.ScriptedLLMClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checker, progress, verification and branching engines over scripted replies.
 */
class AnalysisEnginesTest {

    private ScriptedLLMClient llm;

    @BeforeEach
    void setUp() {
        llm = new ScriptedLLMClient();
    }

    private static StepHistory threeSteps() {
        StepHistory history = new StepHistory("Solve 2(x+1)=4");
        history.append("2(x+1)=4", List.of(), null, null);
        history.append("2(x+1)=4", List.of(), Candidate.of("Expand", "2x+2=4", "expand"), "2x+2=4");
        history.append("2x+2=4", List.of(), Candidate.of("Square", "4x^2+8x+4=16", "multiply"), "4x^2+8x+4=16");
        return history;
    }

    // =========================================================================
    // SolutionChecker
    // =========================================================================

    @Test
    void testCheckerClampsConfidence() {
        llm.reply("{\"is_solved\":true,\"confidence\":1.7,\"explanation\":\"x isolated\","
                + "\"solution_type\":\"single\",\"next_steps\":[]}");

        CheckResult result = new SolutionChecker(llm).check("x = 1", "Solve 2(x+1)=4");

        assertTrue(result.isSolved());
        assertEquals(1.0, result.getConfidence(), 1e-9);
        assertEquals("single", result.getCategory());
        assertEquals(ModelRole.CHECKER, llm.lastRequest().getRole());
    }

    @Test
    void testCheckerRequiresCategory() {
        llm.reply("{\"solved\":false,\"confidence\":0.4,\"explanation\":\"not yet\"}");

        MissingFieldException e = assertThrows(MissingFieldException.class,
                () -> new SolutionChecker(llm).check("2x = 2", "Solve"));

        assertEquals("category", e.getField());
    }

    // =========================================================================
    // ProgressAnalyzer
    // =========================================================================

    @Test
    void testProgressRecommendationInRangeIsActionable() {
        llm.reply("{\"progress_assessment\":\"poor\",\"confidence\":0.8,\"recommend_rollback\":true,"
                + "\"recommended_step\":1,\"rollback_reason\":\"squaring added work\"}");

        ProgressAnalysis analysis = new ProgressAnalyzer(llm).analyze(threeSteps());

        assertTrue(analysis.isRecommendRollback());
        assertTrue(analysis.isActionable());
        assertEquals(1, analysis.getRecommendedStep());
        assertEquals("squaring added work", analysis.getRollbackReason());
        assertTrue(llm.lastRequest().getMessages().get(1).getContent().contains("4x^2+8x+4=16"));
    }

    @Test
    void testProgressRecommendationOutOfRangeIsNotActionable() {
        llm.reply("{\"progress_assessment\":\"poor\",\"recommend_rollback\":true,\"recommended_step\":7}");
        llm.reply("{\"progress_assessment\":\"poor\",\"recommend_rollback\":true,\"recommended_step\":2}");
        llm.reply("{\"progress_assessment\":\"good\",\"recommend_rollback\":false}");

        ProgressAnalyzer analyzer = new ProgressAnalyzer(llm);

        assertFalse(analyzer.analyze(threeSteps()).isActionable());
        assertFalse(analyzer.analyze(threeSteps()).isActionable());
        assertFalse(analyzer.analyze(threeSteps()).isActionable());
    }

    @Test
    void testProgressRequiresAssessment() {
        llm.reply("{\"recommend_rollback\":false}");

        assertThrows(MissingFieldException.class, () -> new ProgressAnalyzer(llm).analyze(threeSteps()));
    }

    @Test
    void testDescribeStepsListsEveryOrdinal() {
        String described = ProgressAnalyzer.describeSteps(threeSteps());

        assertTrue(described.contains("0: 2(x+1)=4"));
        assertTrue(described.contains("2: 2x+2=4"));
    }

    // =========================================================================
    // TransformationVerifier
    // =========================================================================

    @Test
    void testVerifierDefaultsCorrectedResultToClaim() {
        llm.reply("{\"is_correct\":true,\"verification_explanation\":\"fine\"}");

        VerificationResult result = new TransformationVerifier(llm)
                .verify("2(x+1)=4", "Expand", "2x+2=4", null);

        assertTrue(result.isCorrect());
        assertEquals("2x+2=4", result.getCorrectedResult());
        assertTrue(llm.lastRequest().getMessages().get(1).getContent().contains("Verification type: transformation"));
    }

    @Test
    void testVerifierChecksUserResult() {
        llm.reply("{\"is_correct\":false,\"corrected_result\":\"2x+2=4\",\"errors_found\":[\"dropped factor\"],"
                + "\"user_result_assessment\":\"the 2 was not distributed\"}");

        VerificationResult result = new TransformationVerifier(llm)
                .verify("2(x+1)=4", "Expand", "2x+2=4", "2x+1=4");

        assertFalse(result.isCorrect());
        assertEquals(List.of("dropped factor"), result.getErrorsFound());
        assertEquals("the 2 was not distributed", result.getUserResultAssessment());
        assertTrue(llm.lastRequest().getMessages().get(1).getContent().contains("Verification type: user_result"));
        assertEquals(ModelRole.VERIFIER, llm.lastRequest().getRole());
    }

    // =========================================================================
    // BranchingAnalyzer
    // =========================================================================

    @Test
    void testBranchingAssignsIdsAndDefaults() {
        llm.reply("{\"requires_branching\":true,\"solution_type\":\"Cases\",\"explanation\":\"absolute value\","
                + "\"branches\":[{\"name\":\"Positive\",\"expression\":\"x = 2\",\"condition\":\"x >= 0\"},"
                + "\"junk\","
                + "{\"expression\":\"x = -2\",\"is_valid\":false}]}");

        BranchingResult result = new BranchingAnalyzer(llm).analyze("|x| = 2");

        assertTrue(result.isRequiresBranching());
        assertEquals(BranchingResult.CASES, result.getSolutionType());
        List<Branch> branches = result.getBranches();
        assertEquals(2, branches.size());
        assertEquals("branch_0", branches.get(0).getId());
        assertTrue(branches.get(0).isValid());
        assertEquals("branch_1", branches.get(1).getId());
        assertEquals("Branch 2", branches.get(1).getName());
        assertFalse(branches.get(1).isValid());
    }

    @Test
    void testNoBranchingYieldsEmptyResult() {
        llm.reply("{\"requires_branching\":false}");

        BranchingResult result = new BranchingAnalyzer(llm).analyze("x + 1 = 2");

        assertFalse(result.isRequiresBranching());
        assertTrue(result.getBranches().isEmpty());
    }

    @Test
    void testNormalizeType() {
        assertEquals(BranchingResult.SYSTEM, BranchingAnalyzer.normalizeType(" system "));
        assertEquals(BranchingResult.ALTERNATIVES, BranchingAnalyzer.normalizeType("parallel"));
        assertEquals(BranchingResult.ALTERNATIVES, BranchingAnalyzer.normalizeType(null));
    }
}
