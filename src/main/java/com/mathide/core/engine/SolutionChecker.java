package com.mathide.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.mathide.core.parser.ResponseFields;
import com.mathide.llm.LLMClient;
import com.mathide.llm.ModelRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether the current expression completes the original task.
 *
 * Required reply fields: {@code solved} (alias {@code is_solved}), {@code confidence},
 * {@code explanation}, {@code category} (alias {@code solution_type}).
 */
@Component
public class SolutionChecker extends ModelBackedEngine {

    private static final Logger log = LoggerFactory.getLogger(SolutionChecker.class);

    private static final String USER_TEMPLATE = """
            Original task:
            %s

            Current state of the solution:
            %s

            Is the task completely solved? Return a JSON object:
            {
              "solved": true or false,
              "confidence": number between 0 and 1,
              "explanation": "why",
              "category": "single" | "multiple" | "no_solution" | "infinite" | "identity" | "incomplete",
              "next_steps": ["what remains to be done, if anything"]
            }
            """;

    public SolutionChecker(LLMClient llmClient) {
        super(llmClient);
    }

    public CheckResult check(String currentExpression, String originalTask) {
        log.info("[Checker] Checking completeness of: {}", currentExpression);

        JsonNode reply = requestObject(
                ModelRole.CHECKER,
                JSON_ONLY_PERSONA,
                USER_TEMPLATE.formatted(originalTask, currentExpression));

        double confidence = ResponseFields.requireNumber(reply, "confidence");

        CheckResult result = new CheckResult(
                ResponseFields.requireBoolean(reply, "solved", "is_solved"),
                Math.max(0.0, Math.min(1.0, confidence)),
                ResponseFields.requireText(reply, "explanation"),
                ResponseFields.requireText(reply, "category", "solution_type"),
                ResponseFields.textList(reply, "next_steps"));

        log.info("[Checker] solved={} category={} confidence={}",
                result.isSolved(), result.getCategory(), result.getConfidence());
        return result;
    }
}
