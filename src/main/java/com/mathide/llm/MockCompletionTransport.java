package com.mathide.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Canned in-process completions for local runs without a model service.
 *
 * Every role gets a fixed, well-formed reply. The applier echoes the candidate's
 * expected expression so a full loop produces a sensible history.
 */
@Component
@Profile("mock")
public class MockCompletionTransport implements CompletionTransport {

    private static final Logger log = LoggerFactory.getLogger(MockCompletionTransport.class);

    static final String MODEL = "mock";

    private static final String EXPECTED_SHAPE = "Expected shape: ";

    @Override
    public CompletionResponse send(CompletionRequest request) {
        String content = switch (request.getRole()) {
            case GENERATOR -> """
                    [
                      {
                        "description": "Simplify the expression",
                        "expression": "x = 1",
                        "kind": "simplify",
                        "metadata": {"usefulness": "good"}
                      },
                      {
                        "description": "Multiply both sides by {factor}",
                        "expression": "{factor} \\\\cdot x = {factor}",
                        "kind": "multiply",
                        "requires_user_input": true,
                        "parameter_definitions": [
                          {"name": "factor", "prompt": "Multiply by what?", "param_type": "number", "default_value": "2"}
                        ],
                        "metadata": {"usefulness": "neutral"}
                      }
                    ]
                    """;
            case APPLIER -> """
                    {"result": "%s", "valid": true, "explanation": "Applied as described", "errors": []}
                    """.formatted(escape(expectedShape(request)));
            case CHECKER -> """
                    {"solved": true, "confidence": 0.9, "explanation": "The variable is isolated", "category": "single", "next_steps": []}
                    """;
            case PROGRESS_ANALYST -> """
                    {"progress_assessment": "good", "confidence": 0.8, "analysis": "Steady progress", "recommend_rollback": false}
                    """;
            case VERIFIER -> """
                    {"is_correct": true, "verification_explanation": "Both sides agree", "errors_found": [], "step_by_step_check": "Checked"}
                    """;
            case BRANCH_ANALYST -> """
                    {"requires_branching": false, "solution_type": "alternatives", "explanation": "Single equation", "branches": []}
                    """;
        };

        log.debug("[LLM] Mock reply for {}", request.getRole());
        return new CompletionResponse(content.strip(), TokenUsage.zero(), MODEL, "stop");
    }

    private static String expectedShape(CompletionRequest request) {
        for (ChatMessage m : request.getMessages()) {
            for (String line : m.getContent().split("\n")) {
                if (line.startsWith(EXPECTED_SHAPE)) {
                    return line.substring(EXPECTED_SHAPE.length()).strip();
                }
            }
        }
        return "x = 1";
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
