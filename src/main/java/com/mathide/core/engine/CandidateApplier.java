package com.mathide.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.mathide.core.candidate.Candidate;
import com.mathide.core.parser.ResponseFields;
import com.mathide.llm.LLMClient;
import com.mathide.llm.ModelRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies a concrete candidate to the current expression.
 *
 * Required reply fields: {@code result} (alias {@code result_expression}) and
 * {@code valid} (alias {@code is_valid}).
 */
@Component
public class CandidateApplier extends ModelBackedEngine {

    private static final Logger log = LoggerFactory.getLogger(CandidateApplier.class);

    private static final String USER_TEMPLATE = """
            Current expression:
            %s

            Apply this transformation to it.
            Kind: %s
            Description: %s
            Expected shape: %s

            Return a JSON object:
            {
              "result": "the expression after the transformation",
              "valid": true if the transformation is mathematically valid here, else false,
              "explanation": "short justification",
              "errors": ["problems found, if any"]
            }
            """;

    public CandidateApplier(LLMClient llmClient) {
        super(llmClient);
    }

    public ApplyResult apply(String currentExpression, Candidate candidate) {
        log.info("[Applier] Applying '{}' ({}) to: {}", candidate.getDescription(), candidate.getKind(), currentExpression);

        JsonNode reply = requestObject(
                ModelRole.APPLIER,
                JSON_ONLY_PERSONA,
                USER_TEMPLATE.formatted(
                        currentExpression,
                        candidate.getKind(),
                        candidate.getDescription(),
                        candidate.getExpression()));

        ApplyResult result = new ApplyResult(
                ResponseFields.requireText(reply, "result", "result_expression"),
                ResponseFields.requireBoolean(reply, "valid", "is_valid"),
                ResponseFields.optionalText(reply, "explanation"),
                ResponseFields.textList(reply, "errors"));

        log.info("[Applier] Result valid={}: {}", result.isValid(), result.getResultExpression());
        return result;
    }
}
