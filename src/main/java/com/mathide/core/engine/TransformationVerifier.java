package com.mathide.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.mathide.core.parser.ResponseFields;
import com.mathide.llm.LLMClient;
import com.mathide.llm.ModelRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Re-derives a transformation independently and compares it with a claimed result,
 * optionally also judging a result the student worked out by hand.
 *
 * Stateless; safe to call whatever the session is doing.
 */
@Component
public class TransformationVerifier extends ModelBackedEngine {

    private static final Logger log = LoggerFactory.getLogger(TransformationVerifier.class);

    static final String CHECK_TRANSFORMATION = "transformation";
    static final String CHECK_USER_RESULT    = "user_result";

    private static final String SYSTEM_PROMPT = """
            You are a meticulous mathematics verifier.
            Redo the described transformation yourself, step by step, and compare your result with the claimed one.
            Be strict: equivalent forms are correct, anything else is not.
            Respond ONLY with valid JSON. No prose outside the JSON.
            Escape every backslash inside JSON strings.
            """;

    private static final String USER_TEMPLATE = """
            Verification type: %s
            Original expression:
            %s
            Transformation: %s
            Claimed result:
            %s
            Result proposed by the student (may be empty):
            %s

            Return a JSON object:
            {
              "is_correct": true or false,
              "corrected_result": "the correct result",
              "verification_explanation": "what you checked",
              "errors_found": ["each mistake found"],
              "step_by_step_check": "your derivation",
              "user_result_assessment": "verdict on the student's result", or null
            }
            """;

    public TransformationVerifier(LLMClient llmClient) {
        super(llmClient);
    }

    public VerificationResult verify(
            String originalExpression,
            String claimedDescription,
            String claimedResult,
            String userSuggestedResult
    ) {
        String type = userSuggestedResult != null && !userSuggestedResult.isBlank()
                ? CHECK_USER_RESULT
                : CHECK_TRANSFORMATION;

        log.info("[Verifier] Verifying ({}): {} -> {}", type, originalExpression, claimedResult);

        JsonNode reply = requestObject(
                ModelRole.VERIFIER,
                SYSTEM_PROMPT,
                USER_TEMPLATE.formatted(
                        type,
                        originalExpression,
                        claimedDescription,
                        claimedResult,
                        userSuggestedResult != null ? userSuggestedResult : ""));

        String corrected = ResponseFields.optionalText(reply, "corrected_result");

        VerificationResult result = new VerificationResult(
                ResponseFields.requireBoolean(reply, "is_correct"),
                corrected != null ? corrected : claimedResult,
                ResponseFields.optionalText(reply, "verification_explanation"),
                ResponseFields.textList(reply, "errors_found"),
                ResponseFields.optionalText(reply, "step_by_step_check"),
                ResponseFields.optionalText(reply, "user_result_assessment"));

        log.info("[Verifier] correct={} errors={}", result.isCorrect(), result.getErrorsFound().size());
        return result;
    }
}
