package com.mathide.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.mathide.core.history.Step;
import com.mathide.core.history.StepHistory;
import com.mathide.core.parser.ResponseFields;
import com.mathide.llm.LLMClient;
import com.mathide.llm.ModelRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reviews the whole step chain and may recommend rolling back to an earlier step.
 *
 * Purely advisory: nothing here touches the history.
 */
@Component
public class ProgressAnalyzer extends ModelBackedEngine {

    private static final Logger log = LoggerFactory.getLogger(ProgressAnalyzer.class);

    private static final String SYSTEM_PROMPT = """
            You are a mathematics tutor reviewing a student's step-by-step solution.
            Judge whether the solution is moving towards the answer, stalled, or heading into a dead end.
            If an earlier step was a better place to continue from, recommend rolling back to it.
            Step numbers start at 0, which is the original task.
            Respond ONLY with valid JSON. No prose outside the JSON.
            """;

    private static final String USER_TEMPLATE = """
            Original task:
            %s

            Steps so far (%d):
            %s
            Current expression:
            %s

            Return a JSON object:
            {
              "progress_assessment": "good" | "stalled" | "regressing" | "dead_end",
              "confidence": number between 0 and 1,
              "analysis": "short assessment",
              "recommend_rollback": true or false,
              "recommended_step": step number to roll back to, or null,
              "rollback_reason": "why that step", or null,
              "suggestion_message": "advice for the student", or null
            }
            """;

    public ProgressAnalyzer(LLMClient llmClient) {
        super(llmClient);
    }

    public ProgressAnalysis analyze(StepHistory history) {
        log.info("[Progress] Analyzing {} step(s)", history.size());

        JsonNode reply = requestObject(
                ModelRole.PROGRESS_ANALYST,
                SYSTEM_PROMPT,
                USER_TEMPLATE.formatted(
                        history.getOriginalTask(),
                        history.size(),
                        describeSteps(history),
                        history.currentExpression()));

        boolean recommend = ResponseFields.requireBoolean(reply, "recommend_rollback");
        Integer target    = ResponseFields.optionalInteger(reply, "recommended_step");

        // Rolling back onto the last step changes nothing
        boolean actionable = recommend
                && target != null
                && target >= 0
                && target < history.size() - 1;

        if (recommend && !actionable) {
            log.warn("[Progress] Recommended step {} is outside the chain of {} step(s)", target, history.size());
        }

        ProgressAnalysis analysis = new ProgressAnalysis(
                ResponseFields.requireText(reply, "progress_assessment"),
                ResponseFields.optionalNumber(reply, 0.0, "confidence"),
                ResponseFields.optionalText(reply, "analysis"),
                recommend,
                target,
                ResponseFields.optionalText(reply, "rollback_reason"),
                ResponseFields.optionalText(reply, "suggestion_message"),
                actionable);

        log.info("[Progress] assessment={} recommendRollback={} step={}",
                analysis.getProgressAssessment(), recommend, target);
        return analysis;
    }

    static String describeSteps(StepHistory history) {
        StringBuilder sb = new StringBuilder();
        for (Step step : history.steps()) {
            sb.append(step.getOrdinal()).append(": ").append(step.getExpression());
            if (step.hasChosenCandidate()) {
                sb.append(" | applied [").append(step.getChosenCandidate().getKind()).append("] ")
                  .append(step.getChosenCandidate().getDescription());
            }
            if (step.hasResult()) {
                sb.append(" | result ").append(step.getResultExpression());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
