package com.mathide.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.mathide.core.history.Branch;
import com.mathide.core.parser.ResponseFields;
import com.mathide.llm.LLMClient;
import com.mathide.llm.ModelRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Asks whether the current expression splits into a system, cases or alternatives.
 *
 * Branch ids are positional ({@code branch_0}, {@code branch_1}, ...). An unknown
 * solution type is read as alternatives.
 */
@Component
public class BranchingAnalyzer extends ModelBackedEngine {

    private static final Logger log = LoggerFactory.getLogger(BranchingAnalyzer.class);

    private static final String USER_TEMPLATE = """
            Current expression:
            %s

            Does solving it require splitting into several branches?
            - "system": several equations that hold together
            - "cases": mutually exclusive cases with conditions (e.g. |x|, division by a variable)
            - "alternatives": independent solution sets (e.g. a product equal to zero)

            Return a JSON object:
            {
              "requires_branching": true or false,
              "solution_type": "system" | "cases" | "alternatives",
              "explanation": "why",
              "branches": [
                {"name": "short label", "expression": "the branch", "condition": "when it applies" or null, "is_valid": true}
              ]
            }
            """;

    public BranchingAnalyzer(LLMClient llmClient) {
        super(llmClient);
    }

    public BranchingResult analyze(String expression) {
        log.info("[Branching] Analyzing: {}", expression);

        JsonNode reply = requestObject(
                ModelRole.BRANCH_ANALYST,
                JSON_ONLY_PERSONA,
                USER_TEMPLATE.formatted(expression));

        boolean requires    = ResponseFields.requireBoolean(reply, "requires_branching");
        String  explanation = ResponseFields.optionalText(reply, "explanation");

        if (!requires) {
            log.info("[Branching] No branching required");
            return new BranchingResult(false, null, explanation, List.of());
        }

        List<Branch> branches = new ArrayList<>();
        JsonNode branchesNode = ResponseFields.find(reply, "branches");
        if (branchesNode != null && branchesNode.isArray()) {
            int i = 0;
            for (JsonNode b : branchesNode) {
                if (!b.isObject()) {
                    log.warn("[Branching] Skipping branch element {}: not an object", i);
                    i++;
                    continue;
                }
                branches.add(new Branch(
                        "branch_" + branches.size(),
                        firstNonNull(ResponseFields.optionalText(b, "name"), "Branch " + (branches.size() + 1)),
                        firstNonNull(ResponseFields.optionalText(b, "expression"), ""),
                        ResponseFields.optionalText(b, "condition"),
                        ResponseFields.optionalBoolean(b, true, "is_valid", "valid")));
                i++;
            }
        }

        String type = normalizeType(ResponseFields.optionalText(reply, "solution_type", "type"));
        log.info("[Branching] {} branch(es) of type {}", branches.size(), type);
        return new BranchingResult(true, type, explanation, branches);
    }

    static String normalizeType(String raw) {
        if (raw == null) {
            return BranchingResult.ALTERNATIVES;
        }
        String t = raw.trim().toLowerCase(Locale.ROOT);
        return switch (t) {
            case BranchingResult.SYSTEM, BranchingResult.CASES -> t;
            default -> BranchingResult.ALTERNATIVES;
        };
    }

    private static String firstNonNull(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
