package com.mathide.core.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mathide.core.candidate.Candidate;
import com.mathide.exception.HistoryImportException;
import com.mathide.exception.MissingFieldException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the persisted history layout:
 *
 * <pre>
 * {original_task, current_step_number,
 *  steps: [{id, step_number, expression, available_transformations, chosen_transformation,
 *           result_expression, timestamp, parent_id, metadata, branches?}]}
 * </pre>
 *
 * Reading validates the whole record before building anything.
 */
final class HistoryCodec {

    static final String ORIGINAL_TASK       = "original_task";
    static final String CURRENT_STEP_NUMBER = "current_step_number";
    static final String STEPS               = "steps";

    static final String ID                  = "id";
    static final String STEP_NUMBER         = "step_number";
    static final String EXPRESSION          = "expression";
    static final String AVAILABLE           = "available_transformations";
    static final String CHOSEN              = "chosen_transformation";
    static final String RESULT              = "result_expression";
    static final String TIMESTAMP           = "timestamp";
    static final String PARENT_ID           = "parent_id";
    static final String METADATA            = "metadata";
    static final String BRANCHES            = "branches";

    private HistoryCodec() {}

    // =========================================================================
    // Write
    // =========================================================================

    static ObjectNode write(StepHistory history, ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        root.put(ORIGINAL_TASK, history.getOriginalTask());
        root.put(CURRENT_STEP_NUMBER, history.size());

        ArrayNode steps = root.putArray(STEPS);
        for (Step step : history.steps()) {
            ObjectNode node = steps.addObject();
            node.put(ID, step.getId());
            node.put(STEP_NUMBER, step.getOrdinal());
            node.put(EXPRESSION, step.getExpression());

            ArrayNode available = node.putArray(AVAILABLE);
            step.getAvailableCandidateIds().forEach(available::add);

            if (step.hasChosenCandidate()) {
                node.set(CHOSEN, step.getChosenCandidate().toJson(mapper));
            } else {
                node.putNull(CHOSEN);
            }
            node.put(RESULT, step.getResultExpression());
            node.put(TIMESTAMP, step.getCreatedAt().toString());
            node.put(PARENT_ID, step.getParentId());

            ObjectNode meta = node.putObject(METADATA);
            step.getMetadata().forEach(meta::put);

            if (!step.getBranches().isEmpty()) {
                ArrayNode branches = node.putArray(BRANCHES);
                for (Branch b : step.getBranches()) {
                    branches.addObject()
                            .put("id", b.getId())
                            .put("name", b.getName())
                            .put("expression", b.getExpression())
                            .put("condition", b.getCondition())
                            .put("is_valid", b.isValid());
                }
            }
        }
        return root;
    }

    // =========================================================================
    // Read
    // =========================================================================

    static StepHistory read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new HistoryImportException("$", -1, "Exported history must be a JSON object");
        }

        String task = requireText(root, ORIGINAL_TASK, -1);

        JsonNode count = require(root, CURRENT_STEP_NUMBER, -1);
        if (!count.canConvertToInt()) {
            throw new HistoryImportException(CURRENT_STEP_NUMBER, -1, "Field '" + CURRENT_STEP_NUMBER + "' must be an integer");
        }

        JsonNode stepsNode = require(root, STEPS, -1);
        if (!stepsNode.isArray()) {
            throw new HistoryImportException(STEPS, -1, "Field '" + STEPS + "' must be an array");
        }
        if (count.asInt() != stepsNode.size()) {
            throw new HistoryImportException(CURRENT_STEP_NUMBER, -1,
                    "Field '" + CURRENT_STEP_NUMBER + "' is " + count.asInt()
                            + " but " + stepsNode.size() + " step(s) are present");
        }

        List<Step> steps = new ArrayList<>(stepsNode.size());
        String previousId = null;
        for (int i = 0; i < stepsNode.size(); i++) {
            Step step = readStep(stepsNode.get(i), i);

            if (step.getOrdinal() != i) {
                throw new HistoryImportException(STEP_NUMBER, i,
                        "Step at index " + i + " has step_number " + step.getOrdinal());
            }
            if (!equalsNullable(previousId, step.getParentId())) {
                throw new HistoryImportException(PARENT_ID, i,
                        "Step " + i + " does not link to the step before it");
            }
            steps.add(step);
            previousId = step.getId();
        }

        return StepHistory.restore(task, steps);
    }

    private static Step readStep(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            throw new HistoryImportException("$", index, "Step " + index + " is not an object");
        }

        String id = requireText(node, ID, index);
        if (id.isBlank()) {
            throw new HistoryImportException(ID, index, "Step " + index + " has a blank id");
        }

        JsonNode ordinalNode = require(node, STEP_NUMBER, index);
        if (!ordinalNode.canConvertToInt()) {
            throw new HistoryImportException(STEP_NUMBER, index, "Step " + index + " has a non-integer step_number");
        }

        String expression = requireText(node, EXPRESSION, index);

        JsonNode availableNode = require(node, AVAILABLE, index);
        if (!availableNode.isArray()) {
            throw new HistoryImportException(AVAILABLE, index, "Step " + index + " has a non-array " + AVAILABLE);
        }
        List<String> available = new ArrayList<>();
        for (JsonNode a : availableNode) {
            if (!a.isTextual()) {
                throw new HistoryImportException(AVAILABLE, index, "Step " + index + " lists a non-text candidate id");
            }
            available.add(a.asText());
        }

        Candidate chosen = null;
        JsonNode chosenNode = require(node, CHOSEN, index);
        if (!chosenNode.isNull()) {
            try {
                chosen = Candidate.fromJson(chosenNode);
            } catch (MissingFieldException e) {
                throw new HistoryImportException(CHOSEN + "." + e.getField(), index,
                        "Step " + index + " has an incomplete chosen candidate: " + e.getMessage());
            }
        }

        String result   = nullableText(node, RESULT, index);
        String parentId = nullableText(node, PARENT_ID, index);
        Instant created = parseTimestamp(requireText(node, TIMESTAMP, index), index);

        Map<String, String> metadata = new LinkedHashMap<>();
        JsonNode metaNode = require(node, METADATA, index);
        if (metaNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = metaNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                metadata.put(e.getKey(), e.getValue().isValueNode() ? e.getValue().asText() : e.getValue().toString());
            }
        } else if (!metaNode.isNull()) {
            throw new HistoryImportException(METADATA, index, "Step " + index + " has non-object metadata");
        }

        return new Step(id, ordinalNode.asInt(), expression, chosen, result, available,
                parentId, created, readBranches(node, index), metadata);
    }

    private static List<Branch> readBranches(JsonNode node, int index) {
        JsonNode branchesNode = node.get(BRANCHES);
        if (branchesNode == null || branchesNode.isNull()) {
            return List.of();
        }
        if (!branchesNode.isArray()) {
            throw new HistoryImportException(BRANCHES, index, "Step " + index + " has a non-array " + BRANCHES);
        }
        List<Branch> branches = new ArrayList<>();
        for (JsonNode b : branchesNode) {
            String field = BRANCHES + "[" + branches.size() + "]";
            if (!b.isObject()) {
                throw new HistoryImportException(field, index, "Step " + index + " has a malformed branch");
            }
            branches.add(new Branch(
                    requireText(b, "id", index),
                    requireText(b, "name", index),
                    requireText(b, "expression", index),
                    b.hasNonNull("condition") ? b.get("condition").asText() : null,
                    !b.has("is_valid") || b.get("is_valid").asBoolean(true)
            ));
        }
        return branches;
    }

    // =========================================================================
    // Field helpers
    // =========================================================================

    private static JsonNode require(JsonNode node, String field, int index) {
        JsonNode value = node.get(field);
        if (value == null) {
            throw new HistoryImportException(field, index,
                    (index >= 0 ? "Step " + index + " is" : "Exported history is") + " missing field '" + field + "'");
        }
        return value;
    }

    private static String requireText(JsonNode node, String field, int index) {
        JsonNode value = require(node, field, index);
        if (!value.isTextual()) {
            throw new HistoryImportException(field, index, "Field '" + field + "' must be text");
        }
        return value.asText();
    }

    /** The key must be present; its value may be null. */
    private static String nullableText(JsonNode node, String field, int index) {
        JsonNode value = require(node, field, index);
        if (value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new HistoryImportException(field, index, "Field '" + field + "' must be text or null");
        }
        return value.asText();
    }

    private static Instant parseTimestamp(String text, int index) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            // Zone-less timestamps are read as UTC
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException inner) {
                throw new HistoryImportException(TIMESTAMP, index,
                        "Step " + index + " has an unreadable timestamp '" + text + "'");
            }
        }
    }

    private static boolean equalsNullable(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }
}
