package com.mathide.core.candidate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mathide.core.parser.ResponseFields;
import com.mathide.exception.MissingFieldException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Candidate - one transformation the model proposes for the current expression.
 *
 * CANONICAL JSON SCHEMA (one element of the generation array):
 * {
 *   "description": "Expand the brackets",
 *   "expression":  "2x + 2 = 4",
 *   "kind":        "expand",
 *   "metadata":    { "usefulness": "good" },
 *   "requires_user_input":   false,
 *   "parameter_definitions": [ ... ]
 * }
 *
 * "type" is accepted as a legacy alias of "kind", "usefullness" of "usefulness".
 *
 * Immutable. The only derived copies are {@link #withPreviewResult(String)} and
 * {@link #withParameters(List)}; the latter substitutes every {@code {name}} placeholder
 * and yields a candidate that no longer requires input.
 */
public final class Candidate {

    private static final Logger log = LoggerFactory.getLogger(Candidate.class);

    public static final String FIELD_DESCRIPTION    = "description";
    public static final String FIELD_EXPRESSION     = "expression";
    public static final String FIELD_KIND           = "kind";
    public static final String FIELD_METADATA       = "metadata";
    public static final String FIELD_REQUIRES_INPUT = "requires_user_input";
    public static final String FIELD_PARAM_DEFS     = "parameter_definitions";
    public static final String FIELD_PARAMETERS     = "parameters";
    public static final String FIELD_PREVIEW        = "preview_result";

    public static final String USEFULNESS = "usefulness";

    private final String                    description;
    private final String                    expression;
    private final String                    kind;
    private final List<CandidateParameter>  parameters;
    private final List<ParameterDefinition> parameterDefinitions;
    private final boolean                   requiresUserInput;
    private final String                    previewResult;
    private final Map<String, String>       metadata;

    public Candidate(
            String                    description,
            String                    expression,
            String                    kind,
            List<CandidateParameter>  parameters,
            List<ParameterDefinition> parameterDefinitions,
            boolean                   requiresUserInput,
            String                    previewResult,
            Map<String, String>       metadata
    ) {
        this.description          = description != null ? description : "";
        this.expression           = expression != null ? expression : "";
        this.kind                 = kind != null ? kind : "";
        this.parameters           = parameters != null ? List.copyOf(parameters) : List.of();
        this.parameterDefinitions = parameterDefinitions != null ? List.copyOf(parameterDefinitions) : List.of();
        this.requiresUserInput    = requiresUserInput;
        this.previewResult        = previewResult;
        this.metadata             = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    public static Candidate of(String description, String expression, String kind) {
        return new Candidate(description, expression, kind, null, null, false, null, null);
    }

    // =========================================================================
    // JSON
    // =========================================================================

    /**
     * Build a candidate from one decoded generation element.
     *
     * Malformed parameter definitions are dropped with a warning; the candidate survives.
     *
     * @throws MissingFieldException if the element is not an object or lacks
     *                               description, expression or kind
     */
    public static Candidate fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MissingFieldException(FIELD_DESCRIPTION, "Candidate element is not an object");
        }

        String description = ResponseFields.requireText(node, FIELD_DESCRIPTION);
        String expression  = ResponseFields.requireText(node, FIELD_EXPRESSION);
        String kind        = ResponseFields.requireText(node, FIELD_KIND, "type");

        List<ParameterDefinition> definitions = new ArrayList<>();
        JsonNode defsNode = ResponseFields.find(node, FIELD_PARAM_DEFS);
        if (defsNode != null && defsNode.isArray()) {
            for (JsonNode defNode : defsNode) {
                try {
                    definitions.add(ParameterDefinition.fromJson(defNode));
                } catch (MissingFieldException e) {
                    log.warn("[Candidate] Dropping parameter definition of '{}': {}", description, e.getMessage());
                }
            }
        }

        List<CandidateParameter> parameters = new ArrayList<>();
        JsonNode paramsNode = ResponseFields.find(node, FIELD_PARAMETERS);
        if (paramsNode != null && paramsNode.isArray()) {
            for (JsonNode p : paramsNode) {
                String name  = ResponseFields.optionalText(p, "name");
                String value = ResponseFields.optionalText(p, "value");
                if (name != null && value != null) {
                    parameters.add(new CandidateParameter(name, value,
                            ParameterType.fromWire(ResponseFields.optionalText(p, "param_type", "type"))));
                }
            }
        }

        Map<String, String> metadata = new LinkedHashMap<>(ResponseFields.textMap(node, FIELD_METADATA));
        if (!metadata.containsKey(USEFULNESS) && metadata.containsKey("usefullness")) {
            metadata.put(USEFULNESS, metadata.get("usefullness"));
        }

        return new Candidate(
                description,
                expression,
                kind,
                parameters,
                definitions,
                ResponseFields.optionalBoolean(node, false, FIELD_REQUIRES_INPUT),
                ResponseFields.optionalText(node, FIELD_PREVIEW),
                metadata
        );
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put(FIELD_DESCRIPTION, description);
        node.put(FIELD_EXPRESSION, expression);
        node.put(FIELD_KIND, kind);
        node.put(FIELD_REQUIRES_INPUT, requiresUserInput);

        ObjectNode meta = node.putObject(FIELD_METADATA);
        metadata.forEach(meta::put);

        if (!parameterDefinitions.isEmpty()) {
            var defs = node.putArray(FIELD_PARAM_DEFS);
            parameterDefinitions.forEach(d -> defs.add(d.toJson(mapper)));
        }
        if (!parameters.isEmpty()) {
            var params = node.putArray(FIELD_PARAMETERS);
            for (CandidateParameter p : parameters) {
                params.addObject()
                      .put("name", p.getName())
                      .put("value", p.getValue())
                      .put("param_type", p.getType().wireName());
            }
        }
        if (previewResult != null) {
            node.put(FIELD_PREVIEW, previewResult);
        }
        return node;
    }

    // =========================================================================
    // Derived copies
    // =========================================================================

    public Candidate withPreviewResult(String preview) {
        return new Candidate(description, expression, kind, parameters, parameterDefinitions,
                requiresUserInput, preview, metadata);
    }

    /**
     * Bind parameter values and substitute each {@code {name}} placeholder in description,
     * expression and preview. The result requires no further input and carries no definitions.
     */
    public Candidate withParameters(List<CandidateParameter> values) {
        String newDescription = substitute(description, values);
        String newExpression  = substitute(expression, values);
        String newPreview     = previewResult != null ? substitute(previewResult, values) : null;
        return new Candidate(newDescription, newExpression, kind, values, null,
                false, newPreview, metadata);
    }

    static String substitute(String text, List<CandidateParameter> values) {
        String result = text;
        for (CandidateParameter p : values) {
            result = result.replace("{" + p.getName() + "}", p.getValue() != null ? p.getValue() : "");
        }
        return result;
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String getDescription()                            { return description; }
    public String getExpression()                             { return expression; }
    public String getKind()                                   { return kind; }
    public List<CandidateParameter> getParameters()           { return parameters; }
    public List<ParameterDefinition> getParameterDefinitions() { return parameterDefinitions; }
    public boolean isRequiresUserInput()                      { return requiresUserInput; }
    public String getPreviewResult()                          { return previewResult; }
    public Map<String, String> getMetadata()                  { return metadata; }

    /** True when input is required and there is something to ask for. */
    public boolean needsParameters() {
        return requiresUserInput && !parameterDefinitions.isEmpty();
    }

    /** Usefulness tag from metadata; untagged candidates count as neutral. */
    public String usefulness() {
        return metadata.getOrDefault(USEFULNESS, "neutral");
    }

    @Override
    public String toString() {
        return "Candidate{kind=" + kind + ", description='" + description + "', expression='" + expression + "'}";
    }
}
