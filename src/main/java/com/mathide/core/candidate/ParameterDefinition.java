package com.mathide.core.candidate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mathide.core.parser.ResponseFields;
import com.mathide.exception.MissingFieldException;

import java.util.List;

/**
 * Describes one value a candidate needs before it can be applied.
 *
 * Wire shape: {@code {name, prompt, param_type, options?, default_value?, validation_rule?,
 * suggested_values?}}. The name doubles as the {@code {name}} placeholder in the candidate's
 * description and expression.
 */
public final class ParameterDefinition {

    private final String        name;
    private final String        promptText;
    private final ParameterType type;
    private final List<String>  options;
    private final String        defaultValue;
    private final String        validationRule;
    private final List<String>  suggestedValues;

    public ParameterDefinition(
            String        name,
            String        promptText,
            ParameterType type,
            List<String>  options,
            String        defaultValue,
            String        validationRule,
            List<String>  suggestedValues
    ) {
        this.name            = name;
        this.promptText      = promptText != null ? promptText : "";
        this.type            = type != null ? type : ParameterType.TEXT;
        this.options         = options != null ? List.copyOf(options) : List.of();
        this.defaultValue    = defaultValue;
        this.validationRule  = validationRule;
        this.suggestedValues = suggestedValues != null ? List.copyOf(suggestedValues) : List.of();
    }

    /**
     * @throws MissingFieldException if name, prompt or a known param_type is absent
     */
    public static ParameterDefinition fromJson(JsonNode node) {
        String name   = ResponseFields.requireText(node, "name");
        String prompt = ResponseFields.requireText(node, "prompt");
        String rawType = ResponseFields.requireText(node, "param_type", "type");

        ParameterType type = ParameterType.fromWire(rawType);
        if (type == null) {
            throw new MissingFieldException("param_type", "Unknown parameter type '" + rawType + "'");
        }

        return new ParameterDefinition(
                name,
                prompt,
                type,
                ResponseFields.textList(node, "options"),
                ResponseFields.optionalText(node, "default_value"),
                ResponseFields.optionalText(node, "validation_rule"),
                ResponseFields.textList(node, "suggested_values")
        );
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", name);
        node.put("prompt", promptText);
        node.put("param_type", type.wireName());
        if (!options.isEmpty())         options.forEach(node.putArray("options")::add);
        if (defaultValue != null)       node.put("default_value", defaultValue);
        if (validationRule != null)     node.put("validation_rule", validationRule);
        if (!suggestedValues.isEmpty()) suggestedValues.forEach(node.putArray("suggested_values")::add);
        return node;
    }

    public String getName()                { return name; }
    public String getPromptText()          { return promptText; }
    public ParameterType getType()         { return type; }
    public List<String> getOptions()       { return options; }
    public String getDefaultValue()        { return defaultValue; }
    public String getValidationRule()      { return validationRule; }
    public List<String> getSuggestedValues() { return suggestedValues; }

    public String placeholder() {
        return "{" + name + "}";
    }
}
