package com.mathide.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.mathide.core.parser.PayloadLocator;
import com.mathide.core.parser.ResilientDecoder;
import com.mathide.exception.MissingFieldException;
import com.mathide.llm.LLMClient;
import com.mathide.llm.ModelRole;

/**
 * Shared request/decode path for the engines.
 *
 * A reply goes through payload location, then the staged decoder, then a shape check.
 * Decode-level problems surface as {@link com.mathide.exception.PayloadNotFoundException},
 * {@link com.mathide.exception.ParseFailureException} or {@link MissingFieldException};
 * collaborator failures as {@link com.mathide.exception.CompletionException}.
 */
abstract class ModelBackedEngine {

    /** Common persona for operations that answer with a bare JSON payload. */
    static final String JSON_ONLY_PERSONA = """
            You are an expert mathematician guiding a student through a problem one step at a time.
            Respond ONLY with valid JSON. No prose or markdown outside the JSON.
            Write mathematics in LaTeX and escape every backslash inside JSON strings (\\\\frac, \\\\sqrt).
            """;

    protected final LLMClient llmClient;

    protected ModelBackedEngine(LLMClient llmClient) {
        this.llmClient = llmClient;
    }

    protected JsonNode requestArray(ModelRole role, String systemPrompt, String userPrompt) {
        JsonNode node = request(role, systemPrompt, userPrompt, PayloadLocator.Shape.ARRAY);
        if (!node.isArray()) {
            throw new MissingFieldException("$", "Expected a JSON array, got " + node.getNodeType());
        }
        return node;
    }

    protected JsonNode requestObject(ModelRole role, String systemPrompt, String userPrompt) {
        JsonNode node = request(role, systemPrompt, userPrompt, PayloadLocator.Shape.OBJECT);
        if (!node.isObject()) {
            throw new MissingFieldException("$", "Expected a JSON object, got " + node.getNodeType());
        }
        return node;
    }

    private JsonNode request(ModelRole role, String systemPrompt, String userPrompt, PayloadLocator.Shape shape) {
        String reply   = llmClient.completeText(role, systemPrompt, userPrompt);
        String payload = PayloadLocator.locate(reply, shape);
        return ResilientDecoder.decode(payload);
    }
}
