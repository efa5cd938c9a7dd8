package com.mathide.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mathide.exception.CompletionException;
import com.mathide.exception.CompletionException.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * OpenAiCompletionTransport - single-attempt calls to an OpenAI-compatible
 * {@code /chat/completions} endpoint.
 *
 * FAILURE MAPPING:
 * - HTTP 429                                 -> RATE_LIMITED
 * - I/O error, timeout, HTTP 502 / 503 / 504 -> CONNECTION
 * - unreadable body, no choices, no content  -> INVALID_RESPONSE
 * - anything else                            -> OTHER
 */
@Component
@Profile("!mock")
public class OpenAiCompletionTransport implements CompletionTransport {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompletionTransport.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String       baseUrl;
    private final String       apiKey;
    private final String       defaultModel;

    public OpenAiCompletionTransport(
            RestTemplate llmRestTemplate,
            @Value("${mathide.llm.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${mathide.llm.api-key:}") String apiKey,
            @Value("${mathide.llm.model:gpt-4o-mini}") String defaultModel
    ) {
        this.restTemplate = llmRestTemplate;
        this.baseUrl      = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey       = apiKey;
        this.defaultModel = defaultModel;

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[LLM] No API key configured (mathide.llm.api-key); calls will be rejected by the service");
        }
        log.info("[LLM] OpenAI-compatible transport | url={} | model={}", this.baseUrl, defaultModel);
    }

    // =========================================================================
    // CompletionTransport contract
    // =========================================================================

    @Override
    public CompletionResponse send(CompletionRequest request) {
        String model = request.getModel() != null ? request.getModel() : defaultModel;

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        String body = requestBody(request, model);
        log.debug("[LLM] POST {}/chat/completions role={} model={} bodyLen={}",
                baseUrl, request.getRole(), model, body.length());

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(
                    baseUrl + "/chat/completions", new HttpEntity<>(body, headers), String.class);

        } catch (RestClientResponseException e) {
            throw new CompletionException(kindForStatus(e.getStatusCode().value()),
                    "HTTP " + e.getStatusCode().value() + " from completion service: " + e.getStatusText(), e);

        } catch (ResourceAccessException e) {
            throw new CompletionException(FailureKind.CONNECTION,
                    "Connection to completion service failed: " + e.getMessage(), e);

        } catch (RestClientException e) {
            throw new CompletionException(FailureKind.OTHER,
                    "Completion request failed: " + e.getMessage(), e);
        }

        return parseResponse(response.getBody(), model);
    }

    // =========================================================================
    // Wire format
    // =========================================================================

    String requestBody(CompletionRequest request, String model) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", model);
        root.put("temperature", request.getTemperature());

        ArrayNode messages = root.putArray("messages");
        for (ChatMessage m : request.getMessages()) {
            messages.addObject()
                    .put("role", m.getRole())
                    .put("content", m.getContent());
        }
        return root.toString();
    }

    CompletionResponse parseResponse(String body, String requestedModel) {
        if (body == null || body.isBlank()) {
            throw new CompletionException(FailureKind.INVALID_RESPONSE, "Empty body from completion service");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CompletionException(FailureKind.INVALID_RESPONSE, "Unreadable completion body", e);
        }

        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new CompletionException(FailureKind.INVALID_RESPONSE, "Completion has no choices");
        }

        JsonNode first   = choices.get(0);
        String   content = first.path("message").path("content").asText("").strip();
        if (content.isEmpty()) {
            throw new CompletionException(FailureKind.INVALID_RESPONSE, "Completion has empty content");
        }

        JsonNode usageNode = root.get("usage");
        TokenUsage usage = usageNode == null || usageNode.isNull()
                ? TokenUsage.zero()
                : new TokenUsage(
                        usageNode.path("prompt_tokens").asInt(0),
                        usageNode.path("completion_tokens").asInt(0),
                        usageNode.path("total_tokens").asInt(0));

        JsonNode finish = first.get("finish_reason");
        String finishReason = finish == null || finish.isNull() ? "stop" : finish.asText();

        return new CompletionResponse(content, usage, root.path("model").asText(requestedModel), finishReason);
    }

    static FailureKind kindForStatus(int status) {
        return switch (status) {
            case 429           -> FailureKind.RATE_LIMITED;
            case 502, 503, 504 -> FailureKind.CONNECTION;
            default            -> FailureKind.OTHER;
        };
    }
}
