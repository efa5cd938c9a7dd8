package com.mathide.llm;

import java.util.List;
import java.util.Objects;

/**
 * Ordered messages plus sampling settings for one completion.
 *
 * A null model leaves the choice to the transport's configured default.
 */
public final class CompletionRequest {

    private final ModelRole         role;
    private final List<ChatMessage> messages;
    private final double            temperature;
    private final String            model;

    public CompletionRequest(ModelRole role, List<ChatMessage> messages, double temperature, String model) {
        this.role        = Objects.requireNonNull(role, "role");
        this.messages    = List.copyOf(messages);
        this.temperature = temperature;
        this.model       = model;
    }

    /** System prompt plus a single user message at the role's canonical temperature. */
    public static CompletionRequest of(ModelRole role, String systemPrompt, String userPrompt) {
        return new CompletionRequest(
                role,
                List.of(ChatMessage.system(systemPrompt), ChatMessage.user(userPrompt)),
                role.temperature(),
                null
        );
    }

    public ModelRole         getRole()        { return role; }
    public List<ChatMessage> getMessages()    { return messages; }
    public double            getTemperature() { return temperature; }
    public String            getModel()       { return model; }
}
