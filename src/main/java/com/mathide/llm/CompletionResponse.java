package com.mathide.llm;

/**
 * Text returned by the model plus the service's accounting.
 */
public final class CompletionResponse {

    private final String     content;
    private final TokenUsage usage;
    private final String     model;
    private final String     finishReason;

    public CompletionResponse(String content, TokenUsage usage, String model, String finishReason) {
        this.content      = content;
        this.usage        = usage != null ? usage : TokenUsage.zero();
        this.model        = model;
        this.finishReason = finishReason != null ? finishReason : "stop";
    }

    public String     getContent()      { return content; }
    public TokenUsage getUsage()        { return usage; }
    public String     getModel()        { return model; }
    public String     getFinishReason() { return finishReason; }
}
