package com.mathide.llm;

/**
 * Token accounting reported with a completion.
 */
public final class TokenUsage {

    private static final TokenUsage ZERO = new TokenUsage(0, 0, 0);

    private final int promptTokens;
    private final int completionTokens;
    private final int totalTokens;

    public TokenUsage(int promptTokens, int completionTokens, int totalTokens) {
        this.promptTokens     = promptTokens;
        this.completionTokens = completionTokens;
        this.totalTokens      = totalTokens;
    }

    /** Used when the service reports no usage at all. */
    public static TokenUsage zero() {
        return ZERO;
    }

    public int getPromptTokens()     { return promptTokens; }
    public int getCompletionTokens() { return completionTokens; }
    public int getTotalTokens()      { return totalTokens; }

    @Override
    public String toString() {
        return "prompt=" + promptTokens + " completion=" + completionTokens + " total=" + totalTokens;
    }
}
