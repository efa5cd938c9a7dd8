package com.mathide.llm;

import java.util.Objects;

/**
 * One role/content pair of a completion request.
 */
public final class ChatMessage {

    public static final String SYSTEM    = "system";
    public static final String USER      = "user";
    public static final String ASSISTANT = "assistant";

    private final String role;
    private final String content;

    public ChatMessage(String role, String content) {
        this.role    = Objects.requireNonNull(role, "role");
        this.content = content != null ? content : "";
    }

    public static ChatMessage system(String content) { return new ChatMessage(SYSTEM, content); }
    public static ChatMessage user(String content)   { return new ChatMessage(USER, content); }

    public String getRole()    { return role; }
    public String getContent() { return content; }

    @Override
    public String toString() {
        return role + ": " + (content.length() > 80 ? content.substring(0, 80) + "..." : content);
    }
}
