package com.bko.team.completion;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record ChatMessage(
        String role,
        String content
) {
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public static ChatMessage user(String content) {
        return new ChatMessage(ROLE_USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ROLE_ASSISTANT, content);
    }

    @JsonIgnore
    public boolean isUser() {
        return ROLE_USER.equals(role);
    }

    public ChatMessage withContent(String newContent) {
        return new ChatMessage(role, newContent);
    }
}
