package com.bko.team.agent;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Map;

public record ConversationEntry(Instant timestamp,
                                String message,
                                String response,
                                @Nullable Map<String, Object> context) {
}
