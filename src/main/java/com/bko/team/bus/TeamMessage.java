package com.bko.team.bus;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A message exchanged between agents. Recipients are optional; a message without one is a
 * broadcast.
 */
public record TeamMessage(String id,
                          String content,
                          String senderId,
                          String senderRole,
                          @Nullable String recipientId,
                          @Nullable String recipientRole,
                          MessageType messageType,
                          Map<String, Object> metadata,
                          Instant timestamp) {

    public TeamMessage {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        messageType = messageType != null ? messageType : MessageType.TEXT;
    }

    public static TeamMessage of(String content,
                                 String senderId,
                                 String senderRole,
                                 @Nullable String recipientId,
                                 @Nullable String recipientRole,
                                 MessageType messageType,
                                 @Nullable Map<String, Object> metadata) {
        return new TeamMessage(UUID.randomUUID().toString(), content, senderId, senderRole,
                recipientId, recipientRole, messageType, metadata, Instant.now());
    }
}
