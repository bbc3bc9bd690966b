package com.bko.team.bus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Conjunction of field and metadata equality checks. A metadata key absent from the message
 * never matches. The empty filter matches everything.
 */
public record MessageFilter(Map<MessageField, Object> fields, Map<String, Object> metadata) {

    public MessageFilter {
        fields = fields != null && !fields.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(fields))
                : Map.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static MessageFilter any() {
        return new MessageFilter(Map.of(), Map.of());
    }

    public MessageFilter where(MessageField field, Object value) {
        Map<MessageField, Object> updated = new EnumMap<>(MessageField.class);
        updated.putAll(fields);
        updated.put(field, value);
        return new MessageFilter(updated, metadata);
    }

    public MessageFilter withMetadata(String key, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(metadata);
        updated.put(key, value);
        return new MessageFilter(fields, updated);
    }

    public boolean matches(TeamMessage message) {
        for (Map.Entry<MessageField, Object> entry : fields.entrySet()) {
            if (!Objects.equals(entry.getKey().valueOf(message), entry.getValue())) {
                return false;
            }
        }
        for (Map.Entry<String, Object> entry : metadata.entrySet()) {
            if (!message.metadata().containsKey(entry.getKey())
                    || !Objects.equals(message.metadata().get(entry.getKey()), entry.getValue())) {
                return false;
            }
        }
        return true;
    }
}
