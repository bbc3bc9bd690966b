package com.bko.team.orchestration.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    private final ObjectMapper objectMapper;

    /**
     * Parses a JSON object out of free model output. The whole response is tried first, then
     * every balanced {@code {...}} span in order of appearance. Returns null when nothing parses.
     */
    public <T> @Nullable T parseJsonResponse(String label, @Nullable String raw, Class<T> type) {
        if (!StringUtils.hasText(raw)) {
            log.warn("Empty response for {}. Unable to parse JSON.", label);
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("{")) {
            T direct = readObject(trimmed, type);
            if (direct != null) {
                return direct;
            }
        }
        for (int[] span : spanBounds(trimmed)) {
            T parsed = readObject(trimmed.substring(span[0], span[1] + 1), type);
            if (parsed != null) {
                return parsed;
            }
        }
        log.warn("Failed to parse {} response as JSON. Snippet: {}", label, truncate(raw, 240));
        return null;
    }

    private <T> @Nullable T readObject(String json, Class<T> type) {
        try {
            T value = objectMapper.readValue(json, type);
            if (value instanceof JsonNode node && !node.isObject()) {
                return null;
            }
            return value;
        } catch (JsonProcessingException ex) {
            log.debug("Candidate is not valid JSON: {}", ex.getOriginalMessage());
            return null;
        }
    }

    /**
     * Every brace-balanced span, in order of its opening brace, found in a single pass. Braces
     * inside JSON string literals are ignored; quotes between top-level spans are prose.
     */
    static List<String> balancedObjects(String text) {
        List<String> spans = new ArrayList<>();
        for (int[] span : spanBounds(text)) {
            spans.add(text.substring(span[0], span[1] + 1));
        }
        return spans;
    }

    private static List<int[]> spanBounds(String text) {
        List<int[]> bounds = new ArrayList<>();
        Deque<Integer> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"' && !open.isEmpty()) {
                inString = true;
            } else if (c == '{') {
                open.push(i);
            } else if (c == '}' && !open.isEmpty()) {
                bounds.add(new int[]{open.pop(), i});
            }
        }
        bounds.sort(Comparator.comparingInt(span -> span[0]));
        return bounds;
    }

    private String truncate(String value, int maxLength) {
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            log.warn("Failed to serialize {}: {}", value.getClass().getSimpleName(), ex.getOriginalMessage());
            return "\"serialization-failed-" + UUID.randomUUID() + "\"";
        }
    }
}
