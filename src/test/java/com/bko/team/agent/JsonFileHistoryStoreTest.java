package com.bko.team.agent;

import com.bko.team.support.TestAgents;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileHistoryStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = TestAgents.objectMapper();

    @Test
    void testFileNameUsesRoleIdAndDate() {
        JsonFileHistoryStore store = new JsonFileHistoryStore(tempDir, objectMapper, Runnable::run, CLOCK);

        assertEquals(tempDir.resolve("backend_ab12cd34_20240315.json"), store.fileFor(AgentRole.BACKEND, "ab12cd34"));
    }

    @Test
    void testSaveWritesLatestSnapshot() throws IOException {
        Path historyDir = tempDir.resolve("history");
        JsonFileHistoryStore store = new JsonFileHistoryStore(historyDir, objectMapper, Runnable::run, CLOCK);
        ConversationEntry first = new ConversationEntry(Instant.parse("2024-03-15T10:00:01Z"), "hello", "hi", null);
        ConversationEntry second = new ConversationEntry(Instant.parse("2024-03-15T10:00:02Z"), "task", "done", Map.of("step", 2));

        store.save(AgentRole.COORDINATOR, "agent001", List.of(first));
        store.save(AgentRole.COORDINATOR, "agent001", List.of(first, second));

        Path file = historyDir.resolve("coordinator_agent001_20240315.json");
        JsonNode saved = objectMapper.readTree(file.toFile());
        assertTrue(saved.isArray());
        assertEquals(2, saved.size());
        assertEquals("task", saved.get(1).get("message").asText());
        assertEquals("done", saved.get(1).get("response").asText());
        assertEquals(2, saved.get(1).at("/context/step").asInt());
        try (Stream<Path> files = Files.list(historyDir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void testWriteFailureIsNotPropagated() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("not-a-directory"), "x");
        JsonFileHistoryStore store = new JsonFileHistoryStore(blocker, objectMapper, Runnable::run, CLOCK);

        assertDoesNotThrow(() -> store.save(AgentRole.FRONTEND, "agent002", List.of()));
    }

    @Test
    void testRejectedExecutionIsNotPropagated() {
        Executor closed = command -> {
            throw new RejectedExecutionException("shut down");
        };
        JsonFileHistoryStore store = new JsonFileHistoryStore(tempDir, objectMapper, closed, CLOCK);

        assertDoesNotThrow(() -> store.save(AgentRole.FRONTEND, "agent003", List.of()));
    }
}
