package com.bko.team.agent;

import com.bko.team.config.AgentTeamProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Writes each agent's history to {@code <dir>/<role>_<agentId>_<yyyyMMdd>.json} on a background
 * executor. The file is replaced atomically with the latest snapshot. Failures are logged only.
 */
@Component
@Slf4j
public class JsonFileHistoryStore implements ConversationHistoryStore {

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Path historyDir;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final Clock clock;

    @Autowired
    public JsonFileHistoryStore(AgentTeamProperties properties,
                                ObjectMapper objectMapper,
                                @Qualifier("historyExecutor") Executor executor) {
        this(Paths.get(properties.getHistory().getHistoryDir()), objectMapper, executor, Clock.systemDefaultZone());
    }

    JsonFileHistoryStore(Path historyDir, ObjectMapper objectMapper, Executor executor, Clock clock) {
        this.historyDir = historyDir;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public void save(AgentRole role, String agentId, List<ConversationEntry> snapshot) {
        Path target = fileFor(role, agentId);
        try {
            executor.execute(() -> write(target, snapshot));
        } catch (RejectedExecutionException ex) {
            log.error("History of agent {} not saved, writer is shut down", agentId, ex);
        }
    }

    Path fileFor(AgentRole role, String agentId) {
        String date = LocalDate.now(clock).format(FILE_DATE);
        return historyDir.resolve(role.key() + "_" + agentId + "_" + date + ".json");
    }

    private void write(Path target, List<ConversationEntry> snapshot) {
        try {
            Files.createDirectories(historyDir);
            Path temp = Files.createTempFile(historyDir, target.getFileName().toString(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
                move(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("History saved to {}", target);
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to save conversation history to {}", target, ex);
        }
    }

    private void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
