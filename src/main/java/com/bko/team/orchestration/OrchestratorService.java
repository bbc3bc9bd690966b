package com.bko.team.orchestration;

import com.bko.team.agent.AgentFactory;
import com.bko.team.agent.AgentTeam;
import com.bko.team.agent.Coordinator;
import com.bko.team.bus.MessageBus;
import com.bko.team.bus.MessageType;
import com.bko.team.bus.TeamMessage;
import com.bko.team.config.AgentTeamProperties;
import com.bko.team.orchestration.model.AssignmentResult;
import com.bko.team.orchestration.model.PipelineState;
import com.bko.team.orchestration.model.PipelineStatus;
import com.bko.team.orchestration.model.Review;
import com.bko.team.orchestration.model.Specialization;
import com.bko.team.orchestration.model.SubtaskResult;
import com.bko.team.orchestration.model.TaskAnalysis;
import com.bko.team.orchestration.model.TaskAssignment;
import com.bko.team.orchestration.model.TaskOutcome;
import com.bko.team.orchestration.service.OrchestrationMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import static com.bko.team.orchestration.OrchestrationConstants.ERROR_REPORT_TEMPLATE;
import static com.bko.team.orchestration.OrchestrationConstants.NO_SOLUTION_PRODUCED;

/**
 * Drives one task through analysis, parallel sub-task execution and integration under a
 * wall-clock budget.
 * <p>
 * Sub-tasks of both specializations share the bounded worker pool. A sub-task that starts after
 * the deadline is skipped; one still running at the deadline is cancelled and left out of the
 * integration. Any other failure ends the run as {@link PipelineStatus#FAILED} with an error
 * report instead of an exception.
 */
@Service
@Slf4j
public class OrchestratorService {

    static final String ORCHESTRATOR_ID = "orchestrator";
    static final String TASK_ID_KEY = "taskId";

    private final AgentTeamProperties properties;
    private final AgentFactory agentFactory;
    private final MessageBus messageBus;
    private final OrchestrationMetricsService metricsService;
    private final ExecutorService workerExecutor;
    private final Clock clock;
    private final Map<String, PipelineState> runs = new LinkedHashMap<>();

    public OrchestratorService(AgentTeamProperties properties,
                               AgentFactory agentFactory,
                               MessageBus messageBus,
                               OrchestrationMetricsService metricsService,
                               @Qualifier("workerExecutor") ExecutorService workerExecutor,
                               Clock clock) {
        this.properties = properties;
        this.agentFactory = agentFactory;
        this.messageBus = messageBus;
        this.metricsService = metricsService;
        this.workerExecutor = workerExecutor;
        this.clock = clock;
    }

    /**
     * Solves a task and returns the final text: the integrated solution, or the error report
     * when the run failed.
     */
    public String solveTask(String description, @Nullable Duration timeout) {
        return solve(description, timeout).text();
    }

    public TaskOutcome solve(String description, @Nullable Duration timeout) {
        Duration budget = timeout != null && !timeout.isNegative() && !timeout.isZero()
                ? timeout
                : properties.getPipeline().getTaskTimeout();
        String taskId = UUID.randomUUID().toString().substring(0, 8);
        Instant start = clock.instant();
        Instant deadline = start.plus(budget);
        PipelineState state = new PipelineState(taskId, description, start);
        register(state);
        log.info("Solving task {} (budget {} s): {}", taskId, budget.toSeconds(), abbreviate(description, 100));
        publish(taskId, ORCHESTRATOR_ID, ORCHESTRATOR_ID, MessageType.TASK, description, Map.of());

        try {
            AgentTeam team = agentFactory.createTeam();
            Coordinator coordinator = team.coordinator();

            log.info("Step 1: task analysis by the coordinator");
            TaskAnalysis analysis = coordinator.analyzeTask(description);
            state.setAnalysis(analysis);
            metricsService.recordAnalysis(analysis);

            state.setStatus(PipelineStatus.EXECUTING);
            log.info("Step 2: executing {} frontend and {} backend sub-tasks",
                    analysis.subtasksFor(Specialization.FRONTEND).size(), analysis.subtasksFor(Specialization.BACKEND).size());
            Map<Specialization, List<SubtaskResult>> results = executeSubtasks(taskId, team, analysis, deadline);
            results.forEach(state::setResults);

            state.setStatus(PipelineStatus.INTEGRATING);
            log.info("Step 3: integration of the solutions by the coordinator");
            String finalSolution = integrate(coordinator, analysis, results, description);
            if (!StringUtils.hasText(finalSolution)) {
                log.warn("Task {} produced an empty solution", taskId);
                finalSolution = NO_SOLUTION_PRODUCED;
            }

            Instant end = clock.instant();
            state.complete(finalSolution, end);
            Duration duration = Duration.between(start, end);
            publish(taskId, coordinator.getId(), coordinator.getRole().key(), MessageType.RESULT, finalSolution, Map.of());
            log.info("Task {} solved in {} ms", taskId, duration.toMillis());
            return new TaskOutcome(taskId, PipelineStatus.COMPLETED, finalSolution, null, duration);
        } catch (Exception ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Error while solving task {}: {}", taskId, message, ex);
            Instant end = clock.instant();
            String report = ERROR_REPORT_TEMPLATE.formatted(taskId, message);
            state.fail(message, report, end);
            publish(taskId, ORCHESTRATOR_ID, ORCHESTRATOR_ID, MessageType.ERROR, message, Map.of());
            return new TaskOutcome(taskId, PipelineStatus.FAILED, report, message, Duration.between(start, end));
        } finally {
            metricsService.logSummary();
        }
    }

    public Optional<PipelineState> findRun(String taskId) {
        synchronized (runs) {
            return Optional.ofNullable(runs.get(taskId));
        }
    }

    public List<PipelineState> activeRuns() {
        synchronized (runs) {
            return runs.values().stream()
                    .filter(run -> !run.getStatus().isTerminal())
                    .toList();
        }
    }

    private Map<Specialization, List<SubtaskResult>> executeSubtasks(String taskId,
                                                                     AgentTeam team,
                                                                     TaskAnalysis analysis,
                                                                     Instant deadline) throws InterruptedException {
        Map<Specialization, List<Future<Optional<SubtaskResult>>>> futures = new EnumMap<>(Specialization.class);
        for (Specialization specialization : Specialization.values()) {
            List<Future<Optional<SubtaskResult>>> submitted = new ArrayList<>();
            int count = analysis.subtasksFor(specialization).size();
            for (int i = 0; i < count; i++) {
                int index = i;
                submitted.add(workerExecutor.submit(() -> runSubtask(taskId, team, analysis, specialization, index, deadline)));
            }
            futures.put(specialization, submitted);
        }

        Map<Specialization, List<SubtaskResult>> results = new EnumMap<>(Specialization.class);
        try {
            for (Specialization specialization : Specialization.values()) {
                List<SubtaskResult> collected = collect(taskId, specialization, futures.get(specialization), deadline);
                metricsService.recordSubtasksExecuted(specialization, collected.size());
                results.put(specialization, collected);
            }
        } finally {
            futures.values().forEach(list -> list.forEach(future -> future.cancel(true)));
        }
        return results;
    }

    /**
     * Waits for the sub-tasks in list order until the deadline. Late ones are interrupted and
     * skipped; a sub-task failure aborts the run.
     */
    private List<SubtaskResult> collect(String taskId,
                                        Specialization specialization,
                                        List<Future<Optional<SubtaskResult>>> futures,
                                        Instant deadline) throws InterruptedException {
        List<SubtaskResult> collected = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Future<Optional<SubtaskResult>> future = futures.get(i);
            long remaining = Duration.between(clock.instant(), deadline).toMillis();
            try {
                Optional<SubtaskResult> result = future.isDone() || remaining > 0
                        ? future.get(Math.max(remaining, 0), TimeUnit.MILLISECONDS)
                        : Optional.empty();
                if (result.isPresent()) {
                    collected.add(result.get());
                } else if (!future.isDone()) {
                    future.cancel(true);
                    log.warn("Timeout reached for task {}, {} sub-task {} cancelled", taskId, specialization.label(), i + 1);
                }
            } catch (TimeoutException ex) {
                future.cancel(true);
                log.warn("Timeout reached for task {}, {} sub-task {} cancelled", taskId, specialization.label(), i + 1);
            } catch (CancellationException ex) {
                log.warn("{} sub-task {} of task {} was cancelled", specialization.label(), i + 1, taskId);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException(cause.getMessage(), cause);
            }
        }
        return collected;
    }

    Optional<SubtaskResult> runSubtask(String taskId,
                                       AgentTeam team,
                                       TaskAnalysis analysis,
                                       Specialization specialization,
                                       int index,
                                       Instant deadline) {
        List<String> subtasks = analysis.subtasksFor(specialization);
        if (!clock.instant().isBefore(deadline)) {
            log.warn("Timeout reached for task {}, {} sub-task {} not started", taskId, specialization.label(), index + 1);
            return Optional.empty();
        }
        Coordinator coordinator = team.coordinator();
        AssignmentResult assignmentResult = coordinator.createTaskAssignment(analysis, specialization, index);
        if (!assignmentResult.isValid()) {
            log.error("Skipping {} sub-task {} of task {}: {}", specialization.label(), index + 1, taskId,
                    assignmentResult.errorMessage());
            return Optional.empty();
        }
        TaskAssignment assignment = assignmentResult.assignment();
        String subtask = subtasks.get(index);
        log.info("{} sub-task {}/{}: {}", specialization.label(), index + 1, subtasks.size(), abbreviate(subtask, 50));
        var worker = team.workerFor(specialization);
        publish(taskId, coordinator.getId(), coordinator.getRole().key(), worker.getId(), worker.getRole().key(),
                MessageType.ASSIGNMENT, assignment.renderedPrompt(), Map.of("subtaskIndex", index));

        String solution = worker.executeTask(assignment);
        publish(taskId, worker.getId(), worker.getRole().key(), coordinator.getId(), coordinator.getRole().key(),
                MessageType.SOLUTION, solution, Map.of("subtaskIndex", index));

        Review review = coordinator.reviewWork(analysis, specialization, solution);
        publish(taskId, coordinator.getId(), coordinator.getRole().key(), worker.getId(), worker.getRole().key(),
                MessageType.REVIEW, review.evaluationText(), Map.of("subtaskIndex", index, "approved", review.approved()));
        return Optional.of(new SubtaskResult(subtask, solution, review, review.approved()));
    }

    private String integrate(Coordinator coordinator,
                             TaskAnalysis analysis,
                             Map<Specialization, List<SubtaskResult>> results,
                             String description) {
        if (!analysis.hasSubtasks()) {
            log.info("No sub-task found, asking the coordinator to solve the task directly");
            return coordinator.solveDirectly(description);
        }
        String frontend = joinSolutions(results.getOrDefault(Specialization.FRONTEND, List.of()));
        String backend = joinSolutions(results.getOrDefault(Specialization.BACKEND, List.of()));
        return coordinator.integrateSolutions(analysis, frontend, backend);
    }

    /**
     * Approved solutions separated by blank lines, or every solution when none was approved.
     */
    static String joinSolutions(List<SubtaskResult> results) {
        String approved = results.stream()
                .filter(SubtaskResult::approved)
                .map(SubtaskResult::solution)
                .collect(Collectors.joining("\n\n"));
        if (StringUtils.hasText(approved)) {
            return approved;
        }
        return results.stream().map(SubtaskResult::solution).collect(Collectors.joining("\n\n"));
    }

    private void register(PipelineState state) {
        synchronized (runs) {
            runs.put(state.getTaskId(), state);
            int retained = properties.getPipeline().getRetainedRuns();
            Iterator<PipelineState> iterator = runs.values().iterator();
            while (runs.size() > retained && iterator.hasNext()) {
                PipelineState oldest = iterator.next();
                if (oldest.getStatus().isTerminal()) {
                    iterator.remove();
                }
            }
        }
    }

    private void publish(String taskId, String senderId, String senderRole, MessageType type,
                         String content, Map<String, Object> metadata) {
        publish(taskId, senderId, senderRole, null, null, type, content, metadata);
    }

    private void publish(String taskId, String senderId, String senderRole,
                         @Nullable String recipientId, @Nullable String recipientRole,
                         MessageType type, String content, Map<String, Object> metadata) {
        Map<String, Object> withTask = new LinkedHashMap<>(metadata);
        withTask.put(TASK_ID_KEY, taskId);
        messageBus.publish(TeamMessage.of(content, senderId, senderRole, recipientId, recipientRole, type, withTask));
    }

    private static String abbreviate(@Nullable String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength) + "...";
    }
}
