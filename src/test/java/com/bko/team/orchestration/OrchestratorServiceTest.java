package com.bko.team.orchestration;

import com.bko.team.agent.AgentFactory;
import com.bko.team.agent.AgentTeam;
import com.bko.team.agent.BackendWorker;
import com.bko.team.agent.ConversationHistoryStore;
import com.bko.team.agent.Coordinator;
import com.bko.team.agent.FrontendWorker;
import com.bko.team.bus.MessageBus;
import com.bko.team.bus.MessageField;
import com.bko.team.bus.MessageFilter;
import com.bko.team.bus.MessageType;
import com.bko.team.bus.TeamMessage;
import com.bko.team.completion.CompletionConnectionException;
import com.bko.team.config.AgentTeamProperties;
import com.bko.team.orchestration.model.AssignmentResult;
import com.bko.team.orchestration.model.PipelineState;
import com.bko.team.orchestration.model.PipelineStatus;
import com.bko.team.orchestration.model.Review;
import com.bko.team.orchestration.model.Specialization;
import com.bko.team.orchestration.model.SubtaskResult;
import com.bko.team.orchestration.model.TaskAnalysis;
import com.bko.team.orchestration.model.TaskOutcome;
import com.bko.team.orchestration.review.ApprovalPolicyService;
import com.bko.team.orchestration.service.OrchestrationMetricsService;
import com.bko.team.support.ScriptedCompletionClient;
import com.bko.team.support.TestAgents;
import com.bko.team.orchestration.service.JsonProcessingService;
import com.bko.team.orchestration.service.PromptRenderingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.bko.team.orchestration.OrchestrationConstants.NO_SOLUTION_PRODUCED;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class OrchestratorServiceTest {

    private static final String TASK = "Build a todo application";
    private static final String DECOMPOSITION = """
            {"frontend_tasks": ["List view"],
             "backend_tasks": ["Todo API"],
             "integration_points": ["REST /api/todos"]}""";

    private final ScriptedCompletionClient client = new ScriptedCompletionClient();
    private AgentTeamProperties properties;
    private MessageBus messageBus;
    private ExecutorService executor;
    private OrchestratorService orchestrator;

    @BeforeEach
    void setUp() {
        properties = new AgentTeamProperties();
        properties.getHistory().setSaveHistory(false);
        messageBus = new MessageBus(properties);
        executor = Executors.newFixedThreadPool(4);
        OrchestrationMetricsService metrics = new OrchestrationMetricsService();
        AgentFactory factory = new AgentFactory(properties, client, new JsonProcessingService(TestAgents.objectMapper()),
                new PromptRenderingService(), metrics, new ApprovalPolicyService(properties), ConversationHistoryStore.NONE);
        orchestrator = new OrchestratorService(properties, factory, messageBus, metrics, executor, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void scriptTeam() {
        client.on("As technical lead", "Two parts: a list view and an API.")
                .on("From your previous analysis", DECOMPOSITION)
                .on("Answer with a single digit only", "3")
                .on("As frontend developer, complete", "FRONTEND CODE")
                .on("As backend developer, complete", "BACKEND CODE")
                .on("Review of the work submitted by", "Approved.");
    }

    @Test
    void testSolveRunsTheWholePipeline() {
        scriptTeam();
        client.on("Integration of the components", message -> "INTEGRATED");

        TaskOutcome outcome = orchestrator.solve(TASK, Duration.ofSeconds(30));

        assertTrue(outcome.succeeded());
        assertEquals("INTEGRATED", outcome.text());
        assertNull(outcome.error());
        String integration = client.messagesContaining("Integration of the components").get(0);
        assertTrue(integration.contains("FRONTEND CODE"));
        assertTrue(integration.contains("BACKEND CODE"));

        PipelineState state = orchestrator.findRun(outcome.taskId()).orElseThrow();
        assertEquals(PipelineStatus.COMPLETED, state.getStatus());
        assertEquals("INTEGRATED", state.getFinalSolution());
        assertEquals(1, state.getResults(Specialization.FRONTEND).size());
        assertEquals("BACKEND CODE", state.getResults(Specialization.BACKEND).get(0).solution());
        assertNotNull(state.getDuration());
        assertTrue(orchestrator.activeRuns().isEmpty());
    }

    @Test
    void testSolvePublishesPipelineMessages() {
        scriptTeam();
        client.on("Integration of the components", "INTEGRATED");

        TaskOutcome outcome = orchestrator.solve(TASK, Duration.ofSeconds(30));

        MessageFilter forTask = MessageFilter.any().withMetadata(OrchestratorService.TASK_ID_KEY, outcome.taskId());
        List<TeamMessage> messages = messageBus.messages(forTask);
        assertEquals(MessageType.TASK, messages.get(0).messageType());
        assertEquals(TASK, messages.get(0).content());
        assertEquals(MessageType.RESULT, messages.get(messages.size() - 1).messageType());
        assertEquals(2, messageBus.messages(forTask.where(MessageField.MESSAGE_TYPE, MessageType.ASSIGNMENT)).size());
        assertEquals(2, messageBus.messages(forTask.where(MessageField.MESSAGE_TYPE, MessageType.SOLUTION)).size());
        List<TeamMessage> reviews = messageBus.messages(forTask.where(MessageField.MESSAGE_TYPE, MessageType.REVIEW));
        assertEquals(2, reviews.size());
        assertEquals(true, reviews.get(0).metadata().get("approved"));
        TeamMessage backendSolution = messageBus.messages(forTask
                .where(MessageField.MESSAGE_TYPE, MessageType.SOLUTION)
                .where(MessageField.SENDER_ROLE, "backend")).get(0);
        assertEquals("BACKEND CODE", backendSolution.content());
        assertEquals("coordinator", backendSolution.recipientRole());
        assertEquals(0, backendSolution.metadata().get("subtaskIndex"));
    }

    @Test
    void testTaskWithoutSubtasksIsSolvedDirectly() {
        client.on("As technical lead", "Too simple to split.")
                .on("From your previous analysis", "{\"frontend_tasks\": [], \"backend_tasks\": []}")
                .on("No sub-task was identified", "print('hello')");

        TaskOutcome outcome = orchestrator.solve("Print hello", null);

        assertTrue(outcome.succeeded());
        assertEquals("print('hello')", outcome.text());
        assertTrue(client.messagesContaining("Answer with a single digit only").isEmpty());
        assertTrue(client.messagesContaining("Integration of the components").isEmpty());
    }

    @Test
    void testBlankSolutionIsReplaced() {
        client.on("No sub-task was identified", "   ");

        TaskOutcome outcome = orchestrator.solve("Print hello", Duration.ofSeconds(30));

        assertTrue(outcome.succeeded());
        assertEquals(NO_SOLUTION_PRODUCED, outcome.text());
    }

    @Test
    void testFailureReturnsErrorReport() {
        client.on("As technical lead", message -> {
            throw new CompletionConnectionException("Unable to reach the completion service");
        });

        TaskOutcome outcome = orchestrator.solve(TASK, Duration.ofSeconds(30));

        assertFalse(outcome.succeeded());
        assertEquals(PipelineStatus.FAILED, outcome.status());
        assertEquals("Unable to reach the completion service", outcome.error());
        assertTrue(outcome.text().startsWith("ERROR WHILE SOLVING THE TASK"));
        assertTrue(outcome.text().contains(outcome.taskId()));
        assertTrue(orchestrator.solveTask(TASK, Duration.ofSeconds(30)).startsWith("ERROR WHILE SOLVING THE TASK"));
        PipelineState state = orchestrator.findRun(outcome.taskId()).orElseThrow();
        assertEquals(PipelineStatus.FAILED, state.getStatus());
        assertEquals(1, messageBus.messages(MessageFilter.any()
                .where(MessageField.MESSAGE_TYPE, MessageType.ERROR)
                .withMetadata(OrchestratorService.TASK_ID_KEY, outcome.taskId())).size());
    }

    @Test
    void testWorkerFailureFailsTheRun() {
        client.on("As technical lead", "analysis")
                .on("From your previous analysis", DECOMPOSITION)
                .on("Answer with a single digit only", "3")
                .on("As frontend developer, complete", "FRONTEND CODE")
                .on("As backend developer, complete", message -> {
                    throw new CompletionConnectionException("backend unreachable");
                })
                .on("Review of the work submitted by", "Approved.");

        TaskOutcome outcome = orchestrator.solve(TASK, Duration.ofSeconds(30));

        assertEquals(PipelineStatus.FAILED, outcome.status());
        assertEquals("backend unreachable", outcome.error());
        assertTrue(client.messagesContaining("Integration of the components").isEmpty());
    }

    @Test
    void testTimeoutCancelsSlowSubtask() {
        client.on("As technical lead", "analysis")
                .on("From your previous analysis", DECOMPOSITION)
                .on("Answer with a single digit only", "3")
                .on("As frontend developer, complete", "FRONTEND CODE")
                .on("As backend developer, complete", message -> {
                    try {
                        Thread.sleep(30_000);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                        throw new CancellationException("interrupted");
                    }
                    return "too late";
                })
                .on("Review of the work submitted by", "Approved.")
                .on("Integration of the components", "INTEGRATED");

        long start = System.nanoTime();
        TaskOutcome outcome = orchestrator.solve(TASK, Duration.ofSeconds(2));
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertTrue(outcome.succeeded());
        assertTrue(elapsedMillis < 15_000);
        String integration = client.messagesContaining("Integration of the components").get(0);
        assertTrue(integration.contains("FRONTEND CODE"));
        assertTrue(integration.contains(Specialization.BACKEND.missingSolutionText()));
        PipelineState state = orchestrator.findRun(outcome.taskId()).orElseThrow();
        assertTrue(state.getResults(Specialization.BACKEND).isEmpty());
    }

    @Test
    void testOldFinishedRunsAreEvicted() {
        properties.getPipeline().setRetainedRuns(2);
        client.on("No sub-task was identified", "done");

        TaskOutcome first = orchestrator.solve("one", null);
        TaskOutcome second = orchestrator.solve("two", null);
        TaskOutcome third = orchestrator.solve("three", null);

        assertTrue(orchestrator.findRun(first.taskId()).isEmpty());
        assertTrue(orchestrator.findRun(second.taskId()).isPresent());
        assertTrue(orchestrator.findRun(third.taskId()).isPresent());
    }

    @Test
    void testRunSubtaskSkipsInvalidAssignment() {
        Coordinator coordinator = mock(Coordinator.class);
        FrontendWorker frontend = mock(FrontendWorker.class);
        BackendWorker backend = mock(BackendWorker.class);
        when(coordinator.createTaskAssignment(any(), eq(Specialization.BACKEND), anyInt()))
                .thenReturn(AssignmentResult.invalidIndex("Invalid sub-task index 5"));
        TaskAnalysis analysis = TaskAnalysis.empty(TASK, "");

        Optional<SubtaskResult> result = orchestrator.runSubtask("t1", new AgentTeam(coordinator, frontend, backend),
                analysis, Specialization.BACKEND, 5, Instant.now().plusSeconds(60));

        assertTrue(result.isEmpty());
        verify(backend, never()).executeTask(any());
        verify(coordinator, never()).reviewWork(any(), any(), any());
    }

    @Test
    void testRunSubtaskAfterDeadlineDoesNothing() {
        Coordinator coordinator = mock(Coordinator.class);
        FrontendWorker frontend = mock(FrontendWorker.class);
        BackendWorker backend = mock(BackendWorker.class);
        TaskAnalysis analysis = new TaskAnalysis(TASK, "", Map.of(Specialization.FRONTEND, List.of("List view")), List.of());

        Optional<SubtaskResult> result = orchestrator.runSubtask("t1", new AgentTeam(coordinator, frontend, backend),
                analysis, Specialization.FRONTEND, 0, Instant.now().minusSeconds(1));

        assertTrue(result.isEmpty());
        verifyNoInteractions(coordinator, frontend);
    }

    @Test
    void testJoinSolutionsPrefersApproved() {
        SubtaskResult approved = result("approved code", true);
        SubtaskResult rejected = result("rejected code", false);
        SubtaskResult alsoApproved = result("more code", true);

        assertEquals("approved code\n\nmore code", OrchestratorService.joinSolutions(List.of(approved, rejected, alsoApproved)));
        assertEquals("rejected code\n\nrejected code", OrchestratorService.joinSolutions(List.of(rejected, rejected)));
        assertEquals("", OrchestratorService.joinSolutions(List.of()));
    }

    private static SubtaskResult result(String solution, boolean approved) {
        Review review = new Review(Specialization.BACKEND, "Bruno", TASK, approved ? "ok" : "REJECTED", approved);
        return new SubtaskResult("task", solution, review, approved);
    }
}
