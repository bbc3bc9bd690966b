package com.bko.team.api;

import com.bko.team.orchestration.OrchestratorService;
import com.bko.team.orchestration.model.PipelineState;
import com.bko.team.orchestration.model.PipelineStatus;
import com.bko.team.orchestration.model.Specialization;
import com.bko.team.orchestration.model.TaskAnalysis;
import com.bko.team.orchestration.model.TaskOutcome;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TaskController.class)
class TaskControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OrchestratorService orchestratorService;

    @Test
    void testSolveTask() throws Exception {
        when(orchestratorService.solve(eq("Build a todo app"), eq(Duration.ofSeconds(60))))
                .thenReturn(new TaskOutcome("ab12cd34", PipelineStatus.COMPLETED, "the solution", null, Duration.ofMillis(1500)));

        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"Build a todo app\", \"timeoutSeconds\": 60}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.taskId").value("ab12cd34"))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.succeeded").value(true))
                .andExpect(jsonPath("$.solution").value("the solution"))
                .andExpect(jsonPath("$.durationMillis").value(1500));
    }

    @Test
    void testSolveTaskWithoutTimeoutUsesDefault() throws Exception {
        when(orchestratorService.solve(eq("Build a todo app"), isNull()))
                .thenReturn(new TaskOutcome("ab12cd34", PipelineStatus.FAILED, "ERROR WHILE SOLVING THE TASK", "down", Duration.ZERO));

        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"Build a todo app\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.succeeded").value(false))
                .andExpect(jsonPath("$.error").value("down"));
    }

    @Test
    void testSolveTaskValidation() throws Exception {
        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"  \"}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"Build\", \"timeoutSeconds\": 0}"))
                .andExpect(status().isBadRequest());

        verify(orchestratorService, never()).solve(any(), any());
    }

    @Test
    void testGetTaskStatus() throws Exception {
        PipelineState state = new PipelineState("ab12cd34", "Build a todo app", Instant.parse("2024-03-15T10:00:00Z"));
        state.setAnalysis(new TaskAnalysis("Build a todo app", "analysis",
                Map.of(Specialization.FRONTEND, List.of("List view")), List.of("REST")));
        state.setStatus(PipelineStatus.EXECUTING);
        when(orchestratorService.findRun("ab12cd34")).thenReturn(Optional.of(state));

        mockMvc.perform(get("/api/tasks/ab12cd34"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("EXECUTING"))
                .andExpect(jsonPath("$.frontendTasks[0]").value("List view"))
                .andExpect(jsonPath("$.integrationPoints[0]").value("REST"))
                .andExpect(jsonPath("$.backendResults").isArray());
    }

    @Test
    void testUnknownTaskIsNotFound() throws Exception {
        when(orchestratorService.findRun("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/tasks/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testActiveTasks() throws Exception {
        PipelineState state = new PipelineState("ab12cd34", "Build a todo app", Instant.parse("2024-03-15T10:00:00Z"));
        when(orchestratorService.activeRuns()).thenReturn(List.of(state));

        mockMvc.perform(get("/api/tasks/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].taskId").value("ab12cd34"))
                .andExpect(jsonPath("$[0].status").value("ANALYZING"));
    }
}
