package com.bko.team.cli;

import com.bko.team.bus.MessageBus;
import com.bko.team.config.AgentTeamProperties;
import com.bko.team.orchestration.OrchestratorService;
import com.bko.team.orchestration.model.PipelineStatus;
import com.bko.team.orchestration.model.TaskOutcome;
import org.junit.jupiter.api.Test;
import org.springframework.boot.logging.LoggingSystem;
import picocli.CommandLine;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class CliRunnerTest {

    private final OrchestratorService orchestratorService = mock(OrchestratorService.class);
    private final CliRunner runner = new CliRunner(
            new TeamCommand(orchestratorService, new MessageBus(new AgentTeamProperties()), mock(LoggingSystem.class)),
            CommandLine.defaultFactory());

    @Test
    void testServeModeOnlyAsFirstArgument() {
        assertTrue(CliRunner.isServeMode("serve"));
        assertTrue(CliRunner.isServeMode("serve", "--help"));
        assertFalse(CliRunner.isServeMode("--task", "serve"));
        assertFalse(CliRunner.isServeMode());
    }

    @Test
    void testTaskNamedServeIsSolved() {
        when(orchestratorService.solve(eq("serve"), isNull()))
                .thenReturn(new TaskOutcome("ab12cd34", PipelineStatus.COMPLETED, "done", null, Duration.ZERO));

        runner.run("--task", "serve");

        verify(orchestratorService).solve(eq("serve"), isNull());
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void testServeLeavesPicocliOut() {
        runner.run("serve");

        verify(orchestratorService, never()).solve(any(), any());
        assertEquals(0, runner.getExitCode());
    }
}
