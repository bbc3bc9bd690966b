package com.bko.team.api;

import com.bko.team.orchestration.OrchestratorService;
import com.bko.team.orchestration.model.TaskOutcome;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final OrchestratorService orchestratorService;

    @PostMapping
    public TaskOutcomeResponse solve(@Valid @RequestBody SolveTaskRequest request) {
        Duration timeout = request.timeoutSeconds() != null ? Duration.ofSeconds(request.timeoutSeconds()) : null;
        TaskOutcome outcome = orchestratorService.solve(request.description(), timeout);
        return TaskOutcomeResponse.from(outcome);
    }

    @GetMapping("/active")
    public List<TaskStatusResponse> active() {
        return orchestratorService.activeRuns().stream()
                .map(TaskStatusResponse::from)
                .toList();
    }

    @GetMapping("/{taskId}")
    public TaskStatusResponse status(@PathVariable String taskId) {
        return orchestratorService.findRun(taskId)
                .map(TaskStatusResponse::from)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Task not found: " + taskId));
    }
}
