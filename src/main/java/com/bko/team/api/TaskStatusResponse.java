package com.bko.team.api;

import com.bko.team.orchestration.model.PipelineState;
import com.bko.team.orchestration.model.PipelineStatus;
import com.bko.team.orchestration.model.Specialization;
import com.bko.team.orchestration.model.SubtaskResult;
import com.bko.team.orchestration.model.TaskAnalysis;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record TaskStatusResponse(
        String taskId,
        String description,
        PipelineStatus status,
        Instant startTime,
        Instant endTime,
        Long durationMillis,
        List<String> frontendTasks,
        List<String> backendTasks,
        List<String> integrationPoints,
        List<SubtaskResult> frontendResults,
        List<SubtaskResult> backendResults,
        String finalSolution,
        String errorMessage
) {

    public static TaskStatusResponse from(PipelineState state) {
        TaskAnalysis analysis = state.getAnalysis();
        Duration duration = state.getDuration();
        return new TaskStatusResponse(
                state.getTaskId(),
                state.getDescription(),
                state.getStatus(),
                state.getStartTime(),
                state.getEndTime(),
                duration != null ? duration.toMillis() : null,
                analysis != null ? analysis.subtasksFor(Specialization.FRONTEND) : List.of(),
                analysis != null ? analysis.subtasksFor(Specialization.BACKEND) : List.of(),
                analysis != null ? analysis.integrationPoints() : List.of(),
                state.getResults(Specialization.FRONTEND),
                state.getResults(Specialization.BACKEND),
                state.getFinalSolution(),
                state.getErrorMessage());
    }
}
