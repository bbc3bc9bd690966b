package com.bko.team.api;

import com.bko.team.orchestration.model.PipelineStatus;
import com.bko.team.orchestration.model.TaskOutcome;

public record TaskOutcomeResponse(
        String taskId,
        PipelineStatus status,
        boolean succeeded,
        String solution,
        String error,
        long durationMillis
) {

    public static TaskOutcomeResponse from(TaskOutcome outcome) {
        return new TaskOutcomeResponse(outcome.taskId(), outcome.status(), outcome.succeeded(),
                outcome.text(), outcome.error(), outcome.duration().toMillis());
    }
}
