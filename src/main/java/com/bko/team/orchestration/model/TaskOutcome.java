package com.bko.team.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Duration;

/**
 * Result of one pipeline run. {@code text} is the final solution on success and the error
 * report on failure; {@code error} is only set for failed runs.
 */
public record TaskOutcome(String taskId,
                          PipelineStatus status,
                          String text,
                          @Nullable String error,
                          Duration duration) {

    public boolean succeeded() {
        return status == PipelineStatus.COMPLETED;
    }
}
