package com.bko.team.orchestration.model;

public enum PipelineStatus {
    ANALYZING,
    EXECUTING,
    INTEGRATING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
