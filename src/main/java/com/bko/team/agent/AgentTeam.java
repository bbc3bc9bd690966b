package com.bko.team.agent;

import com.bko.team.orchestration.model.Specialization;

/**
 * The agents of one pipeline run.
 */
public record AgentTeam(Coordinator coordinator, FrontendWorker frontend, BackendWorker backend) {

    public Worker workerFor(Specialization specialization) {
        return switch (specialization) {
            case FRONTEND -> frontend;
            case BACKEND -> backend;
        };
    }
}
