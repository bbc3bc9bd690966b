package com.bko.team.orchestration.model;

import com.bko.team.agent.AgentRole;

public enum Specialization {
    FRONTEND(AgentRole.FRONTEND, "frontend"),
    BACKEND(AgentRole.BACKEND, "backend");

    private final AgentRole role;
    private final String label;

    Specialization(AgentRole role, String label) {
        this.role = role;
        this.label = label;
    }

    public AgentRole role() {
        return role;
    }

    public String label() {
        return label;
    }

    public String missingSolutionText() {
        return "No " + label + " solution available.";
    }
}
