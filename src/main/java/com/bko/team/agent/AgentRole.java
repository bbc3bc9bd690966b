package com.bko.team.agent;

public enum AgentRole {
    COORDINATOR("coordinator", "Coordinator"),
    FRONTEND("frontend", "Frontend Developer"),
    BACKEND("backend", "Backend Developer");

    private final String key;
    private final String displayName;

    AgentRole(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }
}
