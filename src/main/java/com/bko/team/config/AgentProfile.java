package com.bko.team.config;

/**
 * Identity of one agent: display name, model and system instructions.
 * Unset fields are filled from the completion defaults when the profile is resolved.
 */
public class AgentProfile {

    private String name;
    private String model;
    private String systemPrompt;

    public AgentProfile() {
    }

    public AgentProfile(String name, String model, String systemPrompt) {
        this.name = name;
        this.model = model;
        this.systemPrompt = systemPrompt;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    @Override
    public String toString() {
        return "AgentProfile{" +
                "name='" + name + '\'' +
                ", model='" + model + '\'' +
                '}';
    }
}
