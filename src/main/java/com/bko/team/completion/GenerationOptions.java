package com.bko.team.completion;

import com.bko.team.config.AgentTeamProperties;

import java.util.Map;

public record GenerationOptions(
        double temperature,
        double topP,
        int maxTokens
) {

    public static GenerationOptions from(AgentTeamProperties.CompletionConfig config) {
        return new GenerationOptions(config.getTemperature(), config.getTopP(), config.getMaxTokens());
    }

    void applyTo(Map<String, Object> body) {
        body.put("temperature", temperature);
        body.put("top_p", topP);
        body.put("max_tokens", maxTokens);
    }
}
