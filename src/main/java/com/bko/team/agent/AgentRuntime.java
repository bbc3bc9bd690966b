package com.bko.team.agent;

import com.bko.team.completion.CompletionClient;
import com.bko.team.completion.GenerationOptions;
import com.bko.team.orchestration.service.JsonProcessingService;
import com.bko.team.orchestration.service.OrchestrationMetricsService;
import com.bko.team.orchestration.service.PromptRenderingService;

/**
 * Collaborators shared by every agent of a team.
 */
public record AgentRuntime(CompletionClient completionClient,
                           GenerationOptions options,
                           JsonProcessingService jsonService,
                           PromptRenderingService prompts,
                           OrchestrationMetricsService metrics,
                           ConversationHistoryStore historyStore,
                           int maxHistoryMessages) {
}
