package com.bko.team.agent;

import com.bko.team.completion.CompletionClient;
import com.bko.team.completion.GenerationOptions;
import com.bko.team.config.AgentTeamProperties;
import com.bko.team.orchestration.model.Specialization;
import com.bko.team.orchestration.review.ApprovalPolicyService;
import com.bko.team.orchestration.service.JsonProcessingService;
import com.bko.team.orchestration.service.OrchestrationMetricsService;
import com.bko.team.orchestration.service.PromptRenderingService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Builds a fresh team per run so no conversation state is shared between runs.
 */
@Component
@RequiredArgsConstructor
public class AgentFactory {

    private final AgentTeamProperties properties;
    private final CompletionClient completionClient;
    private final JsonProcessingService jsonService;
    private final PromptRenderingService promptRenderingService;
    private final OrchestrationMetricsService metricsService;
    private final ApprovalPolicyService approvalPolicyService;
    private final ConversationHistoryStore historyStore;

    public AgentTeam createTeam() {
        AgentRuntime runtime = runtime();
        Map<Specialization, String> developerNames = new EnumMap<>(Specialization.class);
        for (Specialization specialization : Specialization.values()) {
            developerNames.put(specialization, properties.getAgentProfile(specialization.role()).getName());
        }
        Coordinator coordinator = new Coordinator(properties.getAgentProfile(AgentRole.COORDINATOR), runtime,
                approvalPolicyService.activePolicy(), developerNames);
        FrontendWorker frontend = new FrontendWorker(properties.getAgentProfile(AgentRole.FRONTEND), runtime);
        BackendWorker backend = new BackendWorker(properties.getAgentProfile(AgentRole.BACKEND), runtime);
        return new AgentTeam(coordinator, frontend, backend);
    }

    private AgentRuntime runtime() {
        AgentTeamProperties.HistoryConfig history = properties.getHistory();
        ConversationHistoryStore store = history.isSaveHistory() ? historyStore : ConversationHistoryStore.NONE;
        return new AgentRuntime(completionClient,
                GenerationOptions.from(properties.getCompletion()),
                jsonService,
                promptRenderingService,
                metricsService,
                store,
                history.getMaxMessages());
    }
}
