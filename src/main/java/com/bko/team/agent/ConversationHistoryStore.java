package com.bko.team.agent;

import java.util.List;

/**
 * Persists an agent's trimmed history. Implementations must not throw. Called with the history
 * lock held, in append order; slow work belongs on another thread.
 */
@FunctionalInterface
public interface ConversationHistoryStore {

    ConversationHistoryStore NONE = (role, agentId, snapshot) -> {
    };

    void save(AgentRole role, String agentId, List<ConversationEntry> snapshot);
}
