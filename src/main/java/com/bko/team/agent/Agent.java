package com.bko.team.agent;

import com.bko.team.completion.ChatMessage;
import com.bko.team.config.AgentProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.bko.team.orchestration.OrchestrationConstants.CONTEXT_SEPARATOR;

/**
 * An agent: a named identity bound to one model and one set of system instructions, with a
 * bounded conversation history. Every call carries a JSON context envelope describing the agent.
 */
@Slf4j
public class Agent {

    private final String id;
    private final AgentRole role;
    private final AgentProfile profile;
    protected final AgentRuntime runtime;
    private final ConversationHistory history;

    public Agent(AgentRole role, AgentProfile profile, AgentRuntime runtime) {
        this.id = UUID.randomUUID().toString().substring(0, 8);
        this.role = role;
        this.profile = profile;
        this.runtime = runtime;
        this.history = new ConversationHistory(runtime.maxHistoryMessages());
        log.info("Agent {} ({}) initialized with id {} on model {}", profile.getName(), role.key(), id, profile.getModel());
    }

    public String getId() {
        return id;
    }

    public AgentRole getRole() {
        return role;
    }

    public String getName() {
        return profile.getName();
    }

    public String getModel() {
        return profile.getModel();
    }

    public List<ConversationEntry> getHistory() {
        return history.snapshot();
    }

    /**
     * Sends one message, followed by the serialized context envelope, to the completion service.
     */
    public String process(String message, @Nullable Map<String, Object> context) {
        String prompt = message + CONTEXT_SEPARATOR + runtime.jsonService().toJson(envelope(context));
        long start = System.nanoTime();
        runtime.metrics().recordCompletionRequest(getName(), role.key());
        String response = runtime.completionClient()
                .generate(prompt, profile.getModel(), profile.getSystemPrompt(), runtime.options());
        record(message, response, context);
        log.info("Agent {} processed a message in {} ms", getName(), elapsedMillis(start));
        return response;
    }

    /**
     * Sends a conversation. The context envelope is attached to the first user message of a copy
     * of {@code messages}; the caller's list is left untouched.
     */
    public String chat(List<ChatMessage> messages, @Nullable Map<String, Object> context) {
        List<ChatMessage> conversation = new ArrayList<>(messages);
        String serialized = runtime.jsonService().toJson(envelope(context));
        for (int i = 0; i < conversation.size(); i++) {
            ChatMessage candidate = conversation.get(i);
            if (candidate.isUser()) {
                conversation.set(i, candidate.withContent(candidate.content() + CONTEXT_SEPARATOR + serialized));
                break;
            }
        }
        long start = System.nanoTime();
        runtime.metrics().recordCompletionRequest(getName(), role.key());
        String response = runtime.completionClient()
                .chat(conversation, profile.getModel(), profile.getSystemPrompt(), runtime.options());
        String lastMessage = conversation.isEmpty() ? "" : conversation.get(conversation.size() - 1).content();
        record(lastMessage, response, context);
        log.info("Agent {} processed a conversation in {} ms", getName(), elapsedMillis(start));
        return response;
    }

    protected String render(String template, Map<String, ?> variables) {
        return runtime.prompts().render(template, variables);
    }

    private Map<String, Object> envelope(@Nullable Map<String, Object> context) {
        Map<String, Object> agent = new LinkedHashMap<>();
        agent.put("name", getName());
        agent.put("role", role.key());
        agent.put("id", id);
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("agent", agent);
        envelope.put("timestamp", Instant.now().toString());
        if (context != null) {
            envelope.putAll(context);
        }
        return envelope;
    }

    private void record(String message, String response, @Nullable Map<String, Object> context) {
        Map<String, Object> contextCopy = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : null;
        history.append(new ConversationEntry(Instant.now(), message, response, contextCopy),
                snapshot -> runtime.historyStore().save(role, id, snapshot));
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    protected static String abbreviate(@Nullable String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength) + "...";
    }
}
