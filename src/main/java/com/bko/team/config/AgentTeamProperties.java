package com.bko.team.config;

import com.bko.team.agent.AgentRole;
import com.bko.team.orchestration.review.ApprovalStrategy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "agentteam")
public class AgentTeamProperties {

    private CompletionConfig completion = new CompletionConfig();
    private Map<String, AgentProfile> agents = new HashMap<>();
    private HistoryConfig history = new HistoryConfig();
    private PipelineConfig pipeline = new PipelineConfig();
    private ReviewConfig review = new ReviewConfig();
    private BusConfig bus = new BusConfig();

    public static class CompletionConfig {
        private String baseUrl = "http://localhost:11434";
        private String defaultModel = "deepseek-r1:1.5b";
        private String defaultSystemPrompt = "You are a professional assistant specialised in software development.";
        private double temperature = 0.7;
        private double topP = 0.9;
        private int maxTokens = 2000;
        private int maxRetries = 3;
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(60);
        private Duration pullTimeout = Duration.ofHours(1);
        private int maxConcurrentRequests = 2;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
        public String getDefaultSystemPrompt() { return defaultSystemPrompt; }
        public void setDefaultSystemPrompt(String defaultSystemPrompt) { this.defaultSystemPrompt = defaultSystemPrompt; }
        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }
        public double getTopP() { return topP; }
        public void setTopP(double topP) { this.topP = topP; }
        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = Math.max(1, maxRetries); }
        public Duration getBackoffBase() { return backoffBase; }
        public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
        public Duration getPullTimeout() { return pullTimeout; }
        public void setPullTimeout(Duration pullTimeout) { this.pullTimeout = pullTimeout; }
        public int getMaxConcurrentRequests() { return maxConcurrentRequests; }
        public void setMaxConcurrentRequests(int maxConcurrentRequests) { this.maxConcurrentRequests = Math.max(1, maxConcurrentRequests); }
    }

    public static class HistoryConfig {
        private int maxMessages = 50;
        private boolean saveHistory = true;
        private String historyDir = "conversation_history";

        public int getMaxMessages() { return maxMessages; }
        public void setMaxMessages(int maxMessages) { this.maxMessages = Math.max(1, maxMessages); }
        public boolean isSaveHistory() { return saveHistory; }
        public void setSaveHistory(boolean saveHistory) { this.saveHistory = saveHistory; }
        public String getHistoryDir() { return historyDir; }
        public void setHistoryDir(String historyDir) { this.historyDir = historyDir; }
    }

    public static class PipelineConfig {
        private Duration taskTimeout = Duration.ofSeconds(300);
        private int workerConcurrency = 4;
        private int retainedRuns = 50;

        public Duration getTaskTimeout() { return taskTimeout; }
        public void setTaskTimeout(Duration taskTimeout) { this.taskTimeout = taskTimeout; }
        public int getWorkerConcurrency() { return workerConcurrency; }
        public void setWorkerConcurrency(int workerConcurrency) { this.workerConcurrency = Math.max(1, workerConcurrency); }
        public int getRetainedRuns() { return retainedRuns; }
        public void setRetainedRuns(int retainedRuns) { this.retainedRuns = Math.max(1, retainedRuns); }
    }

    public static class ReviewConfig {
        private ApprovalStrategy approvalStrategy = ApprovalStrategy.ALWAYS_APPROVE;
        private List<String> rejectionKeywords = new ArrayList<>(
                List.of("REJECTED", "NOT APPROVED", "NEEDS REWORK"));

        public ApprovalStrategy getApprovalStrategy() { return approvalStrategy; }
        public void setApprovalStrategy(ApprovalStrategy approvalStrategy) {
            if (approvalStrategy == null) {
                return;
            }
            this.approvalStrategy = approvalStrategy;
        }
        public List<String> getRejectionKeywords() { return rejectionKeywords; }
        public void setRejectionKeywords(List<String> rejectionKeywords) {
            if (rejectionKeywords == null) {
                return;
            }
            this.rejectionKeywords = new ArrayList<>(rejectionKeywords);
        }
    }

    public static class BusConfig {
        private int maxMessages = 1000;

        public int getMaxMessages() { return maxMessages; }
        public void setMaxMessages(int maxMessages) { this.maxMessages = Math.max(1, maxMessages); }
    }

    public CompletionConfig getCompletion() {
        return completion;
    }

    public void setCompletion(CompletionConfig completion) {
        this.completion = completion != null ? completion : new CompletionConfig();
    }

    public Map<String, AgentProfile> getAgents() {
        return agents;
    }

    public void setAgents(Map<String, AgentProfile> agents) {
        if (agents == null) {
            return;
        }
        this.agents = new HashMap<>(agents);
    }

    public HistoryConfig getHistory() {
        return history;
    }

    public void setHistory(HistoryConfig history) {
        this.history = history != null ? history : new HistoryConfig();
    }

    public PipelineConfig getPipeline() {
        return pipeline;
    }

    public void setPipeline(PipelineConfig pipeline) {
        this.pipeline = pipeline != null ? pipeline : new PipelineConfig();
    }

    public ReviewConfig getReview() {
        return review;
    }

    public void setReview(ReviewConfig review) {
        this.review = review != null ? review : new ReviewConfig();
    }

    public BusConfig getBus() {
        return bus;
    }

    public void setBus(BusConfig bus) {
        this.bus = bus != null ? bus : new BusConfig();
    }

    /**
     * Resolves the profile configured for a role, falling back to the role's display name,
     * the default model and the default system prompt for anything left unset.
     */
    public AgentProfile getAgentProfile(AgentRole role) {
        AgentProfile override = agents.get(role.key().toLowerCase(Locale.ROOT));
        String name = override != null && StringUtils.hasText(override.getName())
                ? override.getName()
                : role.displayName();
        String model = override != null && StringUtils.hasText(override.getModel())
                ? override.getModel()
                : completion.getDefaultModel();
        String systemPrompt = override != null && StringUtils.hasText(override.getSystemPrompt())
                ? override.getSystemPrompt()
                : completion.getDefaultSystemPrompt();
        return new AgentProfile(name, model, systemPrompt);
    }
}
