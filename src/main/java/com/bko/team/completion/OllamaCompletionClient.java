package com.bko.team.completion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * {@link CompletionClient} for an Ollama-compatible HTTP API.
 * <p>
 * Every request is attempted up to {@code maxRetries} times. Connection failures, I/O
 * timeouts and non-2xx statuses count as transport failures and are retried after
 * {@code backoffBase * 2^attempt}. Response bodies are read as text and parsed outside
 * the retry loop, so a malformed body is never retried. A request that fails while the calling
 * thread is interrupted is cancelled instead of retried.
 */
@Slf4j
public class OllamaCompletionClient implements CompletionClient {

    static final String GENERATE_PATH = "/api/generate";
    static final String CHAT_PATH = "/api/chat";
    static final String TAGS_PATH = "/api/tags";
    static final String PULL_PATH = "/api/pull";

    private final RestClient restClient;
    private final RestClient pullClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final int maxRetries;
    private final Duration backoffBase;
    private final BackoffSleeper sleeper;

    public OllamaCompletionClient(RestClient restClient,
                                  RestClient pullClient,
                                  ObjectMapper objectMapper,
                                  String baseUrl,
                                  int maxRetries,
                                  Duration backoffBase,
                                  BackoffSleeper sleeper) {
        this.restClient = restClient;
        this.pullClient = pullClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.maxRetries = Math.max(1, maxRetries);
        this.backoffBase = backoffBase != null ? backoffBase : Duration.ofSeconds(1);
        this.sleeper = sleeper != null ? sleeper : BackoffSleeper.THREAD_SLEEP;
    }

    @Override
    public String generate(String prompt, String model, @Nullable String systemInstructions, GenerationOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("stream", false);
        if (StringUtils.hasText(systemInstructions)) {
            body.put("system", systemInstructions);
        }
        options.applyTo(body);
        log.debug("Sending prompt to model {}: {}", model, abbreviate(prompt));
        String raw = execute(HttpMethod.POST, GENERATE_PATH, body, restClient);
        String text = readText(raw, "/response", GENERATE_PATH);
        log.debug("Response received: {}", abbreviate(text));
        return text;
    }

    @Override
    public String chat(List<ChatMessage> messages, String model, @Nullable String systemInstructions, GenerationOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("stream", false);
        if (StringUtils.hasText(systemInstructions)) {
            body.put("system", systemInstructions);
        }
        options.applyTo(body);
        log.debug("Sending {} messages to model {}", messages.size(), model);
        String raw = execute(HttpMethod.POST, CHAT_PATH, body, restClient);
        String text = readText(raw, "/message/content", CHAT_PATH);
        log.debug("Response received: {}", abbreviate(text));
        return text;
    }

    @Override
    public List<ModelDescriptor> listModels() {
        String raw = execute(HttpMethod.GET, TAGS_PATH, null, restClient);
        if (!StringUtils.hasText(raw)) {
            return List.of();
        }
        try {
            ModelList list = objectMapper.readValue(raw, ModelList.class);
            return list.models() != null ? list.models() : List.of();
        } catch (JsonProcessingException ex) {
            log.warn("Malformed model list from {}: {}", TAGS_PATH, ex.getOriginalMessage());
            return List.of();
        }
    }

    @Override
    public boolean pullModel(String name) {
        try {
            boolean present = listModels().stream().anyMatch(model -> name.equals(model.name()));
            if (present) {
                log.info("Model {} is already available locally", name);
                return true;
            }
            log.info("Pulling model {}...", name);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("name", name);
            body.put("stream", false);
            String raw = execute(HttpMethod.POST, PULL_PATH, body, pullClient);
            String status = readText(raw, "/status", PULL_PATH);
            if (StringUtils.hasText(status) && !"success".equalsIgnoreCase(status.trim())) {
                log.error("Pull of model {} ended with status {}", name, status);
                return false;
            }
            log.info("Model {} pulled successfully", name);
            return true;
        } catch (RuntimeException ex) {
            log.error("Failed to pull model {}: {}", name, ex.getMessage());
            return false;
        }
    }

    private String execute(HttpMethod method, String path, @Nullable Object body, RestClient client) {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                RestClient.RequestBodySpec spec = client.method(method).uri(path);
                if (body != null) {
                    spec = spec.contentType(MediaType.APPLICATION_JSON).body(body);
                }
                String response = spec.retrieve().body(String.class);
                return response != null ? response : "";
            } catch (ResourceAccessException | RestClientResponseException ex) {
                if (Thread.currentThread().isInterrupted()) {
                    CancellationException cancelled = new CancellationException("Request to " + path + " interrupted");
                    cancelled.initCause(ex);
                    throw cancelled;
                }
                lastFailure = ex;
                if (attempt == maxRetries) {
                    break;
                }
                Duration wait = backoffBase.multipliedBy(1L << attempt);
                log.warn("Request to {}{} failed (attempt {}/{}): {}. Retrying in {} ms...",
                        baseUrl, path, attempt, maxRetries, ex.getMessage(), wait.toMillis());
                pause(wait, path);
            }
        }
        log.error("Request to {}{} failed after {} attempts", baseUrl, path, maxRetries);
        throw new CompletionConnectionException(
                "Unable to reach the completion service at " + baseUrl + path + " after " + maxRetries + " attempts",
                lastFailure);
    }

    private void pause(Duration wait, String path) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while waiting to retry " + path);
            cancelled.initCause(ex);
            throw cancelled;
        }
    }

    private String readText(@Nullable String raw, String pointer, String path) {
        if (!StringUtils.hasText(raw)) {
            log.warn("Empty response body from {}", path);
            return "";
        }
        try {
            JsonNode node = objectMapper.readTree(raw).at(pointer);
            return node.isMissingNode() || node.isNull() ? "" : node.asText("");
        } catch (JsonProcessingException ex) {
            log.warn("Malformed response body from {}: {}", path, ex.getOriginalMessage());
            return "";
        }
    }

    private static String abbreviate(@Nullable String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= 100 ? value : value.substring(0, 100) + "...";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ModelList(List<ModelDescriptor> models) {
    }
}
