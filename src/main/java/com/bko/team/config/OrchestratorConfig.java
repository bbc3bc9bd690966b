package com.bko.team.config;

import com.bko.team.completion.BackoffSleeper;
import com.bko.team.completion.CompletionClient;
import com.bko.team.completion.OllamaCompletionClient;
import com.bko.team.completion.ThrottledCompletionClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class OrchestratorConfig {

    @Bean
    public CompletionClient completionClient(RestClient.Builder restClientBuilder,
                                             ObjectMapper objectMapper,
                                             AgentTeamProperties properties) {
        AgentTeamProperties.CompletionConfig config = properties.getCompletion();
        RestClient restClient = restClientBuilder.clone()
                .baseUrl(config.getBaseUrl())
                .requestFactory(RestClientConfig.timedRequestFactory(config.getConnectTimeout(), config.getRequestTimeout()))
                .build();
        RestClient pullClient = restClientBuilder.clone()
                .baseUrl(config.getBaseUrl())
                .requestFactory(RestClientConfig.timedRequestFactory(config.getConnectTimeout(), config.getPullTimeout()))
                .build();
        OllamaCompletionClient ollama = new OllamaCompletionClient(restClient, pullClient, objectMapper,
                config.getBaseUrl(), config.getMaxRetries(), config.getBackoffBase(), BackoffSleeper.THREAD_SLEEP);
        return new ThrottledCompletionClient(ollama, config.getMaxConcurrentRequests());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService workerExecutor(AgentTeamProperties properties) {
        return Executors.newFixedThreadPool(properties.getPipeline().getWorkerConcurrency());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService historyExecutor() {
        return Executors.newSingleThreadExecutor();
    }
}
