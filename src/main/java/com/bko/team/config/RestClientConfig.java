package com.bko.team.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

@Configuration
@Slf4j
public class RestClientConfig {

    private static final int MAX_LOGGED_BODY = 2000;

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
    }

    /**
     * Request factory with the given timeouts, backed by the JDK {@link HttpClient} so that
     * interrupting the calling thread aborts a request in flight. Buffered so the logging
     * interceptor can read the response body without consuming it.
     */
    public static ClientHttpRequestFactory timedRequestFactory(Duration connectTimeout, Duration readTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(readTimeout);
        return new BufferingClientHttpRequestFactory(factory);
    }

    private static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger("com.bko.team.http.logging");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            logRequest(request, body);
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(response);
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            if (!httpLogger.isDebugEnabled()) {
                return;
            }
            httpLogger.debug("--> {} {}", request.getMethod(), request.getURI());
            if (body.length > 0) {
                httpLogger.debug("Body: {}", truncate(new String(body, StandardCharsets.UTF_8)));
            }
        }

        private void logResponse(ClientHttpResponse response) throws IOException {
            if (!httpLogger.isDebugEnabled()) {
                return;
            }
            try {
                httpLogger.debug("<-- Status: {}", response.getStatusCode());
            } catch (IOException e) {
                httpLogger.debug("<-- Status: Unknown");
            }
            byte[] body = StreamUtils.copyToByteArray(response.getBody());
            if (body.length > 0) {
                httpLogger.debug("Body: {}", truncate(new String(body, StandardCharsets.UTF_8)));
            }
        }

        private static String truncate(String value) {
            return value.length() <= MAX_LOGGED_BODY ? value : value.substring(0, MAX_LOGGED_BODY) + "...";
        }
    }
}
