package com.bko.team.completion;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Request/response boundary to the text-completion service.
 * <p>
 * Transport failures are retried by implementations and surface as
 * {@link CompletionConnectionException} once retries are exhausted. Malformed
 * response bodies are never retried and degrade to empty content.
 */
public interface CompletionClient {

    /**
     * Single prompt-to-text call.
     *
     * @param prompt             the full prompt
     * @param model              the model name
     * @param systemInstructions optional system instructions
     * @param options            sampling options
     * @return the generated text, empty when the response could not be read
     */
    String generate(String prompt, String model, @Nullable String systemInstructions, GenerationOptions options);

    /**
     * Multi-turn call. System instructions travel as the reserved {@code system}
     * parameter rather than as a message.
     */
    String chat(List<ChatMessage> messages, String model, @Nullable String systemInstructions, GenerationOptions options);

    List<ModelDescriptor> listModels();

    /**
     * Ensures a model is available locally. Succeeds without pulling when the model
     * is already listed.
     *
     * @return {@code true} when the model is available afterwards
     */
    boolean pullModel(String name);
}
