package com.bko.team.completion;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Caps the number of in-flight completion calls so a wide sub-task fan-out cannot
 * overload the backend.
 */
@Slf4j
public class ThrottledCompletionClient implements CompletionClient {

    private final CompletionClient delegate;
    private final Semaphore permits;

    public ThrottledCompletionClient(CompletionClient delegate, int maxConcurrentRequests) {
        this.delegate = delegate;
        this.permits = new Semaphore(Math.max(1, maxConcurrentRequests), true);
    }

    @Override
    public String generate(String prompt, String model, @Nullable String systemInstructions, GenerationOptions options) {
        return withPermit(() -> delegate.generate(prompt, model, systemInstructions, options));
    }

    @Override
    public String chat(List<ChatMessage> messages, String model, @Nullable String systemInstructions, GenerationOptions options) {
        return withPermit(() -> delegate.chat(messages, model, systemInstructions, options));
    }

    @Override
    public List<ModelDescriptor> listModels() {
        return withPermit(delegate::listModels);
    }

    @Override
    public boolean pullModel(String name) {
        return withPermit(() -> delegate.pullModel(name));
    }

    int availablePermits() {
        return permits.availablePermits();
    }

    private <T> T withPermit(Supplier<T> call) {
        try {
            permits.acquire();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while waiting for a completion slot");
            cancelled.initCause(ex);
            throw cancelled;
        }
        try {
            return call.get();
        } finally {
            permits.release();
        }
    }
}
