package com.tessera.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link TextGenerationClient} backed by Spring AI's {@link ChatClient}.
 * <p>
 * Each call runs on a dedicated worker thread so the caller can bound it with a
 * timeout; the calling thread blocks until the reply arrives or the timeout elapses.
 * A timed-out call interrupts its worker. The caller's MDC is copied onto the worker
 * so request-scoped log fields stay attached.
 */
@Service
public class SpringAiTextGenerationClient implements TextGenerationClient, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SpringAiTextGenerationClient.class);

    private final ChatClient chatClient;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "tessera-generation");
        t.setDaemon(true);
        return t;
    });

    public SpringAiTextGenerationClient(ChatClient.Builder builder,
                                        @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        log.info("Text generation client initialized, OpenAI base-url: {}", baseUrl);
    }

    @Override
    public String generate(String prompt, int maxTokens, Duration timeout) {
        log.info("Generation started ({} prompt chars, maxTokens={}, timeout={}s)",
                prompt.length(), maxTokens, timeout.toSeconds());
        long start = System.currentTimeMillis();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<String> call = executor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return chatClient.prompt()
                        .options(ChatOptions.builder().maxTokens(maxTokens).build())
                        .user(prompt)
                        .call()
                        .content();
            } finally {
                MDC.clear();
            }
        });
        String response;
        try {
            response = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new GenerationFailureException(GenerationFailureException.Kind.TIMEOUT,
                    "Generation timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new GenerationFailureException(GenerationFailureException.Kind.INTERRUPTED,
                    "Interrupted while waiting for generation", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new GenerationFailureException(GenerationFailureException.Kind.UPSTREAM,
                    "Generation failed: " + cause.getMessage(), cause);
        }
        long elapsed = System.currentTimeMillis() - start;
        log.info("Generation complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new GenerationFailureException(GenerationFailureException.Kind.EMPTY,
                    "Model returned empty content. Check that the model is running and reachable.");
        }
        log.debug("Raw generation: {}", response);
        return response;
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }
}
