package com.odedia.contracts.services;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Resilient wrapper for LLM calls with retry logic and timeouts.
 *
 * Features:
 * - Fixed number of retries after the first attempt
 * - Fixed delay between attempts
 * - Per-attempt timeout
 *
 * A call that produces an unusable response should throw from inside the
 * supplier so the response counts as a failed attempt.
 */
@Service
public class ResilientLlmService {

    private static final Logger logger = LoggerFactory.getLogger(ResilientLlmService.class);

    private final int maxRetries;
    private final long retryDelayMs;
    private final int timeoutSeconds;

    public ResilientLlmService(
            @Value("${app.ai.fallback.maxRetries:2}") int maxRetries,
            @Value("${app.ai.fallback.retryDelayMs:600}") long retryDelayMs,
            @Value("${app.ai.fallback.timeoutSeconds:60}") int timeoutSeconds) {
        if (maxRetries < 0 || retryDelayMs < 0 || timeoutSeconds < 1) {
            throw new IllegalArgumentException("Invalid resilience settings");
        }
        this.maxRetries = maxRetries;
        this.retryDelayMs = retryDelayMs;
        this.timeoutSeconds = timeoutSeconds;

        logger.info("Initialized ResilientLlmService: maxRetries={}, retryDelayMs={}, timeoutSeconds={}",
                maxRetries, retryDelayMs, timeoutSeconds);
    }

    /**
     * Execute an LLM call with retry logic, throwing exception on failure.
     *
     * @param operation Description of the operation (for logging)
     * @param llmCall   The LLM call to execute
     * @return The call's result
     * @throws LlmCallException if every attempt fails
     */
    public <T> T callWithRetryOrThrow(String operation, Supplier<T> llmCall) throws LlmCallException {
        int attempts = maxRetries + 1;
        Exception lastException = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                logger.debug("[{}] Attempt {}/{}", operation, attempt, attempts);
                T result = executeWithTimeout(llmCall);
                logger.debug("[{}] Success on attempt {}", operation, attempt);
                return result;

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LlmCallException("Interrupted during: " + operation, e);

            } catch (Exception e) {
                lastException = e;
                logger.warn("[{}] Attempt {}/{} failed: {}", operation, attempt, attempts, e.getMessage());

                if (attempt < attempts && !sleep(retryDelayMs)) {
                    throw new LlmCallException("Interrupted while waiting to retry: " + operation, e);
                }
            }
        }

        logger.error("[{}] All {} attempts failed. Last error: {}",
                operation, attempts, lastException != null ? lastException.getMessage() : "unknown");
        throw new LlmCallException("All " + attempts + " attempts failed for: " + operation, lastException);
    }

    /**
     * Execute a supplier with timeout.
     */
    private <T> T executeWithTimeout(Supplier<T> llmCall) throws Exception {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(llmCall);
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("No response within " + timeoutSeconds + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        }
    }

    /**
     * Sleep for the specified duration, handling interruption.
     *
     * @return false when the thread was interrupted
     */
    private boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Custom exception for LLM call failures.
     */
    public static class LlmCallException extends Exception {
        public LlmCallException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
