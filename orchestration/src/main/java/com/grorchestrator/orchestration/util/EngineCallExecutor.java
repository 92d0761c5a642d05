package com.grorchestrator.orchestration.util;

import com.grorchestrator.configuration.properties.predefined.OrchestrationProperties;
import com.grorchestrator.orchestration.exception.TransientEngineException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries engine calls which failed with {@link TransientEngineException} using exponential backoff.
 * All other exceptions are propagated immediately.
 */
@Slf4j
@ApplicationScoped
public class EngineCallExecutor {

    @Inject
    OrchestrationProperties orchestrationProperties;

    public <T> T executeWithRetry(String operationName, Supplier<T> call) throws TransientEngineException {
        OrchestrationProperties.EngineRetryProperties retryProperties = orchestrationProperties.engineRetry();
        int attempts = Math.max(1, retryProperties.attempts());
        Duration delay = retryProperties.initialBackoff();
        TransientEngineException lastException = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return call.get();
            } catch (TransientEngineException e) {
                lastException = e;
                if (attempt == attempts) {
                    break;
                }
                log.warn("Engine call '{}' failed (attempt {} of {}), retrying in {} ms. Cause: {}", operationName, attempt, attempts, delay.toMillis(), e.getMessage());
                sleep(delay);
                delay = min(delay.multipliedBy(2), retryProperties.maxBackoff());
            }
        }

        throw new TransientEngineException("Engine call '" + operationName + "' failed after " + attempts + " attempts. Cause: " + lastException.getMessage(), lastException);
    }

    public void executeWithRetry(String operationName, Runnable call) throws TransientEngineException {
        executeWithRetry(operationName, () -> {
            call.run();
            return null;
        });
    }

    private void sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientEngineException("Interrupted while waiting to retry engine call", e);
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
