package com.grorchestrator.orchestration.util;

import com.grorchestrator.configuration.properties.predefined.OrchestrationProperties;
import com.grorchestrator.orchestration.exception.EngineOperationException;
import com.grorchestrator.orchestration.exception.TransientEngineException;
import com.grorchestrator.orchestration.testsupport.BeanWiring;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EngineCallExecutorTest {

    private EngineCallExecutor executor;

    @BeforeEach
    void setUp() {
        OrchestrationProperties orchestrationProperties = mock(OrchestrationProperties.class);
        OrchestrationProperties.EngineRetryProperties retry = mock(OrchestrationProperties.EngineRetryProperties.class);
        when(retry.attempts()).thenReturn(3);
        when(retry.initialBackoff()).thenReturn(Duration.ofMillis(1));
        when(retry.maxBackoff()).thenReturn(Duration.ofMillis(2));
        when(orchestrationProperties.engineRetry()).thenReturn(retry);
        executor = BeanWiring.wire(new EngineCallExecutor(), orchestrationProperties);
    }

    @Test
    void transientFailureIsRetried() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.executeWithRetry("status", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientEngineException("connection refused");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void givesUpAfterConfiguredAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.executeWithRetry("add instance", () -> {
            calls.incrementAndGet();
            throw new TransientEngineException("connection refused");
        }))
                .isInstanceOf(TransientEngineException.class)
                .hasMessageContaining("'add instance' failed after 3 attempts")
                .hasMessageContaining("connection refused");
        assertThat(calls).hasValue(3);
    }

    @Test
    void nonTransientFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.executeWithRetry("remove instance", () -> {
            calls.incrementAndGet();
            throw new EngineOperationException("instance is not a member");
        })).isInstanceOf(EngineOperationException.class);
        assertThat(calls).hasValue(1);
    }
}
