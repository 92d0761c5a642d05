package com.grorchestrator.configuration.properties.predefined;

import io.smallrye.config.ConfigMapping;

import java.time.Duration;

@ConfigMapping(prefix = "gr-orchestrator.orchestration")
public interface OrchestrationProperties {

    Duration tickInterval();

    /**
     * How many follow-up passes may be enqueued in a row after a pass that applied an operation.
     */
    int maxFollowUpPasses();

    /**
     * Maintenance flag older than this is released by the coordinator, its owner is assumed to be gone.
     */
    Duration maintenanceTimeout();

    EngineRetryProperties engineRetry();

    CoordinationProperties coordination();

    interface EngineRetryProperties {
        int attempts();

        Duration initialBackoff();

        Duration maxBackoff();
    }

    interface CoordinationProperties {
        Duration leaseDuration();

        Duration renewInterval();
    }
}
