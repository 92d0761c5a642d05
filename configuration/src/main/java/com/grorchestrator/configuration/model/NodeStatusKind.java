package com.grorchestrator.configuration.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Status of this node as seen by operators. Only {@link #ACTIVE}, {@link #WAITING} and {@link #MAINTENANCE} are considered healthy.
 */
@RequiredArgsConstructor
public enum NodeStatusKind {
    /**
     * Node is a converged member of the cluster.
     */
    ACTIVE("active", true),
    /**
     * Node is still converging. For example, waiting for credentials or for its turn to join.
     */
    WAITING("waiting", true),
    /**
     * Restore is running and membership changes are deferred.
     */
    MAINTENANCE("maintenance", true),
    /**
     * Engine calls keep failing after retries. Reconciliation continues on the next pass.
     */
    DEGRADED("degraded", false),
    /**
     * Topology can not be reconciled without operator intervention.
     */
    BLOCKED("blocked", false);

    @Getter
    private final String value;

    @Getter
    private final boolean healthy;
}
