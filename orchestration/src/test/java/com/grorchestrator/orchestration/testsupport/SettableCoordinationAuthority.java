package com.grorchestrator.orchestration.testsupport;

import com.grorchestrator.orchestration.service.api.CoordinationAuthority;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Coordination authority of one simulated node. All nodes of a simulation share the same holder.
 */
public class SettableCoordinationAuthority implements CoordinationAuthority {
    private final String nodeId;
    private final AtomicReference<String> coordinatorHolder;

    public SettableCoordinationAuthority(String nodeId, AtomicReference<String> coordinatorHolder) {
        this.nodeId = nodeId;
        this.coordinatorHolder = coordinatorHolder;
    }

    @Override
    public boolean isCoordinator() {
        return nodeId.equals(coordinatorHolder.get());
    }

    @Override
    public Optional<String> getCoordinatorNodeId() {
        return Optional.ofNullable(coordinatorHolder.get());
    }
}
