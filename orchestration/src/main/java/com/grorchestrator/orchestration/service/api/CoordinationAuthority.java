package com.grorchestrator.orchestration.service.api;

import java.util.Optional;

/**
 * Tells whether this node may issue cluster-mutating operations. Exactly one coordinator is expected eventually, but short
 * windows with zero or two believed coordinators are possible, so all mutating operations must be idempotent.
 */
public interface CoordinationAuthority {

    boolean isCoordinator();

    /**
     * @return id of the node currently believed to be coordinator, if known
     */
    Optional<String> getCoordinatorNodeId();
}
