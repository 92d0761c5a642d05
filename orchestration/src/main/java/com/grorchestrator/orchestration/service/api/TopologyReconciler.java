package com.grorchestrator.orchestration.service.api;

import com.grorchestrator.orchestration.model.LifecycleEvent;
import com.grorchestrator.orchestration.model.ReconciliationPassResult;

/**
 * Converges actual cluster topology to the target one. Every call is one pass: observe, diff, apply at most one mutating
 * operation. Passes never run concurrently on one node.
 */
public interface TopologyReconciler {

    /**
     * Handles event specific part (registration, relations, configuration) and runs one reconciliation pass.
     * Recoverable failures are reflected in node status and never thrown.
     *
     * @return result of the pass. Decision is null when this node is not coordinator.
     */
    ReconciliationPassResult reconcile(LifecycleEvent event);
}
