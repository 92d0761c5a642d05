package com.grorchestrator.orchestration.service.api;

import com.grorchestrator.orchestration.exception.ConflictingOperationException;
import com.grorchestrator.orchestration.exception.InvalidArgumentException;
import com.grorchestrator.orchestration.exception.NotFoundException;
import com.grorchestrator.orchestration.exception.PreconditionNotMetException;
import com.grorchestrator.orchestration.model.ClusterStatusReport;
import com.grorchestrator.orchestration.model.PreUpgradeCheckResult;
import com.grorchestrator.orchestration.model.clusterset.PromotionResult;

/**
 * Operator commands which act on the cluster as a whole.
 */
public interface ClusterOperationsService {

    /**
     * @param includeClusterSet also report status of the cluster set, if cluster is part of one
     */
    ClusterStatusReport getClusterStatus(boolean includeClusterSet);

    /**
     * Verifies that every registered member is online and moves the primary role to the member which will be upgraded last.
     */
    PreUpgradeCheckResult preUpgradeCheck() throws PreconditionNotMetException;

    /**
     * @param scope 'unit' to make this node primary of its cluster, 'cluster' to make this cluster primary of the cluster set
     * @param force fail over cluster set primary even if it is unreachable. Ignored for 'unit' scope.
     */
    PromotionResult promote(String scope, boolean force) throws InvalidArgumentException, PreconditionNotMetException;

    /**
     * Dissolves local cluster and marks it for re-creation under a fresh name. Reconciliation rebuilds it.
     *
     * @return new cluster name
     */
    String recreateCluster() throws PreconditionNotMetException, ConflictingOperationException;

    void rejoinCluster(String clusterName) throws InvalidArgumentException, NotFoundException;
}
