package com.grorchestrator.orchestration.service.api;

import com.grorchestrator.orchestration.exception.*;
import com.grorchestrator.orchestration.model.clusterset.ClusterSetStatus;
import com.grorchestrator.orchestration.model.clusterset.LinkResult;
import com.grorchestrator.orchestration.model.clusterset.PromotionResult;
import com.grorchestrator.orchestration.model.clusterset.ReplicationHandle;

/**
 * Links independently bootstrapped clusters into a cluster set with one primary cluster and asynchronous replica clusters.
 */
public interface ClusterSetReplicationManager {

    /**
     * Creates cluster set around the local cluster if needed and offers replication to cluster with provided name.
     * Coordinator of the primary cluster only.
     */
    ReplicationHandle offer(String replicaClusterName) throws InvalidArgumentException, PreconditionNotMetException;

    /**
     * Attaches local cluster as replica of the cluster set described by handle.
     *
     * @throws ConflictingOperationException if local cluster has transactions unknown to the primary cluster. Such cluster
     *                                       must be dissolved and re-created as a clone before linking.
     */
    LinkResult link(ReplicationHandle handle) throws InvalidArgumentException, PreconditionNotMetException, ConflictingOperationException;

    /**
     * Makes local cluster the primary of the cluster set.
     *
     * @param force fail over without contacting the current primary cluster. Operator must make sure the old primary
     *              cluster can not accept writes anymore.
     * @throws OperatorPreconditionException if the primary cluster is unreachable and force is not set
     */
    PromotionResult promoteCluster(boolean force) throws PreconditionNotMetException, OperatorPreconditionException;

    /**
     * Rejoins invalidated replica cluster to the cluster set.
     */
    void rejoinCluster(String clusterName) throws NotFoundException, PreconditionNotMetException;

    /**
     * @return cluster set status or null if local cluster is not part of a cluster set
     */
    ClusterSetStatus getStatus();
}
