package com.grorchestrator.orchestration.adapter.api;

import com.grorchestrator.orchestration.exception.EngineOperationException;
import com.grorchestrator.orchestration.exception.TransientEngineException;
import com.grorchestrator.orchestration.model.Credential;
import com.grorchestrator.orchestration.model.ObservedClusterStatus;
import com.grorchestrator.orchestration.model.SystemAccount;
import com.grorchestrator.orchestration.model.clusterset.ClusterSetStatus;
import com.grorchestrator.orchestration.model.clusterset.ReplicationHandle;

import java.util.Map;

/**
 * Administrative interface of the database engine and its cluster management tooling.
 * <p>
 * Every call is synchronous and may fail. Failures which are expected to pass on retry (lost connection, timeout, no quorum)
 * are reported as {@link TransientEngineException}, all other failures as {@link EngineOperationException}.
 * <p>
 * Membership calls are idempotent: adding a member which is already in the cluster or removing a member which is not there
 * is not an error. Calls which take an address are executed through the instance with that address.
 */
public interface ClusterControlAdapter {

    /**
     * Reads cluster topology through the provided instance.
     *
     * @param viaAddress address of any instance which is supposed to be a cluster member
     * @return observed topology or {@link ObservedClusterStatus#noCluster()} if instance is not part of any cluster
     */
    ObservedClusterStatus getClusterStatus(String viaAddress);

    /**
     * Creates system accounts locally (without writing them to binary log) and prepares instance for group replication.
     */
    void configureInstance(String address, Map<SystemAccount, Credential> systemCredentials);

    /**
     * Persists engine variables on the provided instance.
     */
    void applyInstanceSettings(String address, Map<String, String> settings);

    /**
     * Creates cluster with a single seed instance which becomes primary.
     */
    void createCluster(String clusterName, String seedNodeId, String seedAddress);

    void addInstance(String primaryAddress, String nodeId, String address);

    /**
     * @param force remove instance even if it is not reachable
     */
    void removeInstance(String primaryAddress, String nodeId, String address, boolean force);

    void rejoinInstance(String primaryAddress, String nodeId, String address);

    /**
     * Makes provided instance the primary of the cluster. Current primary becomes secondary.
     */
    void setPrimary(String viaAddress, String nodeId, String address);

    /**
     * Dissolves cluster. All members become standalone instances. No-op if there is no cluster.
     */
    void dissolveCluster(String viaAddress);

    /**
     * Restarts group replication of a cluster whose members are all stopped, keeping its metadata. Provided instance
     * becomes the primary, other members have to rejoin.
     */
    void rebootClusterFromCompleteOutage(String address, String clusterName);

    /**
     * @return set of executed transaction identifiers (GTID set) of the instance
     */
    String getExecutedTransactionSet(String address);

    /**
     * Same as {@link #getExecutedTransactionSet(String)} but for an instance of another cluster, connecting with provided
     * credentials.
     */
    String getExecutedTransactionSet(String address, String username, String password);

    void createClusterSet(String primaryAddress, String clusterSetName, String domainId);

    /**
     * @return cluster set status or null if cluster is not part of a cluster set
     */
    ClusterSetStatus getClusterSetStatus(String viaAddress);

    /**
     * Attaches local cluster to the cluster set of the primary cluster described by handle. Local instance is cloned from
     * the primary cluster.
     */
    void createReplicaCluster(ReplicationHandle handle, String replicaClusterName, String localAddress);

    /**
     * Switches cluster set primary. All clusters must be reachable.
     */
    void setPrimaryCluster(String viaAddress, String clusterName);

    /**
     * Fails over cluster set primary to provided cluster without contacting the current primary cluster.
     */
    void forcePrimaryCluster(String viaAddress, String clusterName);

    void rejoinClusterToSet(String viaAddress, String clusterName);

    void upsertSystemAccount(String primaryAddress, SystemAccount account, String password);

    void upsertRelationAccount(String primaryAddress, String username, String password, String database);

    void dropAccount(String primaryAddress, String username);

    /**
     * Hides instance from client routing. Used while instance is being backed up.
     */
    void setInstanceHidden(String primaryAddress, String address, boolean hidden);

    void setOfflineMode(String address, boolean offline);

    /**
     * Makes instance re-read certificate and key files.
     */
    void reloadTls(String address);
}
