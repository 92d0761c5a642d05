package com.grorchestrator.orchestration.service.impl;

import com.grorchestrator.configuration.properties.predefined.ClusterProperties;
import com.grorchestrator.orchestration.adapter.api.ClusterControlAdapter;
import com.grorchestrator.orchestration.exception.*;
import com.grorchestrator.orchestration.model.Credential;
import com.grorchestrator.orchestration.model.SystemAccount;
import com.grorchestrator.orchestration.model.clusterset.*;
import com.grorchestrator.orchestration.model.peerstate.MaintenanceFlag;
import com.grorchestrator.orchestration.service.api.ClusterSetReplicationManager;
import com.grorchestrator.orchestration.service.api.CredentialManager;
import com.grorchestrator.orchestration.util.*;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

@Slf4j
@ApplicationScoped
public class ClusterSetReplicationManagerImpl implements ClusterSetReplicationManager {
    private static final Pattern CLUSTER_NAME_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{0,62}$");

    @Inject
    PeerStateFunctionalityCombinator peerStateFunctionalityCombinator;

    @Inject
    ClusterControlAdapter clusterControlAdapter;

    @Inject
    ClusterTopologyResolver clusterTopologyResolver;

    @Inject
    EngineCallExecutor engineCallExecutor;

    @Inject
    CredentialManager credentialManager;

    @Inject
    ReconciliationPassLock reconciliationPassLock;

    @Inject
    ClusterProperties clusterProperties;

    Clock clock = Clock.systemUTC();

    @Override
    public ReplicationHandle offer(String replicaClusterName) {
        validateClusterName(replicaClusterName);
        peerStateFunctionalityCombinator.checkCoordinator("offer replication");

        String localClusterName = requireClusterName();
        if (localClusterName.equals(replicaClusterName)) {
            throw new InvalidArgumentException("Replica cluster must have a name different from the primary cluster " + localClusterName);
        }
        if (peerStateFunctionalityCombinator.getClusterSetRole().map(ClusterSetRole.REPLICA::equals).orElse(false)) {
            throw new PreconditionNotMetException("Cluster " + localClusterName + " is a replica, only the primary cluster can offer replication");
        }

        return reconciliationPassLock.runExclusive(() -> {
            String primaryAddress = clusterTopologyResolver.resolvePrimaryAddress();
            String domainId = peerStateFunctionalityCombinator.getDomainId().orElseGet(() -> {
                String generated = UUID.randomUUID().toString();
                peerStateFunctionalityCombinator.saveDomainId(generated);
                return generated;
            });
            String clusterSetName = peerStateFunctionalityCombinator.getClusterSetName()
                    .or(() -> clusterProperties.clusterSetName())
                    .orElseGet(CredentialUtils::generateClusterSetName);

            engineCallExecutor.executeWithRetry("create cluster set", () -> clusterControlAdapter.createClusterSet(primaryAddress, clusterSetName, domainId));
            peerStateFunctionalityCombinator.saveClusterSetMembership(clusterSetName, ClusterSetRole.PRIMARY, localClusterName);

            Credential admin = credentialManager.get(SystemAccount.CLUSTER_ADMIN.getUsername());
            ReplicationHandle handle = ReplicationHandle.builder()
                    .clusterSetName(clusterSetName)
                    .domainId(domainId)
                    .primaryClusterName(localClusterName)
                    .primaryEndpoint(primaryAddress)
                    .replicaClusterName(replicaClusterName)
                    .adminUser(SystemAccount.CLUSTER_ADMIN.getUsername())
                    .adminPassword(admin.getEngineValue())
                    .offeredAt(clock.instant())
                    .build();
            peerStateFunctionalityCombinator.saveReplicationOffer(handle);

            log.info("Offered replication in cluster set {} to cluster {}", clusterSetName, replicaClusterName);
            return handle;
        });
    }

    @Override
    public LinkResult link(ReplicationHandle handle) {
        validateHandle(handle);
        peerStateFunctionalityCombinator.checkCoordinator("link cluster set");

        String localClusterName = requireClusterName();
        if (!localClusterName.equals(handle.getReplicaClusterName())) {
            throw new InvalidArgumentException("Replication was offered to cluster " + handle.getReplicaClusterName() + ", but this cluster is " + localClusterName);
        }

        Optional<String> currentSet = peerStateFunctionalityCombinator.getClusterSetName();
        if (currentSet.isPresent()) {
            if (currentSet.get().equals(handle.getClusterSetName())) {
                return LinkResult.builder()
                        .clusterSetName(handle.getClusterSetName())
                        .domainId(handle.getDomainId())
                        .replicaClusterName(localClusterName)
                        .primaryClusterName(handle.getPrimaryClusterName())
                        .alreadyLinked(true)
                        .build();
            }
            throw new ConflictingOperationException("Cluster " + localClusterName + " already belongs to cluster set " + currentSet.get() + ". Recreate the cluster first");
        }

        return reconciliationPassLock.runExclusive(() -> {
            String localPrimaryAddress = clusterTopologyResolver.resolvePrimaryAddress();

            String primaryGtidSet = engineCallExecutor.executeWithRetry(
                    "read GTID set of primary cluster",
                    () -> clusterControlAdapter.getExecutedTransactionSet(handle.getPrimaryEndpoint(), handle.getAdminUser(), handle.getAdminPassword())
            );
            String localGtidSet = engineCallExecutor.executeWithRetry(
                    "read local GTID set",
                    () -> clusterControlAdapter.getExecutedTransactionSet(localPrimaryAddress)
            );

            if (!GtidSetUtils.isSubset(localGtidSet, primaryGtidSet)) {
                throw new ConflictingOperationException(
                        "Cluster " + localClusterName + " has transactions which primary cluster " + handle.getPrimaryClusterName()
                                + " does not have. Dissolve this cluster and recreate it as a clone of the primary cluster before linking"
                );
            }

            if (!peerStateFunctionalityCombinator.acquireMaintenanceFlag("link to cluster set " + handle.getClusterSetName())) {
                throw new ConflictingOperationException("Another maintenance operation is in progress: "
                        + peerStateFunctionalityCombinator.getMaintenanceFlag().map(MaintenanceFlag::getReason).orElse("unknown"));
            }
            try {
                // an instance which belongs to a cluster can not seed a replica cluster
                engineCallExecutor.executeWithRetry("dissolve local cluster", () -> clusterControlAdapter.dissolveCluster(localPrimaryAddress));
                log.info("Cluster {} dissolved, it is re-created as replica from {}", localClusterName, localPrimaryAddress);

                engineCallExecutor.executeWithRetry(
                        "create replica cluster",
                        () -> clusterControlAdapter.createReplicaCluster(handle, localClusterName, localPrimaryAddress)
                );

                peerStateFunctionalityCombinator.saveDomainId(handle.getDomainId());
                peerStateFunctionalityCombinator.saveClusterSetMembership(handle.getClusterSetName(), ClusterSetRole.REPLICA, handle.getPrimaryClusterName());
            } finally {
                peerStateFunctionalityCombinator.releaseMaintenanceFlag();
            }
            log.info("Cluster {} linked as replica of {} in cluster set {}", localClusterName, handle.getPrimaryClusterName(), handle.getClusterSetName());

            return LinkResult.builder()
                    .clusterSetName(handle.getClusterSetName())
                    .domainId(handle.getDomainId())
                    .replicaClusterName(localClusterName)
                    .primaryClusterName(handle.getPrimaryClusterName())
                    .alreadyLinked(false)
                    .build();
        });
    }

    @Override
    public PromotionResult promoteCluster(boolean force) {
        peerStateFunctionalityCombinator.checkCoordinator("promote cluster");
        String localClusterName = requireClusterName();

        return reconciliationPassLock.runExclusive(() -> {
            String viaAddress = clusterTopologyResolver.resolvePrimaryAddress();
            ClusterSetStatus status = requireClusterSetStatus(viaAddress);

            if (localClusterName.equals(status.getPrimaryClusterName())) {
                return PromotionResult.builder()
                        .scope(PromotionScope.CLUSTER)
                        .promotedClusterName(localClusterName)
                        .alreadyPrimary(true)
                        .message("Cluster " + localClusterName + " is already the primary cluster")
                        .build();
            }

            boolean primaryReachable = status.findCluster(status.getPrimaryClusterName())
                    .map(ClusterSetMemberStatus::isReachable)
                    .orElse(false);

            PromotionResult result;
            if (primaryReachable) {
                engineCallExecutor.executeWithRetry("set primary cluster", () -> clusterControlAdapter.setPrimaryCluster(viaAddress, localClusterName));
                log.info("Cluster {} is now the primary cluster of {}", localClusterName, status.getClusterSetName());
                result = PromotionResult.builder()
                        .scope(PromotionScope.CLUSTER)
                        .promotedClusterName(localClusterName)
                        .message("Switched primary cluster from " + status.getPrimaryClusterName() + " to " + localClusterName)
                        .build();
            } else {
                if (!force) {
                    throw new OperatorPreconditionException(
                            "Primary cluster " + status.getPrimaryClusterName() + " is unreachable. Use force to fail over, after making sure it can not accept writes anymore"
                    );
                }
                engineCallExecutor.executeWithRetry("force primary cluster", () -> clusterControlAdapter.forcePrimaryCluster(viaAddress, localClusterName));
                log.error(
                        "Forced failover: cluster {} is now primary of cluster set {}. Former primary {} MUST be verified manually to not accept writes",
                        localClusterName,
                        status.getClusterSetName(),
                        status.getPrimaryClusterName()
                );
                result = PromotionResult.builder()
                        .scope(PromotionScope.CLUSTER)
                        .promotedClusterName(localClusterName)
                        .forced(true)
                        .requiresManualVerification(true)
                        .message("Forced failover from unreachable cluster " + status.getPrimaryClusterName()
                                + ". Verify manually that it can not accept writes and rejoin or remove it")
                        .build();
            }

            peerStateFunctionalityCombinator.saveClusterSetMembership(status.getClusterSetName(), ClusterSetRole.PRIMARY, localClusterName);
            return result;
        });
    }

    @Override
    public void rejoinCluster(String clusterName) {
        if (StringUtils.isBlank(clusterName)) {
            throw new InvalidArgumentException("Cluster name is required");
        }
        peerStateFunctionalityCombinator.checkCoordinator("rejoin cluster");

        reconciliationPassLock.runExclusive(() -> {
            String viaAddress = clusterTopologyResolver.resolvePrimaryAddress();
            ClusterSetStatus status = requireClusterSetStatus(viaAddress);

            if (status.findCluster(clusterName).isEmpty()) {
                throw new NotFoundException("Cluster " + clusterName + " is not part of cluster set " + status.getClusterSetName());
            }

            engineCallExecutor.executeWithRetry("rejoin cluster", () -> clusterControlAdapter.rejoinClusterToSet(viaAddress, clusterName));
            log.info("Cluster {} rejoined cluster set {}", clusterName, status.getClusterSetName());
        });
    }

    @Override
    public ClusterSetStatus getStatus() {
        String viaAddress = clusterTopologyResolver.resolvePrimaryAddress();
        ClusterSetStatus status = engineCallExecutor.executeWithRetry("get cluster set status", () -> clusterControlAdapter.getClusterSetStatus(viaAddress));
        if (status != null) {
            status.setDomainId(peerStateFunctionalityCombinator.getDomainId().orElse(null));
        }
        return status;
    }

    private ClusterSetStatus requireClusterSetStatus(String viaAddress) {
        ClusterSetStatus status = engineCallExecutor.executeWithRetry("get cluster set status", () -> clusterControlAdapter.getClusterSetStatus(viaAddress));
        if (status == null) {
            throw new PreconditionNotMetException("Cluster is not part of a cluster set");
        }
        return status;
    }

    private String requireClusterName() {
        return peerStateFunctionalityCombinator.getClusterName()
                .orElseThrow(() -> new PreconditionNotMetException("Cluster is not bootstrapped yet"));
    }

    private void validateClusterName(String name) {
        if (StringUtils.isBlank(name) || !CLUSTER_NAME_PATTERN.matcher(name).matches()) {
            throw new InvalidArgumentException("Invalid cluster name '" + name + "'");
        }
    }

    private void validateHandle(ReplicationHandle handle) {
        if (handle == null
                || StringUtils.isAnyBlank(handle.getClusterSetName(), handle.getDomainId(), handle.getPrimaryClusterName(),
                handle.getPrimaryEndpoint(), handle.getReplicaClusterName(), handle.getAdminUser(), handle.getAdminPassword())) {
            throw new InvalidArgumentException("Replication handle is incomplete");
        }
    }
}
