package com.grorchestrator.orchestration.service.impl;

import com.grorchestrator.configuration.properties.runtime.NodeRuntimeProperties;
import com.grorchestrator.orchestration.adapter.api.ClusterControlAdapter;
import com.grorchestrator.orchestration.exception.*;
import com.grorchestrator.orchestration.model.*;
import com.grorchestrator.orchestration.model.clusterset.ClusterSetStatus;
import com.grorchestrator.orchestration.model.clusterset.PromotionResult;
import com.grorchestrator.orchestration.model.clusterset.PromotionScope;
import com.grorchestrator.orchestration.model.peerstate.PersistedMemberInfo;
import com.grorchestrator.orchestration.service.api.BackupRestoreCoordinator;
import com.grorchestrator.orchestration.service.api.ClusterOperationsService;
import com.grorchestrator.orchestration.service.api.ClusterSetReplicationManager;
import com.grorchestrator.orchestration.util.*;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@ApplicationScoped
public class ClusterOperationsServiceImpl implements ClusterOperationsService {

    @Inject
    PeerStateFunctionalityCombinator peerStateFunctionalityCombinator;

    @Inject
    ClusterTopologyResolver clusterTopologyResolver;

    @Inject
    ClusterControlAdapter clusterControlAdapter;

    @Inject
    EngineCallExecutor engineCallExecutor;

    @Inject
    ClusterSetReplicationManager clusterSetReplicationManager;

    @Inject
    BackupRestoreCoordinator backupRestoreCoordinator;

    @Inject
    ReconciliationPassLock reconciliationPassLock;

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Override
    public ClusterStatusReport getClusterStatus(boolean includeClusterSet) {
        Map<String, PersistedMemberInfo> persistedMembers = peerStateFunctionalityCombinator.getMembers();

        ObservedClusterStatus observed;
        try {
            observed = clusterTopologyResolver.observe();
        } catch (TransientEngineException e) {
            log.warn("Failed to observe cluster while building status report: {}", e.getMessage());
            observed = null;
        }

        List<ClusterStatusReport.MemberReport> memberReports = new ArrayList<>();
        for (PersistedMemberInfo member : persistedMembers.values()) {
            MemberState engineState = null;
            if (observed != null) {
                engineState = observed.findMember(member.getNodeId())
                        .map(ObservedMember::getState)
                        .orElse(MemberState.MISSING);
            }
            memberReports.add(
                    ClusterStatusReport.MemberReport.builder()
                            .nodeId(member.getNodeId())
                            .address(member.getAddress())
                            .role(member.getRole())
                            .engineState(engineState)
                            .markedForRemoval(member.isMarkedForRemoval())
                            .build()
            );
        }

        String primaryNodeId = Optional.ofNullable(observed)
                .flatMap(ObservedClusterStatus::getOnlinePrimary)
                .map(ObservedMember::getNodeId)
                .orElse(null);

        ClusterSetStatus clusterSetStatus = null;
        if (includeClusterSet && primaryNodeId != null && peerStateFunctionalityCombinator.getClusterSetName().isPresent()) {
            clusterSetStatus = clusterSetReplicationManager.getStatus();
        }

        return ClusterStatusReport.builder()
                .clusterName(peerStateFunctionalityCombinator.getClusterName().orElse(null))
                .domainId(peerStateFunctionalityCombinator.getDomainId().orElse(null))
                .health(nodeRuntimeProperties.getClusterHealth())
                .primaryNodeId(primaryNodeId)
                .members(memberReports)
                .reportingNodeId(peerStateFunctionalityCombinator.getSelfNodeId())
                .nodeStatus(nodeRuntimeProperties.getStatusKind())
                .statusMessage(nodeRuntimeProperties.getStatusMessage())
                .maintenance(peerStateFunctionalityCombinator.getMaintenanceFlag().isPresent())
                .membershipChangeInProgress(peerStateFunctionalityCombinator.getMembershipChangeMarker().isPresent())
                .clusterSet(clusterSetStatus)
                .build();
    }

    @Override
    public PreUpgradeCheckResult preUpgradeCheck() {
        peerStateFunctionalityCombinator.checkCoordinator("run pre-upgrade check");

        return reconciliationPassLock.runExclusive(() -> {
            ObservedClusterStatus observed = clusterTopologyResolver.observe();
            ObservedMember primary = clusterTopologyResolver.resolvePrimary(observed);

            List<String> notOnline = peerStateFunctionalityCombinator.getMembers().values().stream()
                    .filter(member -> !member.isMarkedForRemoval())
                    .map(PersistedMemberInfo::getNodeId)
                    .filter(nodeId -> observed.findMember(nodeId).map(m -> !MemberState.ONLINE.equals(m.getState())).orElse(true))
                    .collect(Collectors.toList());

            if (!notOnline.isEmpty()) {
                throw new PreconditionNotMetException(
                        "Members " + notOnline + " are not online. Wait for them to rejoin or remove them from the cluster, then retry the check"
                );
            }

            // lowest id is upgraded last, so it keeps the primary role during the upgrade
            ObservedMember target = observed.getOnlineMembers().stream()
                    .min((a, b) -> a.getNodeId().compareTo(b.getNodeId()))
                    .orElse(primary);

            if (target.getNodeId().equals(primary.getNodeId())) {
                return PreUpgradeCheckResult.builder()
                        .primaryNodeId(primary.getNodeId())
                        .primarySwitched(false)
                        .message("All members are online. Node " + primary.getNodeId() + " is primary and must be upgraded last")
                        .build();
            }

            engineCallExecutor.executeWithRetry(
                    "switch primary before upgrade",
                    () -> clusterControlAdapter.setPrimary(primary.getAddress(), target.getNodeId(), target.getAddress())
            );
            log.info("Switched primary from {} to {} before upgrade", primary.getNodeId(), target.getNodeId());

            return PreUpgradeCheckResult.builder()
                    .primaryNodeId(target.getNodeId())
                    .primarySwitched(true)
                    .message("All members are online. Primary switched to node " + target.getNodeId() + ", which must be upgraded last")
                    .build();
        });
    }

    @Override
    public PromotionResult promote(String scope, boolean force) {
        PromotionScope promotionScope = PromotionScope.fromValue(scope)
                .orElseThrow(() -> new InvalidArgumentException("Invalid scope '" + scope + "'. Allowed values are 'unit' and 'cluster'"));

        if (PromotionScope.CLUSTER.equals(promotionScope)) {
            return clusterSetReplicationManager.promoteCluster(force);
        }

        String selfNodeId = peerStateFunctionalityCombinator.getSelfNodeId();
        if (peerStateFunctionalityCombinator.getMember(selfNodeId).isEmpty()) {
            throw new PreconditionNotMetException("Node " + selfNodeId + " is not registered as cluster member yet");
        }

        ObservedClusterStatus observed = clusterTopologyResolver.observe();
        ObservedMember primary = clusterTopologyResolver.resolvePrimary(observed);
        if (primary.getNodeId().equals(selfNodeId)) {
            return PromotionResult.builder()
                    .scope(PromotionScope.UNIT)
                    .promotedNodeId(selfNodeId)
                    .alreadyPrimary(true)
                    .message("Node " + selfNodeId + " is already primary")
                    .build();
        }

        ObservedMember self = observed.findMember(selfNodeId)
                .filter(member -> MemberState.ONLINE.equals(member.getState()))
                .orElseThrow(() -> new PreconditionNotMetException("Node " + selfNodeId + " is not an online cluster member"));

        if (!peerStateFunctionalityCombinator.isCoordinator()) {
            peerStateFunctionalityCombinator.requestPromotion(selfNodeId);
            log.info("Requested promotion of node {} from coordinator", selfNodeId);
            return PromotionResult.builder()
                    .scope(PromotionScope.UNIT)
                    .promotedNodeId(selfNodeId)
                    .message("Promotion requested. Coordinator switches primary to node " + selfNodeId + " on its next pass")
                    .build();
        }

        reconciliationPassLock.runExclusive(() -> {
            engineCallExecutor.executeWithRetry(
                    "switch primary to " + selfNodeId,
                    () -> clusterControlAdapter.setPrimary(primary.getAddress(), selfNodeId, self.getAddress())
            );
        });
        log.info("Switched primary from {} to {}", primary.getNodeId(), selfNodeId);

        return PromotionResult.builder()
                .scope(PromotionScope.UNIT)
                .promotedNodeId(selfNodeId)
                .message("Node " + selfNodeId + " is now primary")
                .build();
    }

    @Override
    public String recreateCluster() {
        peerStateFunctionalityCombinator.checkCoordinator("recreate cluster");

        if (peerStateFunctionalityCombinator.getMembershipChangeMarker().isPresent()) {
            throw new ConflictingOperationException("Membership change is in progress. Retry after it completes");
        }
        if (backupRestoreCoordinator.isBackupInProgress()) {
            throw new ConflictingOperationException("Backup is in progress. Retry after it completes");
        }

        return reconciliationPassLock.runExclusive(() -> {
            if (!peerStateFunctionalityCombinator.acquireMaintenanceFlag("recreate cluster")) {
                throw new ConflictingOperationException("Maintenance is already in progress");
            }
            try {
                ObservedClusterStatus observed = clusterTopologyResolver.observe();

                // marked first, an interrupted dissolve is then finished by reconciliation
                String newName = CredentialUtils.generateClusterName();
                peerStateFunctionalityCombinator.clearClusterSetState();
                peerStateFunctionalityCombinator.markClusterForRecreation(newName);

                if (observed.isClusterExists()) {
                    String viaAddress = observed.getOnlinePrimary()
                            .map(ObservedMember::getAddress)
                            .orElse(clusterTopologyResolver.getSelfEndpoint());
                    engineCallExecutor.executeWithRetry("dissolve cluster", () -> clusterControlAdapter.dissolveCluster(viaAddress));
                }
                log.info("Cluster dissolved, it will be recreated as {}", newName);
                return newName;
            } finally {
                peerStateFunctionalityCombinator.releaseMaintenanceFlag();
            }
        });
    }

    @Override
    public void rejoinCluster(String clusterName) {
        clusterSetReplicationManager.rejoinCluster(clusterName);
    }
}
