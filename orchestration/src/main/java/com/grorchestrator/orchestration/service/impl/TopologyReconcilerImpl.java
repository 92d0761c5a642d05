package com.grorchestrator.orchestration.service.impl;

import com.grorchestrator.configuration.model.ClusterHealth;
import com.grorchestrator.configuration.model.NodeStatusKind;
import com.grorchestrator.configuration.properties.predefined.ClusterProperties;
import com.grorchestrator.configuration.properties.predefined.EngineProperties;
import com.grorchestrator.configuration.properties.predefined.OrchestrationProperties;
import com.grorchestrator.configuration.properties.runtime.NodeRuntimeProperties;
import com.grorchestrator.orchestration.adapter.api.ClusterControlAdapter;
import com.grorchestrator.orchestration.constant.RelationConstants;
import com.grorchestrator.orchestration.exception.*;
import com.grorchestrator.orchestration.model.*;
import com.grorchestrator.orchestration.model.peerstate.MaintenanceFlag;
import com.grorchestrator.orchestration.model.peerstate.PersistedMemberInfo;
import com.grorchestrator.orchestration.service.api.BackupRestoreCoordinator;
import com.grorchestrator.orchestration.service.api.CredentialManager;
import com.grorchestrator.orchestration.service.api.TlsCertificateManager;
import com.grorchestrator.orchestration.service.api.TopologyReconciler;
import com.grorchestrator.orchestration.util.*;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

@Slf4j
@ApplicationScoped
public class TopologyReconcilerImpl implements TopologyReconciler {

    @Inject
    PeerStateFunctionalityCombinator peerStateFunctionalityCombinator;

    @Inject
    ClusterTopologyResolver clusterTopologyResolver;

    @Inject
    ClusterControlAdapter clusterControlAdapter;

    @Inject
    EngineCallExecutor engineCallExecutor;

    @Inject
    ReconciliationPlanner reconciliationPlanner;

    @Inject
    ReconciliationPassLock reconciliationPassLock;

    @Inject
    EngineSettingsCalculator engineSettingsCalculator;

    @Inject
    CredentialManager credentialManager;

    @Inject
    TlsCertificateManager tlsCertificateManager;

    @Inject
    BackupRestoreCoordinator backupRestoreCoordinator;

    @Inject
    ClusterProperties clusterProperties;

    @Inject
    EngineProperties engineProperties;

    @Inject
    OrchestrationProperties orchestrationProperties;

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    Clock clock = Clock.systemUTC();

    // settings which were last persisted on the local instance, reset on configuration change
    private Map<String, String> appliedSettings = null;

    @Override
    public ReconciliationPassResult reconcile(LifecycleEvent event) {
        return reconciliationPassLock.runExclusive(() -> {
            try {
                handleEvent(event);
                return runPass();
            } catch (TransientEngineException e) {
                log.warn("Reconciliation pass degraded: {}", e.getMessage());
                updateStatus(NodeStatusKind.DEGRADED, e.getMessage(), ClusterHealth.UNREACHABLE);
            } catch (StructuralInconsistencyException e) {
                log.error("Reconciliation blocked: {}", e.getMessage());
                updateStatus(NodeStatusKind.BLOCKED, e.getMessage(), nodeRuntimeProperties.getClusterHealth());
            } catch (PreconditionNotMetException e) {
                log.info("Reconciliation deferred: {}", e.getMessage());
                updateStatus(NodeStatusKind.WAITING, e.getMessage(), nodeRuntimeProperties.getClusterHealth());
            } catch (EngineOperationException e) {
                log.error("Engine call failed during reconciliation pass. Will retry on next pass.", e);
                updateStatus(NodeStatusKind.DEGRADED, e.getMessage(), nodeRuntimeProperties.getClusterHealth());
            } catch (OrchestrationException e) {
                log.error("Reconciliation pass failed with {}. Will retry on next pass.", e.getCategory(), e);
                updateStatus(NodeStatusKind.DEGRADED, e.getMessage(), nodeRuntimeProperties.getClusterHealth());
            }
            return ReconciliationPassResult.nothingApplied(null);
        });
    }

    private void handleEvent(LifecycleEvent event) {
        String selfNodeId = peerStateFunctionalityCombinator.getSelfNodeId();
        boolean coordinator = peerStateFunctionalityCombinator.isCoordinator();

        switch (event.getType()) {
            case NODE_ADDED -> {
                if (selfNodeId.equals(event.getNodeId()) || coordinator) {
                    peerStateFunctionalityCombinator.registerMember(event.getNodeId(), event.getNodeAddress());
                    log.info("Registered node {} with address {}", event.getNodeId(), event.getNodeAddress());
                }
            }
            case NODE_REMOVED -> {
                if (selfNodeId.equals(event.getNodeId()) || coordinator) {
                    peerStateFunctionalityCombinator.markMemberForRemoval(event.getNodeId());
                    log.info("Node {} is marked for removal", event.getNodeId());
                }
            }
            case CONFIG_CHANGED -> appliedSettings = null;
            case RELATION_JOINED, RELATION_BROKEN -> {
                if (!coordinator) {
                    log.debug("Ignoring {} of relation {}, this node is not coordinator", event.getType(), event.getRelationId());
                    return;
                }
                handleRelationEvent(event);
            }
            default -> {
            }
        }
    }

    private void handleRelationEvent(LifecycleEvent event) {
        boolean joined = LifecycleEventType.RELATION_JOINED.equals(event.getType());

        if (RelationConstants.CERTIFICATES_RELATION_NAME.equals(event.getRelationName())) {
            tlsCertificateManager.setEnabled(joined);
            return;
        }
        if (event.getRelationId() == null) {
            log.error("Relation event {} without relation id is ignored", event.getEventId());
            return;
        }

        int relationId = event.getRelationId();
        String username = CredentialUtils.relationUsername(relationId);
        String database = event.getDatabase();
        if (RelationConstants.LEGACY_RELATION_NAME.equals(event.getRelationName())) {
            username = engineProperties.legacyRelation().user().orElse(username);
            database = engineProperties.legacyRelation().database().orElse(database);
        }

        try {
            if (joined) {
                credentialManager.createRelationCredential(relationId, database, username);
            } else {
                credentialManager.destroyRelationCredential(relationId, username);
            }
        } catch (InvalidArgumentException e) {
            log.error("Can not handle {} of relation {}: {}", event.getType(), relationId, e.getMessage());
        }
    }

    private ReconciliationPassResult runPass() {
        String selfNodeId = peerStateFunctionalityCombinator.getSelfNodeId();
        boolean coordinator = peerStateFunctionalityCombinator.isCoordinator();

        if (coordinator) {
            bootstrapClusterIdentity();
            releaseStaleMaintenanceFlag(selfNodeId);
        }

        Optional<MaintenanceFlag> maintenanceFlag = peerStateFunctionalityCombinator.getMaintenanceFlag();
        if (maintenanceFlag.isPresent()) {
            String reason = "Maintenance in progress: " + maintenanceFlag.get().getReason();
            log.info("Membership changes are deferred. {}", reason);
            updateStatus(NodeStatusKind.MAINTENANCE, reason, nodeRuntimeProperties.getClusterHealth());
            return ReconciliationPassResult.nothingApplied(ReconciliationDecision.deferred(Set.of(), reason));
        }

        runLocalSteps(selfNodeId);

        ObservedClusterStatus observed = clusterTopologyResolver.observe();
        rejoinSelfIfNeeded(selfNodeId, observed);

        if (!coordinator) {
            updateFollowerStatus(selfNodeId, observed);
            return ReconciliationPassResult.nothingApplied(null);
        }

        return runCoordinatorPass(observed);
    }

    private void bootstrapClusterIdentity() {
        if (peerStateFunctionalityCombinator.getClusterName().isEmpty()) {
            String clusterName = clusterProperties.name().orElseGet(CredentialUtils::generateClusterName);
            peerStateFunctionalityCombinator.saveClusterName(clusterName);
            log.info("Cluster name is {}", clusterName);
        }
        if (peerStateFunctionalityCombinator.getDomainId().isEmpty()) {
            peerStateFunctionalityCombinator.saveDomainId(UUID.randomUUID().toString());
        }
        credentialManager.ensureSystemCredentials();
    }

    /**
     * Releases a flag whose operation can not be running anymore: it was set by this node before a restart, by a node
     * which left, or longer ago than the maintenance timeout.
     */
    private void releaseStaleMaintenanceFlag(String selfNodeId) {
        Optional<MaintenanceFlag> flag = peerStateFunctionalityCombinator.getMaintenanceFlag();
        if (flag.isEmpty() || peerStateFunctionalityCombinator.isMaintenanceFlagHeldLocally()) {
            return;
        }
        String owner = flag.get().getOwnerNodeId();
        boolean ownerIsMember = owner != null && peerStateFunctionalityCombinator.getMember(owner)
                .map(member -> !member.isMarkedForRemoval())
                .orElse(false);
        String staleReason = null;
        if (selfNodeId.equals(owner)) {
            staleReason = "it was set by this node and no operation holds it";
        } else if (owner != null && !ownerIsMember) {
            staleReason = "owner " + owner + " is not a member anymore";
        } else if (flag.get().getAcquiredAt() != null
                && Duration.between(flag.get().getAcquiredAt(), clock.instant()).compareTo(orchestrationProperties.maintenanceTimeout()) > 0) {
            staleReason = "it was set at " + flag.get().getAcquiredAt() + " which is longer ago than " + orchestrationProperties.maintenanceTimeout();
        }
        if (staleReason != null) {
            log.warn("Releasing maintenance flag '{}' because {}", flag.get().getReason(), staleReason);
            peerStateFunctionalityCombinator.releaseMaintenanceFlag();
        }
    }

    private void runLocalSteps(String selfNodeId) {
        String selfEndpoint = clusterTopologyResolver.getSelfEndpoint();

        Optional<PersistedMemberInfo> self = peerStateFunctionalityCombinator.getMember(selfNodeId);
        if (self.isEmpty() || !selfEndpoint.equals(self.get().getAddress())) {
            peerStateFunctionalityCombinator.registerMember(selfNodeId, selfEndpoint);
            log.info("Registered this node with address {}", selfEndpoint);
        }

        if (!peerStateFunctionalityCombinator.isInstanceConfigured(selfNodeId)) {
            if (!credentialManager.isSystemCredentialsReady()) {
                log.info("Waiting for coordinator to publish shared credentials before configuring local instance");
                return;
            }
            engineCallExecutor.executeWithRetry(
                    "configure instance",
                    () -> clusterControlAdapter.configureInstance(selfEndpoint, credentialManager.getSystemCredentials())
            );
            peerStateFunctionalityCombinator.markInstanceConfigured(selfNodeId, true);
            log.info("Local instance configured for clustering");
        }

        Map<String, String> settings = engineSettingsCalculator.calculateSettings();
        if (!settings.equals(appliedSettings)) {
            engineCallExecutor.executeWithRetry("apply instance settings", () -> clusterControlAdapter.applyInstanceSettings(selfEndpoint, settings));
            appliedSettings = settings;
            log.info("Applied {} engine settings to local instance", settings.size());
        }

        try {
            tlsCertificateManager.applyLocal();
        } catch (CertificateIssuanceException e) {
            log.warn("Failed to apply TLS material locally, will retry on next pass: {}", e.getMessage());
        }
    }

    private void rejoinSelfIfNeeded(String selfNodeId, ObservedClusterStatus observed) {
        Optional<PersistedMemberInfo> self = peerStateFunctionalityCombinator.getMember(selfNodeId);
        if (self.isEmpty() || self.get().isMarkedForRemoval() || self.get().getRole() == null || !self.get().getRole().wasClusterMember()) {
            return;
        }
        Optional<ObservedMember> observedSelf = observed.findMember(selfNodeId);
        Optional<ObservedMember> primary = observed.getOnlinePrimary();
        if (observedSelf.isEmpty() || primary.isEmpty()) {
            return;
        }
        MemberState state = observedSelf.get().getState();
        if (MemberState.OFFLINE.equals(state) || MemberState.ERROR.equals(state)) {
            log.info("Local instance is {}, rejoining cluster", state);
            engineCallExecutor.executeWithRetry(
                    "rejoin instance",
                    () -> clusterControlAdapter.rejoinInstance(primary.get().getAddress(), selfNodeId, observedSelf.get().getAddress())
            );
        }
    }

    private void updateFollowerStatus(String selfNodeId, ObservedClusterStatus observed) {
        ClusterHealth health = calculateHealth(observed, peerStateFunctionalityCombinator.getMembers());
        boolean online = observed.findMember(selfNodeId)
                .map(member -> MemberState.ONLINE.equals(member.getState()))
                .orElse(false);
        if (online) {
            updateStatus(NodeStatusKind.ACTIVE, "Node is an online cluster member", health);
        } else {
            updateStatus(NodeStatusKind.WAITING, "Waiting for coordinator to add this node to the cluster", health);
        }
    }

    private ReconciliationPassResult runCoordinatorPass(ObservedClusterStatus observed) {
        if (peerStateFunctionalityCombinator.getMembershipChangeMarker().isPresent()) {
            // left behind by a pass which did not complete
            log.warn("Clearing membership change marker left by interrupted pass: {}", peerStateFunctionalityCombinator.getMembershipChangeMarker().get().getValue());
            peerStateFunctionalityCombinator.clearMembershipChangeMarker();
        }

        backupRestoreCoordinator.markStaleBackupsFailed();

        observed.getOnlinePrimary().ifPresent(primary -> {
            try {
                credentialManager.applyPendingCredentials(primary.getAddress());
            } catch (TransientEngineException | EngineOperationException e) {
                log.warn("Failed to apply pending credentials, will retry on next pass: {}", e.getMessage());
            }
        });

        TreeMap<String, PersistedMemberInfo> members = peerStateFunctionalityCombinator.getMembers();
        PlanningContext context = buildPlanningContext(observed, members);
        ReconciliationDecision decision = reconciliationPlanner.plan(context);

        boolean applied = false;
        switch (decision.getOutcome()) {
            case APPLY -> {
                ReconciliationOperation operation = decision.getOperation();
                log.info("Applying {} for node {}: {}", operation.getType(), operation.getTargetNodeId(), operation.getReason());
                peerStateFunctionalityCombinator.setMembershipChangeMarker(operation.getType() + " " + operation.getTargetNodeId());
                try {
                    executeOperation(operation, observed, context);
                } finally {
                    peerStateFunctionalityCombinator.clearMembershipChangeMarker();
                }
                applied = true;
            }
            case DEFERRED -> log.info("Reconciliation deferred: {}", decision.getReason());
            case BLOCKED -> log.error("Reconciliation blocked, operator intervention required: {}", decision.getReason());
            default -> {
            }
        }

        ObservedClusterStatus after = observed;
        if (applied) {
            try {
                after = clusterTopologyResolver.observe();
            } catch (TransientEngineException e) {
                log.warn("Failed to observe cluster after applying operation: {}", e.getMessage());
            }
        }

        saveMemberRoles(after, members, context.isRecreationPending());
        clearFulfilledPromotionRequests(after);

        ClusterHealth health = calculateHealth(after, members);
        switch (decision.getOutcome()) {
            case BLOCKED -> updateStatus(NodeStatusKind.BLOCKED, decision.getReason(), health);
            case DEFERRED -> updateStatus(NodeStatusKind.WAITING, decision.getReason(), health);
            case APPLY -> updateStatus(NodeStatusKind.WAITING, "Applied " + decision.getOperation().getType() + " for node " + decision.getOperation().getTargetNodeId(), health);
            default -> updateStatus(NodeStatusKind.ACTIVE, "Cluster is converged", health);
        }

        return ReconciliationPassResult.builder()
                .decision(decision)
                .operationApplied(applied)
                .moreWorkExpected(applied)
                .build();
    }

    private PlanningContext buildPlanningContext(ObservedClusterStatus observed, TreeMap<String, PersistedMemberInfo> members) {
        Set<String> configured = members.keySet().stream()
                .filter(peerStateFunctionalityCombinator::isInstanceConfigured)
                .collect(Collectors.toSet());
        Set<String> withCertificate = members.keySet().stream()
                .filter(nodeId -> peerStateFunctionalityCombinator.getNodeCertificate(nodeId).isPresent())
                .collect(Collectors.toSet());
        Map<String, Long> transactionCounts = observed.isClusterExists() ? new HashMap<>() : readStandaloneTransactionCounts(members);

        return PlanningContext.builder()
                .coordinatorNodeId(peerStateFunctionalityCombinator.getSelfNodeId())
                .clusterName(peerStateFunctionalityCombinator.getClusterName().orElse(null))
                .observed(observed)
                .members(members)
                .recreationPending(peerStateFunctionalityCombinator.isClusterRecreationPending())
                .restoreFailure(peerStateFunctionalityCombinator.getIncompleteRestore().orElse(null))
                .credentialsReady(credentialManager.isSystemCredentialsReady())
                .tlsEnabled(peerStateFunctionalityCombinator.isTlsEnabled())
                .caChainPresent(peerStateFunctionalityCombinator.getCaChain().isPresent())
                .configuredInstances(configured)
                .nodesWithCertificate(withCertificate)
                .promotionRequests(peerStateFunctionalityCombinator.getPromotionRequests())
                .maxMembers(clusterProperties.maxMembers())
                .standaloneTransactionCounts(transactionCounts)
                .build();
    }

    private Map<String, Long> readStandaloneTransactionCounts(Map<String, PersistedMemberInfo> members) {
        Map<String, Long> counts = new HashMap<>();
        for (PersistedMemberInfo member : members.values()) {
            if (member.isMarkedForRemoval() || member.getRole() == null || !member.getRole().wasClusterMember()) {
                continue;
            }
            try {
                String gtidSet = engineCallExecutor.executeWithRetry(
                        "read executed GTID set of " + member.getNodeId(),
                        () -> clusterControlAdapter.getExecutedTransactionSet(member.getAddress())
                );
                counts.put(member.getNodeId(), GtidSetUtils.countTransactions(gtidSet));
            } catch (TransientEngineException | EngineOperationException e) {
                log.info("Can not read executed transactions of {}: {}", member.getNodeId(), e.getMessage());
            }
        }
        return counts;
    }

    private void executeOperation(ReconciliationOperation operation, ObservedClusterStatus observed, PlanningContext context) {
        String nodeId = operation.getTargetNodeId();
        String address = operation.getTargetAddress();
        String primaryAddress = observed.getOnlinePrimary().map(ObservedMember::getAddress).orElse(null);
        String operationName = operation.getType() + " " + nodeId;

        switch (operation.getType()) {
            case CREATE_CLUSTER -> {
                engineCallExecutor.executeWithRetry(operationName, () -> clusterControlAdapter.createCluster(context.getClusterName(), nodeId, address));
                if (context.isRecreationPending()) {
                    peerStateFunctionalityCombinator.markClusterActive();
                }
                log.info("Created cluster {} with seed {}", context.getClusterName(), nodeId);
            }
            case ADD_MEMBER -> engineCallExecutor.executeWithRetry(operationName, () -> clusterControlAdapter.addInstance(primaryAddress, nodeId, address));
            case REMOVE_MEMBER -> engineCallExecutor.executeWithRetry(
                    operationName,
                    () -> clusterControlAdapter.removeInstance(primaryAddress, nodeId, address, operation.isForce())
            );
            case PROMOTE_PRIMARY -> engineCallExecutor.executeWithRetry(operationName, () -> clusterControlAdapter.setPrimary(address, nodeId, address));
            case SWITCH_PRIMARY -> engineCallExecutor.executeWithRetry(operationName, () -> clusterControlAdapter.setPrimary(primaryAddress, nodeId, address));
            case DISSOLVE_CLUSTER -> {
                String viaAddress = primaryAddress != null ? primaryAddress : address;
                engineCallExecutor.executeWithRetry(operationName, () -> clusterControlAdapter.dissolveCluster(viaAddress));
            }
            case REBOOT_CLUSTER -> {
                engineCallExecutor.executeWithRetry(operationName, () -> clusterControlAdapter.rebootClusterFromCompleteOutage(address, context.getClusterName()));
                log.info("Rebooted cluster {} from complete outage on {}", context.getClusterName(), nodeId);
            }
        }
    }

    private void saveMemberRoles(ObservedClusterStatus observed, Map<String, PersistedMemberInfo> members, boolean recreationPending) {
        Map<String, NodeRole> changed = new HashMap<>();
        for (PersistedMemberInfo member : members.values()) {
            NodeRole role = resolveRole(member, observed, recreationPending);
            if (!role.equals(member.getRole())) {
                changed.put(member.getNodeId(), role);
                log.info("Role of node {} changed from {} to {}", member.getNodeId(), member.getRole(), role);
            }
        }
        peerStateFunctionalityCombinator.saveMemberRoles(changed);
    }

    private NodeRole resolveRole(PersistedMemberInfo member, ObservedClusterStatus observed, boolean recreationPending) {
        Optional<ObservedMember> observedMember = observed.isClusterExists() ? observed.findMember(member.getNodeId()) : Optional.empty();
        if (observedMember.isEmpty()) {
            if (member.isMarkedForRemoval()) {
                return NodeRole.DISSOLVED;
            }
            // without any cluster a former member keeps its history, it decides between reboot and create
            if (!observed.isClusterExists() && !recreationPending && member.getRole() != null && member.getRole().wasClusterMember()) {
                return NodeRole.UNREACHABLE;
            }
            return NodeRole.UNINITIALIZED;
        }
        return switch (observedMember.get().getState()) {
            case ONLINE -> observedMember.get().isPrimary() ? NodeRole.PRIMARY : NodeRole.MEMBER;
            case RECOVERING -> NodeRole.JOINING;
            default -> NodeRole.UNREACHABLE;
        };
    }

    private void clearFulfilledPromotionRequests(ObservedClusterStatus observed) {
        Optional<ObservedMember> primary = observed.getOnlinePrimary();
        if (primary.isEmpty()) {
            return;
        }
        for (String requester : peerStateFunctionalityCombinator.getPromotionRequests()) {
            if (requester.equals(primary.get().getNodeId())) {
                peerStateFunctionalityCombinator.clearPromotionRequest(requester);
                log.info("Promotion request of node {} is fulfilled", requester);
            }
        }
    }

    private ClusterHealth calculateHealth(ObservedClusterStatus observed, Map<String, PersistedMemberInfo> members) {
        if (!observed.isClusterExists()) {
            return ClusterHealth.NO_CLUSTER;
        }
        if (observed.getOnlineMembers().isEmpty()) {
            return ClusterHealth.UNREACHABLE;
        }
        if (observed.getOnlinePrimary().isEmpty()) {
            return ClusterHealth.DEGRADED;
        }
        boolean allTargetsOnline = members.values().stream()
                .filter(member -> !member.isMarkedForRemoval())
                .allMatch(member -> observed.findMember(member.getNodeId())
                        .map(observedMember -> MemberState.ONLINE.equals(observedMember.getState()))
                        .orElse(false));
        return allTargetsOnline ? ClusterHealth.OK : ClusterHealth.DEGRADED;
    }

    private void updateStatus(NodeStatusKind kind, String message, ClusterHealth health) {
        nodeRuntimeProperties.setStatusKind(kind);
        nodeRuntimeProperties.setStatusMessage(StringUtils.abbreviate(message, 512));
        nodeRuntimeProperties.setClusterHealth(health);
        nodeRuntimeProperties.setLastPassCompletedAt(clock.instant());
    }
}
