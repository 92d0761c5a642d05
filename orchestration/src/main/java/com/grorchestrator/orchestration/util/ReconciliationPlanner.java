package com.grorchestrator.orchestration.util;

import com.grorchestrator.orchestration.model.*;
import com.grorchestrator.orchestration.model.peerstate.PersistedMemberInfo;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Diffs observed topology against the target membership and picks the single next step. Has no side effects, so the same
 * context always yields the same decision.
 */
@ApplicationScoped
public class ReconciliationPlanner {

    public ReconciliationDecision plan(PlanningContext context) {
        Set<String> target = resolveTargetMembers(context);
        ObservedClusterStatus observed = context.getObserved();

        if (context.getRestoreFailure() != null) {
            return ReconciliationDecision.blocked(
                    target,
                    "Restore did not complete: " + context.getRestoreFailure() + ". Run restore again or recreate-cluster"
            );
        }

        if (context.isRecreationPending() && observed.isClusterExists()) {
            return ReconciliationDecision.apply(
                    target,
                    operation(OperationType.DISSOLVE_CLUSTER, context.getCoordinatorNodeId(), context, false, "cluster is marked for re-creation")
            );
        }

        if (!observed.isClusterExists()) {
            return planClusterCreation(context, target);
        }

        for (ObservedMember member : observed.getMembers()) {
            if (!context.getMembers().containsKey(member.getNodeId())) {
                return ReconciliationDecision.blocked(
                        target,
                        "Engine reports member " + member.getNodeId() + " (" + member.getAddress() + ") which was never provisioned. Remove it manually."
                );
            }
        }

        List<ObservedMember> primaries = observed.getOnlinePrimaries();
        if (primaries.size() > 1) {
            return ReconciliationDecision.blocked(
                    target,
                    "Engine reports more than one online primary: " + primaries.stream().map(ObservedMember::getNodeId).collect(Collectors.joining(", "))
            );
        }

        if (primaries.isEmpty()) {
            return planPromotion(context, target);
        }

        ObservedMember primary = primaries.get(0);

        if (isMarkedForRemoval(context, primary.getNodeId())) {
            List<ObservedMember> others = observed.getOnlineMembers()
                    .stream()
                    .filter(member -> !member.getNodeId().equals(primary.getNodeId()))
                    .collect(Collectors.toList());
            List<ObservedMember> staying = others.stream()
                    .filter(member -> !isMarkedForRemoval(context, member.getNodeId()))
                    .collect(Collectors.toList());
            Optional<ObservedMember> successor = pickMostCaughtUp(context, staying.isEmpty() ? others : staying);
            if (successor.isPresent()) {
                return ReconciliationDecision.apply(
                        target,
                        ReconciliationOperation.builder()
                                .type(OperationType.SWITCH_PRIMARY)
                                .targetNodeId(successor.get().getNodeId())
                                .targetAddress(successor.get().getAddress())
                                .reason("primary " + primary.getNodeId() + " is being removed")
                                .build()
                );
            }
        }

        for (ObservedMember member : observed.getMembers()) {
            if (member.isPrimary() || !isMarkedForRemoval(context, member.getNodeId())) {
                continue;
            }
            return ReconciliationDecision.apply(
                    target,
                    ReconciliationOperation.builder()
                            .type(OperationType.REMOVE_MEMBER)
                            .targetNodeId(member.getNodeId())
                            .targetAddress(member.getAddress())
                            .force(!member.getState().isReachable())
                            .reason("member is marked for removal")
                            .build()
            );
        }

        if (isMarkedForRemoval(context, primary.getNodeId()) && observed.getMembers().size() == 1 && target.isEmpty()) {
            return ReconciliationDecision.apply(
                    target,
                    operation(OperationType.DISSOLVE_CLUSTER, primary.getNodeId(), context, false, "last member is being removed")
            );
        }

        for (String requester : context.getPromotionRequests()) {
            Optional<ObservedMember> candidate = observed.findMember(requester)
                    .filter(member -> MemberState.ONLINE.equals(member.getState()))
                    .filter(member -> !isMarkedForRemoval(context, member.getNodeId()));
            if (candidate.isPresent() && !candidate.get().isPrimary()) {
                return ReconciliationDecision.apply(
                        target,
                        ReconciliationOperation.builder()
                                .type(OperationType.SWITCH_PRIMARY)
                                .targetNodeId(candidate.get().getNodeId())
                                .targetAddress(candidate.get().getAddress())
                                .reason("operator requested promotion of " + requester)
                                .build()
                );
            }
        }

        return planMissingMembers(context, target);
    }

    private ReconciliationDecision planClusterCreation(PlanningContext context, Set<String> target) {
        if (!context.isRecreationPending()) {
            List<String> formed = context.getMembers()
                    .values()
                    .stream()
                    .filter(member -> !member.isMarkedForRemoval())
                    .filter(member -> member.getRole() != null && member.getRole().wasClusterMember())
                    .map(PersistedMemberInfo::getNodeId)
                    .collect(Collectors.toList());
            if (!formed.isEmpty()) {
                return planReboot(context, target, formed);
            }
        }

        String seed = context.getCoordinatorNodeId();
        if (!target.contains(seed)) {
            return ReconciliationDecision.deferred(target, "Coordinator " + seed + " is not registered as a member yet");
        }
        Optional<String> missing = findMissingJoinPrerequisite(context, seed);
        if (missing.isPresent()) {
            return ReconciliationDecision.deferred(target, "Cannot create cluster: " + missing.get());
        }
        return ReconciliationDecision.apply(
                target,
                operation(OperationType.CREATE_CLUSTER, seed, context, false, "no cluster exists")
        );
    }

    /**
     * Cluster existed before and every member is down or standalone now. Creating a fresh cluster here would throw away
     * the cluster metadata, so the instance with the most executed transactions reboots it instead.
     */
    private ReconciliationDecision planReboot(PlanningContext context, Set<String> target, List<String> formed) {
        Map<String, Long> counts = context.getStandaloneTransactionCounts();
        List<String> silent = formed.stream()
                .filter(nodeId -> !counts.containsKey(nodeId))
                .collect(Collectors.toList());
        if (!silent.isEmpty()) {
            return ReconciliationDecision.deferred(
                    target,
                    "Complete outage, waiting for " + String.join(", ", silent) + " to report executed transactions"
            );
        }
        String best = formed.stream()
                .min(Comparator.comparingLong((String nodeId) -> counts.get(nodeId)).reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .orElseThrow();
        return ReconciliationDecision.apply(
                target,
                operation(OperationType.REBOOT_CLUSTER, best, context, false, "complete outage, " + best + " has the most executed transactions")
        );
    }

    private ReconciliationDecision planPromotion(PlanningContext context, Set<String> target) {
        List<ObservedMember> online = context.getObserved().getOnlineMembers();
        if (online.isEmpty()) {
            return ReconciliationDecision.deferred(target, "No online member is left to promote");
        }
        ObservedMember best = pickMostCaughtUp(context, online).orElseThrow();
        return ReconciliationDecision.apply(
                target,
                ReconciliationOperation.builder()
                        .type(OperationType.PROMOTE_PRIMARY)
                        .targetNodeId(best.getNodeId())
                        .targetAddress(best.getAddress())
                        .reason("cluster has no online primary")
                        .build()
        );
    }

    private ReconciliationDecision planMissingMembers(PlanningContext context, Set<String> target) {
        ObservedClusterStatus observed = context.getObserved();
        for (String nodeId : target) {
            if (observed.findMember(nodeId).isPresent()) {
                continue;
            }
            if (observed.getMembers().size() >= context.getMaxMembers()) {
                return ReconciliationDecision.blocked(
                        target,
                        "Cluster already has " + observed.getMembers().size() + " members which is the maximum, can not add " + nodeId
                );
            }
            if (observed.hasRecoveringMember()) {
                return ReconciliationDecision.deferred(target, "Waiting for recovering member before adding " + nodeId);
            }
            Optional<String> missing = findMissingJoinPrerequisite(context, nodeId);
            if (missing.isPresent()) {
                return ReconciliationDecision.deferred(target, "Cannot add " + nodeId + ": " + missing.get());
            }
            return ReconciliationDecision.apply(
                    target,
                    operation(OperationType.ADD_MEMBER, nodeId, context, false, "member is not part of cluster")
            );
        }
        return ReconciliationDecision.converged(target);
    }

    private Optional<String> findMissingJoinPrerequisite(PlanningContext context, String nodeId) {
        if (!context.isCredentialsReady()) {
            return Optional.of("shared credentials are not published yet");
        }
        if (!context.getConfiguredInstances().contains(nodeId)) {
            return Optional.of("instance " + nodeId + " is not configured for clustering yet");
        }
        if (context.isTlsEnabled()) {
            if (!context.isCaChainPresent()) {
                return Optional.of("CA chain is not published yet");
            }
            if (!context.getNodesWithCertificate().contains(nodeId)) {
                return Optional.of("certificate of " + nodeId + " is not issued yet");
            }
        }
        return Optional.empty();
    }

    /**
     * Most applied transactions first, then members not being removed, then lowest node id.
     */
    private Optional<ObservedMember> pickMostCaughtUp(PlanningContext context, List<ObservedMember> candidates) {
        return candidates.stream()
                .min(Comparator.comparingLong(ObservedMember::getAppliedTransactionPosition).reversed()
                        .thenComparing(member -> isMarkedForRemoval(context, member.getNodeId()))
                        .thenComparing(ObservedMember::getNodeId));
    }

    private Set<String> resolveTargetMembers(PlanningContext context) {
        return context.getMembers()
                .values()
                .stream()
                .filter(member -> !member.isMarkedForRemoval())
                .map(PersistedMemberInfo::getNodeId)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private boolean isMarkedForRemoval(PlanningContext context, String nodeId) {
        PersistedMemberInfo member = context.getMembers().get(nodeId);
        return member != null && member.isMarkedForRemoval();
    }

    private ReconciliationOperation operation(OperationType type, String nodeId, PlanningContext context, boolean force, String reason) {
        PersistedMemberInfo member = context.getMembers().get(nodeId);
        return ReconciliationOperation.builder()
                .type(type)
                .targetNodeId(nodeId)
                .targetAddress(member != null ? member.getAddress() : null)
                .force(force)
                .reason(reason)
                .build();
    }
}
