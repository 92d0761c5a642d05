package com.grorchestrator.orchestration.util;

import com.grorchestrator.orchestration.model.*;
import com.grorchestrator.orchestration.model.peerstate.PersistedMemberInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;

import static org.assertj.core.api.Assertions.assertThat;

class ReconciliationPlannerTest {

    private final ReconciliationPlanner planner = new ReconciliationPlanner();

    private PlanningContext context;

    @BeforeEach
    void setUp() {
        context = PlanningContext.builder()
                .coordinatorNodeId("node-1")
                .clusterName("cluster-a")
                .observed(ObservedClusterStatus.noCluster())
                .credentialsReady(true)
                .configuredInstances(new HashSet<>(Arrays.asList("node-1", "node-2", "node-3")))
                .maxMembers(9)
                .build();
        register("node-1");
        register("node-2");
        register("node-3");
    }

    @Test
    void createsClusterSeededByCoordinator() {
        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOutcome()).isEqualTo(ReconciliationDecision.Outcome.APPLY);
        assertThat(decision.getOperation().getType()).isEqualTo(OperationType.CREATE_CLUSTER);
        assertThat(decision.getOperation().getTargetNodeId()).isEqualTo("node-1");
        assertThat(decision.getOperation().getTargetAddress()).isEqualTo("10.0.0.1");
        assertThat(decision.getTargetMembers()).containsExactly("node-1", "node-2", "node-3");
    }

    @Test
    void clusterCreationWaitsForCoordinatorRegistration() {
        context.getMembers().remove("node-1");

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOutcome()).isEqualTo(ReconciliationDecision.Outcome.DEFERRED);
        assertThat(decision.getReason()).contains("node-1");
    }

    @Test
    void clusterCreationWaitsForCredentials() {
        context.setCredentialsReady(false);

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOutcome()).isEqualTo(ReconciliationDecision.Outcome.DEFERRED);
        assertThat(decision.getReason()).contains("credentials");
    }

    @Test
    void addsMissingMembersOneAtATimeInNodeIdOrder() {
        observe(member("node-1", MemberState.ONLINE, true, 10));

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOutcome()).isEqualTo(ReconciliationDecision.Outcome.APPLY);
        assertThat(decision.getOperations()).hasSize(1);
        assertThat(decision.getOperation().getType()).isEqualTo(OperationType.ADD_MEMBER);
        assertThat(decision.getOperation().getTargetNodeId()).isEqualTo("node-2");
    }

    @Test
    void additionWaitsForRecoveringMember() {
        observe(member("node-1", MemberState.ONLINE, true, 10), member("node-2", MemberState.RECOVERING, false, 3));

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOutcome()).isEqualTo(ReconciliationDecision.Outcome.DEFERRED);
        assertThat(decision.getReason()).contains("recovering").contains("node-3");
    }

    @Test
    void additionWaitsForInstanceConfiguration() {
        context.getConfiguredInstances().remove("node-2");
        observe(member("node-1", MemberState.ONLINE, true, 10));

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOutcome()).isEqualTo(ReconciliationDecision.Outcome.DEFERRED);
        assertThat(decision.getReason()).contains("node-2").contains("not configured");
    }

    @Test
    void additionWaitsForCertificatesWhenTlsIsEnabled() {
        context.setTlsEnabled(true);
        observe(member("node-1", MemberState.ONLINE, true, 10));

        assertThat(planner.plan(context).getReason()).contains("CA chain");

        context.setCaChainPresent(true);
        context.getNodesWithCertificate().add("node-1");

        ReconciliationDecision decision = planner.plan(context);
        assertThat(decision.getOutcome()).isEqualTo(ReconciliationDecision.Outcome.DEFERRED);
        assertThat(decision.getReason()).contains("certificate of node-2");

        context.getNodesWithCertificate().add("node-2");
        assertThat(planner.plan(context).getOperation().getType()).isEqualTo(OperationType.ADD_MEMBER);
    }

    @Test
    void additionIsBlockedAtMemberLimit() {
        context.setMaxMembers(2);
        observe(member("node-1", MemberState.ONLINE, true, 10), member("node-2", MemberState.ONLINE, false, 10));

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOutcome()).isEqualTo(ReconciliationDecision.Outcome.BLOCKED);
        assertThat(decision.getReason()).contains("maximum").contains("node-3");
    }

    @Test
    void convergedWhenObservedMatchesTarget() {
        observe(
                member("node-1", MemberState.ONLINE, true, 10),
                member("node-2", MemberState.ONLINE, false, 10),
                member("node-3", MemberState.ONLINE, false, 10)
        );

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOutcome()).isEqualTo(ReconciliationDecision.Outcome.CONVERGED);
        assertThat(decision.getOperation()).isNull();
    }

    @Test
    void unknownMemberBlocksReconciliation() {
        observe(member("node-1", MemberState.ONLINE, true, 10), member("stranger", MemberState.ONLINE, false, 10));

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOutcome()).isEqualTo(ReconciliationDecision.Outcome.BLOCKED);
        assertThat(decision.getReason()).contains("stranger");
    }

    @Test
    void splitBrainBlocksReconciliation() {
        observe(member("node-1", MemberState.ONLINE, true, 10), member("node-2", MemberState.ONLINE, true, 10));

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOutcome()).isEqualTo(ReconciliationDecision.Outcome.BLOCKED);
        assertThat(decision.getReason()).contains("node-1, node-2");
    }

    @Test
    void promotesMostCaughtUpMember() {
        observe(
                member("node-1", MemberState.UNREACHABLE, false, 0),
                member("node-2", MemberState.ONLINE, false, 40),
                member("node-3", MemberState.ONLINE, false, 55)
        );

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOperation().getType()).isEqualTo(OperationType.PROMOTE_PRIMARY);
        assertThat(decision.getOperation().getTargetNodeId()).isEqualTo("node-3");
    }

    @Test
    void promotionTieIsBrokenByRemovalMarkThenNodeId() {
        observe(
                member("node-1", MemberState.UNREACHABLE, false, 0),
                member("node-2", MemberState.ONLINE, false, 40),
                member("node-3", MemberState.ONLINE, false, 40)
        );

        assertThat(planner.plan(context).getOperation().getTargetNodeId()).isEqualTo("node-2");

        context.getMembers().get("node-2").setMarkedForRemoval(true);

        assertThat(planner.plan(context).getOperation().getTargetNodeId()).isEqualTo("node-3");
    }

    @Test
    void promotionIsDeferredWithoutOnlineMembers() {
        observe(member("node-1", MemberState.UNREACHABLE, false, 0), member("node-2", MemberState.OFFLINE, false, 40));

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOutcome()).isEqualTo(ReconciliationDecision.Outcome.DEFERRED);
    }

    @Test
    void primaryMarkedForRemovalIsSwitchedFirst() {
        context.getMembers().get("node-1").setMarkedForRemoval(true);
        observe(
                member("node-1", MemberState.ONLINE, true, 10),
                member("node-2", MemberState.ONLINE, false, 10),
                member("node-3", MemberState.ONLINE, false, 10)
        );

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOperation().getType()).isEqualTo(OperationType.SWITCH_PRIMARY);
        assertThat(decision.getOperation().getTargetNodeId()).isEqualTo("node-2");
        assertThat(decision.getTargetMembers()).containsExactly("node-2", "node-3");
    }

    @Test
    void primarySuccessorIsNotAnotherMemberBeingRemoved() {
        context.getMembers().get("node-1").setMarkedForRemoval(true);
        context.getMembers().get("node-2").setMarkedForRemoval(true);
        observe(
                member("node-1", MemberState.ONLINE, true, 100),
                member("node-2", MemberState.ONLINE, false, 100),
                member("node-3", MemberState.ONLINE, false, 50)
        );

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOperation().getType()).isEqualTo(OperationType.SWITCH_PRIMARY);
        assertThat(decision.getOperation().getTargetNodeId()).isEqualTo("node-3");
    }

    @Test
    void primarySuccessorFallsBackToMarkedMemberWhenNoOtherIsOnline() {
        context.getMembers().get("node-1").setMarkedForRemoval(true);
        context.getMembers().get("node-2").setMarkedForRemoval(true);
        observe(
                member("node-1", MemberState.ONLINE, true, 100),
                member("node-2", MemberState.ONLINE, false, 100),
                member("node-3", MemberState.RECOVERING, false, 50)
        );

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOperation().getType()).isEqualTo(OperationType.SWITCH_PRIMARY);
        assertThat(decision.getOperation().getTargetNodeId()).isEqualTo("node-2");
    }

    @Test
    void completeOutageRebootsFromMostAdvancedInstance() {
        formed("node-1", "node-2", "node-3");
        context.getStandaloneTransactionCounts().put("node-1", 40L);
        context.getStandaloneTransactionCounts().put("node-2", 42L);
        context.getStandaloneTransactionCounts().put("node-3", 42L);

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOutcome()).isEqualTo(ReconciliationDecision.Outcome.APPLY);
        assertThat(decision.getOperation().getType()).isEqualTo(OperationType.REBOOT_CLUSTER);
        assertThat(decision.getOperation().getTargetNodeId()).isEqualTo("node-2");
        assertThat(decision.getOperation().getTargetAddress()).isEqualTo("10.0.0.2");
    }

    @Test
    void completeOutageWaitsForEveryFormerMember() {
        formed("node-1", "node-2", "node-3");
        context.getStandaloneTransactionCounts().put("node-1", 40L);

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOutcome()).isEqualTo(ReconciliationDecision.Outcome.DEFERRED);
        assertThat(decision.getReason()).contains("node-2", "node-3");
    }

    @Test
    void pendingRecreationCreatesClusterEvenWhenMembersWereFormed() {
        formed("node-1", "node-2", "node-3");
        context.setRecreationPending(true);

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOperation().getType()).isEqualTo(OperationType.CREATE_CLUSTER);
    }

    @Test
    void incompleteRestoreBlocksReconciliation() {
        context.setRestoreFailure("backup 2024-01-01T00:00:00Z failed: disk full");

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOutcome()).isEqualTo(ReconciliationDecision.Outcome.BLOCKED);
        assertThat(decision.getReason()).contains("disk full", "recreate-cluster");
    }

    @Test
    void unreachableMemberIsRemovedWithForce() {
        context.getMembers().get("node-3").setMarkedForRemoval(true);
        observe(
                member("node-1", MemberState.ONLINE, true, 10),
                member("node-2", MemberState.ONLINE, false, 10),
                member("node-3", MemberState.UNREACHABLE, false, 0)
        );

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOperation().getType()).isEqualTo(OperationType.REMOVE_MEMBER);
        assertThat(decision.getOperation().getTargetNodeId()).isEqualTo("node-3");
        assertThat(decision.getOperation().isForce()).isTrue();
    }

    @Test
    void reachableMemberIsRemovedGracefully() {
        context.getMembers().get("node-3").setMarkedForRemoval(true);
        observe(
                member("node-1", MemberState.ONLINE, true, 10),
                member("node-2", MemberState.ONLINE, false, 10),
                member("node-3", MemberState.ONLINE, false, 10)
        );

        assertThat(planner.plan(context).getOperation().isForce()).isFalse();
    }

    @Test
    void lastMemberRemovalDissolvesCluster() {
        context.getMembers().remove("node-2");
        context.getMembers().remove("node-3");
        context.getMembers().get("node-1").setMarkedForRemoval(true);
        observe(member("node-1", MemberState.ONLINE, true, 10));

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOperation().getType()).isEqualTo(OperationType.DISSOLVE_CLUSTER);
        assertThat(decision.getTargetMembers()).isEmpty();
    }

    @Test
    void pendingRecreationDissolvesExistingCluster() {
        context.setRecreationPending(true);
        observe(member("node-1", MemberState.ONLINE, true, 10));

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOperation().getType()).isEqualTo(OperationType.DISSOLVE_CLUSTER);
        assertThat(decision.getOperation().getTargetNodeId()).isEqualTo("node-1");
    }

    @Test
    void promotionRequestSwitchesPrimary() {
        context.getPromotionRequests().add("node-3");
        observe(
                member("node-1", MemberState.ONLINE, true, 10),
                member("node-2", MemberState.ONLINE, false, 10),
                member("node-3", MemberState.ONLINE, false, 10)
        );

        ReconciliationDecision decision = planner.plan(context);

        assertThat(decision.getOperation().getType()).isEqualTo(OperationType.SWITCH_PRIMARY);
        assertThat(decision.getOperation().getTargetNodeId()).isEqualTo("node-3");
    }

    @Test
    void promotionRequestOfRecoveringMemberIsIgnored() {
        context.getPromotionRequests().add("node-3");
        observe(
                member("node-1", MemberState.ONLINE, true, 10),
                member("node-2", MemberState.ONLINE, false, 10),
                member("node-3", MemberState.RECOVERING, false, 2)
        );

        assertThat(planner.plan(context).getOutcome()).isEqualTo(ReconciliationDecision.Outcome.CONVERGED);
    }

    @Test
    void sameContextYieldsSameDecision() {
        observe(member("node-1", MemberState.ONLINE, true, 10));

        assertThat(planner.plan(context)).isEqualTo(planner.plan(context));
    }

    private void register(String nodeId) {
        context.getMembers().put(nodeId, PersistedMemberInfo.builder()
                .nodeId(nodeId)
                .address("10.0.0." + nodeId.substring(nodeId.length() - 1))
                .role(NodeRole.UNINITIALIZED)
                .build());
    }

    private void formed(String... nodeIds) {
        for (String nodeId : nodeIds) {
            context.getMembers().get(nodeId).setRole(NodeRole.UNREACHABLE);
        }
    }

    private void observe(ObservedMember... members) {
        ObservedClusterStatus status = ObservedClusterStatus.builder()
                .clusterExists(true)
                .clusterName("cluster-a")
                .build();
        status.getMembers().addAll(Arrays.asList(members));
        context.setObserved(status);
    }

    private ObservedMember member(String nodeId, MemberState state, boolean primary, long position) {
        return ObservedMember.builder()
                .nodeId(nodeId)
                .address("10.0.0." + nodeId.substring(nodeId.length() - 1) + ":3306")
                .state(state)
                .primary(primary)
                .appliedTransactionPosition(position)
                .build();
    }
}
