package com.grorchestrator.orchestration.service.impl;

import com.grorchestrator.orchestration.constant.PeerStateKeys;
import com.grorchestrator.orchestration.exception.ConflictingOperationException;
import com.grorchestrator.orchestration.exception.InvalidArgumentException;
import com.grorchestrator.orchestration.exception.PreconditionNotMetException;
import com.grorchestrator.orchestration.exception.TransientEngineException;
import com.grorchestrator.orchestration.model.ClusterStatusReport;
import com.grorchestrator.orchestration.model.MemberState;
import com.grorchestrator.orchestration.model.NodeRole;
import com.grorchestrator.orchestration.model.PreUpgradeCheckResult;
import com.grorchestrator.orchestration.model.clusterset.PromotionResult;
import com.grorchestrator.orchestration.testsupport.ClusterSimulation;
import com.grorchestrator.orchestration.testsupport.FakeClusterControlAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

class ClusterOperationsServiceImplTest {

    private ClusterSimulation simulation;
    private FakeClusterControlAdapter engine;

    @BeforeEach
    void setUp() {
        simulation = new ClusterSimulation();
        simulation.addNode("node-1", "10.0.0.1");
        simulation.addNode("node-2", "10.0.0.2");
        simulation.addNode("node-3", "10.0.0.3");
        simulation.setCoordinator("node-1");
        engine = simulation.getEngine();
        simulation.converge(10);
    }

    @Test
    void statusReportCombinesPeerStateAndEngineView() {
        engine.kill(simulation.node("node-3").getEndpoint());

        ClusterStatusReport report = simulation.node("node-2").getOperationsService().getClusterStatus(false);

        assertThat(report.getClusterName()).isEqualTo(ClusterSimulation.DEFAULT_CLUSTER_NAME);
        assertThat(report.getPrimaryNodeId()).isEqualTo("node-1");
        assertThat(report.getReportingNodeId()).isEqualTo("node-2");
        assertThat(report.getDomainId()).isNotBlank();
        assertThat(report.getMembers()).hasSize(3);
        assertThat(report.getMembers())
                .filteredOn(member -> member.getNodeId().equals("node-3"))
                .singleElement()
                .satisfies(member -> {
                    assertThat(member.getEngineState()).isEqualTo(MemberState.UNREACHABLE);
                    assertThat(member.getRole()).isEqualTo(NodeRole.MEMBER);
                });
        assertThat(report.getClusterSet()).isNull();
        assertThat(report.isMaintenance()).isFalse();
    }

    @Test
    void preUpgradeCheckKeepsLowestNodeAsPrimary() {
        PreUpgradeCheckResult result = simulation.node("node-1").getOperationsService().preUpgradeCheck();

        assertThat(result.isPrimarySwitched()).isFalse();
        assertThat(result.getPrimaryNodeId()).isEqualTo("node-1");
    }

    @Test
    void preUpgradeCheckSwitchesPrimaryToLowestNode() {
        simulation.setCoordinator("node-3");
        simulation.node("node-3").getOperationsService().promote("unit", false);
        assertThat(engine.getPrimaryNodeId()).isEqualTo("node-3");

        PreUpgradeCheckResult result = simulation.node("node-3").getOperationsService().preUpgradeCheck();

        assertThat(result.isPrimarySwitched()).isTrue();
        assertThat(result.getPrimaryNodeId()).isEqualTo("node-1");
        assertThat(engine.getPrimaryNodeId()).isEqualTo("node-1");
    }

    @Test
    void preUpgradeCheckFailsWhenMemberIsNotOnline() {
        engine.forceMemberState("node-2", MemberState.RECOVERING);

        assertThatThrownBy(() -> simulation.node("node-1").getOperationsService().preUpgradeCheck())
                .isInstanceOf(PreconditionNotMetException.class)
                .hasMessageContaining("node-2");
    }

    @Test
    void preUpgradeCheckIsCoordinatorOnly() {
        assertThatThrownBy(() -> simulation.node("node-2").getOperationsService().preUpgradeCheck())
                .isInstanceOf(PreconditionNotMetException.class);
    }

    @Test
    void promotionOfPrimaryIsNoOp() {
        PromotionResult result = simulation.node("node-1").getOperationsService().promote("UNIT", false);

        assertThat(result.isAlreadyPrimary()).isTrue();
        assertThat(engine.countCalls("setPrimary")).isZero();
    }

    @Test
    void coordinatorPromotesItselfDirectly() {
        simulation.setCoordinator("node-2");

        PromotionResult result = simulation.node("node-2").getOperationsService().promote("unit", false);

        assertThat(result.isAlreadyPrimary()).isFalse();
        assertThat(result.getPromotedNodeId()).isEqualTo("node-2");
        assertThat(engine.getPrimaryNodeId()).isEqualTo("node-2");
    }

    @Test
    void unknownPromotionScopeIsRejected() {
        assertThatThrownBy(() -> simulation.node("node-1").getOperationsService().promote("region", false))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("'unit' and 'cluster'");
    }

    @Test
    void recreateDissolvesClusterAndReconcilerBuildsItAgain() {
        String newName = simulation.node("node-1").getOperationsService().recreateCluster();

        assertThat(engine.isClusterPresent()).isFalse();
        assertThat(simulation.node("node-1").getCombinator().isClusterRecreationPending()).isTrue();
        assertThat(simulation.node("node-1").getCombinator().getMember("node-2").get().getRole()).isEqualTo(NodeRole.UNINITIALIZED);
        assertThat(simulation.getPeerStateStore().get(PeerStateKeys.MAINTENANCE_FLAG)).isEmpty();

        simulation.converge(10);

        assertThat(engine.getClusterName()).isEqualTo(newName);
        assertThat(engine.getMemberIds()).containsExactlyInAnyOrder("node-1", "node-2", "node-3");
        assertThat(simulation.node("node-1").getCombinator().isClusterRecreationPending()).isFalse();
    }

    @Test
    void interruptedRecreateIsFinishedByReconciler() {
        engine.kill(simulation.node("node-1").getEndpoint());

        assertThatThrownBy(() -> simulation.node("node-1").getOperationsService().recreateCluster())
                .isInstanceOf(TransientEngineException.class);
        assertThat(engine.isClusterPresent()).isTrue();
        assertThat(simulation.node("node-1").getCombinator().isClusterRecreationPending()).isTrue();
        assertThat(simulation.getPeerStateStore().get(PeerStateKeys.MAINTENANCE_FLAG)).isEmpty();

        engine.revive(simulation.node("node-1").getEndpoint());
        simulation.converge(10);

        assertThat(engine.countCalls("dissolveCluster")).isEqualTo(1);
        assertThat(engine.getClusterName()).isEqualTo(simulation.node("node-1").getCombinator().getClusterName().orElseThrow());
        assertThat(engine.getMemberIds()).containsExactlyInAnyOrder("node-1", "node-2", "node-3");
    }

    @Test
    void recreateIsRejectedWhileBackupIsRunning() {
        when(simulation.node("node-1").getBackupRestoreCoordinator().isBackupInProgress()).thenReturn(true);

        assertThatThrownBy(() -> simulation.node("node-1").getOperationsService().recreateCluster())
                .isInstanceOf(ConflictingOperationException.class);
        assertThat(engine.isClusterPresent()).isTrue();
    }

    @Test
    void recreateIsRejectedWhileMaintenanceIsInProgress() {
        simulation.getPeerStateStore().put(PeerStateKeys.MAINTENANCE_FLAG, "restore");

        assertThatThrownBy(() -> simulation.node("node-1").getOperationsService().recreateCluster())
                .isInstanceOf(ConflictingOperationException.class);
        assertThat(simulation.getPeerStateStore().get(PeerStateKeys.MAINTENANCE_FLAG)).isPresent();
    }
}
