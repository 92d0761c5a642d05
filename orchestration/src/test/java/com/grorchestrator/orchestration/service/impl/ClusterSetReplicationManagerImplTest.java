package com.grorchestrator.orchestration.service.impl;

import com.grorchestrator.orchestration.constant.PeerStateKeys;
import com.grorchestrator.orchestration.exception.ConflictingOperationException;
import com.grorchestrator.orchestration.exception.InvalidArgumentException;
import com.grorchestrator.orchestration.exception.NotFoundException;
import com.grorchestrator.orchestration.exception.OperatorPreconditionException;
import com.grorchestrator.orchestration.exception.PreconditionNotMetException;
import com.grorchestrator.orchestration.model.clusterset.ClusterSetMemberStatus;
import com.grorchestrator.orchestration.model.clusterset.ClusterSetRole;
import com.grorchestrator.orchestration.model.clusterset.ClusterSetStatus;
import com.grorchestrator.orchestration.model.clusterset.LinkResult;
import com.grorchestrator.orchestration.model.clusterset.PromotionResult;
import com.grorchestrator.orchestration.model.clusterset.ReplicationHandle;
import com.grorchestrator.orchestration.testsupport.ClusterSimulation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClusterSetReplicationManagerImplTest {
    private static final String SOURCE_A = "3e11fa47-71ca-11e1-9e33-c80aa9429562";
    private static final String SOURCE_B = "8a94f357-aab4-11df-86ab-c80aa9429562";

    private ClusterSimulation east;
    private ClusterSimulation west;

    @BeforeEach
    void setUp() {
        east = new ClusterSimulation("east");
        east.addNode("east-1", "10.1.0.1");
        east.setCoordinator("east-1");
        east.converge(10);

        west = new ClusterSimulation("west");
        west.addNode("west-1", "10.2.0.1");
        west.setCoordinator("west-1");
        west.converge(10);
    }

    @Test
    void offerCreatesClusterSetAndPublishesHandle() {
        ReplicationHandle handle = east.node("east-1").getReplicationManager().offer("west");

        assertThat(handle.getPrimaryClusterName()).isEqualTo("east");
        assertThat(handle.getReplicaClusterName()).isEqualTo("west");
        assertThat(handle.getPrimaryEndpoint()).isEqualTo("10.1.0.1:3306");
        assertThat(handle.getAdminUser()).isEqualTo("clusteradmin");
        assertThat(handle.getAdminPassword()).isEqualTo(east.node("east-1").getCredentialManager().get("clusteradmin").getValue());
        assertThat(handle.getDomainId()).isEqualTo(east.node("east-1").getCombinator().getDomainId().orElseThrow());
        assertThat(east.node("east-1").getCombinator().getClusterSetRole()).contains(ClusterSetRole.PRIMARY);
        assertThat(east.node("east-1").getCombinator().getReplicationOffer("west")).contains(handle);
        assertThat(east.getEngine().getClusterSetStatus().getPrimaryClusterName()).isEqualTo("east");
    }

    @Test
    void offerToItselfIsRejected() {
        assertThatThrownBy(() -> east.node("east-1").getReplicationManager().offer("east"))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void offerWithInvalidNameIsRejected() {
        assertThatThrownBy(() -> east.node("east-1").getReplicationManager().offer("west cluster"))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void linkWithDivergedTransactionsIsRejected() {
        ReplicationHandle handle = east.node("east-1").getReplicationManager().offer("west");
        west.getEngine().setGtidSet(handle.getPrimaryEndpoint(), SOURCE_A + ":1-100");
        west.getEngine().setGtidSet("10.2.0.1:3306", SOURCE_A + ":1-50," + SOURCE_B + ":1-3");

        assertThatThrownBy(() -> west.node("west-1").getReplicationManager().link(handle))
                .isInstanceOf(ConflictingOperationException.class)
                .hasMessageContaining("Dissolve this cluster");

        assertThat(west.node("west-1").getCombinator().getClusterSetName()).isEmpty();
        assertThat(west.getEngine().countCalls("createReplicaCluster")).isZero();
    }

    @Test
    void linkAttachesReplicaAndIsIdempotent() {
        ReplicationHandle handle = east.node("east-1").getReplicationManager().offer("west");
        west.getEngine().setGtidSet(handle.getPrimaryEndpoint(), SOURCE_A + ":1-100");
        west.getEngine().setGtidSet("10.2.0.1:3306", SOURCE_A + ":1-50");

        LinkResult first = west.node("west-1").getReplicationManager().link(handle);
        LinkResult second = west.node("west-1").getReplicationManager().link(handle);

        assertThat(first.isAlreadyLinked()).isFalse();
        assertThat(first.getPrimaryClusterName()).isEqualTo("east");
        assertThat(second.isAlreadyLinked()).isTrue();
        assertThat(west.getEngine().countCalls("createReplicaCluster")).isEqualTo(1);
        assertThat(west.node("west-1").getCombinator().getClusterSetRole()).contains(ClusterSetRole.REPLICA);
        assertThat(west.node("west-1").getCombinator().getDomainId()).contains(handle.getDomainId());
    }

    @Test
    void linkDissolvesLocalClusterBeforeCreatingReplica() {
        west.addNode("west-2", "10.2.0.2");
        west.converge(10);
        ReplicationHandle handle = east.node("east-1").getReplicationManager().offer("west");

        west.node("west-1").getReplicationManager().link(handle);

        assertThat(west.getEngine().getMutatingCalls()).containsSubsequence("addInstance west-2", "dissolveCluster", "createReplicaCluster west");
        assertThat(west.getEngine().getClusterName()).isEqualTo("west");
        assertThat(west.getEngine().getPrimaryNodeId()).isEqualTo("west-1");
        assertThat(west.getPeerStateStore().get(PeerStateKeys.MAINTENANCE_FLAG)).isEmpty();

        west.converge(10);

        assertThat(west.getEngine().getMemberIds()).containsExactlyInAnyOrder("west-1", "west-2");
        assertThat(west.getEngine().countCalls("addInstance west-2")).isEqualTo(2);
    }

    @Test
    void linkIsRejectedWhileMaintenanceIsInProgress() {
        ReplicationHandle handle = east.node("east-1").getReplicationManager().offer("west");
        west.node("west-1").getCombinator().acquireMaintenanceFlag("restore of backup 2024-01-01T00:00:00Z");

        assertThatThrownBy(() -> west.node("west-1").getReplicationManager().link(handle))
                .isInstanceOf(ConflictingOperationException.class)
                .hasMessageContaining("restore of backup");
        assertThat(west.getEngine().countCalls("dissolveCluster")).isZero();
    }

    @Test
    void linkOfferedToAnotherClusterIsRejected() {
        ReplicationHandle handle = east.node("east-1").getReplicationManager().offer("north");

        assertThatThrownBy(() -> west.node("west-1").getReplicationManager().link(handle))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void promoteWithoutClusterSetFails() {
        assertThatThrownBy(() -> west.node("west-1").getReplicationManager().promoteCluster(false))
                .isInstanceOf(PreconditionNotMetException.class);
    }

    @Test
    void promoteSwitchesPrimaryClusterWhenOldPrimaryIsReachable() {
        west.getEngine().setClusterSetStatus(clusterSet("OK"));

        PromotionResult result = west.node("west-1").getReplicationManager().promoteCluster(false);

        assertThat(result.isForced()).isFalse();
        assertThat(result.getPromotedClusterName()).isEqualTo("west");
        assertThat(west.getEngine().countCalls("setPrimaryCluster west")).isEqualTo(1);
        assertThat(west.node("west-1").getCombinator().getClusterSetRole()).contains(ClusterSetRole.PRIMARY);
    }

    @Test
    void promoteRequiresForceWhenOldPrimaryIsUnreachable() {
        west.getEngine().setClusterSetStatus(clusterSet("NOT_OK"));

        assertThatThrownBy(() -> west.node("west-1").getReplicationManager().promoteCluster(false))
                .isInstanceOf(OperatorPreconditionException.class);

        PromotionResult result = west.node("west-1").getReplicationManager().promoteCluster(true);

        assertThat(result.isForced()).isTrue();
        assertThat(result.isRequiresManualVerification()).isTrue();
        assertThat(west.getEngine().countCalls("forcePrimaryCluster west")).isEqualTo(1);
    }

    @Test
    void promoteOfPrimaryClusterIsNoOp() {
        east.node("east-1").getReplicationManager().offer("west");

        PromotionResult result = east.node("east-1").getReplicationManager().promoteCluster(false);

        assertThat(result.isAlreadyPrimary()).isTrue();
    }

    @Test
    void rejoinOfUnknownClusterFails() {
        west.getEngine().setClusterSetStatus(clusterSet("OK"));

        assertThatThrownBy(() -> west.node("west-1").getReplicationManager().rejoinCluster("north"))
                .isInstanceOf(NotFoundException.class);

        west.node("west-1").getReplicationManager().rejoinCluster("east");
        assertThat(west.getEngine().countCalls("rejoinClusterToSet east")).isEqualTo(1);
    }

    private ClusterSetStatus clusterSet(String primaryGlobalStatus) {
        List<ClusterSetMemberStatus> clusters = new ArrayList<>();
        clusters.add(ClusterSetMemberStatus.builder().clusterName("east").role(ClusterSetRole.PRIMARY).globalStatus(primaryGlobalStatus).build());
        clusters.add(ClusterSetMemberStatus.builder().clusterName("west").role(ClusterSetRole.REPLICA).globalStatus("OK").build());
        return ClusterSetStatus.builder()
                .clusterSetName("global")
                .primaryClusterName("east")
                .clusters(clusters)
                .build();
    }
}
