package com.grorchestrator.orchestration.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.grorchestrator.configuration.producers.FilesPathsProducer;
import com.grorchestrator.configuration.properties.predefined.BackupProperties;
import com.grorchestrator.configuration.properties.predefined.ClusterProperties;
import com.grorchestrator.configuration.properties.predefined.OrchestrationProperties;
import com.grorchestrator.orchestration.adapter.api.ClusterControlAdapter;
import com.grorchestrator.orchestration.adapter.api.ObjectStorageAdapter;
import com.grorchestrator.orchestration.adapter.api.SnapshotToolAdapter;
import com.grorchestrator.orchestration.constant.PeerStateKeys;
import com.grorchestrator.orchestration.exception.*;
import com.grorchestrator.orchestration.model.Credential;
import com.grorchestrator.orchestration.model.MemberState;
import com.grorchestrator.orchestration.model.ObservedClusterStatus;
import com.grorchestrator.orchestration.model.ObservedMember;
import com.grorchestrator.orchestration.model.backup.BackupInfo;
import com.grorchestrator.orchestration.model.backup.BackupStatus;
import com.grorchestrator.orchestration.model.backup.RestoreResult;
import com.grorchestrator.orchestration.model.backup.SnapshotStream;
import com.grorchestrator.orchestration.service.api.CredentialManager;
import com.grorchestrator.orchestration.testsupport.BeanWiring;
import com.grorchestrator.orchestration.testsupport.InMemoryPeerStateStore;
import com.grorchestrator.orchestration.testsupport.SettableCoordinationAuthority;
import com.grorchestrator.orchestration.util.ClusterTopologyResolver;
import com.grorchestrator.orchestration.util.EngineCallExecutor;
import com.grorchestrator.orchestration.util.PeerStateFunctionalityCombinator;
import com.grorchestrator.orchestration.util.ReconciliationPassLock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class BackupRestoreCoordinatorImplTest {
    private static final Instant NOW = Instant.parse("2024-05-02T10:00:00Z");
    private static final String SELF_ENDPOINT = "10.0.0.1:3306";
    private static final String PRIMARY_ENDPOINT = "10.0.0.2:3306";

    @TempDir
    Path tempDir;

    private final InMemoryPeerStateStore peerStateStore = new InMemoryPeerStateStore();
    private final ClusterTopologyResolver clusterTopologyResolver = mock(ClusterTopologyResolver.class);
    private final ClusterControlAdapter clusterControlAdapter = mock(ClusterControlAdapter.class);
    private final ObjectStorageAdapter objectStorageAdapter = mock(ObjectStorageAdapter.class);
    private final SnapshotToolAdapter snapshotToolAdapter = mock(SnapshotToolAdapter.class);
    private final CredentialManager credentialManager = mock(CredentialManager.class);
    private final BackupProperties backupProperties = mock(BackupProperties.class);
    private final ClusterProperties clusterProperties = mock(ClusterProperties.class);
    private final FilesPathsProducer filesPathsProducer = mock(FilesPathsProducer.class);

    private PeerStateFunctionalityCombinator combinator;
    private BackupRestoreCoordinatorImpl coordinator;

    @BeforeEach
    void setUp() {
        when(clusterProperties.nodeId()).thenReturn("node-1");
        when(clusterProperties.maxMembers()).thenReturn(9);
        when(backupProperties.enabled()).thenReturn(true);
        when(backupProperties.staleAfter()).thenReturn(Duration.ofHours(1));
        BackupProperties.S3BackupProperties s3 = mock(BackupProperties.S3BackupProperties.class);
        when(s3.path()).thenReturn("backups");
        when(backupProperties.s3()).thenReturn(s3);
        when(filesPathsProducer.getBackupWorkDirectoryPath()).thenReturn(tempDir.resolve("backup").toString());
        when(filesPathsProducer.getRestoreWorkDirectoryPath()).thenReturn(tempDir.resolve("restore").toString());
        when(clusterTopologyResolver.getSelfEndpoint()).thenReturn(SELF_ENDPOINT);

        OrchestrationProperties orchestrationProperties = mock(OrchestrationProperties.class);
        OrchestrationProperties.EngineRetryProperties retry = mock(OrchestrationProperties.EngineRetryProperties.class);
        when(retry.attempts()).thenReturn(1);
        when(retry.initialBackoff()).thenReturn(Duration.ZERO);
        when(retry.maxBackoff()).thenReturn(Duration.ZERO);
        when(orchestrationProperties.engineRetry()).thenReturn(retry);

        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        combinator = BeanWiring.wire(
                new PeerStateFunctionalityCombinator(),
                peerStateStore, new SettableCoordinationAuthority("node-1", new AtomicReference<>("node-1")), clusterProperties, objectMapper
        );
        EngineCallExecutor engineCallExecutor = BeanWiring.wire(new EngineCallExecutor(), orchestrationProperties);

        coordinator = BeanWiring.wire(
                new BackupRestoreCoordinatorImpl(),
                combinator, clusterTopologyResolver, clusterControlAdapter, objectStorageAdapter, snapshotToolAdapter, credentialManager,
                new ReconciliationPassLock(), engineCallExecutor, backupProperties, clusterProperties, filesPathsProducer, objectMapper
        );
        coordinator.clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Test
    void restoreIsRejectedWhileBackupIsRunningOnAnotherNode() {
        saveBackup("2024-05-01T10:00:00Z", BackupStatus.COMPLETED, "node-2", NOW.minus(Duration.ofDays(1)));
        saveBackup("2024-05-02T09:50:00Z", BackupStatus.IN_PROGRESS, "node-2", NOW.minus(Duration.ofMinutes(10)));

        assertThatThrownBy(() -> coordinator.restore("2024-05-01T10:00:00Z", null))
                .isInstanceOf(ConflictingOperationException.class)
                .hasMessageContaining("2024-05-02T09:50:00Z");

        verifyNoInteractions(snapshotToolAdapter);
        assertThat(combinator.isClusterRecreationPending()).isFalse();
    }

    @Test
    void staleInProgressRecordDoesNotBlockRestore() {
        saveBackup("2024-05-01T10:00:00Z", BackupStatus.COMPLETED, "node-2", NOW.minus(Duration.ofDays(1)));
        saveBackup("2024-05-02T07:00:00Z", BackupStatus.IN_PROGRESS, "node-2", NOW.minus(Duration.ofHours(3)));
        when(clusterTopologyResolver.observe()).thenReturn(ObservedClusterStatus.noCluster());
        when(objectStorageAdapter.download(anyString())).thenReturn(new ByteArrayInputStream(new byte[0]));

        RestoreResult result = coordinator.restore("2024-05-01T10:00:00Z", null);

        assertThat(result.getBackupId()).isEqualTo("2024-05-01T10:00:00Z");
    }

    @Test
    void restoreDissolvesClusterAndMarksItForRecreation() {
        saveBackup("2024-05-01T10:00:00Z", BackupStatus.COMPLETED, "node-2", NOW.minus(Duration.ofDays(1)));
        when(clusterTopologyResolver.observe()).thenReturn(clusterWithPrimary());
        when(objectStorageAdapter.download("backups/2024-05-01T10:00:00Z")).thenReturn(new ByteArrayInputStream("snapshot".getBytes(StandardCharsets.UTF_8)));

        RestoreResult result = coordinator.restore("2024-05-01T10:00:00Z", null);

        assertThat(result.getClusterName()).isEqualTo("cluster-a");
        assertThat(result.getRestoredToTime()).isEqualTo(NOW.minus(Duration.ofDays(1)));
        verify(clusterControlAdapter).dissolveCluster(PRIMARY_ENDPOINT);
        verify(snapshotToolAdapter).restoreSnapshot(any(), any(), any());
        verify(snapshotToolAdapter, never()).recoverToPointInTime(any(), any(), any(), any(), any());
        assertThat(combinator.isClusterRecreationPending()).isTrue();
        assertThat(combinator.getClusterName()).contains("cluster-a");
        assertThat(peerStateStore.get(PeerStateKeys.MAINTENANCE_FLAG)).isEmpty();
    }

    @Test
    void pointInTimeRestoreReplaysBinaryLogs() {
        saveBackup("2024-05-01T10:00:00Z", BackupStatus.COMPLETED, "node-2", NOW.minus(Duration.ofDays(1)));
        when(clusterTopologyResolver.observe()).thenReturn(ObservedClusterStatus.noCluster());
        when(objectStorageAdapter.download(anyString())).thenReturn(new ByteArrayInputStream(new byte[0]));
        when(credentialManager.get("root")).thenReturn(Credential.builder().name("root").value("rootpw").version(1).appliedVersion(1).build());

        RestoreResult result = coordinator.restore("2024-05-01T10:00:00Z", "2024-05-02T08:00:00Z");

        assertThat(result.getRestoredToTime()).isEqualTo(Instant.parse("2024-05-02T08:00:00Z"));
        verify(snapshotToolAdapter).recoverToPointInTime(eq(Instant.parse("2024-05-02T08:00:00Z")), eq("root"), eq("rootpw"), any(), any());
    }

    @Test
    void pointInTimeBeforeBackupIsRejected() {
        saveBackup("2024-05-01T10:00:00Z", BackupStatus.COMPLETED, "node-2", NOW.minus(Duration.ofDays(1)));

        assertThatThrownBy(() -> coordinator.restore("2024-05-01T10:00:00Z", "2024-04-30T00:00:00Z"))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> coordinator.restore("2024-05-01T10:00:00Z", "yesterday"))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void restoreValidatesBackup() {
        saveBackup("2024-05-01T10:00:00Z", BackupStatus.FAILED, "node-2", NOW.minus(Duration.ofDays(1)));

        assertThatThrownBy(() -> coordinator.restore("not-a-backup", null)).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> coordinator.restore("2023-01-01T00:00:00Z", null)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> coordinator.restore("2024-05-01T10:00:00Z", null)).isInstanceOf(PreconditionNotMetException.class);
    }

    @Test
    void restoreIsRejectedWhenMaintenanceIsInProgress() {
        saveBackup("2024-05-01T10:00:00Z", BackupStatus.COMPLETED, "node-2", NOW.minus(Duration.ofDays(1)));
        peerStateStore.put(PeerStateKeys.MAINTENANCE_FLAG, "recreate cluster");

        assertThatThrownBy(() -> coordinator.restore("2024-05-01T10:00:00Z", null))
                .isInstanceOf(ConflictingOperationException.class)
                .hasMessageContaining("recreate cluster");
    }

    @Test
    void restoreIsRejectedWhileMemberIsRecovering() {
        saveBackup("2024-05-01T10:00:00Z", BackupStatus.COMPLETED, "node-2", NOW.minus(Duration.ofDays(1)));
        ObservedClusterStatus status = clusterWithPrimary();
        status.getMembers().add(ObservedMember.builder().nodeId("node-3").address("10.0.0.3:3306").state(MemberState.RECOVERING).build());
        when(clusterTopologyResolver.observe()).thenReturn(status);

        assertThatThrownBy(() -> coordinator.restore("2024-05-01T10:00:00Z", null))
                .isInstanceOf(ConflictingOperationException.class)
                .hasMessageContaining("node-3");

        verify(clusterControlAdapter, never()).dissolveCluster(anyString());
        verifyNoInteractions(snapshotToolAdapter);
    }

    @Test
    void restoreIsRejectedWhileMemberIsWaitingToJoin() {
        saveBackup("2024-05-01T10:00:00Z", BackupStatus.COMPLETED, "node-2", NOW.minus(Duration.ofDays(1)));
        combinator.registerMember("node-1", SELF_ENDPOINT);
        combinator.registerMember("node-2", PRIMARY_ENDPOINT);
        combinator.registerMember("node-3", "10.0.0.3:3306");
        when(clusterTopologyResolver.observe()).thenReturn(clusterWithPrimary());

        assertThatThrownBy(() -> coordinator.restore("2024-05-01T10:00:00Z", null))
                .isInstanceOf(ConflictingOperationException.class)
                .hasMessageContaining("node-3");

        verify(clusterControlAdapter, never()).dissolveCluster(anyString());
    }

    @Test
    void restoreIsRejectedWhileMemberIsBeingRemoved() {
        saveBackup("2024-05-01T10:00:00Z", BackupStatus.COMPLETED, "node-2", NOW.minus(Duration.ofDays(1)));
        combinator.registerMember("node-1", SELF_ENDPOINT);
        combinator.registerMember("node-2", PRIMARY_ENDPOINT);
        combinator.markMemberForRemoval("node-2");
        when(clusterTopologyResolver.observe()).thenReturn(clusterWithPrimary());

        assertThatThrownBy(() -> coordinator.restore("2024-05-01T10:00:00Z", null))
                .isInstanceOf(ConflictingOperationException.class)
                .hasMessageContaining("node-2");

        verify(clusterControlAdapter, never()).dissolveCluster(anyString());
    }

    @Test
    void failedRestoreKeepsClusterFromBeingCreatedAgain() {
        saveBackup("2024-05-01T10:00:00Z", BackupStatus.COMPLETED, "node-2", NOW.minus(Duration.ofDays(1)));
        when(clusterTopologyResolver.observe()).thenReturn(clusterWithPrimary());
        when(objectStorageAdapter.download(anyString())).thenReturn(new ByteArrayInputStream(new byte[0]));
        doThrow(new SnapshotToolException("xbstream exited with code 2")).when(snapshotToolAdapter).restoreSnapshot(any(), any(), any());

        assertThatThrownBy(() -> coordinator.restore("2024-05-01T10:00:00Z", null))
                .isInstanceOf(SnapshotToolException.class);

        verify(clusterControlAdapter).dissolveCluster(PRIMARY_ENDPOINT);
        assertThat(combinator.isClusterRecreationPending()).isFalse();
        assertThat(combinator.getIncompleteRestore()).hasValueSatisfying(detail -> assertThat(detail).contains("2024-05-01T10:00:00Z", "code 2"));
        assertThat(peerStateStore.get(PeerStateKeys.MAINTENANCE_FLAG)).isEmpty();
    }

    @Test
    void successfulRestoreClearsIncompleteRestore() {
        saveBackup("2024-05-01T10:00:00Z", BackupStatus.COMPLETED, "node-2", NOW.minus(Duration.ofDays(1)));
        combinator.markRestoreFailed("2024-05-01T10:00:00Z", "disk full");
        when(clusterTopologyResolver.observe()).thenReturn(ObservedClusterStatus.noCluster());
        when(objectStorageAdapter.download(anyString())).thenReturn(new ByteArrayInputStream(new byte[0]));

        coordinator.restore("2024-05-01T10:00:00Z", null);

        assertThat(combinator.getIncompleteRestore()).isEmpty();
        assertThat(combinator.isClusterRecreationPending()).isTrue();
    }

    @Test
    void backupOfSingleMemberClusterKeepsItInService() {
        ObservedClusterStatus status = ObservedClusterStatus.builder()
                .clusterExists(true)
                .clusterName("cluster-a")
                .build();
        ObservedMember self = ObservedMember.builder().nodeId("node-1").address(SELF_ENDPOINT).state(MemberState.ONLINE).primary(true).build();
        status.getMembers().add(self);
        when(clusterTopologyResolver.observe()).thenReturn(status);
        when(clusterTopologyResolver.resolvePrimary(any())).thenReturn(self);
        when(credentialManager.get("backups")).thenReturn(Credential.builder().name("backups").value("backuppw").version(1).appliedVersion(1).build());
        when(snapshotToolAdapter.startBackup(eq("backups"), eq("backuppw"), any(), any()))
                .thenReturn(SnapshotStream.builder().inputStream(new ByteArrayInputStream("data".getBytes(StandardCharsets.UTF_8))).build());

        BackupInfo backup = coordinator.createBackup();

        assertThat(backup.getStatus()).isEqualTo(BackupStatus.COMPLETED);
        verify(clusterControlAdapter, never()).setOfflineMode(anyString(), anyBoolean());
        verify(clusterControlAdapter, never()).setInstanceHidden(anyString(), anyString(), anyBoolean());
    }

    @Test
    void backupFromSecondaryIsUploaded() {
        when(clusterTopologyResolver.observe()).thenReturn(clusterWithPrimary());
        when(clusterTopologyResolver.resolvePrimary(any())).thenReturn(primary());
        when(credentialManager.get("backups")).thenReturn(Credential.builder().name("backups").value("backuppw").version(1).appliedVersion(1).build());
        when(snapshotToolAdapter.startBackup(eq("backups"), eq("backuppw"), any(), any()))
                .thenReturn(SnapshotStream.builder().inputStream(new ByteArrayInputStream("data".getBytes(StandardCharsets.UTF_8))).build());

        BackupInfo backup = coordinator.createBackup();

        assertThat(backup.getBackupId()).isEqualTo("2024-05-02T10:00:00Z");
        assertThat(backup.getStatus()).isEqualTo(BackupStatus.COMPLETED);
        assertThat(backup.getLocation()).isEqualTo("backups/2024-05-02T10:00:00Z");
        assertThat(combinator.getBackup("2024-05-02T10:00:00Z").map(BackupInfo::getStatus)).contains(BackupStatus.COMPLETED);
        verify(objectStorageAdapter).uploadStream(eq("backups/2024-05-02T10:00:00Z"), any());
        verify(objectStorageAdapter).uploadContent(eq("backups/2024-05-02T10:00:00Z.metadata"), anyString());
        verify(clusterControlAdapter).setInstanceHidden(PRIMARY_ENDPOINT, SELF_ENDPOINT, true);
        verify(clusterControlAdapter).setInstanceHidden(PRIMARY_ENDPOINT, SELF_ENDPOINT, false);
        assertThat(coordinator.isBackupInProgress()).isFalse();
    }

    @Test
    void failedSnapshotReturnsInstanceToService() {
        when(clusterTopologyResolver.observe()).thenReturn(clusterWithPrimary());
        when(clusterTopologyResolver.resolvePrimary(any())).thenReturn(primary());
        when(credentialManager.get("backups")).thenReturn(Credential.builder().name("backups").value("backuppw").version(1).appliedVersion(1).build());
        when(snapshotToolAdapter.startBackup(any(), any(), any(), any())).thenThrow(new SnapshotToolException("xtrabackup exited with code 1"));

        BackupInfo backup = coordinator.createBackup();

        assertThat(backup.getStatus()).isEqualTo(BackupStatus.FAILED);
        assertThat(backup.getMessage()).contains("exited with code 1");
        verify(clusterControlAdapter).setOfflineMode(SELF_ENDPOINT, false);
        verify(clusterControlAdapter).setInstanceHidden(PRIMARY_ENDPOINT, SELF_ENDPOINT, false);
    }

    @Test
    void backupFromPrimaryIsRejectedWhileSecondaryIsOnline() {
        ObservedClusterStatus status = clusterWithPrimary();
        status.getMembers().forEach(member -> member.setPrimary(member.getNodeId().equals("node-1")));
        when(clusterTopologyResolver.observe()).thenReturn(status);

        assertThatThrownBy(() -> coordinator.createBackup())
                .isInstanceOf(PreconditionNotMetException.class)
                .hasMessageContaining("node-2");
    }

    @Test
    void backupIsRejectedWhenDisabled() {
        when(backupProperties.enabled()).thenReturn(false);

        assertThatThrownBy(() -> coordinator.createBackup()).isInstanceOf(PreconditionNotMetException.class);
    }

    @Test
    void staleBackupsAreMarkedFailed() {
        saveBackup("2024-05-02T07:00:00Z", BackupStatus.IN_PROGRESS, "node-2", NOW.minus(Duration.ofHours(3)));
        saveBackup("2024-05-02T09:50:00Z", BackupStatus.IN_PROGRESS, "node-3", NOW.minus(Duration.ofMinutes(10)));

        int marked = coordinator.markStaleBackupsFailed();

        assertThat(marked).isEqualTo(1);
        assertThat(combinator.getBackup("2024-05-02T07:00:00Z").map(BackupInfo::getStatus)).contains(BackupStatus.FAILED);
        assertThat(combinator.getBackup("2024-05-02T09:50:00Z").map(BackupInfo::getStatus)).contains(BackupStatus.IN_PROGRESS);
    }

    @Test
    void onlyInProgressBackupCanBeAbandoned() {
        saveBackup("2024-05-02T09:50:00Z", BackupStatus.IN_PROGRESS, "node-2", NOW.minus(Duration.ofMinutes(10)));
        saveBackup("2024-05-01T10:00:00Z", BackupStatus.COMPLETED, "node-2", NOW.minus(Duration.ofDays(1)));

        BackupInfo abandoned = coordinator.abandonBackup("2024-05-02T09:50:00Z");

        assertThat(abandoned.getStatus()).isEqualTo(BackupStatus.FAILED);
        assertThat(abandoned.getMessage()).isEqualTo("abandoned by operator");
        assertThatThrownBy(() -> coordinator.abandonBackup("2024-05-01T10:00:00Z")).isInstanceOf(PreconditionNotMetException.class);
    }

    @Test
    void listingMergesObjectStorageAndPeerState() throws Exception {
        BackupInfo stored = BackupInfo.builder()
                .backupId("2024-04-01T00:00:00Z")
                .status(BackupStatus.COMPLETED)
                .nodeId("node-9")
                .startedAt(Instant.parse("2024-04-01T00:00:00Z"))
                .completedAt(Instant.parse("2024-04-01T00:10:00Z"))
                .build();
        when(objectStorageAdapter.listKeys("backups/")).thenReturn(List.of("backups/2024-04-01T00:00:00Z", "backups/2024-04-01T00:00:00Z.metadata"));
        when(objectStorageAdapter.readContent("backups/2024-04-01T00:00:00Z.metadata"))
                .thenReturn(new ObjectMapper().findAndRegisterModules().writeValueAsString(stored));
        saveBackup("2024-05-02T09:50:00Z", BackupStatus.IN_PROGRESS, "node-2", NOW.minus(Duration.ofMinutes(10)));

        List<BackupInfo> backups = coordinator.listBackups();

        assertThat(backups).extracting(BackupInfo::getBackupId).containsExactly("2024-04-01T00:00:00Z", "2024-05-02T09:50:00Z");
    }

    private void saveBackup(String backupId, BackupStatus status, String nodeId, Instant startedAt) {
        combinator.saveBackup(BackupInfo.builder()
                .backupId(backupId)
                .status(status)
                .nodeId(nodeId)
                .clusterName("cluster-a")
                .startedAt(startedAt)
                .completedAt(BackupStatus.IN_PROGRESS.equals(status) ? null : startedAt)
                .location("backups/" + backupId)
                .build());
    }

    private ObservedMember primary() {
        return ObservedMember.builder().nodeId("node-2").address(PRIMARY_ENDPOINT).state(MemberState.ONLINE).primary(true).build();
    }

    private ObservedClusterStatus clusterWithPrimary() {
        ObservedClusterStatus status = ObservedClusterStatus.builder()
                .clusterExists(true)
                .clusterName("cluster-a")
                .build();
        status.getMembers().add(ObservedMember.builder().nodeId("node-1").address(SELF_ENDPOINT).state(MemberState.ONLINE).build());
        status.getMembers().add(primary());
        return status;
    }
}
