package com.grorchestrator.orchestration.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grorchestrator.configuration.producers.FilesPathsProducer;
import com.grorchestrator.configuration.properties.predefined.BackupProperties;
import com.grorchestrator.configuration.properties.predefined.ClusterProperties;
import com.grorchestrator.orchestration.adapter.api.ClusterControlAdapter;
import com.grorchestrator.orchestration.adapter.api.ObjectStorageAdapter;
import com.grorchestrator.orchestration.adapter.api.SnapshotToolAdapter;
import com.grorchestrator.orchestration.constant.BackupConstants;
import com.grorchestrator.orchestration.exception.*;
import com.grorchestrator.orchestration.model.MemberState;
import com.grorchestrator.orchestration.model.ObservedClusterStatus;
import com.grorchestrator.orchestration.model.ObservedMember;
import com.grorchestrator.orchestration.model.SystemAccount;
import com.grorchestrator.orchestration.model.backup.BackupInfo;
import com.grorchestrator.orchestration.model.backup.BackupStatus;
import com.grorchestrator.orchestration.model.backup.RestoreResult;
import com.grorchestrator.orchestration.model.backup.SnapshotStream;
import com.grorchestrator.orchestration.model.peerstate.MaintenanceFlag;
import com.grorchestrator.orchestration.model.peerstate.PersistedMemberInfo;
import com.grorchestrator.orchestration.service.api.BackupRestoreCoordinator;
import com.grorchestrator.orchestration.service.api.CredentialManager;
import com.grorchestrator.orchestration.util.ClusterTopologyResolver;
import com.grorchestrator.orchestration.util.EngineCallExecutor;
import com.grorchestrator.orchestration.util.PeerStateFunctionalityCombinator;
import com.grorchestrator.orchestration.util.ReconciliationPassLock;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@ApplicationScoped
public class BackupRestoreCoordinatorImpl implements BackupRestoreCoordinator {

    @Inject
    PeerStateFunctionalityCombinator peerStateFunctionalityCombinator;

    @Inject
    ClusterTopologyResolver clusterTopologyResolver;

    @Inject
    ClusterControlAdapter clusterControlAdapter;

    @Inject
    ObjectStorageAdapter objectStorageAdapter;

    @Inject
    SnapshotToolAdapter snapshotToolAdapter;

    @Inject
    CredentialManager credentialManager;

    @Inject
    ReconciliationPassLock reconciliationPassLock;

    @Inject
    EngineCallExecutor engineCallExecutor;

    @Inject
    BackupProperties backupProperties;

    @Inject
    ClusterProperties clusterProperties;

    @Inject
    FilesPathsProducer filesPathsProducer;

    @Inject
    ObjectMapper objectMapper;

    Clock clock = Clock.systemUTC();

    private final AtomicBoolean backupInProgress = new AtomicBoolean(false);

    @Override
    public BackupInfo createBackup() {
        checkBackupsEnabled();

        String nodeId = clusterProperties.nodeId();
        ObservedClusterStatus status = clusterTopologyResolver.observe();
        ObservedMember self = status.findMember(nodeId)
                .filter(member -> MemberState.ONLINE.equals(member.getState()))
                .orElseThrow(() -> new PreconditionNotMetException("Node " + nodeId + " is not an online cluster member and can not be backed up"));

        if (self.isPrimary()) {
            Optional<ObservedMember> secondary = status.getOnlineMembers()
                    .stream()
                    .filter(member -> !member.getNodeId().equals(nodeId))
                    .findFirst();
            if (secondary.isPresent()) {
                throw new PreconditionNotMetException(
                        "Backup from primary is not allowed while online secondary exists. Run create-backup on " + secondary.get().getNodeId()
                );
            }
        }

        if (!backupInProgress.compareAndSet(false, true)) {
            throw new ConflictingOperationException("Backup is already in progress on this node");
        }

        try {
            Optional<BackupInfo> foreign = findActiveInProgressBackup();
            if (foreign.isPresent()) {
                throw new ConflictingOperationException("Backup " + foreign.get().getBackupId() + " is in progress on node " + foreign.get().getNodeId());
            }

            String primaryAddress = clusterTopologyResolver.resolvePrimary(status).getAddress();
            // the primary backs up only when it is the last online member, it keeps serving writes
            boolean takeOutOfService = !self.isPrimary() && status.getMembers().size() > 1;
            return performBackup(nodeId, status.getClusterName(), primaryAddress, takeOutOfService);
        } finally {
            backupInProgress.set(false);
        }
    }

    @Override
    public List<BackupInfo> listBackups() {
        Map<String, BackupInfo> backups = new TreeMap<>();

        if (backupProperties.enabled()) {
            try {
                for (String key : objectStorageAdapter.listKeys(backupProperties.s3().path() + "/")) {
                    if (!key.endsWith(BackupConstants.S3_METADATA_SUFFIX)) {
                        continue;
                    }
                    BackupInfo info = objectMapper.readValue(objectStorageAdapter.readContent(key), BackupInfo.class);
                    backups.put(info.getBackupId(), info);
                }
            } catch (Exception e) {
                log.warn("Failed to list backups in object storage, only backups known to peer state are listed. Cause: {}", e.getMessage());
            }
        }

        for (BackupInfo record : peerStateFunctionalityCombinator.getBackups()) {
            BackupInfo stored = backups.get(record.getBackupId());
            // object storage metadata is written only for completed backups
            if (stored == null || !BackupStatus.COMPLETED.equals(record.getStatus())) {
                backups.put(record.getBackupId(), record);
            }
        }

        return new ArrayList<>(backups.values());
    }

    @Override
    public RestoreResult restore(String backupId, String restoreToTime) {
        validateBackupId(backupId);
        checkBackupsEnabled();

        BackupInfo backup = listBackups().stream()
                .filter(info -> info.getBackupId().equals(backupId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Backup " + backupId + " does not exist"));

        if (!BackupStatus.COMPLETED.equals(backup.getStatus())) {
            throw new PreconditionNotMetException("Backup " + backupId + " is " + backup.getStatus().getValue() + " and can not be restored");
        }

        Instant pointInTime = parseRestoreToTime(restoreToTime);
        if (pointInTime != null && backup.getCompletedAt() != null && pointInTime.isBefore(backup.getCompletedAt())) {
            throw new InvalidArgumentException("restore-to-time " + restoreToTime + " is earlier than completion of backup " + backupId);
        }

        if (backupInProgress.get()) {
            throw new ConflictingOperationException("Backup is in progress on this node. Retry restore after it finishes");
        }
        Optional<BackupInfo> running = findActiveInProgressBackup();
        if (running.isPresent()) {
            throw new ConflictingOperationException("Backup " + running.get().getBackupId() + " is in progress on node " + running.get().getNodeId() + ". Retry restore after it finishes");
        }
        if (peerStateFunctionalityCombinator.getMembershipChangeMarker().isPresent()) {
            throw new ConflictingOperationException("Membership change is in progress: " + peerStateFunctionalityCombinator.getMembershipChangeMarker().get().getValue());
        }
        Optional<MaintenanceFlag> maintenanceFlag = peerStateFunctionalityCombinator.getMaintenanceFlag();
        if (maintenanceFlag.isPresent()) {
            throw new ConflictingOperationException("Another maintenance operation is in progress: " + maintenanceFlag.get().getReason());
        }
        checkMembershipSettled();
        peerStateFunctionalityCombinator.checkCoordinator("restore backups");

        return reconciliationPassLock.runExclusive(() -> performRestore(backup, pointInTime));
    }

    @Override
    public BackupInfo abandonBackup(String backupId) {
        validateBackupId(backupId);
        BackupInfo backup = peerStateFunctionalityCombinator.getBackup(backupId)
                .orElseThrow(() -> new NotFoundException("Backup " + backupId + " does not exist"));

        if (!BackupStatus.IN_PROGRESS.equals(backup.getStatus())) {
            throw new PreconditionNotMetException("Backup " + backupId + " is " + backup.getStatus().getValue() + ", only in-progress backups can be abandoned");
        }

        backup.setStatus(BackupStatus.FAILED);
        backup.setCompletedAt(clock.instant());
        backup.setMessage("abandoned by operator");
        peerStateFunctionalityCombinator.saveBackup(backup);
        log.warn("Backup {} on node {} was abandoned by operator", backupId, backup.getNodeId());
        return backup;
    }

    @Override
    public boolean isBackupInProgress() {
        return backupInProgress.get() || findActiveInProgressBackup().isPresent();
    }

    @Override
    public int markStaleBackupsFailed() {
        peerStateFunctionalityCombinator.checkCoordinator("mark stale backups");
        Instant threshold = clock.instant().minus(backupProperties.staleAfter());
        int marked = 0;

        for (BackupInfo backup : peerStateFunctionalityCombinator.getBackups()) {
            if (!BackupStatus.IN_PROGRESS.equals(backup.getStatus()) || backup.getStartedAt() == null || backup.getStartedAt().isAfter(threshold)) {
                continue;
            }
            if (backup.getNodeId().equals(clusterProperties.nodeId()) && backupInProgress.get()) {
                continue;
            }
            backup.setStatus(BackupStatus.FAILED);
            backup.setCompletedAt(clock.instant());
            backup.setMessage("no progress since " + backup.getStartedAt() + ", considered abandoned");
            peerStateFunctionalityCombinator.saveBackup(backup);
            log.warn("Backup {} on node {} did not finish in time and is marked as failed", backup.getBackupId(), backup.getNodeId());
            marked++;
        }
        return marked;
    }

    /**
     * Restore dissolves the cluster, so it must not race a member which is joining or leaving.
     */
    private void checkMembershipSettled() {
        ObservedClusterStatus status;
        try {
            status = clusterTopologyResolver.observe();
        } catch (TransientEngineException e) {
            log.warn("Cluster status is unknown, membership can not be checked before restore: {}", e.getMessage());
            return;
        }
        if (!status.isClusterExists()) {
            return;
        }

        for (ObservedMember member : status.getMembers()) {
            if (MemberState.RECOVERING.equals(member.getState())) {
                throw new ConflictingOperationException("Member " + member.getNodeId() + " is still recovering. Retry restore after it is online");
            }
        }

        boolean full = status.getMembers().size() >= clusterProperties.maxMembers();
        for (PersistedMemberInfo member : peerStateFunctionalityCombinator.getMembers().values()) {
            boolean observed = status.findMember(member.getNodeId()).isPresent();
            if (member.isMarkedForRemoval() && observed) {
                throw new ConflictingOperationException("Member " + member.getNodeId() + " is being removed from the cluster. Retry restore after it left");
            }
            if (!member.isMarkedForRemoval() && !observed && !full) {
                throw new ConflictingOperationException("Member " + member.getNodeId() + " is not added to the cluster yet. Retry restore after it joined");
            }
        }
    }

    private BackupInfo performBackup(String nodeId, String clusterName, String primaryAddress, boolean takeOutOfService) {
        String selfEndpoint = clusterTopologyResolver.getSelfEndpoint();
        String path = backupProperties.s3().path();
        Instant startedAt = clock.instant();
        String backupId = BackupConstants.BACKUP_ID_FORMATTER.format(startedAt);

        BackupInfo backup = BackupInfo.builder()
                .backupId(backupId)
                .status(BackupStatus.IN_PROGRESS)
                .nodeId(nodeId)
                .clusterName(clusterName)
                .startedAt(startedAt)
                .location(String.format(BackupConstants.S3_SNAPSHOT_KEY_FORMAT, path, backupId))
                .build();
        peerStateFunctionalityCombinator.saveBackup(backup);
        log.info("Starting backup {} of node {}", backupId, nodeId);

        File workDirectory = Paths.get(filesPathsProducer.getBackupWorkDirectoryPath(), backupId.replace(':', '-')).toFile();
        File logFile = Paths.get(filesPathsProducer.getBackupWorkDirectoryPath(), String.format(BackupConstants.BACKUP_LOG_FILE_NAME_FORMAT, backupId.replace(':', '-'))).toFile();

        boolean prepared = false;
        try {
            if (takeOutOfService) {
                engineCallExecutor.executeWithRetry("hide instance", () -> clusterControlAdapter.setInstanceHidden(primaryAddress, selfEndpoint, true));
                engineCallExecutor.executeWithRetry("enable offline mode", () -> clusterControlAdapter.setOfflineMode(selfEndpoint, true));
                prepared = true;
            } else {
                log.info("Node {} is the only member which can serve clients, it stays in service during backup", nodeId);
            }

            String password = credentialManager.get(SystemAccount.BACKUPS.getUsername()).getEngineValue();
            SnapshotStream snapshotStream = snapshotToolAdapter.startBackup(SystemAccount.BACKUPS.getUsername(), password, workDirectory, logFile);
            try {
                objectStorageAdapter.uploadStream(backup.getLocation(), snapshotStream.getInputStream());
            } finally {
                snapshotToolAdapter.awaitCompletion(snapshotStream);
            }

            backup.setStatus(BackupStatus.COMPLETED);
            backup.setCompletedAt(clock.instant());
            objectStorageAdapter.uploadContent(String.format(BackupConstants.S3_METADATA_KEY_FORMAT, path, backupId), objectMapper.writeValueAsString(backup));
            log.info("Backup {} completed", backupId);
        } catch (OrchestrationException | SnapshotToolException | UploadException | EngineOperationException | JsonProcessingException e) {
            log.error("Backup {} failed", backupId, e);
            backup.setStatus(BackupStatus.FAILED);
            backup.setCompletedAt(clock.instant());
            backup.setMessage(e.getMessage());
        } finally {
            if (prepared) {
                revertBackupPreparation(primaryAddress, selfEndpoint);
            }
            uploadBackupLog(path, backupId, logFile);
            FileUtils.deleteQuietly(workDirectory);
        }

        Optional<BackupInfo> current = peerStateFunctionalityCombinator.getBackup(backupId);
        if (current.isPresent() && BackupStatus.FAILED.equals(current.get().getStatus()) && BackupStatus.COMPLETED.equals(backup.getStatus())) {
            log.warn("Backup {} finished after it was abandoned, its record stays failed", backupId);
            return current.get();
        }

        peerStateFunctionalityCombinator.saveBackup(backup);
        return backup;
    }

    private void revertBackupPreparation(String primaryAddress, String selfEndpoint) {
        try {
            engineCallExecutor.executeWithRetry("disable offline mode", () -> clusterControlAdapter.setOfflineMode(selfEndpoint, false));
            engineCallExecutor.executeWithRetry("unhide instance", () -> clusterControlAdapter.setInstanceHidden(primaryAddress, selfEndpoint, false));
        } catch (TransientEngineException | EngineOperationException e) {
            log.error("Failed to return instance to service after backup. Instance may stay hidden from clients until fixed manually.", e);
        }
    }

    private void uploadBackupLog(String path, String backupId, File logFile) {
        if (!logFile.exists()) {
            return;
        }
        try {
            objectStorageAdapter.uploadContent(
                    String.format(BackupConstants.S3_LOG_KEY_FORMAT, path, backupId),
                    FileUtils.readFileToString(logFile, StandardCharsets.UTF_8)
            );
        } catch (IOException | UploadException e) {
            log.warn("Failed to upload log of backup {}: {}", backupId, e.getMessage());
        } finally {
            FileUtils.deleteQuietly(logFile);
        }
    }

    private RestoreResult performRestore(BackupInfo backup, Instant pointInTime) {
        if (!peerStateFunctionalityCombinator.acquireMaintenanceFlag("restore of backup " + backup.getBackupId())) {
            throw new ConflictingOperationException("Another maintenance operation is in progress: "
                    + peerStateFunctionalityCombinator.getMaintenanceFlag().map(MaintenanceFlag::getReason).orElse("unknown"));
        }

        File workDirectory = new File(filesPathsProducer.getRestoreWorkDirectoryPath());
        File logFile = Paths.get(filesPathsProducer.getRestoreWorkDirectoryPath(), BackupConstants.RESTORE_LOG_FILE_NAME).toFile();

        try {
            log.info("Restoring backup {}{}", backup.getBackupId(), pointInTime != null ? " up to " + pointInTime : "");
            peerStateFunctionalityCombinator.markRestoreStarted(backup.getBackupId());
            String clusterName;
            try {
                clusterName = dissolveIfExists();

                try (InputStream snapshot = objectStorageAdapter.download(backup.getLocation())) {
                    snapshotToolAdapter.restoreSnapshot(snapshot, workDirectory, logFile);
                } catch (IOException e) {
                    throw new DownloadException("Failed to read snapshot of backup " + backup.getBackupId(), e);
                }

                if (pointInTime != null) {
                    String rootPassword = credentialManager.get(SystemAccount.ROOT.getUsername()).getEngineValue();
                    snapshotToolAdapter.recoverToPointInTime(pointInTime, SystemAccount.ROOT.getUsername(), rootPassword, workDirectory, logFile);
                }
            } catch (RuntimeException e) {
                log.error("Restore of backup {} failed, reconciliation stays blocked until restore is repeated or cluster is re-created", backup.getBackupId(), e);
                peerStateFunctionalityCombinator.markRestoreFailed(backup.getBackupId(), e.getMessage());
                throw e;
            }

            String effectiveClusterName = StringUtils.defaultIfBlank(clusterName, backup.getClusterName());
            peerStateFunctionalityCombinator.markClusterForRecreation(effectiveClusterName);
            log.info("Backup {} restored. Cluster {} will be re-created from this node", backup.getBackupId(), effectiveClusterName);

            return RestoreResult.builder()
                    .backupId(backup.getBackupId())
                    .restoredToTime(pointInTime != null ? pointInTime : backup.getCompletedAt())
                    .clusterName(effectiveClusterName)
                    .message("Restore completed. Cluster is being re-created and other members will re-join it")
                    .build();
        } finally {
            peerStateFunctionalityCombinator.releaseMaintenanceFlag();
        }
    }

    private String dissolveIfExists() {
        ObservedClusterStatus status;
        try {
            status = clusterTopologyResolver.observe();
        } catch (TransientEngineException e) {
            log.warn("Cluster status is unknown before restore, continuing: {}", e.getMessage());
            return peerStateFunctionalityCombinator.getClusterName().orElse(null);
        }
        if (status.isClusterExists()) {
            String via = status.getOnlinePrimary().map(ObservedMember::getAddress).orElse(clusterTopologyResolver.getSelfEndpoint());
            engineCallExecutor.executeWithRetry("dissolve cluster", () -> clusterControlAdapter.dissolveCluster(via));
            log.info("Cluster {} dissolved for restore", status.getClusterName());
            return status.getClusterName();
        }
        return peerStateFunctionalityCombinator.getClusterName().orElse(null);
    }

    private Optional<BackupInfo> findActiveInProgressBackup() {
        Instant threshold = clock.instant().minus(backupProperties.staleAfter());
        return peerStateFunctionalityCombinator.getBackups()
                .stream()
                .filter(backup -> BackupStatus.IN_PROGRESS.equals(backup.getStatus()))
                .filter(backup -> backup.getStartedAt() == null || backup.getStartedAt().isAfter(threshold))
                .findFirst();
    }

    private void validateBackupId(String backupId) {
        if (StringUtils.isBlank(backupId) || !BackupConstants.BACKUP_ID_PATTERN.matcher(backupId).matches()) {
            throw new InvalidArgumentException("Invalid backup id '" + backupId + "'. Expected format yyyy-MM-ddTHH:mm:ssZ");
        }
    }

    private Instant parseRestoreToTime(String restoreToTime) {
        if (StringUtils.isBlank(restoreToTime)) {
            return null;
        }
        try {
            return Instant.parse(restoreToTime.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidArgumentException("Invalid restore-to-time '" + restoreToTime + "'. Expected ISO-8601 UTC timestamp");
        }
    }

    private void checkBackupsEnabled() {
        if (!backupProperties.enabled()) {
            throw new PreconditionNotMetException("Backups are not enabled in configuration");
        }
    }
}
