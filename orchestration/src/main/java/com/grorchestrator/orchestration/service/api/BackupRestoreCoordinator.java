package com.grorchestrator.orchestration.service.api;

import com.grorchestrator.orchestration.exception.ConflictingOperationException;
import com.grorchestrator.orchestration.exception.InvalidArgumentException;
import com.grorchestrator.orchestration.exception.NotFoundException;
import com.grorchestrator.orchestration.exception.PreconditionNotMetException;
import com.grorchestrator.orchestration.model.backup.BackupInfo;
import com.grorchestrator.orchestration.model.backup.RestoreResult;

import java.util.List;

public interface BackupRestoreCoordinator {

    /**
     * Takes a snapshot of the local instance and uploads it to object storage. Blocks until backup is finished.
     *
     * @return record of the backup. Status is failed if the snapshot tool or upload failed.
     * @throws PreconditionNotMetException   if this node can not be backed up right now
     * @throws ConflictingOperationException if another backup is running
     */
    BackupInfo createBackup() throws PreconditionNotMetException, ConflictingOperationException;

    /**
     * @return backups known to object storage and peer state, oldest first
     */
    List<BackupInfo> listBackups();

    /**
     * Restores cluster data from backup. Cluster is dissolved, local instance is restored and the cluster is re-created from
     * it by the following reconciliation passes.
     *
     * @param restoreToTime optional point in time to replay binary logs to
     */
    RestoreResult restore(String backupId, String restoreToTime)
            throws InvalidArgumentException, NotFoundException, ConflictingOperationException, PreconditionNotMetException;

    /**
     * Marks in-progress backup as failed. Running snapshot tool is not interrupted.
     */
    BackupInfo abandonBackup(String backupId) throws InvalidArgumentException, NotFoundException, PreconditionNotMetException;

    boolean isBackupInProgress();

    /**
     * Marks in-progress records which did not finish in time as failed. Coordinator only.
     *
     * @return number of records marked
     */
    int markStaleBackupsFailed();
}
