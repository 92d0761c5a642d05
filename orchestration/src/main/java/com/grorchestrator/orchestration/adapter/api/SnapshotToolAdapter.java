package com.grorchestrator.orchestration.adapter.api;

import com.grorchestrator.orchestration.exception.SnapshotToolException;
import com.grorchestrator.orchestration.model.backup.SnapshotStream;

import java.io.File;
import java.io.InputStream;
import java.time.Instant;

/**
 * Streaming snapshot tool. Only sequencing is done by orchestrator, snapshot algorithm belongs to the tool.
 */
public interface SnapshotToolAdapter {

    /**
     * Starts streaming backup of the local instance.
     *
     * @param workDirectory directory for temporary files of the tool
     * @param logFile       tool output is written there
     */
    SnapshotStream startBackup(String username, String password, File workDirectory, File logFile) throws SnapshotToolException;

    /**
     * Waits until tool finishes.
     *
     * @throws SnapshotToolException if tool exited with error
     */
    void awaitCompletion(SnapshotStream snapshotStream) throws SnapshotToolException;

    /**
     * Stops local engine, replaces its data with snapshot and starts engine again.
     *
     * @param snapshot stream with snapshot. Will NOT be closed.
     */
    void restoreSnapshot(InputStream snapshot, File workDirectory, File logFile) throws SnapshotToolException;

    /**
     * Replays archived binary logs on restored instance up to provided time.
     */
    void recoverToPointInTime(Instant restoreToTime, String username, String password, File workDirectory, File logFile) throws SnapshotToolException;
}
