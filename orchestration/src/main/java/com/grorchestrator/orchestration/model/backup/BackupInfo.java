package com.grorchestrator.orchestration.model.backup;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupInfo {
    /**
     * UTC timestamp in yyyy-MM-dd'T'HH:mm:ss'Z' format.
     */
    private String backupId;
    private BackupStatus status;
    private String nodeId;
    private String clusterName;
    private Instant startedAt;
    private Instant completedAt;
    /**
     * Object storage key of the snapshot.
     */
    private String location;
    private String message;
}
