package com.grorchestrator.rest.model.api.backup;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupDto {
    private String backupId;
    private String status;
    private String nodeId;
    private String clusterName;
    private Instant startedAt;
    private Instant completedAt;
    private String location;
    private String message;
}
