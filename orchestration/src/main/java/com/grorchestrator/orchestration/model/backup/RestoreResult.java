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
public class RestoreResult {
    private String backupId;
    private Instant restoredToTime;
    private String clusterName;
    private String message;
}
