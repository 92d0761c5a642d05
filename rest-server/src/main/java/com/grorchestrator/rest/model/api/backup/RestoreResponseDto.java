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
public class RestoreResponseDto {
    private String backupId;
    private Instant restoredToTime;
    private String clusterName;
    private String message;
}
