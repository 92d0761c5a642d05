package com.grorchestrator.orchestration.model.peerstate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Set while an operation runs which takes the cluster apart. Reconciliation defers all membership changes until it is
 * released.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceFlag {
    private String reason;
    private String ownerNodeId;
    private Instant acquiredAt;
}
