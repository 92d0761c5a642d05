package com.grorchestrator.orchestration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationOperation {
    private OperationType type;
    private String targetNodeId;
    private String targetAddress;
    /**
     * Used for removal of members which are not reachable anymore.
     */
    private boolean force;
    private String reason;
}
