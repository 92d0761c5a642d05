package com.grorchestrator.orchestration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreUpgradeCheckResult {
    /**
     * Node which is primary after the check. Upgraded last.
     */
    private String primaryNodeId;
    private boolean primarySwitched;
    private String message;
}
