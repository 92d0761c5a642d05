package com.grorchestrator.orchestration.model.clusterset;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromotionResult {
    private PromotionScope scope;
    private String promotedNodeId;
    private String promotedClusterName;
    private boolean forced;
    /**
     * Set after forced failover. Operator must make sure that the old primary can not accept writes anymore.
     */
    private boolean requiresManualVerification;
    private boolean alreadyPrimary;
    private String message;
}
