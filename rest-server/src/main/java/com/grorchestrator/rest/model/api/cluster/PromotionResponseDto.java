package com.grorchestrator.rest.model.api.cluster;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromotionResponseDto {
    private String scope;
    private String promotedNodeId;
    private String promotedClusterName;
    private boolean forced;
    private boolean requiresManualVerification;
    private boolean alreadyPrimary;
    private String message;
}
