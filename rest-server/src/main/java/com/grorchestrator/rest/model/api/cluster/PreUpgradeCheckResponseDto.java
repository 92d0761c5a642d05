package com.grorchestrator.rest.model.api.cluster;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreUpgradeCheckResponseDto {
    private String primaryNodeId;
    private boolean primarySwitched;
    private String message;
}
