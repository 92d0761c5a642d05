package com.grorchestrator.rest.model.api.cluster;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromoteRequestDto {
    private String scope;
    private boolean force;
}
