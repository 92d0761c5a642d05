package com.grorchestrator.rest.model.api.cluster;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberDto {
    private String nodeId;
    private String address;
    private String role;
    private String engineState;
    private boolean markedForRemoval;
}
