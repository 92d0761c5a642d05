package com.grorchestrator.rest.model.api.replication;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterSetMemberDto {
    private String clusterName;
    private String role;
    private String globalStatus;
    private String primaryAddress;
}
