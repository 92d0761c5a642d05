package com.grorchestrator.rest.model.api.replication;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterSetStatusDto {
    private String clusterSetName;
    private String domainId;
    private String primaryClusterName;
    private List<ClusterSetMemberDto> clusters;
}
