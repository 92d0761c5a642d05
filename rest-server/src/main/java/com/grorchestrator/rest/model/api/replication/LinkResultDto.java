package com.grorchestrator.rest.model.api.replication;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkResultDto {
    private String clusterSetName;
    private String domainId;
    private String replicaClusterName;
    private String primaryClusterName;
    private boolean alreadyLinked;
}
