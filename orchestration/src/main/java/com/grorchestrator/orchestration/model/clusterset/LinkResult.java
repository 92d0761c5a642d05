package com.grorchestrator.orchestration.model.clusterset;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkResult {
    private String clusterSetName;
    private String domainId;
    private String replicaClusterName;
    private String primaryClusterName;
    private boolean alreadyLinked;
}
