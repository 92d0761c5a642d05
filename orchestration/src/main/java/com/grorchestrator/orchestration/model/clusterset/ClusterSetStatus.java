package com.grorchestrator.orchestration.model.clusterset;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterSetStatus {
    private String clusterSetName;
    private String domainId;
    private String primaryClusterName;
    @Builder.Default
    private List<ClusterSetMemberStatus> clusters = new ArrayList<>();

    public Optional<ClusterSetMemberStatus> findCluster(String clusterName) {
        return clusters.stream()
                .filter(cluster -> cluster.getClusterName().equals(clusterName))
                .findFirst();
    }
}
