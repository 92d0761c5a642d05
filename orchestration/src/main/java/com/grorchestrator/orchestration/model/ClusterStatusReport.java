package com.grorchestrator.orchestration.model;

import com.grorchestrator.configuration.model.ClusterHealth;
import com.grorchestrator.configuration.model.NodeStatusKind;
import com.grorchestrator.orchestration.model.clusterset.ClusterSetStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterStatusReport {
    private String clusterName;
    private String domainId;
    private ClusterHealth health;
    private String primaryNodeId;
    private List<MemberReport> members;
    private String reportingNodeId;
    private NodeStatusKind nodeStatus;
    private String statusMessage;
    private boolean maintenance;
    private boolean membershipChangeInProgress;
    private ClusterSetStatus clusterSet;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemberReport {
        private String nodeId;
        private String address;
        private NodeRole role;
        private MemberState engineState;
        private boolean markedForRemoval;
    }
}
