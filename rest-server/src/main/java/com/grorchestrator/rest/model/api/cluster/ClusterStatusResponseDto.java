package com.grorchestrator.rest.model.api.cluster;

import com.grorchestrator.rest.model.api.replication.ClusterSetStatusDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterStatusResponseDto {
    private String clusterName;
    private String domainId;
    private String health;
    private String primaryNodeId;
    private List<MemberDto> members;
    private String reportingNodeId;
    private String nodeStatus;
    private String statusMessage;
    private boolean maintenance;
    private boolean membershipChangeInProgress;
    private ClusterSetStatusDto clusterSet;
}
