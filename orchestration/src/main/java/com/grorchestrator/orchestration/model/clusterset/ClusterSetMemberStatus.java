package com.grorchestrator.orchestration.model.clusterset;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterSetMemberStatus {
    private String clusterName;
    private ClusterSetRole role;
    /**
     * Global status reported by the engine, e.g. OK, INVALIDATED, NOT_OK.
     */
    private String globalStatus;
    private String primaryAddress;

    public boolean isInvalidated() {
        return "INVALIDATED".equalsIgnoreCase(globalStatus);
    }

    public boolean isReachable() {
        return globalStatus != null && !"UNKNOWN".equalsIgnoreCase(globalStatus) && !"NOT_OK".equalsIgnoreCase(globalStatus);
    }
}
