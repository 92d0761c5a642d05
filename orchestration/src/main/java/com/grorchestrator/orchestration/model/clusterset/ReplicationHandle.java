package com.grorchestrator.orchestration.model.clusterset;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Offer made by the primary cluster to a replica cluster. Handed over to the replica cluster by operator or dispatcher.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReplicationHandle {
    private String clusterSetName;
    private String domainId;
    private String primaryClusterName;
    /**
     * address:port of the primary instance of the primary cluster.
     */
    private String primaryEndpoint;
    private String replicaClusterName;
    private String adminUser;
    @ToString.Exclude
    private String adminPassword;
    private Instant offeredAt;
}
