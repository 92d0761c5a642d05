package com.grorchestrator.rest.model.api.replication;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReplicationHandleDto {
    private String clusterSetName;
    private String domainId;
    private String primaryClusterName;
    private String primaryEndpoint;
    private String replicaClusterName;
    private String adminUser;
    @ToString.Exclude
    private String adminPassword;
    private Instant offeredAt;
}
