package com.grorchestrator.configuration.properties.runtime;

import com.grorchestrator.configuration.model.ClusterHealth;
import com.grorchestrator.configuration.model.CoordinationRole;
import com.grorchestrator.configuration.model.NodeStatusKind;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@ApplicationScoped
public class NodeRuntimeProperties {
    private String nodeId;
    private CoordinationRole coordinationRole = CoordinationRole.FOLLOWER;
    private NodeStatusKind statusKind = NodeStatusKind.WAITING;
    private String statusMessage = "waiting for first reconciliation pass";
    private ClusterHealth clusterHealth;
    private Instant lastPassCompletedAt;
    private boolean started = false;
}
