package com.grorchestrator.quarkusroot.health;

import com.grorchestrator.configuration.model.NodeStatusKind;
import com.grorchestrator.configuration.properties.constant.GrOrchestratorConstants;
import com.grorchestrator.configuration.properties.runtime.NodeRuntimeProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class NodeStatusReadinessHealthcheck implements HealthCheck {

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder responseBuilder = HealthCheckResponse.named(GrOrchestratorConstants.NODE_STATUS_READINESS_CHECK);

        NodeStatusKind statusKind = nodeRuntimeProperties.getStatusKind();
        if (nodeRuntimeProperties.isStarted() && statusKind.isHealthy()) {
            responseBuilder.up();
        } else {
            responseBuilder.down();
        }

        responseBuilder.withData("status", statusKind.getValue());
        if (nodeRuntimeProperties.getStatusMessage() != null) {
            responseBuilder.withData("message", nodeRuntimeProperties.getStatusMessage());
        }
        if (nodeRuntimeProperties.getClusterHealth() != null) {
            responseBuilder.withData("clusterHealth", nodeRuntimeProperties.getClusterHealth().getValue());
        }

        return responseBuilder.build();
    }
}
