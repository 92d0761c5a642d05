package com.grorchestrator.quarkusroot.health;

import com.grorchestrator.configuration.properties.constant.GrOrchestratorConstants;
import com.grorchestrator.orchestration.service.api.CoordinationAuthority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Up while some node of the cluster holds the coordination lease. Followers report who it is.
 */
@Readiness
@ApplicationScoped
public class CoordinationReadinessHealthcheck implements HealthCheck {

    @Inject
    CoordinationAuthority coordinationAuthority;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder responseBuilder = HealthCheckResponse.named(GrOrchestratorConstants.COORDINATION_READINESS_CHECK);

        String coordinator = coordinationAuthority.getCoordinatorNodeId().orElse(null);
        if (coordinator != null) {
            responseBuilder.up().withData("coordinator", coordinator);
        } else {
            responseBuilder.down();
        }
        responseBuilder.withData("thisNodeIsCoordinator", coordinationAuthority.isCoordinator());

        return responseBuilder.build();
    }
}
