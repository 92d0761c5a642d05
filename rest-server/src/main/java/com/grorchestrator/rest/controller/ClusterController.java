package com.grorchestrator.rest.controller;

import com.grorchestrator.orchestration.service.api.ClusterOperationsService;
import com.grorchestrator.rest.constant.ApiConstants;
import com.grorchestrator.rest.mapper.ClusterMapper;
import com.grorchestrator.rest.model.api.cluster.*;
import com.grorchestrator.rest.util.RequestUtils;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Path(ApiConstants.API_V1_PREFIX + "/cluster")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ClusterController {

    @Inject
    ClusterOperationsService clusterOperationsService;

    @Inject
    ClusterMapper clusterMapper;

    @GET
    @Path("/status")
    public ClusterStatusResponseDto getClusterStatus(@QueryParam("cluster-set") @DefaultValue("false") boolean clusterSet) {
        return clusterMapper.from(clusterOperationsService.getClusterStatus(clusterSet));
    }

    @POST
    @Path("/pre-upgrade-check")
    public PreUpgradeCheckResponseDto preUpgradeCheck() {
        log.info("Received HTTP request to run pre-upgrade check.");
        return clusterMapper.from(clusterOperationsService.preUpgradeCheck());
    }

    @POST
    @Path("/promote")
    public PromotionResponseDto promoteToPrimary(PromoteRequestDto requestDto) {
        RequestUtils.requireBody(requestDto);
        log.info("Received HTTP request to promote to primary with scope {} (force: {}).", requestDto.getScope(), requestDto.isForce());
        return clusterMapper.from(clusterOperationsService.promote(requestDto.getScope(), requestDto.isForce()));
    }

    @POST
    @Path("/recreate")
    public RecreateClusterResponseDto recreateCluster() {
        log.info("Received HTTP request to recreate cluster.");
        return RecreateClusterResponseDto
                .builder()
                .clusterName(clusterOperationsService.recreateCluster())
                .build();
    }

    @POST
    @Path("/rejoin")
    public Response rejoinCluster(RejoinClusterRequestDto requestDto) {
        RequestUtils.requireBody(requestDto);
        log.info("Received HTTP request to rejoin cluster {}.", requestDto.getClusterName());
        clusterOperationsService.rejoinCluster(requestDto.getClusterName());
        return Response.noContent().build();
    }
}
