package com.grorchestrator.rest.controller;

import com.grorchestrator.orchestration.model.clusterset.ClusterSetStatus;
import com.grorchestrator.orchestration.service.api.ClusterSetReplicationManager;
import com.grorchestrator.rest.constant.ApiConstants;
import com.grorchestrator.rest.mapper.ClusterMapper;
import com.grorchestrator.rest.mapper.ReplicationMapper;
import com.grorchestrator.rest.model.api.replication.ClusterSetStatusDto;
import com.grorchestrator.rest.model.api.replication.CreateReplicationRequestDto;
import com.grorchestrator.rest.model.api.replication.LinkResultDto;
import com.grorchestrator.rest.model.api.replication.ReplicationHandleDto;
import com.grorchestrator.rest.util.RequestUtils;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Path(ApiConstants.API_V1_PREFIX + "/replication")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ReplicationController {

    @Inject
    ClusterSetReplicationManager clusterSetReplicationManager;

    @Inject
    ReplicationMapper replicationMapper;

    @Inject
    ClusterMapper clusterMapper;

    @POST
    @Path("/offers")
    public ReplicationHandleDto createReplication(CreateReplicationRequestDto requestDto) {
        RequestUtils.requireBody(requestDto);
        log.info("Received HTTP request to offer replication to cluster {}.", requestDto.getName());
        return replicationMapper.from(clusterSetReplicationManager.offer(requestDto.getName()));
    }

    @POST
    @Path("/link")
    public LinkResultDto link(ReplicationHandleDto handleDto) {
        RequestUtils.requireBody(handleDto);
        log.info("Received HTTP request to link cluster set {}.", handleDto.getClusterSetName());
        return replicationMapper.from(clusterSetReplicationManager.link(replicationMapper.to(handleDto)));
    }

    @GET
    @Path("/status")
    public Response getStatus() {
        ClusterSetStatus status = clusterSetReplicationManager.getStatus();
        if (status == null) {
            return Response.noContent().build();
        }
        ClusterSetStatusDto statusDto = clusterMapper.from(status);
        return Response.ok(statusDto).build();
    }
}
