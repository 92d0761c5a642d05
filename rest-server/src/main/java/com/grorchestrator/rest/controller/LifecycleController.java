package com.grorchestrator.rest.controller;

import com.grorchestrator.rest.constant.ApiConstants;
import com.grorchestrator.rest.model.api.lifecycle.LifecycleEventRequestDto;
import com.grorchestrator.rest.service.api.LifecycleEventIngressService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

@Path(ApiConstants.API_V1_PREFIX + "/lifecycle")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class LifecycleController {

    @Inject
    LifecycleEventIngressService lifecycleEventIngressService;

    @POST
    @Path("/events")
    public Response postEvent(LifecycleEventRequestDto requestDto) {
        return Response
                .accepted(lifecycleEventIngressService.accept(requestDto))
                .build();
    }
}
