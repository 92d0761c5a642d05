package com.grorchestrator.rest.controller;

import com.grorchestrator.orchestration.service.api.TlsCertificateManager;
import com.grorchestrator.rest.constant.ApiConstants;
import com.grorchestrator.rest.mapper.SecurityMapper;
import com.grorchestrator.rest.model.api.tls.SetTlsPrivateKeyRequestDto;
import com.grorchestrator.rest.model.api.tls.TlsStatusDto;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Path(ApiConstants.API_V1_PREFIX + "/tls")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TlsController {

    @Inject
    TlsCertificateManager tlsCertificateManager;

    @Inject
    SecurityMapper securityMapper;

    @GET
    @Path("/status")
    public TlsStatusDto getStatus() {
        return securityMapper.from(tlsCertificateManager.getStatus());
    }

    @POST
    @Path("/private-key")
    public TlsStatusDto setPrivateKey(SetTlsPrivateKeyRequestDto requestDto) {
        log.info("Received HTTP request to set TLS private key.");
        tlsCertificateManager.setPrivateKey(requestDto == null ? null : requestDto.getInternalKey());
        return securityMapper.from(tlsCertificateManager.getStatus());
    }
}
