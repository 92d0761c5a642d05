package com.grorchestrator.orchestration.restclient;

import com.grorchestrator.orchestration.restclient.model.CaChainResponseDto;
import com.grorchestrator.orchestration.restclient.model.CertificateRequestDto;
import com.grorchestrator.orchestration.restclient.model.CertificateResponseDto;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;

import java.io.Closeable;

@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
@Path("")
public interface CertificateIssuerTemplateRestClient extends Closeable {

    @POST
    @Path("/v1/certificates")
    CertificateResponseDto issueCertificate(CertificateRequestDto request);

    @GET
    @Path("/v1/ca-chain")
    CaChainResponseDto getCaChain();
}
