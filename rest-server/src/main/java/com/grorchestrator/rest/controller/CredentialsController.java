package com.grorchestrator.rest.controller;

import com.grorchestrator.orchestration.model.SystemAccount;
import com.grorchestrator.orchestration.service.api.CredentialManager;
import com.grorchestrator.rest.constant.ApiConstants;
import com.grorchestrator.rest.mapper.SecurityMapper;
import com.grorchestrator.rest.model.api.credentials.PasswordResponseDto;
import com.grorchestrator.rest.model.api.credentials.SetPasswordRequestDto;
import com.grorchestrator.rest.model.api.credentials.SetPasswordResponseDto;
import com.grorchestrator.rest.util.RequestUtils;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

@Slf4j
@Path(ApiConstants.API_V1_PREFIX + "/credentials")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CredentialsController {

    @Inject
    CredentialManager credentialManager;

    @Inject
    SecurityMapper securityMapper;

    @GET
    @Path("/password")
    public PasswordResponseDto getPassword(@QueryParam("username") String username) {
        String resolvedUsername = StringUtils.defaultIfBlank(username, SystemAccount.ROOT.getUsername());
        return PasswordResponseDto
                .builder()
                .username(resolvedUsername)
                .password(credentialManager.getPassword(resolvedUsername))
                .build();
    }

    @POST
    @Path("/password")
    public SetPasswordResponseDto setPassword(SetPasswordRequestDto requestDto) {
        RequestUtils.requireBody(requestDto);
        log.info("Received HTTP request to set password of {}.", StringUtils.defaultIfBlank(requestDto.getUsername(), SystemAccount.ROOT.getUsername()));
        return securityMapper.from(credentialManager.setPassword(requestDto.getUsername(), requestDto.getPassword()));
    }
}
