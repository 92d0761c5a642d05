package com.grorchestrator.rest.controller;

import com.grorchestrator.orchestration.service.api.BackupRestoreCoordinator;
import com.grorchestrator.rest.constant.ApiConstants;
import com.grorchestrator.rest.mapper.BackupMapper;
import com.grorchestrator.rest.model.api.backup.BackupDto;
import com.grorchestrator.rest.model.api.backup.ListBackupsResponseDto;
import com.grorchestrator.rest.model.api.backup.RestoreRequestDto;
import com.grorchestrator.rest.model.api.backup.RestoreResponseDto;
import com.grorchestrator.rest.util.RequestUtils;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Path(ApiConstants.API_V1_PREFIX + "/backups")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class BackupController {

    @Inject
    BackupRestoreCoordinator backupRestoreCoordinator;

    @Inject
    BackupMapper backupMapper;

    @POST
    public BackupDto createBackup() {
        log.info("Received HTTP request to create backup.");
        return backupMapper.from(backupRestoreCoordinator.createBackup());
    }

    @GET
    public ListBackupsResponseDto listBackups() {
        return ListBackupsResponseDto
                .builder()
                .backups(backupMapper.from(backupRestoreCoordinator.listBackups()))
                .build();
    }

    @POST
    @Path("/restore")
    public RestoreResponseDto restore(RestoreRequestDto requestDto) {
        RequestUtils.requireBody(requestDto);
        log.info("Received HTTP request to restore backup {}.", requestDto.getBackupId());
        return backupMapper.from(backupRestoreCoordinator.restore(requestDto.getBackupId(), requestDto.getRestoreToTime()));
    }

    @POST
    @Path("/{backupId}/abandon")
    public BackupDto abandonBackup(@PathParam("backupId") String backupId) {
        log.info("Received HTTP request to abandon backup {}.", backupId);
        return backupMapper.from(backupRestoreCoordinator.abandonBackup(backupId));
    }
}
