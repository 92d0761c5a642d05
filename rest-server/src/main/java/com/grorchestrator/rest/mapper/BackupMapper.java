package com.grorchestrator.rest.mapper;

import com.grorchestrator.orchestration.model.backup.BackupInfo;
import com.grorchestrator.orchestration.model.backup.BackupStatus;
import com.grorchestrator.orchestration.model.backup.RestoreResult;
import com.grorchestrator.rest.model.api.backup.BackupDto;
import com.grorchestrator.rest.model.api.backup.RestoreResponseDto;
import org.mapstruct.Mapper;

import java.util.List;

@Mapper
public abstract class BackupMapper {
    public abstract BackupDto from(BackupInfo source);

    public abstract List<BackupDto> from(List<BackupInfo> source);

    public abstract RestoreResponseDto from(RestoreResult source);

    protected String toValue(BackupStatus status) {
        return status == null ? null : status.getValue();
    }
}
