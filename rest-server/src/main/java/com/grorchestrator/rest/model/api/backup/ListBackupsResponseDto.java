package com.grorchestrator.rest.model.api.backup;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListBackupsResponseDto {
    private List<BackupDto> backups;
}
