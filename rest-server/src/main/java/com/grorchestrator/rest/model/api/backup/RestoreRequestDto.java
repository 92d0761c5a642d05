package com.grorchestrator.rest.model.api.backup;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreRequestDto {
    private String backupId;
    /**
     * Optional. ISO-8601 UTC timestamp to replay binary logs up to.
     */
    private String restoreToTime;
}
