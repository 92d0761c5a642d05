package com.grorchestrator.rest.model.api.credentials;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SetPasswordResponseDto {
    private String username;
    private long version;
    private boolean appliedToEngine;
}
