package com.grorchestrator.rest.model.api.credentials;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SetPasswordRequestDto {
    /**
     * Defaults to root.
     */
    private String username;
    @ToString.Exclude
    private String password;
}
