package com.grorchestrator.rest.model.api.tls;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SetTlsPrivateKeyRequestDto {
    /**
     * PEM encoded private key. When absent, a new key is generated.
     */
    @ToString.Exclude
    private String internalKey;
}
