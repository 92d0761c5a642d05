package com.grorchestrator.rest.model.api.tls;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TlsStatusDto {
    private boolean enabled;
    private String nodeId;
    private String currentSerial;
    private String adoptedSerial;
    private String supersededSerial;
    private Instant expiresAt;
    private boolean selfSigned;
}
