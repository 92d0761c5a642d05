package com.grorchestrator.orchestration.model.tls;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TlsStatus {
    private boolean enabled;
    private String nodeId;
    private String currentSerial;
    private String adoptedSerial;
    private String supersededSerial;
    private Instant expiresAt;
    private boolean selfSigned;
}
