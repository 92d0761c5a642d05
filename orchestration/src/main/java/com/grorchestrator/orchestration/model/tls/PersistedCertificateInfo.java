package com.grorchestrator.orchestration.model.tls;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Certificate of a node as shared in peer state. Never contains private key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersistedCertificateInfo {
    private String nodeId;
    /**
     * Identifies this issuance. Node reports it back when certificate is installed locally.
     */
    private String serial;
    private String certificatePem;
    private String caPem;
    private List<String> chain;
    private String issuer;
    private Instant issuedAt;
    private Instant expiresAt;
}
