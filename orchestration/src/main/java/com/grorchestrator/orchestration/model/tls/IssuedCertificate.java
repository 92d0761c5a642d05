package com.grorchestrator.orchestration.model.tls;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssuedCertificate {
    private String certificatePem;
    private String caPem;
    private List<String> chain;
    private Instant expiresAt;
    private String issuer;
}
