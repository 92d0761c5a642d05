package com.grorchestrator.orchestration.restclient.model;

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
public class CertificateResponseDto {
    private String certificate;
    private String ca;
    private List<String> chain;
    private Instant expiresAt;
    private String issuer;
}
