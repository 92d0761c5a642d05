package com.grorchestrator.orchestration.model.tls;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CertificateSigningRequest {
    private String nodeId;
    private String commonName;
    private List<String> subjectAlternativeNames;
    private String csrPem;
}
