package com.grorchestrator.orchestration.restclient.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CertificateRequestDto {
    private String commonName;
    private List<String> sans;
    private String csr;
}
