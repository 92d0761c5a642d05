package com.grorchestrator.orchestration.adapter.impl;

import com.grorchestrator.configuration.properties.predefined.TlsProperties;
import com.grorchestrator.orchestration.adapter.api.CertificateIssuerAdapter;
import com.grorchestrator.orchestration.exception.CertificateIssuanceException;
import com.grorchestrator.orchestration.model.tls.CertificateSigningRequest;
import com.grorchestrator.orchestration.model.tls.IssuedCertificate;
import com.grorchestrator.orchestration.restclient.CertificateIssuerTemplateRestClient;
import com.grorchestrator.orchestration.restclient.model.CaChainResponseDto;
import com.grorchestrator.orchestration.restclient.model.CertificateRequestDto;
import com.grorchestrator.orchestration.restclient.model.CertificateResponseDto;
import com.grorchestrator.orchestration.util.DynamicRestClientUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Issuer reachable over HTTP. A new client is created for every call since issuance is rare.
 */
@Slf4j
@ApplicationScoped
public class RestCertificateIssuerAdapter implements CertificateIssuerAdapter {

    @Inject
    TlsProperties tlsProperties;

    @Inject
    DynamicRestClientUtils dynamicRestClientUtils;

    @Override
    public IssuedCertificate issue(CertificateSigningRequest request) throws CertificateIssuanceException {
        CertificateIssuerTemplateRestClient client = null;
        try {
            client = createClient();
            CertificateResponseDto response = client.issueCertificate(
                    CertificateRequestDto.builder()
                            .commonName(request.getCommonName())
                            .sans(request.getSubjectAlternativeNames())
                            .csr(request.getCsrPem())
                            .build()
            );

            if (response == null || StringUtils.isBlank(response.getCertificate())) {
                throw new CertificateIssuanceException("Issuer returned empty certificate for " + request.getCommonName());
            }

            return IssuedCertificate.builder()
                    .certificatePem(response.getCertificate())
                    .caPem(response.getCa())
                    .chain(response.getChain())
                    .expiresAt(response.getExpiresAt())
                    .issuer(response.getIssuer())
                    .build();
        } catch (CertificateIssuanceException e) {
            throw e;
        } catch (Exception e) {
            throw new CertificateIssuanceException("Failed to request certificate for " + request.getCommonName(), e);
        } finally {
            dynamicRestClientUtils.closeClient(client);
        }
    }

    @Override
    public List<String> getCaChain() throws CertificateIssuanceException {
        CertificateIssuerTemplateRestClient client = null;
        try {
            client = createClient();
            CaChainResponseDto response = client.getCaChain();

            if (response == null || CollectionUtils.isEmpty(response.getChain())) {
                throw new CertificateIssuanceException("Issuer returned empty CA chain");
            }
            return response.getChain();
        } catch (CertificateIssuanceException e) {
            throw e;
        } catch (Exception e) {
            throw new CertificateIssuanceException("Failed to get CA chain", e);
        } finally {
            dynamicRestClientUtils.closeClient(client);
        }
    }

    private CertificateIssuerTemplateRestClient createClient() {
        return dynamicRestClientUtils.createRestClient(
                CertificateIssuerTemplateRestClient.class,
                tlsProperties.issuer().url(),
                tlsProperties.issuer().timeout()
        );
    }
}
