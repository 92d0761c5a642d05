package com.grorchestrator.orchestration.adapter.api;

import com.grorchestrator.orchestration.exception.CertificateIssuanceException;
import com.grorchestrator.orchestration.model.tls.CertificateSigningRequest;
import com.grorchestrator.orchestration.model.tls.IssuedCertificate;

import java.util.List;

/**
 * External certificate issuer. Receives only signing requests, private keys never leave the node.
 */
public interface CertificateIssuerAdapter {

    IssuedCertificate issue(CertificateSigningRequest request) throws CertificateIssuanceException;

    List<String> getCaChain() throws CertificateIssuanceException;
}
