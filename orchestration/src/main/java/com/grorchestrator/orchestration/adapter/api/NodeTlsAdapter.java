package com.grorchestrator.orchestration.adapter.api;

import java.util.List;

/**
 * Local TLS material of this node.
 */
public interface NodeTlsAdapter {

    boolean privateKeyExists();

    void generatePrivateKey();

    /**
     * Replaces local private key with provided one.
     *
     * @param privateKeyPem key in PEM format. Must be validated by caller.
     */
    void installPrivateKey(String privateKeyPem);

    /**
     * @return signing request in PEM format for local private key
     */
    String createSigningRequest(String commonName, List<String> subjectAlternativeNames);

    void installCertificate(String certificatePem, String caPem);

    /**
     * Replaces certificate by a self-signed one for local private key.
     */
    void installSelfSignedPlaceholder(String commonName);
}
