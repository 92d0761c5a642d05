package com.grorchestrator.orchestration.service.api;

import com.grorchestrator.orchestration.exception.InvalidArgumentException;
import com.grorchestrator.orchestration.model.tls.TlsStatus;

public interface TlsCertificateManager {

    /**
     * Switches TLS mode of the whole cluster. Coordinator only.
     */
    void setEnabled(boolean enabled);

    /**
     * Converges local TLS material of this node with peer state: requests and renews own certificate, installs issued
     * certificates, falls back to a self-signed placeholder when TLS is disabled. On coordinator also publishes CA chain.
     *
     * @return true if local material changed
     */
    boolean applyLocal();

    /**
     * Installs operator supplied private key. Certificate is re-requested for the new key when TLS is enabled.
     *
     * @param privateKeyPem key in PEM format, or null to generate a new one
     */
    void setPrivateKey(String privateKeyPem) throws InvalidArgumentException;

    TlsStatus getStatus();
}
