package com.grorchestrator.orchestration.service.impl;

import com.grorchestrator.configuration.properties.predefined.ClusterProperties;
import com.grorchestrator.configuration.properties.predefined.TlsProperties;
import com.grorchestrator.orchestration.adapter.api.CertificateIssuerAdapter;
import com.grorchestrator.orchestration.adapter.api.ClusterControlAdapter;
import com.grorchestrator.orchestration.adapter.api.NodeTlsAdapter;
import com.grorchestrator.orchestration.exception.CertificateIssuanceException;
import com.grorchestrator.orchestration.exception.EngineOperationException;
import com.grorchestrator.orchestration.exception.InvalidArgumentException;
import com.grorchestrator.orchestration.exception.TransientEngineException;
import com.grorchestrator.orchestration.model.tls.CertificateSigningRequest;
import com.grorchestrator.orchestration.model.tls.IssuedCertificate;
import com.grorchestrator.orchestration.model.tls.PersistedCertificateInfo;
import com.grorchestrator.orchestration.model.tls.TlsStatus;
import com.grorchestrator.orchestration.service.api.CoordinationAuthority;
import com.grorchestrator.orchestration.service.api.TlsCertificateManager;
import com.grorchestrator.orchestration.util.ClusterTopologyResolver;
import com.grorchestrator.orchestration.util.PeerStateFunctionalityCombinator;
import com.grorchestrator.orchestration.util.TlsUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@ApplicationScoped
public class TlsCertificateManagerImpl implements TlsCertificateManager {
    static final String SELF_SIGNED_SERIAL = "self-signed";

    @Inject
    PeerStateFunctionalityCombinator peerStateFunctionalityCombinator;

    @Inject
    CoordinationAuthority coordinationAuthority;

    @Inject
    CertificateIssuerAdapter certificateIssuerAdapter;

    @Inject
    NodeTlsAdapter nodeTlsAdapter;

    @Inject
    ClusterControlAdapter clusterControlAdapter;

    @Inject
    ClusterTopologyResolver clusterTopologyResolver;

    @Inject
    ClusterProperties clusterProperties;

    @Inject
    TlsProperties tlsProperties;

    Clock clock = Clock.systemUTC();

    @Override
    public void setEnabled(boolean enabled) {
        if (peerStateFunctionalityCombinator.isTlsEnabled() == enabled) {
            return;
        }
        peerStateFunctionalityCombinator.saveTlsEnabled(enabled);
        log.info("TLS is now {} for the cluster", enabled ? "enabled" : "disabled");
    }

    @Override
    public boolean applyLocal() {
        String nodeId = clusterProperties.nodeId();
        boolean enabled = peerStateFunctionalityCombinator.isTlsEnabled();

        if (coordinationAuthority.isCoordinator()) {
            publishCaChain(enabled);
        }

        if (!enabled) {
            return revertToPlaceholder(nodeId);
        }

        if (!nodeTlsAdapter.privateKeyExists()) {
            nodeTlsAdapter.generatePrivateKey();
        }

        boolean changed = false;
        Optional<PersistedCertificateInfo> current = peerStateFunctionalityCombinator.getNodeCertificate(nodeId);
        if (current.isEmpty() || isExpiringSoon(current.get())) {
            if (current.isPresent()) {
                log.info("Certificate {} expires at {}, renewing", current.get().getSerial(), current.get().getExpiresAt());
            }
            current = Optional.of(requestCertificate(nodeId));
            changed = true;
        }

        String adoptedSerial = peerStateFunctionalityCombinator.getAdoptedCertificateSerial(nodeId).orElse(null);
        if (!current.get().getSerial().equals(adoptedSerial)) {
            changed = install(current.get()) || changed;
        }
        return changed;
    }

    @Override
    public void setPrivateKey(String privateKeyPem) {
        if (privateKeyPem == null) {
            nodeTlsAdapter.generatePrivateKey();
        } else {
            if (!TlsUtils.isValidPrivateKeyPem(TlsUtils.normalizePem(privateKeyPem))) {
                throw new InvalidArgumentException("Provided value is not a PEM encoded private key");
            }
            nodeTlsAdapter.installPrivateKey(TlsUtils.normalizePem(privateKeyPem));
        }

        String nodeId = clusterProperties.nodeId();
        if (peerStateFunctionalityCombinator.isTlsEnabled()) {
            PersistedCertificateInfo certificateInfo = requestCertificate(nodeId);
            install(certificateInfo);
        } else {
            installPlaceholder(nodeId);
        }
    }

    @Override
    public TlsStatus getStatus() {
        String nodeId = clusterProperties.nodeId();
        Optional<PersistedCertificateInfo> current = peerStateFunctionalityCombinator.getNodeCertificate(nodeId);
        String adopted = peerStateFunctionalityCombinator.getAdoptedCertificateSerial(nodeId).orElse(null);

        return TlsStatus.builder()
                .enabled(peerStateFunctionalityCombinator.isTlsEnabled())
                .nodeId(nodeId)
                .currentSerial(current.map(PersistedCertificateInfo::getSerial).orElse(null))
                .adoptedSerial(adopted)
                .supersededSerial(peerStateFunctionalityCombinator.getPreviousNodeCertificate(nodeId).map(PersistedCertificateInfo::getSerial).orElse(null))
                .expiresAt(current.map(PersistedCertificateInfo::getExpiresAt).orElse(null))
                .selfSigned(SELF_SIGNED_SERIAL.equals(adopted))
                .build();
    }

    private void publishCaChain(boolean enabled) {
        boolean present = peerStateFunctionalityCombinator.getCaChain().isPresent();
        if (enabled && !present) {
            try {
                List<String> chain = certificateIssuerAdapter.getCaChain();
                peerStateFunctionalityCombinator.saveCaChain(chain);
                log.info("Published CA chain with {} certificates", chain.size());
            } catch (CertificateIssuanceException e) {
                log.warn("Failed to get CA chain from issuer, will retry on next pass. Cause: {}", e.getMessage());
            }
        } else if (!enabled && present) {
            peerStateFunctionalityCombinator.deleteCaChain();
        }
    }

    private PersistedCertificateInfo requestCertificate(String nodeId) {
        String commonName = clusterProperties.nodeAddress();
        List<String> sans = List.of(clusterProperties.nodeAddress(), nodeId);
        String csr = nodeTlsAdapter.createSigningRequest(commonName, sans);

        IssuedCertificate issued = certificateIssuerAdapter.issue(
                CertificateSigningRequest.builder()
                        .nodeId(nodeId)
                        .commonName(commonName)
                        .subjectAlternativeNames(sans)
                        .csrPem(csr)
                        .build()
        );

        PersistedCertificateInfo certificateInfo = PersistedCertificateInfo.builder()
                .nodeId(nodeId)
                .serial(UUID.randomUUID().toString())
                .certificatePem(issued.getCertificatePem())
                .caPem(issued.getCaPem())
                .chain(issued.getChain())
                .issuer(issued.getIssuer())
                .issuedAt(clock.instant())
                .expiresAt(issued.getExpiresAt())
                .build();

        peerStateFunctionalityCombinator.saveNodeCertificate(certificateInfo);
        log.info("Received certificate {} for node {}, expires at {}", certificateInfo.getSerial(), nodeId, certificateInfo.getExpiresAt());
        return certificateInfo;
    }

    private boolean install(PersistedCertificateInfo certificateInfo) {
        nodeTlsAdapter.installCertificate(certificateInfo.getCertificatePem(), certificateInfo.getCaPem());
        if (!reloadEngineTls()) {
            return false;
        }
        peerStateFunctionalityCombinator.markCertificateAdopted(certificateInfo.getNodeId(), certificateInfo.getSerial());
        log.info("Installed certificate {}", certificateInfo.getSerial());
        return true;
    }

    private boolean revertToPlaceholder(String nodeId) {
        Optional<String> adopted = peerStateFunctionalityCombinator.getAdoptedCertificateSerial(nodeId);
        if (adopted.isEmpty() || SELF_SIGNED_SERIAL.equals(adopted.get())) {
            return false;
        }
        return installPlaceholder(nodeId);
    }

    private boolean installPlaceholder(String nodeId) {
        if (!nodeTlsAdapter.privateKeyExists()) {
            nodeTlsAdapter.generatePrivateKey();
        }
        nodeTlsAdapter.installSelfSignedPlaceholder(clusterProperties.nodeAddress());
        if (!reloadEngineTls()) {
            return false;
        }
        peerStateFunctionalityCombinator.markCertificateAdopted(nodeId, SELF_SIGNED_SERIAL);
        peerStateFunctionalityCombinator.deleteNodeCertificate(nodeId);
        log.info("Node {} switched to self-signed certificate", nodeId);
        return true;
    }

    private boolean reloadEngineTls() {
        try {
            clusterControlAdapter.reloadTls(clusterTopologyResolver.getSelfEndpoint());
            return true;
        } catch (TransientEngineException | EngineOperationException e) {
            log.warn("Engine did not reload TLS material, will retry on next pass. Cause: {}", e.getMessage());
            return false;
        }
    }

    private boolean isExpiringSoon(PersistedCertificateInfo certificateInfo) {
        if (certificateInfo.getExpiresAt() == null) {
            return false;
        }
        Instant renewAt = certificateInfo.getExpiresAt().minus(tlsProperties.renewBefore());
        return !clock.instant().isBefore(renewAt);
    }
}
