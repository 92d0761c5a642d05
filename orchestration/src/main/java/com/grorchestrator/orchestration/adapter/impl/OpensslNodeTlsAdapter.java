package com.grorchestrator.orchestration.adapter.impl;

import com.grorchestrator.configuration.producers.FilesPathsProducer;
import com.grorchestrator.configuration.properties.predefined.TlsProperties;
import com.grorchestrator.orchestration.adapter.api.NodeTlsAdapter;
import com.grorchestrator.orchestration.exception.CertificateIssuanceException;
import com.grorchestrator.orchestration.model.ShellCommandExecutionResult;
import com.grorchestrator.orchestration.util.ShellCommandExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.grorchestrator.orchestration.constant.CommandsConstants.*;

/**
 * Keeps node key, certificate and CA in the local TLS directory which the engine is configured to read.
 */
@Slf4j
@ApplicationScoped
public class OpensslNodeTlsAdapter implements NodeTlsAdapter {
    private static final Pattern IP_ADDRESS_PATTERN = Pattern.compile("^(\\d{1,3}\\.){3}\\d{1,3}$|^[0-9a-fA-F:]+:[0-9a-fA-F:]*$");

    @Inject
    FilesPathsProducer filesPathsProducer;

    @Inject
    TlsProperties tlsProperties;

    @Inject
    ShellCommandExecutor shellCommandExecutor;

    @Override
    public boolean privateKeyExists() {
        return new File(filesPathsProducer.getNodePrivateKeyFilePath()).exists();
    }

    @Override
    public void generatePrivateKey() {
        runOpenssl(List.of(tlsProperties.opensslPath(), OPENSSL_GENRSA, "-out", filesPathsProducer.getNodePrivateKeyFilePath(), OPENSSL_RSA_KEY_SIZE));
        restrictPermissions(new File(filesPathsProducer.getNodePrivateKeyFilePath()));
        log.info("Generated new private key for this node");
    }

    @Override
    public void installPrivateKey(String privateKeyPem) {
        File keyFile = new File(filesPathsProducer.getNodePrivateKeyFilePath());
        writeFile(keyFile, privateKeyPem);
        restrictPermissions(keyFile);
        log.info("Installed operator supplied private key");
    }

    @Override
    public String createSigningRequest(String commonName, List<String> subjectAlternativeNames) {
        List<String> command = new ArrayList<>(List.of(
                tlsProperties.opensslPath(),
                OPENSSL_REQ,
                "-new",
                "-key", filesPathsProducer.getNodePrivateKeyFilePath(),
                "-subj", "/CN=" + commonName,
                "-out", filesPathsProducer.getNodeCsrFilePath()
        ));
        if (!subjectAlternativeNames.isEmpty()) {
            command.add("-addext");
            command.add("subjectAltName=" + subjectAlternativeNames.stream().map(this::toSanEntry).collect(Collectors.joining(",")));
        }
        runOpenssl(command);

        try {
            return FileUtils.readFileToString(new File(filesPathsProducer.getNodeCsrFilePath()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CertificateIssuanceException("Failed to read signing request", e);
        }
    }

    @Override
    public void installCertificate(String certificatePem, String caPem) {
        writeFile(new File(filesPathsProducer.getNodeCertificateFilePath()), certificatePem);
        writeFile(new File(filesPathsProducer.getNodeCaFilePath()), StringUtils.defaultIfBlank(caPem, certificatePem));
    }

    @Override
    public void installSelfSignedPlaceholder(String commonName) {
        runOpenssl(List.of(
                tlsProperties.opensslPath(),
                OPENSSL_REQ,
                "-x509",
                "-new",
                "-key", filesPathsProducer.getNodePrivateKeyFilePath(),
                "-days", OPENSSL_PLACEHOLDER_VALIDITY_DAYS,
                "-subj", "/CN=" + commonName,
                "-out", filesPathsProducer.getNodeCertificateFilePath()
        ));
        try {
            FileUtils.copyFile(new File(filesPathsProducer.getNodeCertificateFilePath()), new File(filesPathsProducer.getNodeCaFilePath()));
        } catch (IOException e) {
            throw new CertificateIssuanceException("Failed to install self-signed CA file", e);
        }
    }

    private String toSanEntry(String name) {
        return IP_ADDRESS_PATTERN.matcher(name).matches() ? "IP:" + name : "DNS:" + name;
    }

    private void runOpenssl(List<String> command) {
        ShellCommandExecutionResult result;
        try {
            result = shellCommandExecutor.execute(command, Map.of(), null, tlsProperties.issuer().timeout());
        } catch (IOException e) {
            throw new CertificateIssuanceException("Failed to execute openssl " + command.get(1), e);
        }
        if (!result.isSuccess()) {
            throw new CertificateIssuanceException("openssl " + command.get(1) + " failed: " + StringUtils.abbreviate(result.getStderr(), 500));
        }
    }

    private void writeFile(File file, String content) {
        try {
            FileUtils.writeStringToFile(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CertificateIssuanceException("Failed to write " + file.getName(), e);
        }
    }

    private void restrictPermissions(File file) {
        try {
            Files.setPosixFilePermissions(file.toPath(), PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException | IOException e) {
            log.warn("Failed to restrict permissions of {}: {}", file.getName(), e.getMessage());
        }
    }
}
