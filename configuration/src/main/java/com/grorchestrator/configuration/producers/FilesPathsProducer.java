package com.grorchestrator.configuration.producers;

import com.grorchestrator.configuration.exception.ConfigurationInitializationException;
import com.grorchestrator.configuration.properties.constant.GrOrchestratorConstants;
import com.grorchestrator.configuration.properties.predefined.BackupProperties;
import com.grorchestrator.configuration.properties.predefined.PeerStateProperties;
import com.grorchestrator.configuration.properties.predefined.TlsProperties;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;

@Slf4j
@ApplicationScoped
public class FilesPathsProducer {
    @Inject
    PeerStateProperties peerStateProperties;

    @Inject
    TlsProperties tlsProperties;

    @Inject
    BackupProperties backupProperties;

    @PostConstruct
    public void createDirs() {
        try {
            Files.createDirectories(Paths.get(peerStateProperties.directory()));
            Files.createDirectories(Paths.get(tlsProperties.localDirectory()));
            // work directories only hold leftovers of backups and restores interrupted by a restart
            recreateEmpty(new File(getBackupWorkDirectoryPath()));
            recreateEmpty(new File(getRestoreWorkDirectoryPath()));
        } catch (IOException e) {
            throw new ConfigurationInitializationException("Error while creating directories for local files", e);
        }
    }

    private void recreateEmpty(File directory) throws IOException {
        if (directory.exists()) {
            log.info("Removing leftovers in {}", directory);
            FileUtils.forceDelete(directory);
        }
        FileUtils.forceMkdir(directory);
    }

    public String getPeerStateFilePath() {
        return peerStateProperties.directory()
                + "/"
                + GrOrchestratorConstants.PEER_STATE_FILE_NAME;
    }

    public String getNodePrivateKeyFilePath() {
        return tlsProperties.localDirectory()
                + "/"
                + GrOrchestratorConstants.NODE_PRIVATE_KEY_FILE_NAME;
    }

    public String getNodeCertificateFilePath() {
        return tlsProperties.localDirectory()
                + "/"
                + GrOrchestratorConstants.NODE_CERTIFICATE_FILE_NAME;
    }

    public String getNodeCaFilePath() {
        return tlsProperties.localDirectory()
                + "/"
                + GrOrchestratorConstants.NODE_CA_FILE_NAME;
    }

    public String getNodeCsrFilePath() {
        return tlsProperties.localDirectory()
                + "/"
                + GrOrchestratorConstants.NODE_CSR_FILE_NAME;
    }

    public String getBackupWorkDirectoryPath() {
        return backupProperties.tempDirectory()
                + "/"
                + GrOrchestratorConstants.BACKUP_WORK_DIRECTORY_NAME;
    }

    public String getRestoreWorkDirectoryPath() {
        return backupProperties.tempDirectory()
                + "/"
                + GrOrchestratorConstants.RESTORE_WORK_DIRECTORY_NAME;
    }
}
