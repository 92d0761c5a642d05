package com.grorchestrator.configuration.properties.predefined;

import io.smallrye.config.ConfigMapping;

import java.time.Duration;

@ConfigMapping(prefix = "gr-orchestrator.backup")
public interface BackupProperties {

    boolean enabled();

    S3BackupProperties s3();

    String toolPath();

    String tempDirectory();

    /**
     * In-progress backup records older than this are considered abandoned and marked as failed.
     */
    Duration staleAfter();

    interface S3BackupProperties {

        ProtocolType protocol();

        String endpoint();

        String accessKey();

        String secretKey();

        String region();

        String bucket();

        String path();

        int multipartUploadPartSizeMb();
    }

    enum ProtocolType {
        HTTP,
        HTTPS
    }
}
