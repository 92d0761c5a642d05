package com.grorchestrator.quarkusroot.validator;

import com.grorchestrator.configuration.properties.predefined.BackupProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

@Slf4j
@ApplicationScoped
public class BackupConfigurationValidator implements ConfigurationValidator {
    // S3 does not accept multipart parts smaller than 5 MB
    private static final int MIN_PART_SIZE_MB = 5;

    @Inject
    BackupProperties backupProperties;

    @Override
    public boolean validate() {
        if (!backupProperties.enabled()) {
            return true;
        }

        boolean flag = true;
        BackupProperties.S3BackupProperties s3 = backupProperties.s3();

        if (StringUtils.isAnyBlank(s3.endpoint(), s3.bucket(), s3.accessKey(), s3.secretKey(), s3.region())) {
            log.error("Invalid backup configuration. S3 endpoint, bucket, region, access key and secret key are required when backups are enabled.");
            flag = false;
        }

        if (s3.multipartUploadPartSizeMb() < MIN_PART_SIZE_MB) {
            log.error("Invalid backup configuration. Multipart upload part size must be at least {} MB.", MIN_PART_SIZE_MB);
            flag = false;
        }

        if (StringUtils.isBlank(backupProperties.toolPath())) {
            log.error("Invalid backup configuration. Path to snapshot tool directory is required.");
            flag = false;
        }

        if (backupProperties.staleAfter().isNegative() || backupProperties.staleAfter().isZero()) {
            log.error("Invalid backup configuration. Stale-after duration must be positive.");
            flag = false;
        }

        return flag;
    }
}
