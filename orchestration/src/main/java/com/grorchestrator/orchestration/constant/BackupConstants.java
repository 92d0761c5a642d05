package com.grorchestrator.orchestration.constant;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

public class BackupConstants {
    public static final DateTimeFormatter BACKUP_ID_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);
    public static final Pattern BACKUP_ID_PATTERN = Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z");

    // S3
    public static final String S3_SNAPSHOT_KEY_FORMAT = "%s/%s";
    public static final String S3_METADATA_KEY_FORMAT = "%s/%s.metadata";
    public static final String S3_LOG_KEY_FORMAT = "%s/%s.backup.log";
    public static final String S3_METADATA_SUFFIX = ".metadata";

    public static final String BACKUP_LOG_FILE_NAME_FORMAT = "%s.backup.log";
    public static final String RESTORE_LOG_FILE_NAME = "restore.log";

    private BackupConstants() {
    }
}
