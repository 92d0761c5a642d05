package com.grorchestrator.orchestration.constant;

public class CommandsConstants {

    public static final String MYSQLSH_NO_WIZARD_KEY = "--no-wizard";
    public static final String MYSQLSH_PYTHON_MODE_KEY = "--python";
    public static final String MYSQLSH_URI_KEY = "--uri";
    public static final String MYSQLSH_PASSWORDS_FROM_STDIN_KEY = "--passwords-from-stdin";
    public static final String MYSQLSH_EXECUTE_KEY = "-e";

    public static final String XTRABACKUP_COMMAND = "xtrabackup";
    public static final String XBSTREAM_COMMAND = "xbstream";
    public static final String XTRABACKUP_BACKUP_KEY = "--backup";
    public static final String XTRABACKUP_STREAM_KEY = "--stream=xbstream";
    public static final String XTRABACKUP_TARGET_DIR_KEY = "--target-dir=";
    public static final String XTRABACKUP_USER_KEY = "--user=";
    public static final String XTRABACKUP_PREPARE_KEY = "--prepare";
    public static final String XTRABACKUP_MOVE_BACK_KEY = "--move-back";
    public static final String XTRABACKUP_DATADIR_KEY = "--datadir=";
    public static final String XTRABACKUP_NO_LOCK_KEY = "--no-server-version-check";
    public static final String XBSTREAM_EXTRACT_KEY = "-x";
    public static final String XBSTREAM_DIRECTORY_KEY = "-C";
    public static final String MYSQL_PASSWORD_ENV = "MYSQL_PWD";

    public static final String MYSQLBINLOG_COMMAND = "mysqlbinlog";
    public static final String MYSQLBINLOG_STOP_DATETIME_KEY = "--stop-datetime=";
    public static final String MYSQLBINLOG_FILE_PREFIX = "binlog.";
    public static final String MYSQL_CLIENT_COMMAND = "mysql";
    public static final String MYSQL_CLIENT_USER_KEY = "--user=";
    public static final String REPLAY_SQL_FILE_NAME = "replay.sql";

    public static final String OPENSSL_GENRSA = "genrsa";
    public static final String OPENSSL_REQ = "req";
    public static final String OPENSSL_RSA_KEY_SIZE = "2048";
    public static final String OPENSSL_PLACEHOLDER_VALIDITY_DAYS = "3650";

    private CommandsConstants() {
    }
}
