package com.grorchestrator.orchestration.adapter.impl;

import com.grorchestrator.configuration.properties.predefined.BackupProperties;
import com.grorchestrator.configuration.properties.predefined.EngineProperties;
import com.grorchestrator.orchestration.adapter.api.SnapshotToolAdapter;
import com.grorchestrator.orchestration.exception.SnapshotToolException;
import com.grorchestrator.orchestration.model.backup.SnapshotStream;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.grorchestrator.orchestration.constant.CommandsConstants.*;

@Slf4j
@ApplicationScoped
public class XtrabackupSnapshotToolAdapter implements SnapshotToolAdapter {
    private static final DateTimeFormatter BINLOG_DATETIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    @Inject
    BackupProperties backupProperties;

    @Inject
    EngineProperties engineProperties;

    @Override
    public SnapshotStream startBackup(String username, String password, File workDirectory, File logFile) throws SnapshotToolException {
        try {
            FileUtils.forceMkdir(workDirectory);

            ProcessBuilder processBuilder = new ProcessBuilder(
                    tool(XTRABACKUP_COMMAND),
                    XTRABACKUP_BACKUP_KEY,
                    XTRABACKUP_STREAM_KEY,
                    XTRABACKUP_NO_LOCK_KEY,
                    XTRABACKUP_TARGET_DIR_KEY + workDirectory.getAbsolutePath(),
                    XTRABACKUP_USER_KEY + username
            );
            processBuilder.environment().put(MYSQL_PASSWORD_ENV, password);
            processBuilder.redirectError(ProcessBuilder.Redirect.appendTo(logFile));

            Process process = processBuilder.start();

            return SnapshotStream.builder()
                    .process(process)
                    .inputStream(process.getInputStream())
                    .logFile(logFile)
                    .build();
        } catch (IOException e) {
            throw new SnapshotToolException("Failed to start snapshot tool", e);
        }
    }

    @Override
    public void awaitCompletion(SnapshotStream snapshotStream) throws SnapshotToolException {
        try {
            int code = snapshotStream.getProcess().waitFor();
            if (code != 0) {
                throw new SnapshotToolException("Snapshot tool exited with code " + code + ". See " + snapshotStream.getLogFile().getName());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            snapshotStream.getProcess().destroyForcibly();
            throw new SnapshotToolException("Interrupted while waiting for snapshot tool", e);
        }
    }

    @Override
    public void restoreSnapshot(InputStream snapshot, File workDirectory, File logFile) throws SnapshotToolException {
        EngineProperties.ServiceProperties service = engineProperties.service();
        try {
            FileUtils.forceMkdir(workDirectory);
            FileUtils.cleanDirectory(workDirectory);

            log.info("Extracting snapshot into {}", workDirectory.getAbsolutePath());
            extract(snapshot, workDirectory, logFile);

            log.info("Preparing extracted snapshot");
            runToCompletion(List.of(tool(XTRABACKUP_COMMAND), XTRABACKUP_PREPARE_KEY, XTRABACKUP_TARGET_DIR_KEY + workDirectory.getAbsolutePath()), Map.of(), logFile, null, null);

            log.info("Stopping engine to replace its data directory");
            runToCompletion(splitCommand(service.stopCommand()), Map.of(), logFile, null, null);

            File dataDirectory = new File(service.dataDirectory());
            FileUtils.forceMkdir(dataDirectory);
            FileUtils.cleanDirectory(dataDirectory);

            runToCompletion(
                    List.of(
                            tool(XTRABACKUP_COMMAND),
                            XTRABACKUP_MOVE_BACK_KEY,
                            XTRABACKUP_TARGET_DIR_KEY + workDirectory.getAbsolutePath(),
                            XTRABACKUP_DATADIR_KEY + dataDirectory.getAbsolutePath()
                    ),
                    Map.of(),
                    logFile,
                    null,
                    null
            );

            log.info("Starting engine with restored data");
            runToCompletion(splitCommand(service.startCommand()), Map.of(), logFile, null, null);
        } catch (IOException e) {
            throw new SnapshotToolException("Failed to restore snapshot", e);
        }
    }

    @Override
    public void recoverToPointInTime(Instant restoreToTime, String username, String password, File workDirectory, File logFile) throws SnapshotToolException {
        File binlogDirectory = new File(engineProperties.service().binlogDirectory());
        File[] binlogs = binlogDirectory.listFiles((dir, name) -> name.startsWith(MYSQLBINLOG_FILE_PREFIX) && !name.endsWith(".index"));

        if (binlogs == null || binlogs.length == 0) {
            throw new SnapshotToolException("No binary logs found in " + binlogDirectory.getAbsolutePath() + ", can not recover to " + restoreToTime);
        }
        Arrays.sort(binlogs);

        List<String> command = new ArrayList<>();
        command.add(tool(MYSQLBINLOG_COMMAND));
        command.add(MYSQLBINLOG_STOP_DATETIME_KEY + BINLOG_DATETIME_FORMATTER.format(restoreToTime));
        Arrays.stream(binlogs).forEach(binlog -> command.add(binlog.getAbsolutePath()));

        File replayFile = Paths.get(workDirectory.getAbsolutePath(), REPLAY_SQL_FILE_NAME).toFile();

        log.info("Replaying {} binary log files up to {}", binlogs.length, restoreToTime);
        runToCompletion(command, Map.of(), logFile, null, replayFile);
        runToCompletion(
                List.of(tool(MYSQL_CLIENT_COMMAND), MYSQL_CLIENT_USER_KEY + username),
                Map.of(MYSQL_PASSWORD_ENV, password),
                logFile,
                replayFile,
                null
        );
    }

    private void extract(InputStream snapshot, File workDirectory, File logFile) throws IOException {
        ProcessBuilder processBuilder = new ProcessBuilder(
                tool(XBSTREAM_COMMAND),
                XBSTREAM_EXTRACT_KEY,
                XBSTREAM_DIRECTORY_KEY,
                workDirectory.getAbsolutePath()
        );
        processBuilder.redirectError(ProcessBuilder.Redirect.appendTo(logFile));
        processBuilder.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile));
        Process process = processBuilder.start();

        try (OutputStream processInput = process.getOutputStream()) {
            IOUtils.copyLarge(snapshot, processInput);
        }

        awaitExit(process, XBSTREAM_COMMAND);
    }

    private void runToCompletion(List<String> command, Map<String, String> environment, File logFile, File input, File output) {
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.environment().putAll(environment);
            processBuilder.redirectError(ProcessBuilder.Redirect.appendTo(logFile));
            processBuilder.redirectOutput(output != null ? ProcessBuilder.Redirect.to(output) : ProcessBuilder.Redirect.appendTo(logFile));
            if (input != null) {
                processBuilder.redirectInput(input);
            }

            awaitExit(processBuilder.start(), command.get(0));
        } catch (IOException e) {
            throw new SnapshotToolException("Failed to execute " + command.get(0), e);
        }
    }

    private void awaitExit(Process process, String commandName) {
        try {
            int code = process.waitFor();
            if (code != 0) {
                throw new SnapshotToolException(commandName + " exited with code " + code);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new SnapshotToolException("Interrupted while waiting for " + commandName, e);
        }
    }

    private List<String> splitCommand(String command) {
        return Arrays.asList(command.trim().split("\\s+"));
    }

    private String tool(String name) {
        return Paths.get(backupProperties.toolPath(), name).toString();
    }
}
