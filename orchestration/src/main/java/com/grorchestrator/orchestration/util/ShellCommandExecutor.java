package com.grorchestrator.orchestration.util;

import com.grorchestrator.orchestration.model.ShellCommandExecutionResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.eclipse.microprofile.context.ManagedExecutor;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

@Slf4j
@ApplicationScoped
public class ShellCommandExecutor {

    @Inject
    ManagedExecutor managedExecutor;

    /**
     * Executes command without shell. Stdout and stderr are collected in memory, so this method is not suitable for
     * commands producing large output.
     *
     * @param environment additional environment variables. Used to pass secrets.
     * @param stdin       written to process input and closed. Can be null.
     */
    public ShellCommandExecutionResult execute(List<String> command, Map<String, String> environment, String stdin, Duration timeout) throws IOException {
        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.environment().putAll(environment);
        Process process = processBuilder.start();

        CompletableFuture<String> stdoutFuture = readAsync(process.getInputStream());
        CompletableFuture<String> stderrFuture = readAsync(process.getErrorStream());

        try (OutputStream processInput = process.getOutputStream()) {
            if (stdin != null) {
                processInput.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        }

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("Command '{}' did not finish in {}. Killing it.", command.get(0), timeout);
                process.destroyForcibly();
                return ShellCommandExecutionResult.builder()
                        .timedOut(true)
                        .exitCode(-1)
                        .stdout("")
                        .stderr("Timed out after " + timeout)
                        .build();
            }

            return ShellCommandExecutionResult.builder()
                    .exitCode(process.exitValue())
                    .stdout(stdoutFuture.get())
                    .stderr(stderrFuture.get())
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while waiting for command " + command.get(0), e);
        } catch (ExecutionException e) {
            throw new IOException("Failed to read output of command " + command.get(0), e);
        }
    }

    private CompletableFuture<String> readAsync(InputStream inputStream) {
        return managedExecutor.supplyAsync(() -> {
            try {
                return IOUtils.toString(inputStream, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read process output", e);
            }
        });
    }
}
