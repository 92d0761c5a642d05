package com.grorchestrator.orchestration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShellCommandExecutionResult {
    private int exitCode;
    private boolean timedOut;
    private String stdout;
    private String stderr;

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }
}
