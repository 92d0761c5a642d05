package com.grorchestrator.orchestration.model.backup;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum BackupStatus {
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    FAILED("failed");

    @Getter
    private final String value;
}
