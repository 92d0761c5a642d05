package com.grorchestrator.orchestration.exception;

public class SnapshotToolException extends RuntimeException {
    public SnapshotToolException() {
    }

    public SnapshotToolException(String message) {
        super(message);
    }

    public SnapshotToolException(String message, Throwable cause) {
        super(message, cause);
    }

    public SnapshotToolException(Throwable cause) {
        super(cause);
    }

    public SnapshotToolException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
