package com.grorchestrator.orchestration.exception;

public class EngineOperationException extends RuntimeException {
    public EngineOperationException() {
    }

    public EngineOperationException(String message) {
        super(message);
    }

    public EngineOperationException(String message, Throwable cause) {
        super(message, cause);
    }

    public EngineOperationException(Throwable cause) {
        super(cause);
    }

    public EngineOperationException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
