package com.grorchestrator.orchestration.exception;

public class ConflictingOperationException extends OrchestrationException {
    public ConflictingOperationException(String message) {
        super(ErrorCategory.CONFLICTING_OPERATION, message);
    }

    public ConflictingOperationException(String message, Throwable cause) {
        super(ErrorCategory.CONFLICTING_OPERATION, message, cause);
    }
}
