package com.grorchestrator.orchestration.exception;

public class InvalidArgumentException extends OrchestrationException {
    public InvalidArgumentException(String message) {
        super(ErrorCategory.INVALID_ARGUMENT, message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(ErrorCategory.INVALID_ARGUMENT, message, cause);
    }
}
