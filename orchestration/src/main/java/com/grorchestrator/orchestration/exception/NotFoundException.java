package com.grorchestrator.orchestration.exception;

public class NotFoundException extends OrchestrationException {
    public NotFoundException(String message) {
        super(ErrorCategory.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorCategory.NOT_FOUND, message, cause);
    }
}
