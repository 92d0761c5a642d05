package com.grorchestrator.orchestration.exception;

public class PreconditionNotMetException extends OrchestrationException {
    public PreconditionNotMetException(String message) {
        super(ErrorCategory.PRECONDITION_NOT_MET, message);
    }

    public PreconditionNotMetException(String message, Throwable cause) {
        super(ErrorCategory.PRECONDITION_NOT_MET, message, cause);
    }
}
