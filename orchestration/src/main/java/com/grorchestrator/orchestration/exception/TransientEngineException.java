package com.grorchestrator.orchestration.exception;

public class TransientEngineException extends OrchestrationException {
    public TransientEngineException(String message) {
        super(ErrorCategory.TRANSIENT_ENGINE_ERROR, message);
    }

    public TransientEngineException(String message, Throwable cause) {
        super(ErrorCategory.TRANSIENT_ENGINE_ERROR, message, cause);
    }
}
