package com.grorchestrator.orchestration.exception;

public class StructuralInconsistencyException extends OrchestrationException {
    public StructuralInconsistencyException(String message) {
        super(ErrorCategory.STRUCTURAL_INCONSISTENCY, message);
    }

    public StructuralInconsistencyException(String message, Throwable cause) {
        super(ErrorCategory.STRUCTURAL_INCONSISTENCY, message, cause);
    }
}
