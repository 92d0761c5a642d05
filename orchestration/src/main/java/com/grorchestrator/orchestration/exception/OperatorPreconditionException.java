package com.grorchestrator.orchestration.exception;

public class OperatorPreconditionException extends OrchestrationException {
    public OperatorPreconditionException(String message) {
        super(ErrorCategory.OPERATOR_PRECONDITION, message);
    }

    public OperatorPreconditionException(String message, Throwable cause) {
        super(ErrorCategory.OPERATOR_PRECONDITION, message, cause);
    }
}
