package com.grorchestrator.orchestration.exception;

import lombok.Getter;

/**
 * Base for all errors which are reported to operator with a category.
 */
public abstract class OrchestrationException extends RuntimeException {
    @Getter
    private final ErrorCategory category;

    protected OrchestrationException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected OrchestrationException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }
}
