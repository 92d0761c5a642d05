package com.grorchestrator.orchestration.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum ErrorCategory {
    /**
     * Engine call failed in a way which is expected to pass on retry. Absorbed by reconciliation and reported as degraded health.
     */
    TRANSIENT_ENGINE_ERROR(true),
    /**
     * Engine reports topology which can not be reconciled with the target. Requires operator intervention.
     */
    STRUCTURAL_INCONSISTENCY(false),
    /**
     * Something required is not there yet. Re-checked on the next pass.
     */
    PRECONDITION_NOT_MET(true),
    /**
     * Operation clashes with another operation which is in progress.
     */
    CONFLICTING_OPERATION(false),
    /**
     * Operation requires operator to verify something manually before or after it is executed.
     */
    OPERATOR_PRECONDITION(false),
    NOT_FOUND(false),
    INVALID_ARGUMENT(false);

    @Getter
    private final boolean recoverable;
}
