package com.grorchestrator.orchestration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Result of diffing observed topology against the target. Recomputed on every pass.
 * At most one mutating operation is planned per pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationDecision {
    private Outcome outcome;
    private Set<String> targetMembers;
    @Builder.Default
    private List<ReconciliationOperation> operations = new ArrayList<>();
    /**
     * Set for DEFERRED and BLOCKED outcomes.
     */
    private String reason;

    public static ReconciliationDecision converged(Set<String> targetMembers) {
        return ReconciliationDecision.builder()
                .outcome(Outcome.CONVERGED)
                .targetMembers(targetMembers)
                .build();
    }

    public static ReconciliationDecision apply(Set<String> targetMembers, ReconciliationOperation operation) {
        List<ReconciliationOperation> operations = new ArrayList<>();
        operations.add(operation);
        return ReconciliationDecision.builder()
                .outcome(Outcome.APPLY)
                .targetMembers(targetMembers)
                .operations(operations)
                .build();
    }

    public static ReconciliationDecision deferred(Set<String> targetMembers, String reason) {
        return ReconciliationDecision.builder()
                .outcome(Outcome.DEFERRED)
                .targetMembers(targetMembers)
                .reason(reason)
                .build();
    }

    public static ReconciliationDecision blocked(Set<String> targetMembers, String reason) {
        return ReconciliationDecision.builder()
                .outcome(Outcome.BLOCKED)
                .targetMembers(targetMembers)
                .reason(reason)
                .build();
    }

    public ReconciliationOperation getOperation() {
        return operations.isEmpty() ? null : operations.get(0);
    }

    public enum Outcome {
        CONVERGED,
        APPLY,
        DEFERRED,
        BLOCKED
    }
}
