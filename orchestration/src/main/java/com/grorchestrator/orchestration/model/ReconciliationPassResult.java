package com.grorchestrator.orchestration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationPassResult {
    private ReconciliationDecision decision;
    private boolean operationApplied;
    /**
     * True when another pass is expected to make progress right away.
     */
    private boolean moreWorkExpected;

    public static ReconciliationPassResult nothingApplied(ReconciliationDecision decision) {
        return ReconciliationPassResult.builder()
                .decision(decision)
                .operationApplied(false)
                .moreWorkExpected(false)
                .build();
    }
}
