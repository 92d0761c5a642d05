package com.grorchestrator.orchestration.model.peerstate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoordinationLease {
    private String holderNodeId;
    /**
     * Grows every time lease changes hands.
     */
    private long term;
    private Instant renewedAt;
    private Instant expiresAt;
}
