package com.grorchestrator.orchestration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Discrete lifecycle notification consumed by the reconciliation task of this node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleEvent {
    @Builder.Default
    private UUID eventId = UUID.randomUUID();
    private LifecycleEventType type;
    /**
     * Node the event is about. For NODE_ADDED and NODE_REMOVED.
     */
    private String nodeId;
    private String nodeAddress;
    /**
     * For RELATION_JOINED and RELATION_BROKEN.
     */
    private Integer relationId;
    private String relationName;
    private String database;
    @Builder.Default
    private Instant receivedAt = Instant.now();
    /**
     * How many follow-up passes preceded this one in a row.
     */
    private int followUpDepth;

    public static LifecycleEvent tick() {
        return LifecycleEvent.builder().type(LifecycleEventType.UPDATE_TICK).build();
    }

    public static LifecycleEvent followUp(int followUpDepth) {
        return LifecycleEvent.builder()
                .type(LifecycleEventType.UPDATE_TICK)
                .followUpDepth(followUpDepth)
                .build();
    }
}
