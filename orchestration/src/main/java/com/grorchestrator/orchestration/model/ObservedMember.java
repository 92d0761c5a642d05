package com.grorchestrator.orchestration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservedMember {
    /**
     * Node id. Engine stores it as instance label.
     */
    private String nodeId;
    private String address;
    private MemberState state;
    private boolean primary;
    /**
     * Number of transactions applied by this member. Used to pick the most caught-up member for promotion.
     */
    private long appliedTransactionPosition;
}
