package com.grorchestrator.orchestration.model.peerstate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Single entry of peer state. Version starts at 1 and grows by one on every write of the key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionedValue {
    private String value;
    private long version;
    private Instant updatedAt;
    private String updatedBy;
}
