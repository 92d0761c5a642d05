package com.grorchestrator.rest.model.api.lifecycle;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleEventRequestDto {
    private String type;
    private String nodeId;
    /**
     * host:port of the engine instance. Required for NODE_ADDED.
     */
    private String nodeAddress;
    private Integer relationId;
    private String relationName;
    private String database;
}
