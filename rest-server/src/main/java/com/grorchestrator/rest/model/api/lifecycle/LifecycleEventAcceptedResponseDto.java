package com.grorchestrator.rest.model.api.lifecycle;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleEventAcceptedResponseDto {
    private UUID eventId;
    private int pendingEvents;
}
