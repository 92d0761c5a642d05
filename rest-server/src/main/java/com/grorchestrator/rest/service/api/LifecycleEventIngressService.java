package com.grorchestrator.rest.service.api;

import com.grorchestrator.orchestration.exception.InvalidArgumentException;
import com.grorchestrator.rest.model.api.lifecycle.LifecycleEventAcceptedResponseDto;
import com.grorchestrator.rest.model.api.lifecycle.LifecycleEventRequestDto;

public interface LifecycleEventIngressService {
    /**
     * Validates event delivered by the external dispatcher and puts it into the local event queue.
     */
    LifecycleEventAcceptedResponseDto accept(LifecycleEventRequestDto requestDto) throws InvalidArgumentException;
}
