package com.grorchestrator.rest.service.impl;

import com.grorchestrator.orchestration.exception.InvalidArgumentException;
import com.grorchestrator.orchestration.model.LifecycleEvent;
import com.grorchestrator.orchestration.model.LifecycleEventType;
import com.grorchestrator.orchestration.service.api.LifecycleEventDispatcher;
import com.grorchestrator.rest.model.api.lifecycle.LifecycleEventAcceptedResponseDto;
import com.grorchestrator.rest.model.api.lifecycle.LifecycleEventRequestDto;
import com.grorchestrator.rest.service.api.LifecycleEventIngressService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.EnumUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

@Slf4j
@ApplicationScoped
public class LifecycleEventIngressServiceImpl implements LifecycleEventIngressService {
    private static final Pattern ENDPOINT_PATTERN = Pattern.compile("^[^:\\s]+:\\d{1,5}$");

    @Inject
    LifecycleEventDispatcher lifecycleEventDispatcher;

    @Override
    public LifecycleEventAcceptedResponseDto accept(LifecycleEventRequestDto requestDto) {
        if (requestDto == null || StringUtils.isBlank(requestDto.getType())) {
            throw new InvalidArgumentException("Event type is required");
        }

        LifecycleEventType type = EnumUtils.getEnumIgnoreCase(LifecycleEventType.class, requestDto.getType().trim().replace('-', '_'));
        if (type == null) {
            throw new InvalidArgumentException("Unknown event type '" + requestDto.getType() + "'");
        }

        switch (type) {
            case NODE_ADDED -> {
                requireNodeId(requestDto);
                if (StringUtils.isBlank(requestDto.getNodeAddress()) || !ENDPOINT_PATTERN.matcher(requestDto.getNodeAddress()).matches()) {
                    throw new InvalidArgumentException("NODE_ADDED requires node address in host:port format");
                }
            }
            case NODE_REMOVED -> requireNodeId(requestDto);
            case RELATION_JOINED, RELATION_BROKEN -> {
                if (StringUtils.isBlank(requestDto.getRelationName())) {
                    throw new InvalidArgumentException(type + " requires relation name");
                }
                if (requestDto.getRelationId() == null || requestDto.getRelationId() < 0) {
                    throw new InvalidArgumentException(type + " requires non-negative relation id");
                }
            }
            default -> {
            }
        }

        LifecycleEvent event = LifecycleEvent.builder()
                .type(type)
                .nodeId(requestDto.getNodeId())
                .nodeAddress(requestDto.getNodeAddress())
                .relationId(requestDto.getRelationId())
                .relationName(requestDto.getRelationName())
                .database(requestDto.getDatabase())
                .build();

        lifecycleEventDispatcher.enqueue(event);
        log.debug("Accepted {} event {}", type, event.getEventId());

        return LifecycleEventAcceptedResponseDto.builder()
                .eventId(event.getEventId())
                .pendingEvents(lifecycleEventDispatcher.getPendingCount())
                .build();
    }

    private void requireNodeId(LifecycleEventRequestDto requestDto) {
        if (StringUtils.isBlank(requestDto.getNodeId())) {
            throw new InvalidArgumentException(requestDto.getType() + " requires node id");
        }
    }
}
