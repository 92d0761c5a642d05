package com.grorchestrator.orchestration.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grorchestrator.configuration.event.CoordinationRoleChangedEvent;
import com.grorchestrator.configuration.model.CoordinationRole;
import com.grorchestrator.configuration.properties.predefined.ClusterProperties;
import com.grorchestrator.configuration.properties.predefined.OrchestrationProperties;
import com.grorchestrator.configuration.properties.runtime.NodeRuntimeProperties;
import com.grorchestrator.orchestration.constant.PeerStateKeys;
import com.grorchestrator.orchestration.exception.PeerStateVersionConflictException;
import com.grorchestrator.orchestration.model.peerstate.CoordinationLease;
import com.grorchestrator.orchestration.model.peerstate.VersionedValue;
import com.grorchestrator.orchestration.service.api.CoordinationAuthority;
import com.grorchestrator.orchestration.service.api.PeerStateStore;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Coordination authority backed by a lease record in peer state. Lease is acquired and renewed by compare-and-set, so only
 * one node can hold a valid lease at a time. Holder considers itself coordinator only until the lease expires by its own
 * clock.
 */
@Slf4j
@ApplicationScoped
public class LeaseCoordinationAuthority implements CoordinationAuthority {

    @Inject
    PeerStateStore peerStateStore;

    @Inject
    ClusterProperties clusterProperties;

    @Inject
    OrchestrationProperties orchestrationProperties;

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Event<CoordinationRoleChangedEvent> coordinationRoleChangedEvent;

    Clock clock = Clock.systemUTC();

    private volatile Instant holdUntil = Instant.MIN;
    private volatile String lastKnownHolder;
    private volatile boolean released = false;

    @Override
    public boolean isCoordinator() {
        return clock.instant().isBefore(holdUntil);
    }

    @Override
    public Optional<String> getCoordinatorNodeId() {
        if (isCoordinator()) {
            return Optional.of(clusterProperties.nodeId());
        }
        return Optional.ofNullable(lastKnownHolder);
    }

    @Scheduled(every = "${gr-orchestrator.orchestration.coordination.renew-interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void scheduledRenew() {
        if (!nodeRuntimeProperties.isStarted() || released) {
            return;
        }
        renewOrAcquire();
    }

    /**
     * Renews own lease or takes over an expired one.
     *
     * @return true if this node holds the lease after the call
     */
    public boolean renewOrAcquire() {
        CoordinationRole roleBefore = isCoordinator() ? CoordinationRole.COORDINATOR : CoordinationRole.FOLLOWER;
        Instant now = clock.instant();

        try {
            Optional<VersionedValue> current = peerStateStore.get(PeerStateKeys.COORDINATION_LEASE);
            CoordinationLease currentLease = current.map(value -> readLease(value.getValue())).orElse(null);
            String selfId = clusterProperties.nodeId();

            if (currentLease != null) {
                lastKnownHolder = currentLease.getHolderNodeId();
            }

            boolean heldBySelf = currentLease != null && selfId.equals(currentLease.getHolderNodeId());
            boolean expired = currentLease == null || !now.isBefore(currentLease.getExpiresAt());

            if (heldBySelf || expired) {
                long term = currentLease == null ? 1 : (heldBySelf ? currentLease.getTerm() : currentLease.getTerm() + 1);
                Instant expiresAt = now.plus(orchestrationProperties.coordination().leaseDuration());
                CoordinationLease newLease = CoordinationLease.builder()
                        .holderNodeId(selfId)
                        .term(term)
                        .renewedAt(now)
                        .expiresAt(expiresAt)
                        .build();

                peerStateStore.compareAndSet(
                        PeerStateKeys.COORDINATION_LEASE,
                        current.map(VersionedValue::getVersion).orElse(0L),
                        objectMapper.writeValueAsString(newLease)
                );

                holdUntil = expiresAt;
                lastKnownHolder = selfId;
                if (!heldBySelf) {
                    log.info("Acquired coordination lease, term {}.", term);
                }
            } else {
                holdUntil = Instant.MIN;
            }
        } catch (PeerStateVersionConflictException e) {
            log.info("Lost race for coordination lease. Another node renewed or acquired it.");
            holdUntil = Instant.MIN;
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize coordination lease.", e);
            holdUntil = Instant.MIN;
        } catch (RuntimeException e) {
            // keep current lease until it expires by local clock, peer state may be temporary unavailable
            log.error("Failed to renew coordination lease.", e);
        }

        fireIfRoleChanged(roleBefore);
        return isCoordinator();
    }

    /**
     * Gives lease away, so another node can take over without waiting for expiry.
     */
    public void release() {
        released = true;
        CoordinationRole roleBefore = isCoordinator() ? CoordinationRole.COORDINATOR : CoordinationRole.FOLLOWER;
        try {
            Optional<VersionedValue> current = peerStateStore.get(PeerStateKeys.COORDINATION_LEASE);
            if (current.isPresent() && clusterProperties.nodeId().equals(readLease(current.get().getValue()).getHolderNodeId())) {
                peerStateStore.compareAndDelete(PeerStateKeys.COORDINATION_LEASE, current.get().getVersion());
                log.info("Coordination lease released.");
            }
        } catch (RuntimeException e) {
            log.error("Failed to release coordination lease. Other nodes will take over after it expires.", e);
        }
        holdUntil = Instant.MIN;
        fireIfRoleChanged(roleBefore);
    }

    private void fireIfRoleChanged(CoordinationRole roleBefore) {
        CoordinationRole roleAfter = isCoordinator() ? CoordinationRole.COORDINATOR : CoordinationRole.FOLLOWER;
        nodeRuntimeProperties.setCoordinationRole(roleAfter);
        if (roleBefore != roleAfter) {
            log.info("Coordination role changed from {} to {}.", roleBefore, roleAfter);
            coordinationRoleChangedEvent.fire(new CoordinationRoleChangedEvent(roleBefore, roleAfter));
        }
    }

    private CoordinationLease readLease(String value) {
        try {
            return objectMapper.readValue(value, CoordinationLease.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Coordination lease record is corrupted", e);
        }
    }
}
