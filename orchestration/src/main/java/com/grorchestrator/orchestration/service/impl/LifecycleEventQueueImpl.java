package com.grorchestrator.orchestration.service.impl;

import com.grorchestrator.configuration.event.CoordinationRoleChangedEvent;
import com.grorchestrator.configuration.model.CoordinationRole;
import com.grorchestrator.configuration.properties.predefined.OrchestrationProperties;
import com.grorchestrator.configuration.properties.runtime.NodeRuntimeProperties;
import com.grorchestrator.orchestration.model.LifecycleEvent;
import com.grorchestrator.orchestration.model.LifecycleEventType;
import com.grorchestrator.orchestration.model.ReconciliationPassResult;
import com.grorchestrator.orchestration.service.api.LifecycleEventDispatcher;
import com.grorchestrator.orchestration.service.api.TopologyReconciler;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.context.ManagedExecutor;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@ApplicationScoped
public class LifecycleEventQueueImpl implements LifecycleEventDispatcher {

    @Inject
    TopologyReconciler topologyReconciler;

    @Inject
    ManagedExecutor managedExecutor;

    @Inject
    OrchestrationProperties orchestrationProperties;

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    private final BlockingQueue<LifecycleEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean workerActive = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    @Override
    public void enqueue(LifecycleEvent event) {
        if (stopped.get()) {
            log.debug("Dropping {} event, queue is stopped", event.getType());
            return;
        }
        queue.add(event);
        startWorkerIfIdle();
    }

    @Override
    public int getPendingCount() {
        return queue.size();
    }

    @Override
    public void stop() {
        stopped.set(true);
        queue.clear();
    }

    @Scheduled(every = "${gr-orchestrator.orchestration.tick-interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void scheduledTick() {
        if (!nodeRuntimeProperties.isStarted()) {
            return;
        }
        boolean tickPending = queue.stream().anyMatch(event -> LifecycleEventType.UPDATE_TICK.equals(event.getType()));
        if (tickPending) {
            return;
        }
        enqueue(LifecycleEvent.tick());
    }

    public void onCoordinationRoleChanged(@Observes CoordinationRoleChangedEvent event) {
        if (CoordinationRole.COORDINATOR.equals(event.getNewRole())) {
            enqueue(LifecycleEvent.builder().type(LifecycleEventType.COORDINATOR_ELECTED).build());
        }
    }

    private void startWorkerIfIdle() {
        if (workerActive.compareAndSet(false, true)) {
            managedExecutor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            LifecycleEvent event;
            while (!stopped.get() && (event = queue.poll()) != null) {
                process(event);
            }
        } finally {
            workerActive.set(false);
        }
        // event could be added after last poll but before the flag was reset
        if (!queue.isEmpty() && !stopped.get()) {
            startWorkerIfIdle();
        }
    }

    void process(LifecycleEvent event) {
        log.debug("Processing {} event {}", event.getType(), event.getEventId());
        ReconciliationPassResult result;
        try {
            result = topologyReconciler.reconcile(event);
        } catch (Exception e) {
            log.error("Unexpected error while processing {} event", event.getType(), e);
            return;
        }

        if (result.isMoreWorkExpected()) {
            if (event.getFollowUpDepth() < orchestrationProperties.maxFollowUpPasses()) {
                queue.add(LifecycleEvent.followUp(event.getFollowUpDepth() + 1));
            } else {
                log.info("Reached limit of {} follow-up passes, next pass will run on periodic tick", orchestrationProperties.maxFollowUpPasses());
            }
        }
    }
}
