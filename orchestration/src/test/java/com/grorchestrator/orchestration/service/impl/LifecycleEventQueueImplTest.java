package com.grorchestrator.orchestration.service.impl;

import com.grorchestrator.configuration.event.CoordinationRoleChangedEvent;
import com.grorchestrator.configuration.model.CoordinationRole;
import com.grorchestrator.configuration.properties.predefined.OrchestrationProperties;
import com.grorchestrator.configuration.properties.runtime.NodeRuntimeProperties;
import com.grorchestrator.orchestration.model.LifecycleEvent;
import com.grorchestrator.orchestration.model.LifecycleEventType;
import com.grorchestrator.orchestration.model.ReconciliationPassResult;
import com.grorchestrator.orchestration.service.api.TopologyReconciler;
import com.grorchestrator.orchestration.testsupport.BeanWiring;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LifecycleEventQueueImplTest {

    private final TopologyReconciler topologyReconciler = mock(TopologyReconciler.class);
    private final ManagedExecutor managedExecutor = mock(ManagedExecutor.class);
    private final NodeRuntimeProperties nodeRuntimeProperties = new NodeRuntimeProperties();

    private LifecycleEventQueueImpl queue;

    @BeforeEach
    void setUp() {
        // run the worker in the calling thread
        doAnswer(invocation -> {
            ((Runnable) invocation.getArgument(0)).run();
            return null;
        }).when(managedExecutor).execute(any(Runnable.class));

        OrchestrationProperties orchestrationProperties = mock(OrchestrationProperties.class);
        when(orchestrationProperties.maxFollowUpPasses()).thenReturn(3);

        when(topologyReconciler.reconcile(any())).thenReturn(ReconciliationPassResult.builder().build());

        queue = BeanWiring.wire(new LifecycleEventQueueImpl(), topologyReconciler, managedExecutor, orchestrationProperties, nodeRuntimeProperties);
    }

    @Test
    void eventsAreProcessedInDeliveryOrder() {
        queue.enqueue(nodeAdded("node-2"));
        queue.enqueue(nodeAdded("node-3"));

        assertThat(processedEvents()).extracting(LifecycleEvent::getNodeId).containsExactly("node-2", "node-3");
        assertThat(queue.getPendingCount()).isZero();
    }

    @Test
    void followUpPassesAreBounded() {
        when(topologyReconciler.reconcile(any())).thenReturn(ReconciliationPassResult.builder().operationApplied(true).moreWorkExpected(true).build());

        queue.enqueue(nodeAdded("node-2"));

        List<LifecycleEvent> processed = processedEvents();
        assertThat(processed).hasSize(4);
        assertThat(processed).extracting(LifecycleEvent::getFollowUpDepth).containsExactly(0, 1, 2, 3);
        assertThat(processed.subList(1, 4)).extracting(LifecycleEvent::getType).containsOnly(LifecycleEventType.UPDATE_TICK);
    }

    @Test
    void failedPassDoesNotStopQueue() {
        when(topologyReconciler.reconcile(any()))
                .thenThrow(new IllegalStateException("broken"))
                .thenReturn(ReconciliationPassResult.builder().build());

        queue.enqueue(nodeAdded("node-2"));
        queue.enqueue(nodeAdded("node-3"));

        assertThat(processedEvents()).hasSize(2);
    }

    @Test
    void stoppedQueueDropsEvents() {
        queue.stop();

        queue.enqueue(nodeAdded("node-2"));

        verifyNoInteractions(topologyReconciler);
        assertThat(queue.getPendingCount()).isZero();
    }

    @Test
    void periodicTickRunsOnlyAfterStartup() {
        queue.scheduledTick();
        verifyNoInteractions(topologyReconciler);

        nodeRuntimeProperties.setStarted(true);
        queue.scheduledTick();

        assertThat(processedEvents()).extracting(LifecycleEvent::getType).containsExactly(LifecycleEventType.UPDATE_TICK);
    }

    @Test
    void gainingCoordinationTriggersPass() {
        queue.onCoordinationRoleChanged(new CoordinationRoleChangedEvent(CoordinationRole.COORDINATOR, CoordinationRole.FOLLOWER));
        verifyNoInteractions(topologyReconciler);

        queue.onCoordinationRoleChanged(new CoordinationRoleChangedEvent(CoordinationRole.FOLLOWER, CoordinationRole.COORDINATOR));

        assertThat(processedEvents()).extracting(LifecycleEvent::getType).containsExactly(LifecycleEventType.COORDINATOR_ELECTED);
    }

    private List<LifecycleEvent> processedEvents() {
        ArgumentCaptor<LifecycleEvent> captor = ArgumentCaptor.forClass(LifecycleEvent.class);
        verify(topologyReconciler, atLeastOnce()).reconcile(captor.capture());
        return captor.getAllValues();
    }

    private LifecycleEvent nodeAdded(String nodeId) {
        return LifecycleEvent.builder()
                .type(LifecycleEventType.NODE_ADDED)
                .nodeId(nodeId)
                .nodeAddress("10.0.0." + nodeId.substring(nodeId.length() - 1))
                .build();
    }
}
