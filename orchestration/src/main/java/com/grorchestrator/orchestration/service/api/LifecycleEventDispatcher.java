package com.grorchestrator.orchestration.service.api;

import com.grorchestrator.orchestration.model.LifecycleEvent;

/**
 * Per node queue of lifecycle events. Events are consumed one by one in delivery order by a single reconciliation task.
 */
public interface LifecycleEventDispatcher {

    void enqueue(LifecycleEvent event);

    /**
     * @return number of events waiting to be processed
     */
    int getPendingCount();

    void stop();
}
