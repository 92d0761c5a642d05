package com.grorchestrator.orchestration.model;

public enum LifecycleEventType {
    NODE_ADDED,
    NODE_REMOVED,
    CONFIG_CHANGED,
    UPDATE_TICK,
    COORDINATOR_ELECTED,
    RELATION_JOINED,
    RELATION_BROKEN
}
