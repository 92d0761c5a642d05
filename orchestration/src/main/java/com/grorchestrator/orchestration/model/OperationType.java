package com.grorchestrator.orchestration.model;

public enum OperationType {
    CREATE_CLUSTER,
    ADD_MEMBER,
    REMOVE_MEMBER,
    PROMOTE_PRIMARY,
    SWITCH_PRIMARY,
    DISSOLVE_CLUSTER,
    REBOOT_CLUSTER
}
