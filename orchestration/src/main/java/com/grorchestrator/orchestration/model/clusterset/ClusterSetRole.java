package com.grorchestrator.orchestration.model.clusterset;

public enum ClusterSetRole {
    PRIMARY,
    REPLICA
}
