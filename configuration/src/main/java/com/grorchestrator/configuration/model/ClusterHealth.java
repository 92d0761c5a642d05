package com.grorchestrator.configuration.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum ClusterHealth {
    OK("ok"),
    DEGRADED("degraded"),
    UNREACHABLE("unreachable"),
    NO_CLUSTER("no-cluster");

    @Getter
    private final String value;
}
