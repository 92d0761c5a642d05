package com.grorchestrator.configuration.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum CoordinationRole {
    COORDINATOR("Coordinator"),
    FOLLOWER("Follower");

    @Getter
    private final String mdcValue;
}
