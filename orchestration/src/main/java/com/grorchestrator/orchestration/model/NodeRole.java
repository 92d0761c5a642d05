package com.grorchestrator.orchestration.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Role of a node as decided by reconciliation and recorded in peer state.
 */
@RequiredArgsConstructor
public enum NodeRole {
    UNINITIALIZED("uninitialized"),
    JOINING("joining"),
    MEMBER("member"),
    PRIMARY("primary"),
    UNREACHABLE("unreachable"),
    DISSOLVED("dissolved");

    @Getter
    private final String value;

    public boolean isClusterMember() {
        return this == MEMBER || this == PRIMARY;
    }

    /**
     * True for roles which are only recorded after the node joined a cluster at least once.
     */
    public boolean wasClusterMember() {
        return this == MEMBER || this == PRIMARY || this == UNREACHABLE || this == JOINING;
    }
}
