package com.grorchestrator.orchestration.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of internal accounts managed for the whole cluster.
 */
@RequiredArgsConstructor
public enum SystemAccount {
    ROOT("root", "localhost"),
    SERVER_CONFIG("serverconfig", "%"),
    CLUSTER_ADMIN("clusteradmin", "%"),
    MONITORING("monitoring", "%"),
    BACKUPS("backups", "%");

    @Getter
    private final String username;

    @Getter
    private final String host;

    public static Optional<SystemAccount> fromUsername(String username) {
        return Arrays.stream(values())
                .filter(account -> account.getUsername().equals(username))
                .findFirst();
    }
}
