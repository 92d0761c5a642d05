package com.grorchestrator.configuration.properties.predefined;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

@ConfigMapping(prefix = "gr-orchestrator.cluster")
public interface ClusterProperties {

    /**
     * Name of the group replication cluster. When absent, the coordinator generates one on its first pass and persists it.
     */
    Optional<String> name();

    /**
     * Name of the cluster set. When absent, generated on first use.
     */
    Optional<String> clusterSetName();

    /**
     * Stable identity of this node. Used for deterministic tie-breaks, so it must never change for the lifetime of the node.
     */
    String nodeId();

    String nodeAddress();

    @WithDefault("production")
    Profile profile();

    /**
     * Memory limit in megabytes used instead of the detected amount of memory.
     */
    Optional<Integer> profileLimitMemory();

    @WithDefault("9")
    int maxMembers();

    enum Profile {
        /**
         * Engine is sized to use most of the available memory.
         */
        PRODUCTION,

        /**
         * Minimal memory footprint. For test deployments only.
         */
        TESTING
    }
}
