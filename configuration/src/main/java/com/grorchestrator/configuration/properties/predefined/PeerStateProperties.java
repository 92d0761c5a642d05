package com.grorchestrator.configuration.properties.predefined;

import io.smallrye.config.ConfigMapping;

@ConfigMapping(prefix = "gr-orchestrator.peer-state")
public interface PeerStateProperties {

    /**
     * Directory shared by all nodes of one cluster. Peer state file is stored there.
     */
    String directory();
}
