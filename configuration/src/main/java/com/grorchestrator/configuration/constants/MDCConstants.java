package com.grorchestrator.configuration.constants;

public class MDCConstants {
    public static final String COORDINATION_ROLE = "coordinationRole";
    public static final String NODE_ID = "nodeId";

    private MDCConstants() {
    }
}
