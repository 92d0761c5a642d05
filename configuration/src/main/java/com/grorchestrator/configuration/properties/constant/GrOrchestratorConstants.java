package com.grorchestrator.configuration.properties.constant;

public class GrOrchestratorConstants {
    public static final String PEER_STATE_FILE_NAME = "peer-state.json";
    public static final String NODE_PRIVATE_KEY_FILE_NAME = "node-key.pem";
    public static final String NODE_CERTIFICATE_FILE_NAME = "node-cert.pem";
    public static final String NODE_CA_FILE_NAME = "ca.pem";
    public static final String NODE_CSR_FILE_NAME = "node.csr";
    public static final String BACKUP_WORK_DIRECTORY_NAME = "backup";
    public static final String RESTORE_WORK_DIRECTORY_NAME = "restore";

    public static final String NODE_STATUS_READINESS_CHECK = "Node reconciliation status";
    public static final String COORDINATION_READINESS_CHECK = "Coordination authority";

    private GrOrchestratorConstants() {
    }
}
