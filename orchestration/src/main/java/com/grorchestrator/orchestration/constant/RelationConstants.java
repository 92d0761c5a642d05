package com.grorchestrator.orchestration.constant;

/**
 * Relation names with special handling. Any other relation is a client relation which gets its own account.
 */
public class RelationConstants {
    /**
     * Relation to the certificate issuer. Its presence enables TLS for the whole cluster.
     */
    public static final String CERTIFICATES_RELATION_NAME = "certificates";

    /**
     * Legacy client relation. Uses configured database and user names instead of generated ones.
     */
    public static final String LEGACY_RELATION_NAME = "mysql";

    private RelationConstants() {
    }
}
