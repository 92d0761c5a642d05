package com.grorchestrator.orchestration.model;

public enum CredentialScope {
    /**
     * Internal service account shared by the whole cluster.
     */
    CLUSTER,
    /**
     * Account of a single external consumer. Destroyed together with the relation.
     */
    RELATION
}
