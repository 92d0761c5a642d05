package com.grorchestrator.orchestration.constant;

public class PeerStateKeys {
    public static final String CLUSTER_NAME = "cluster.name";
    public static final String CLUSTER_DOMAIN_ID = "cluster.domain_id";
    public static final String CLUSTER_STATE = "cluster.state";
    public static final String CLUSTER_STATE_RECREATE_PENDING = "recreate-pending";
    public static final String CLUSTER_STATE_ACTIVE = "active";
    public static final String CLUSTER_STATE_RESTORE_INCOMPLETE = "restore-incomplete";
    public static final String CLUSTER_STATE_DETAIL = "cluster.state.detail";

    public static final String CREDENTIALS_PREFIX = "credentials.";
    public static final String CREDENTIAL_VALUE_FORMAT = "credentials.%s.value";
    public static final String CREDENTIAL_VERSION_FORMAT = "credentials.%s.version";
    public static final String CREDENTIAL_SCOPE_FORMAT = "credentials.%s.scope";
    public static final String CREDENTIAL_APPLIED_VERSION_FORMAT = "credentials.%s.applied_version";
    public static final String CREDENTIAL_PREVIOUS_VALUE_FORMAT = "credentials.%s.previous_value";
    public static final String CREDENTIAL_KEY_PREFIX_FORMAT = "credentials.%s.";

    public static final String TLS_ENABLED = "tls.enabled";
    public static final String TLS_CA_CHAIN = "tls.ca_chain";
    public static final String TLS_NODE_CERTIFICATE_FORMAT = "tls.node.%s.certificate";
    public static final String TLS_NODE_PREVIOUS_CERTIFICATE_FORMAT = "tls.node.%s.previous";
    public static final String TLS_NODE_ADOPTED_FORMAT = "tls.node.%s.adopted";

    public static final String MAINTENANCE_FLAG = "maintenance.flag";
    public static final String MEMBERSHIP_CHANGE = "membership.change";

    public static final String MEMBERS_PREFIX = "members.";
    public static final String MEMBER_ADDRESS_FORMAT = "members.%s.address";
    public static final String MEMBER_ROLE_FORMAT = "members.%s.role";
    public static final String MEMBER_MARKED_FOR_REMOVAL_FORMAT = "members.%s.marked-for-removal";
    public static final String MEMBER_INSTANCE_CONFIGURED_FORMAT = "members.%s.instance-configured";
    public static final String MEMBER_PROMOTION_REQUESTED_FORMAT = "members.%s.promotion-requested";
    public static final String MEMBER_ADDRESS_SUFFIX = ".address";
    public static final String MEMBER_ROLE_SUFFIX = ".role";
    public static final String MEMBER_MARKED_FOR_REMOVAL_SUFFIX = ".marked-for-removal";

    public static final String BACKUPS_PREFIX = "backups.";
    public static final String BACKUP_FORMAT = "backups.%s";

    public static final String CLUSTER_SET_NAME = "clusterset.name";
    public static final String CLUSTER_SET_ROLE = "clusterset.role";
    public static final String CLUSTER_SET_PRIMARY_CLUSTER = "clusterset.primary_cluster";
    public static final String CLUSTER_SET_PREFIX = "clusterset.";
    public static final String CLUSTER_SET_OFFER_FORMAT = "clusterset.offers.%s";

    public static final String COORDINATION_LEASE = "coordination.lease";

    private PeerStateKeys() {
    }
}
