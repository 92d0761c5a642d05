package com.grorchestrator.orchestration.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grorchestrator.configuration.exception.PropertyReadException;
import com.grorchestrator.configuration.properties.predefined.ClusterProperties;
import com.grorchestrator.orchestration.exception.PeerStateVersionConflictException;
import com.grorchestrator.orchestration.exception.PreconditionNotMetException;
import com.grorchestrator.orchestration.model.Credential;
import com.grorchestrator.orchestration.model.CredentialScope;
import com.grorchestrator.orchestration.model.NodeRole;
import com.grorchestrator.orchestration.model.backup.BackupInfo;
import com.grorchestrator.orchestration.model.clusterset.ClusterSetRole;
import com.grorchestrator.orchestration.model.clusterset.ReplicationHandle;
import com.grorchestrator.orchestration.model.peerstate.MaintenanceFlag;
import com.grorchestrator.orchestration.model.peerstate.PersistedMemberInfo;
import com.grorchestrator.orchestration.model.peerstate.VersionedValue;
import com.grorchestrator.orchestration.model.tls.PersistedCertificateInfo;
import com.grorchestrator.orchestration.service.api.CoordinationAuthority;
import com.grorchestrator.orchestration.service.api.PeerStateStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static com.grorchestrator.orchestration.constant.PeerStateKeys.*;

/**
 * Typed access to peer state. Cluster-wide facts may only be written by the coordinator, node-owned facts by the node
 * itself or by the coordinator.
 */
@Slf4j
@ApplicationScoped
public class PeerStateFunctionalityCombinator {
    @Inject
    PeerStateStore peerStateStore;

    @Inject
    CoordinationAuthority coordinationAuthority;

    @Inject
    ClusterProperties clusterProperties;

    @Inject
    ObjectMapper objectMapper;

    // @formatter:off
    private static final TypeReference<List<String>> STRING_LIST_TYPE_REF = new TypeReference<>() {};
    // @formatter:on

    // true between acquire and release of maintenance flag by this node
    private final AtomicBoolean maintenanceHeldLocally = new AtomicBoolean(false);

    public String getSelfNodeId() {
        return clusterProperties.nodeId();
    }

    public boolean isCoordinator() {
        return coordinationAuthority.isCoordinator();
    }

    public void checkCoordinator(String action) throws PreconditionNotMetException {
        if (!coordinationAuthority.isCoordinator()) {
            throw new PreconditionNotMetException(
                    "Only coordinator can " + action + ". Current coordinator: "
                            + coordinationAuthority.getCoordinatorNodeId().orElse("unknown")
            );
        }
    }

    // cluster identity

    public Optional<String> getClusterName() {
        return getValue(CLUSTER_NAME);
    }

    public void saveClusterName(String clusterName) {
        checkCoordinator("change cluster name");
        peerStateStore.put(CLUSTER_NAME, clusterName);
    }

    public Optional<String> getDomainId() {
        return getValue(CLUSTER_DOMAIN_ID);
    }

    public void saveDomainId(String domainId) {
        checkCoordinator("change domain id");
        peerStateStore.put(CLUSTER_DOMAIN_ID, domainId);
    }

    public boolean isClusterRecreationPending() {
        return getValue(CLUSTER_STATE).map(CLUSTER_STATE_RECREATE_PENDING::equals).orElse(false);
    }

    /**
     * Resets all member roles and marks cluster to be created again by the reconciler.
     */
    public void markClusterForRecreation(String clusterName) {
        checkCoordinator("mark cluster for re-creation");
        Map<String, String> values = new HashMap<>();
        values.put(CLUSTER_NAME, clusterName);
        values.put(CLUSTER_STATE, CLUSTER_STATE_RECREATE_PENDING);
        getMembers().keySet().forEach(nodeId -> values.put(String.format(MEMBER_ROLE_FORMAT, nodeId), NodeRole.UNINITIALIZED.name()));
        peerStateStore.putAll(values);
    }

    public void markClusterActive() {
        checkCoordinator("change cluster state");
        Map<String, String> values = new HashMap<>();
        values.put(CLUSTER_STATE, CLUSTER_STATE_ACTIVE);
        values.put(CLUSTER_STATE_DETAIL, "");
        peerStateStore.putAll(values);
    }

    /**
     * Recorded before the cluster is dissolved for restore, so a restore which stops half way is not mistaken for an
     * outage of a running cluster.
     */
    public void markRestoreStarted(String backupId) {
        checkCoordinator("start restore");
        Map<String, String> values = new HashMap<>();
        values.put(CLUSTER_STATE, CLUSTER_STATE_RESTORE_INCOMPLETE);
        values.put(CLUSTER_STATE_DETAIL, "restore of backup " + backupId + " is in progress");
        peerStateStore.putAll(values);
    }

    public void markRestoreFailed(String backupId, String cause) {
        checkCoordinator("fail restore");
        Map<String, String> values = new HashMap<>();
        values.put(CLUSTER_STATE, CLUSTER_STATE_RESTORE_INCOMPLETE);
        values.put(CLUSTER_STATE_DETAIL, "restore of backup " + backupId + " failed: " + cause);
        peerStateStore.putAll(values);
    }

    /**
     * @return description of a restore which dissolved the cluster and did not finish
     */
    public Optional<String> getIncompleteRestore() {
        if (!getValue(CLUSTER_STATE).map(CLUSTER_STATE_RESTORE_INCOMPLETE::equals).orElse(false)) {
            return Optional.empty();
        }
        return Optional.of(getValue(CLUSTER_STATE_DETAIL).filter(detail -> !detail.isEmpty()).orElse("restore did not finish"));
    }

    // credentials

    public Optional<Credential> getCredential(String name) {
        Map<String, VersionedValue> values = peerStateStore.getByPrefix(String.format(CREDENTIAL_KEY_PREFIX_FORMAT, name));
        VersionedValue value = values.get(String.format(CREDENTIAL_VALUE_FORMAT, name));
        if (value == null) {
            return Optional.empty();
        }

        Credential credential = Credential.builder()
                .name(name)
                .value(value.getValue())
                .version(parseLong(values.get(String.format(CREDENTIAL_VERSION_FORMAT, name))))
                .appliedVersion(parseLong(values.get(String.format(CREDENTIAL_APPLIED_VERSION_FORMAT, name))))
                .previousValue(Optional.ofNullable(values.get(String.format(CREDENTIAL_PREVIOUS_VALUE_FORMAT, name))).map(VersionedValue::getValue).orElse(null))
                .scope(CredentialScope.CLUSTER)
                .build();

        VersionedValue scope = values.get(String.format(CREDENTIAL_SCOPE_FORMAT, name));
        if (scope != null) {
            JsonNode scopeInfo = readTree(scope.getValue());
            credential.setScope(CredentialScope.valueOf(scopeInfo.path("scope").asText(CredentialScope.CLUSTER.name())));
            credential.setRelationId(scopeInfo.hasNonNull("relationId") ? scopeInfo.get("relationId").asInt() : null);
            credential.setDatabase(scopeInfo.hasNonNull("database") ? scopeInfo.get("database").asText() : null);
        }
        return Optional.of(credential);
    }

    public List<Credential> getCredentials() {
        return peerStateStore.getByPrefix(CREDENTIALS_PREFIX)
                .keySet()
                .stream()
                .filter(key -> key.endsWith(".value") && !key.endsWith(".previous_value"))
                .map(key -> key.substring(CREDENTIALS_PREFIX.length(), key.length() - ".value".length()))
                .map(this::getCredential)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    /**
     * Writes value, version and scope of credential in one atomic write. Applied version is not touched.
     */
    public void saveCredential(Credential credential) {
        checkCoordinator("modify credentials");
        Map<String, Object> scopeInfo = new HashMap<>();
        scopeInfo.put("scope", credential.getScope() != null ? credential.getScope().name() : CredentialScope.CLUSTER.name());
        scopeInfo.put("relationId", credential.getRelationId());
        scopeInfo.put("database", credential.getDatabase());

        Map<String, String> values = new HashMap<>();
        values.put(String.format(CREDENTIAL_VALUE_FORMAT, credential.getName()), credential.getValue());
        values.put(String.format(CREDENTIAL_VERSION_FORMAT, credential.getName()), Long.toString(credential.getVersion()));
        values.put(String.format(CREDENTIAL_SCOPE_FORMAT, credential.getName()), writeJson(scopeInfo));
        if (credential.getPreviousValue() != null) {
            values.put(String.format(CREDENTIAL_PREVIOUS_VALUE_FORMAT, credential.getName()), credential.getPreviousValue());
        }
        peerStateStore.putAll(values);
    }

    public void markCredentialApplied(String name, long version) {
        checkCoordinator("modify credentials");
        peerStateStore.put(String.format(CREDENTIAL_APPLIED_VERSION_FORMAT, name), Long.toString(version));
    }

    public void deleteCredential(String name) {
        checkCoordinator("modify credentials");
        peerStateStore.deleteByPrefix(String.format(CREDENTIAL_KEY_PREFIX_FORMAT, name));
    }

    // members

    /**
     * @return registered members sorted by node id
     */
    public TreeMap<String, PersistedMemberInfo> getMembers() {
        TreeMap<String, PersistedMemberInfo> members = new TreeMap<>();
        peerStateStore.getByPrefix(MEMBERS_PREFIX).forEach((key, value) -> {
            String rest = key.substring(MEMBERS_PREFIX.length());
            int dot = rest.indexOf('.');
            if (dot < 0) {
                return;
            }
            String nodeId = rest.substring(0, dot);
            String attribute = rest.substring(dot);
            PersistedMemberInfo member = members.computeIfAbsent(nodeId, id -> PersistedMemberInfo.builder().nodeId(id).role(NodeRole.UNINITIALIZED).build());

            switch (attribute) {
                case MEMBER_ADDRESS_SUFFIX -> member.setAddress(value.getValue());
                case MEMBER_ROLE_SUFFIX -> member.setRole(NodeRole.valueOf(value.getValue()));
                case MEMBER_MARKED_FOR_REMOVAL_SUFFIX -> member.setMarkedForRemoval(Boolean.parseBoolean(value.getValue()));
                default -> {
                }
            }
        });
        // members known only by role or removal mark were never provisioned
        members.values().removeIf(member -> member.getAddress() == null);
        return members;
    }

    public Optional<PersistedMemberInfo> getMember(String nodeId) {
        return Optional.ofNullable(getMembers().get(nodeId));
    }

    public void registerMember(String nodeId, String address) {
        checkNodeOwnedWrite(nodeId, "register member");
        Map<String, String> values = new HashMap<>();
        values.put(String.format(MEMBER_ADDRESS_FORMAT, nodeId), address);
        values.put(String.format(MEMBER_MARKED_FOR_REMOVAL_FORMAT, nodeId), Boolean.FALSE.toString());
        peerStateStore.putAll(values);
    }

    public void markMemberForRemoval(String nodeId) {
        checkNodeOwnedWrite(nodeId, "mark member for removal");
        peerStateStore.put(String.format(MEMBER_MARKED_FOR_REMOVAL_FORMAT, nodeId), Boolean.TRUE.toString());
    }

    public void saveMemberRoles(Map<String, NodeRole> roles) {
        checkCoordinator("change member roles");
        Map<String, String> values = new HashMap<>();
        roles.forEach((nodeId, role) -> values.put(String.format(MEMBER_ROLE_FORMAT, nodeId), role.name()));
        if (!values.isEmpty()) {
            peerStateStore.putAll(values);
        }
    }

    public boolean isInstanceConfigured(String nodeId) {
        return getValue(String.format(MEMBER_INSTANCE_CONFIGURED_FORMAT, nodeId)).map(Boolean::parseBoolean).orElse(false);
    }

    public void markInstanceConfigured(String nodeId, boolean configured) {
        checkNodeOwnedWrite(nodeId, "mark instance configured");
        peerStateStore.put(String.format(MEMBER_INSTANCE_CONFIGURED_FORMAT, nodeId), Boolean.toString(configured));
    }

    public void requestPromotion(String nodeId) {
        checkNodeOwnedWrite(nodeId, "request promotion");
        peerStateStore.put(String.format(MEMBER_PROMOTION_REQUESTED_FORMAT, nodeId), Instant.now().toString());
    }

    /**
     * @return node ids which requested promotion, oldest request first
     */
    public List<String> getPromotionRequests() {
        String suffix = ".promotion-requested";
        return peerStateStore.getByPrefix(MEMBERS_PREFIX)
                .entrySet()
                .stream()
                .filter(entry -> entry.getKey().endsWith(suffix))
                .sorted((a, b) -> a.getValue().getUpdatedAt().compareTo(b.getValue().getUpdatedAt()))
                .map(entry -> entry.getKey().substring(MEMBERS_PREFIX.length(), entry.getKey().length() - suffix.length()))
                .collect(Collectors.toList());
    }

    public void clearPromotionRequest(String nodeId) {
        checkNodeOwnedWrite(nodeId, "clear promotion request");
        peerStateStore.delete(String.format(MEMBER_PROMOTION_REQUESTED_FORMAT, nodeId));
    }

    // coordination flags

    public Optional<MaintenanceFlag> getMaintenanceFlag() {
        return peerStateStore.get(MAINTENANCE_FLAG).map(value -> {
            try {
                return readJson(value.getValue(), MaintenanceFlag.class);
            } catch (PropertyReadException e) {
                // written by hand, the owner is whoever wrote it
                return MaintenanceFlag.builder()
                        .reason(value.getValue())
                        .ownerNodeId(value.getUpdatedBy())
                        .acquiredAt(value.getUpdatedAt())
                        .build();
            }
        });
    }

    /**
     * @return false if flag is already set
     */
    public boolean acquireMaintenanceFlag(String reason) {
        checkCoordinator("set maintenance flag");
        MaintenanceFlag flag = MaintenanceFlag.builder()
                .reason(reason)
                .ownerNodeId(getSelfNodeId())
                .acquiredAt(Instant.now())
                .build();
        try {
            peerStateStore.compareAndSet(MAINTENANCE_FLAG, 0, writeJson(flag));
            maintenanceHeldLocally.set(true);
            return true;
        } catch (PeerStateVersionConflictException e) {
            return false;
        }
    }

    public void releaseMaintenanceFlag() {
        peerStateStore.delete(MAINTENANCE_FLAG);
        maintenanceHeldLocally.set(false);
    }

    /**
     * @return true if the flag was acquired by an operation which is still running on this node
     */
    public boolean isMaintenanceFlagHeldLocally() {
        return maintenanceHeldLocally.get();
    }

    public Optional<VersionedValue> getMembershipChangeMarker() {
        return peerStateStore.get(MEMBERSHIP_CHANGE);
    }

    public void setMembershipChangeMarker(String description) {
        checkCoordinator("start membership change");
        peerStateStore.put(MEMBERSHIP_CHANGE, description);
    }

    public void clearMembershipChangeMarker() {
        peerStateStore.delete(MEMBERSHIP_CHANGE);
    }

    // tls

    public boolean isTlsEnabled() {
        return getValue(TLS_ENABLED).map(Boolean::parseBoolean).orElse(false);
    }

    public void saveTlsEnabled(boolean enabled) {
        checkCoordinator("change TLS mode");
        peerStateStore.put(TLS_ENABLED, Boolean.toString(enabled));
    }

    public Optional<List<String>> getCaChain() {
        return getValue(TLS_CA_CHAIN).map(value -> readJson(value, STRING_LIST_TYPE_REF));
    }

    public void saveCaChain(List<String> chain) {
        checkCoordinator("change CA chain");
        peerStateStore.put(TLS_CA_CHAIN, writeJson(chain));
    }

    public void deleteCaChain() {
        checkCoordinator("change CA chain");
        peerStateStore.delete(TLS_CA_CHAIN);
    }

    public Optional<PersistedCertificateInfo> getNodeCertificate(String nodeId) {
        return getValue(String.format(TLS_NODE_CERTIFICATE_FORMAT, nodeId)).map(value -> readJson(value, PersistedCertificateInfo.class));
    }

    public Optional<PersistedCertificateInfo> getPreviousNodeCertificate(String nodeId) {
        return getValue(String.format(TLS_NODE_PREVIOUS_CERTIFICATE_FORMAT, nodeId)).map(value -> readJson(value, PersistedCertificateInfo.class));
    }

    /**
     * Saves new certificate of the node. Current certificate is kept as superseded until the node confirms adoption of the
     * new one.
     */
    public void saveNodeCertificate(PersistedCertificateInfo certificateInfo) {
        String nodeId = certificateInfo.getNodeId();
        checkNodeOwnedWrite(nodeId, "save node certificate");

        Map<String, String> values = new HashMap<>();
        getValue(String.format(TLS_NODE_CERTIFICATE_FORMAT, nodeId))
                .ifPresent(current -> values.put(String.format(TLS_NODE_PREVIOUS_CERTIFICATE_FORMAT, nodeId), current));
        values.put(String.format(TLS_NODE_CERTIFICATE_FORMAT, nodeId), writeJson(certificateInfo));
        peerStateStore.putAll(values);
    }

    public Optional<String> getAdoptedCertificateSerial(String nodeId) {
        return getValue(String.format(TLS_NODE_ADOPTED_FORMAT, nodeId));
    }

    /**
     * Records that node installed certificate with provided serial. Superseded certificate is dropped.
     */
    public void markCertificateAdopted(String nodeId, String serial) {
        checkNodeOwnedWrite(nodeId, "confirm certificate adoption");
        peerStateStore.put(String.format(TLS_NODE_ADOPTED_FORMAT, nodeId), serial);
        peerStateStore.delete(String.format(TLS_NODE_PREVIOUS_CERTIFICATE_FORMAT, nodeId));
    }

    public void deleteNodeCertificate(String nodeId) {
        checkNodeOwnedWrite(nodeId, "delete node certificate");
        peerStateStore.delete(String.format(TLS_NODE_CERTIFICATE_FORMAT, nodeId));
        peerStateStore.delete(String.format(TLS_NODE_PREVIOUS_CERTIFICATE_FORMAT, nodeId));
    }

    // backups

    public List<BackupInfo> getBackups() {
        List<BackupInfo> ret = new ArrayList<>();
        peerStateStore.getByPrefix(BACKUPS_PREFIX).values().forEach(value -> ret.add(readJson(value.getValue(), BackupInfo.class)));
        return ret;
    }

    public Optional<BackupInfo> getBackup(String backupId) {
        return getValue(String.format(BACKUP_FORMAT, backupId)).map(value -> readJson(value, BackupInfo.class));
    }

    /**
     * Backup records are owned by the node which takes the backup.
     */
    public void saveBackup(BackupInfo backupInfo) {
        checkNodeOwnedWrite(backupInfo.getNodeId(), "save backup record");
        peerStateStore.put(String.format(BACKUP_FORMAT, backupInfo.getBackupId()), writeJson(backupInfo));
    }

    // cluster set

    public Optional<String> getClusterSetName() {
        return getValue(CLUSTER_SET_NAME);
    }

    public Optional<ClusterSetRole> getClusterSetRole() {
        return getValue(CLUSTER_SET_ROLE).map(ClusterSetRole::valueOf);
    }

    public Optional<String> getClusterSetPrimaryCluster() {
        return getValue(CLUSTER_SET_PRIMARY_CLUSTER);
    }

    public void saveClusterSetMembership(String clusterSetName, ClusterSetRole role, String primaryClusterName) {
        checkCoordinator("change cluster set membership");
        Map<String, String> values = new HashMap<>();
        values.put(CLUSTER_SET_NAME, clusterSetName);
        values.put(CLUSTER_SET_ROLE, role.name());
        values.put(CLUSTER_SET_PRIMARY_CLUSTER, primaryClusterName);
        peerStateStore.putAll(values);
    }

    public void saveReplicationOffer(ReplicationHandle handle) {
        checkCoordinator("offer replication");
        peerStateStore.put(String.format(CLUSTER_SET_OFFER_FORMAT, handle.getReplicaClusterName()), writeJson(handle));
    }

    public Optional<ReplicationHandle> getReplicationOffer(String replicaClusterName) {
        return getValue(String.format(CLUSTER_SET_OFFER_FORMAT, replicaClusterName)).map(value -> readJson(value, ReplicationHandle.class));
    }

    public void clearClusterSetState() {
        checkCoordinator("clear cluster set membership");
        peerStateStore.deleteByPrefix(CLUSTER_SET_PREFIX);
    }

    private void checkNodeOwnedWrite(String nodeId, String action) {
        if (!getSelfNodeId().equals(nodeId)) {
            checkCoordinator(action + " of node " + nodeId);
        }
    }

    private Optional<String> getValue(String key) {
        return peerStateStore.get(key).map(VersionedValue::getValue);
    }

    private long parseLong(VersionedValue value) {
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(value.getValue());
        } catch (NumberFormatException e) {
            throw new PropertyReadException("Peer state contains invalid number '" + value.getValue() + "'", e);
        }
    }

    private String writeJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new PropertyReadException("Error serializing JSON data for peer state", e);
        }
    }

    private <T> T readJson(String value, Class<T> clazz) {
        try {
            return objectMapper.readValue(value, clazz);
        } catch (JsonProcessingException e) {
            throw new PropertyReadException("Error deserializing peer state value", e);
        }
    }

    private JsonNode readTree(String value) {
        try {
            return objectMapper.readTree(value);
        } catch (JsonProcessingException e) {
            throw new PropertyReadException("Error deserializing peer state value", e);
        }
    }

    private <T> T readJson(String value, TypeReference<T> typeReference) {
        try {
            return objectMapper.readValue(value, typeReference);
        } catch (JsonProcessingException e) {
            throw new PropertyReadException("Error deserializing peer state value", e);
        }
    }
}
