package com.grorchestrator.orchestration.adapter.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grorchestrator.configuration.properties.predefined.EngineProperties;
import com.grorchestrator.orchestration.adapter.api.ClusterControlAdapter;
import com.grorchestrator.orchestration.constant.CommandsConstants;
import com.grorchestrator.orchestration.constant.EngineConstants;
import com.grorchestrator.orchestration.exception.EngineOperationException;
import com.grorchestrator.orchestration.exception.TransientEngineException;
import com.grorchestrator.orchestration.model.*;
import com.grorchestrator.orchestration.model.clusterset.ClusterSetMemberStatus;
import com.grorchestrator.orchestration.model.clusterset.ClusterSetRole;
import com.grorchestrator.orchestration.model.clusterset.ClusterSetStatus;
import com.grorchestrator.orchestration.model.clusterset.ReplicationHandle;
import com.grorchestrator.orchestration.util.PeerStateFunctionalityCombinator;
import com.grorchestrator.orchestration.util.ShellCommandExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.grorchestrator.orchestration.constant.EngineConstants.*;

/**
 * Drives the engine through MySQL Shell in python mode. Every call starts a new shell process which prints a single
 * result line prefixed with {@link EngineConstants#RESULT_MARKER}.
 */
@Slf4j
@ApplicationScoped
public class MySqlShellClusterControlAdapter implements ClusterControlAdapter {

    @Inject
    EngineProperties engineProperties;

    @Inject
    ShellCommandExecutor shellCommandExecutor;

    @Inject
    PeerStateFunctionalityCombinator peerStateFunctionalityCombinator;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public ObservedClusterStatus getClusterStatus(String viaAddress) {
        JsonNode result = runAsClusterAdmin("get cluster status", viaAddress, CLUSTER_STATUS_SCRIPT, Map.of());

        if (!result.path("exists").asBoolean(false)) {
            return ObservedClusterStatus.noCluster();
        }

        List<ObservedMember> members = new ArrayList<>();
        for (JsonNode member : result.path("members")) {
            members.add(
                    ObservedMember.builder()
                            .nodeId(member.path("nodeId").asText())
                            .address(member.path("address").asText())
                            .state(MemberState.fromEngineValue(member.path("state").asText(null)))
                            .primary(member.path("primary").asBoolean(false))
                            .appliedTransactionPosition(member.path("applied").asLong(0))
                            .build()
            );
        }

        return ObservedClusterStatus.builder()
                .clusterExists(true)
                .clusterName(result.path("clusterName").asText())
                .members(members)
                .build();
    }

    @Override
    public void configureInstance(String address, Map<SystemAccount, Credential> systemCredentials) {
        Credential root = systemCredentials.get(SystemAccount.ROOT);
        if (root == null) {
            throw new EngineOperationException("Root credential is required to configure instance " + address);
        }

        List<Map<String, String>> accounts = new ArrayList<>();
        systemCredentials.forEach((account, credential) -> {
            Map<String, String> accountJson = new HashMap<>();
            accountJson.put("username", account.getUsername());
            accountJson.put("host", account.getHost());
            accountJson.put("password", credential.getValue());
            accountJson.put("grants", resolveGrants(account));
            accounts.add(accountJson);
        });

        Map<String, String> args = new HashMap<>();
        args.put(ARG_ACCOUNTS_JSON, writeJson(accounts));

        String uri = SystemAccount.ROOT.getUsername() + "@localhost:" + engineProperties.port();
        run("configure instance", uri, root.getValue(), CONFIGURE_INSTANCE_SCRIPT, args);
    }

    @Override
    public void applyInstanceSettings(String address, Map<String, String> settings) {
        runAsClusterAdmin("apply instance settings", address, APPLY_SETTINGS_SCRIPT, Map.of(ARG_SETTINGS_JSON, writeJson(settings)));
    }

    @Override
    public void createCluster(String clusterName, String seedNodeId, String seedAddress) {
        JsonNode result = runAsClusterAdmin(
                "create cluster",
                seedAddress,
                CREATE_CLUSTER_SCRIPT,
                Map.of(ARG_CLUSTER_NAME, clusterName, ARG_NODE_ID, seedNodeId, ARG_ENDPOINT, seedAddress)
        );
        if (!result.path("created").asBoolean(false)) {
            log.info("Cluster {} already exists on {}", result.path("clusterName").asText(), seedAddress);
        }
    }

    @Override
    public void addInstance(String primaryAddress, String nodeId, String address) {
        JsonNode result = runAsClusterAdmin("add instance", primaryAddress, ADD_INSTANCE_SCRIPT, Map.of(ARG_NODE_ID, nodeId, ARG_ENDPOINT, address));
        if (!result.path("added").asBoolean(false)) {
            log.info("Instance {} is already a member of the cluster", nodeId);
        }
    }

    @Override
    public void removeInstance(String primaryAddress, String nodeId, String address, boolean force) {
        JsonNode result = runAsClusterAdmin(
                "remove instance",
                primaryAddress,
                REMOVE_INSTANCE_SCRIPT,
                Map.of(ARG_NODE_ID, nodeId, ARG_ENDPOINT, address, ARG_FORCE, Boolean.toString(force))
        );
        if (!result.path("removed").asBoolean(false)) {
            log.info("Instance {} is not a member of the cluster", nodeId);
        }
    }

    @Override
    public void rejoinInstance(String primaryAddress, String nodeId, String address) {
        runAsClusterAdmin("rejoin instance", primaryAddress, REJOIN_INSTANCE_SCRIPT, Map.of(ARG_NODE_ID, nodeId, ARG_ENDPOINT, address));
    }

    @Override
    public void setPrimary(String viaAddress, String nodeId, String address) {
        runAsClusterAdmin("set primary", viaAddress, SET_PRIMARY_SCRIPT, Map.of(ARG_NODE_ID, nodeId, ARG_ENDPOINT, address));
    }

    @Override
    public void dissolveCluster(String viaAddress) {
        runAsClusterAdmin("dissolve cluster", viaAddress, DISSOLVE_CLUSTER_SCRIPT, Map.of());
    }

    @Override
    public void rebootClusterFromCompleteOutage(String address, String clusterName) {
        runAsClusterAdmin("reboot cluster", address, REBOOT_CLUSTER_SCRIPT, Map.of(ARG_CLUSTER_NAME, clusterName));
    }

    @Override
    public String getExecutedTransactionSet(String address) {
        return runAsClusterAdmin("read executed GTID set", address, EXECUTED_GTID_SET_SCRIPT, Map.of())
                .path("gtidExecuted")
                .asText("");
    }

    @Override
    public String getExecutedTransactionSet(String address, String username, String password) {
        return run("read executed GTID set", username + "@" + address, password, EXECUTED_GTID_SET_SCRIPT, Map.of())
                .path("gtidExecuted")
                .asText("");
    }

    @Override
    public void createClusterSet(String primaryAddress, String clusterSetName, String domainId) {
        JsonNode result = runAsClusterAdmin("create cluster set", primaryAddress, CREATE_CLUSTER_SET_SCRIPT, Map.of(ARG_CLUSTER_SET_NAME, clusterSetName, ARG_DOMAIN_ID, domainId));
        if (!result.path("created").asBoolean(false)) {
            log.info("Cluster is already part of a cluster set");
        }
    }

    @Override
    public ClusterSetStatus getClusterSetStatus(String viaAddress) {
        JsonNode result = runAsClusterAdmin("get cluster set status", viaAddress, CLUSTER_SET_STATUS_SCRIPT, Map.of());
        if (!result.path("exists").asBoolean(false)) {
            return null;
        }

        List<ClusterSetMemberStatus> clusters = new ArrayList<>();
        for (JsonNode cluster : result.path("clusters")) {
            clusters.add(
                    ClusterSetMemberStatus.builder()
                            .clusterName(cluster.path("clusterName").asText())
                            .role("PRIMARY".equalsIgnoreCase(cluster.path("role").asText()) ? ClusterSetRole.PRIMARY : ClusterSetRole.REPLICA)
                            .globalStatus(cluster.path("globalStatus").asText(null))
                            .primaryAddress(cluster.path("primary").asText(null))
                            .build()
            );
        }

        return ClusterSetStatus.builder()
                .clusterSetName(result.path("clusterSetName").asText())
                .primaryClusterName(result.path("primaryCluster").asText())
                .clusters(clusters)
                .build();
    }

    @Override
    public void createReplicaCluster(ReplicationHandle handle, String replicaClusterName, String localAddress) {
        // executed through the primary cluster, which clones local instance
        String uri = handle.getAdminUser() + "@" + handle.getPrimaryEndpoint();
        JsonNode result = run(
                "create replica cluster",
                uri,
                handle.getAdminPassword(),
                CREATE_REPLICA_CLUSTER_SCRIPT,
                Map.of(ARG_CLUSTER_NAME, replicaClusterName, ARG_ENDPOINT, localAddress)
        );
        if (!result.path("created").asBoolean(false)) {
            log.info("Cluster {} is already a replica in cluster set {}", replicaClusterName, handle.getClusterSetName());
        }
    }

    @Override
    public void setPrimaryCluster(String viaAddress, String clusterName) {
        runAsClusterAdmin("set primary cluster", viaAddress, SET_PRIMARY_CLUSTER_SCRIPT, Map.of(ARG_CLUSTER_NAME, clusterName));
    }

    @Override
    public void forcePrimaryCluster(String viaAddress, String clusterName) {
        runAsClusterAdmin("force primary cluster", viaAddress, FORCE_PRIMARY_CLUSTER_SCRIPT, Map.of(ARG_CLUSTER_NAME, clusterName));
    }

    @Override
    public void rejoinClusterToSet(String viaAddress, String clusterName) {
        runAsClusterAdmin("rejoin cluster", viaAddress, REJOIN_CLUSTER_SCRIPT, Map.of(ARG_CLUSTER_NAME, clusterName));
    }

    @Override
    public void upsertSystemAccount(String primaryAddress, SystemAccount account, String password) {
        upsertAccount(primaryAddress, account.getUsername(), account.getHost(), password, resolveGrants(account));
    }

    @Override
    public void upsertRelationAccount(String primaryAddress, String username, String password, String database) {
        upsertAccount(primaryAddress, username, "%", password, String.format(RELATION_GRANTS_FORMAT, database));
    }

    @Override
    public void dropAccount(String primaryAddress, String username) {
        String host = SystemAccount.fromUsername(username).map(SystemAccount::getHost).orElse("%");
        runAsClusterAdmin("drop account", primaryAddress, DROP_ACCOUNT_SCRIPT, Map.of(ARG_USERNAME, username, ARG_HOST, host));
    }

    @Override
    public void setInstanceHidden(String primaryAddress, String address, boolean hidden) {
        runAsClusterAdmin("set instance hidden", primaryAddress, SET_HIDDEN_SCRIPT, Map.of(ARG_ENDPOINT, address, ARG_ENABLED, Boolean.toString(hidden)));
    }

    @Override
    public void setOfflineMode(String address, boolean offline) {
        runAsClusterAdmin("set offline mode", address, SET_OFFLINE_MODE_SCRIPT, Map.of(ARG_ENABLED, Boolean.toString(offline)));
    }

    @Override
    public void reloadTls(String address) {
        runAsClusterAdmin("reload TLS", address, RELOAD_TLS_SCRIPT, Map.of());
    }

    private void upsertAccount(String primaryAddress, String username, String host, String password, String grants) {
        Map<String, String> args = new HashMap<>();
        args.put(ARG_USERNAME, username);
        args.put(ARG_HOST, host);
        args.put(ARG_PASSWORD, password);
        args.put(ARG_GRANTS, grants);
        runAsClusterAdmin("upsert account " + username, primaryAddress, UPSERT_ACCOUNT_SCRIPT, args);
    }

    private String resolveGrants(SystemAccount account) {
        return switch (account) {
            case ROOT -> ROOT_GRANTS;
            case SERVER_CONFIG -> SERVER_CONFIG_GRANTS;
            case CLUSTER_ADMIN -> CLUSTER_ADMIN_GRANTS;
            case MONITORING -> MONITORING_GRANTS;
            case BACKUPS -> BACKUPS_GRANTS;
        };
    }

    private JsonNode runAsClusterAdmin(String operation, String address, String script, Map<String, String> args) {
        Credential clusterAdmin = peerStateFunctionalityCombinator.getCredential(SystemAccount.CLUSTER_ADMIN.getUsername())
                .orElseThrow(() -> new EngineOperationException("Can not " + operation + ": cluster admin credential is not published yet"));
        return run(operation, SystemAccount.CLUSTER_ADMIN.getUsername() + "@" + address, clusterAdmin.getEngineValue(), script, args);
    }

    private JsonNode run(String operation, String uri, String password, String script, Map<String, String> args) {
        List<String> command = List.of(
                engineProperties.mysqlshPath(),
                CommandsConstants.MYSQLSH_NO_WIZARD_KEY,
                CommandsConstants.MYSQLSH_PYTHON_MODE_KEY,
                CommandsConstants.MYSQLSH_URI_KEY,
                uri,
                CommandsConstants.MYSQLSH_PASSWORDS_FROM_STDIN_KEY,
                CommandsConstants.MYSQLSH_EXECUTE_KEY,
                script
        );

        Map<String, String> environment = new HashMap<>();
        args.forEach((name, value) -> environment.put(ENV_ARG_PREFIX + name, value));

        ShellCommandExecutionResult result;
        try {
            log.debug("Executing engine operation '{}' via {}", operation, uri);
            result = shellCommandExecutor.execute(command, environment, password + "\n", engineProperties.callTimeout());
        } catch (IOException e) {
            throw new EngineOperationException("Failed to start MySQL Shell for operation '" + operation + "'", e);
        }

        if (result.isTimedOut()) {
            throw new TransientEngineException("Engine operation '" + operation + "' timed out");
        }

        if (!result.isSuccess()) {
            String output = StringUtils.defaultString(result.getStderr()) + " " + StringUtils.defaultString(result.getStdout());
            String message = "Engine operation '" + operation + "' failed with exit code " + result.getExitCode() + ": " + StringUtils.abbreviate(output.trim(), 500);
            if (isTransient(output)) {
                throw new TransientEngineException(message);
            }
            throw new EngineOperationException(message);
        }

        return parseResult(operation, result.getStdout());
    }

    private boolean isTransient(String output) {
        return TRANSIENT_ERROR_MARKERS.stream().anyMatch(marker -> StringUtils.containsIgnoreCase(output, marker));
    }

    private JsonNode parseResult(String operation, String stdout) {
        for (String line : StringUtils.split(StringUtils.defaultString(stdout), '\n')) {
            String trimmed = line.trim();
            if (trimmed.startsWith(RESULT_MARKER)) {
                try {
                    return objectMapper.readTree(trimmed.substring(RESULT_MARKER.length()));
                } catch (JsonProcessingException e) {
                    throw new EngineOperationException("Engine operation '" + operation + "' returned malformed result", e);
                }
            }
        }
        throw new EngineOperationException("Engine operation '" + operation + "' returned no result");
    }

    private String writeJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new EngineOperationException("Failed to serialize engine operation arguments", e);
        }
    }
}
