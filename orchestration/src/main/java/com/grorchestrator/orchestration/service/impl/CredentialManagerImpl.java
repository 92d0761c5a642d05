package com.grorchestrator.orchestration.service.impl;

import com.grorchestrator.orchestration.adapter.api.ClusterControlAdapter;
import com.grorchestrator.orchestration.exception.*;
import com.grorchestrator.orchestration.model.Credential;
import com.grorchestrator.orchestration.model.CredentialScope;
import com.grorchestrator.orchestration.model.SystemAccount;
import com.grorchestrator.orchestration.service.api.CredentialManager;
import com.grorchestrator.orchestration.util.ClusterTopologyResolver;
import com.grorchestrator.orchestration.util.CredentialUtils;
import com.grorchestrator.orchestration.util.EngineCallExecutor;
import com.grorchestrator.orchestration.util.PeerStateFunctionalityCombinator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@ApplicationScoped
public class CredentialManagerImpl implements CredentialManager {

    @Inject
    PeerStateFunctionalityCombinator peerStateFunctionalityCombinator;

    @Inject
    ClusterControlAdapter clusterControlAdapter;

    @Inject
    ClusterTopologyResolver clusterTopologyResolver;

    @Inject
    EngineCallExecutor engineCallExecutor;

    @Override
    public Credential generate(String name) {
        peerStateFunctionalityCombinator.checkCoordinator("generate credentials");
        Optional<Credential> existing = peerStateFunctionalityCombinator.getCredential(name);
        if (existing.isPresent()) {
            return existing.get();
        }

        Credential credential = Credential.builder()
                .name(name)
                .value(CredentialUtils.generatePassword())
                .version(1)
                .scope(CredentialScope.CLUSTER)
                .build();
        peerStateFunctionalityCombinator.saveCredential(credential);
        log.info("Generated credential {}", name);
        return credential;
    }

    @Override
    public Credential rotate(String name, String value) {
        peerStateFunctionalityCombinator.checkCoordinator("rotate credentials");
        Credential current = peerStateFunctionalityCombinator.getCredential(name)
                .orElseThrow(() -> new NotFoundException("Credential " + name + " does not exist"));

        if (CredentialScope.RELATION.equals(current.getScope())) {
            throw new InvalidArgumentException("Relation credential " + name + " can not be rotated");
        }

        String newValue = value != null ? value : CredentialUtils.generatePassword();
        Credential rotated = Credential.builder()
                .name(name)
                .value(newValue)
                .version(current.getVersion() + 1)
                .scope(current.getScope())
                .appliedVersion(current.getAppliedVersion())
                .previousValue(current.getEngineValue())
                .build();

        peerStateFunctionalityCombinator.saveCredential(rotated);
        log.info("Credential {} rotated to version {}", name, rotated.getVersion());

        try {
            applyPendingCredentials(clusterTopologyResolver.resolvePrimaryAddress());
        } catch (TransientEngineException | PreconditionNotMetException | EngineOperationException e) {
            log.warn("New value of {} is stored but not applied to engine yet, it will be applied by next reconciliation pass. Cause: {}", name, e.getMessage());
        }

        return peerStateFunctionalityCombinator.getCredential(name).orElse(rotated);
    }

    @Override
    public Credential get(String name) {
        return peerStateFunctionalityCombinator.getCredential(name)
                .orElseThrow(() -> new NotFoundException("Credential " + name + " does not exist"));
    }

    @Override
    public void ensureSystemCredentials() {
        for (SystemAccount account : SystemAccount.values()) {
            generate(account.getUsername());
        }
    }

    @Override
    public boolean isSystemCredentialsReady() {
        for (SystemAccount account : SystemAccount.values()) {
            if (peerStateFunctionalityCombinator.getCredential(account.getUsername()).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Map<SystemAccount, Credential> getSystemCredentials() {
        Map<SystemAccount, Credential> ret = new EnumMap<>(SystemAccount.class);
        for (SystemAccount account : SystemAccount.values()) {
            peerStateFunctionalityCombinator.getCredential(account.getUsername()).ifPresent(credential -> ret.put(account, credential));
        }
        return ret;
    }

    @Override
    public int applyPendingCredentials(String primaryAddress) {
        int applied = 0;
        for (Credential credential : peerStateFunctionalityCombinator.getCredentials()) {
            if (credential.isAppliedToEngine()) {
                continue;
            }

            if (CredentialScope.RELATION.equals(credential.getScope())) {
                engineCallExecutor.executeWithRetry(
                        "upsert relation account " + credential.getName(),
                        () -> clusterControlAdapter.upsertRelationAccount(primaryAddress, credential.getName(), credential.getValue(), credential.getDatabase())
                );
            } else {
                Optional<SystemAccount> account = SystemAccount.fromUsername(credential.getName());
                if (account.isEmpty()) {
                    log.warn("Credential {} does not belong to any known account, skipping", credential.getName());
                    continue;
                }
                engineCallExecutor.executeWithRetry(
                        "upsert account " + credential.getName(),
                        () -> clusterControlAdapter.upsertSystemAccount(primaryAddress, account.get(), credential.getValue())
                );
            }

            peerStateFunctionalityCombinator.markCredentialApplied(credential.getName(), credential.getVersion());
            log.info("Applied version {} of credential {} to engine", credential.getVersion(), credential.getName());
            applied++;
        }
        return applied;
    }

    @Override
    public Credential createRelationCredential(int relationId, String database, String username) {
        peerStateFunctionalityCombinator.checkCoordinator("create relation credentials");
        if (StringUtils.isBlank(database)) {
            throw new InvalidArgumentException("Relation " + relationId + " did not request a database");
        }

        Optional<Credential> existing = peerStateFunctionalityCombinator.getCredential(username);
        if (existing.isPresent()) {
            return existing.get();
        }

        Credential credential = Credential.builder()
                .name(username)
                .value(CredentialUtils.generatePassword())
                .version(1)
                .scope(CredentialScope.RELATION)
                .relationId(relationId)
                .database(database)
                .build();
        peerStateFunctionalityCombinator.saveCredential(credential);
        log.info("Created credential {} for relation {}", username, relationId);
        return credential;
    }

    @Override
    public void destroyRelationCredential(int relationId, String username) {
        peerStateFunctionalityCombinator.checkCoordinator("destroy relation credentials");
        if (peerStateFunctionalityCombinator.getCredential(username).isEmpty()) {
            return;
        }

        String primaryAddress = clusterTopologyResolver.resolvePrimaryAddress();
        engineCallExecutor.executeWithRetry("drop account " + username, () -> clusterControlAdapter.dropAccount(primaryAddress, username));
        peerStateFunctionalityCombinator.deleteCredential(username);
        log.info("Destroyed credential {} of relation {}", username, relationId);
    }

    @Override
    public String getPassword(String username) {
        SystemAccount account = resolveSystemAccount(username);
        return get(account.getUsername()).getValue();
    }

    @Override
    public Credential setPassword(String username, String password) {
        SystemAccount account = resolveSystemAccount(username);
        if (password != null && StringUtils.isBlank(password)) {
            throw new InvalidArgumentException("Password must not be blank");
        }
        peerStateFunctionalityCombinator.checkCoordinator("set password");

        if (peerStateFunctionalityCombinator.getCredential(account.getUsername()).isEmpty()) {
            generate(account.getUsername());
        }
        return rotate(account.getUsername(), password);
    }

    private SystemAccount resolveSystemAccount(String username) {
        String effective = StringUtils.isBlank(username) ? SystemAccount.ROOT.getUsername() : username;
        return SystemAccount.fromUsername(effective)
                .orElseThrow(() -> new InvalidArgumentException("Unknown username '" + effective + "'. Allowed: root, serverconfig, clusteradmin, monitoring, backups"));
    }
}
