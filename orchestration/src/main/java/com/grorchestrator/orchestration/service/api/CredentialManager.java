package com.grorchestrator.orchestration.service.api;

import com.grorchestrator.orchestration.exception.InvalidArgumentException;
import com.grorchestrator.orchestration.exception.NotFoundException;
import com.grorchestrator.orchestration.exception.PreconditionNotMetException;
import com.grorchestrator.orchestration.model.Credential;
import com.grorchestrator.orchestration.model.SystemAccount;

import java.util.Map;

/**
 * Owns internal service account passwords. Credentials are always published to peer state before they are applied to the
 * engine, so an interrupted rotation is finished by a later reconciliation pass.
 */
public interface CredentialManager {

    /**
     * Creates credential with a random value if it does not exist yet.
     *
     * @return existing or created credential
     */
    Credential generate(String name) throws PreconditionNotMetException;

    /**
     * Sets new value of credential and applies it to the engine if possible.
     *
     * @param value new value, or null to generate a random one
     */
    Credential rotate(String name, String value) throws PreconditionNotMetException;

    Credential get(String name) throws NotFoundException;

    /**
     * Generates every missing system account credential. Coordinator only.
     */
    void ensureSystemCredentials() throws PreconditionNotMetException;

    boolean isSystemCredentialsReady();

    Map<SystemAccount, Credential> getSystemCredentials();

    /**
     * Applies every credential whose stored version is newer than the version applied to the engine.
     *
     * @return number of applied credentials
     */
    int applyPendingCredentials(String primaryAddress);

    Credential createRelationCredential(int relationId, String database, String username) throws PreconditionNotMetException;

    /**
     * Drops engine account of the relation and forgets its credential. Never rotated or restored afterwards.
     */
    void destroyRelationCredential(int relationId, String username) throws PreconditionNotMetException;

    /**
     * @param username system account name, root when null
     */
    String getPassword(String username) throws InvalidArgumentException, NotFoundException;

    /**
     * @param username system account name, root when null
     * @param password new password, generated when null
     */
    Credential setPassword(String username, String password) throws InvalidArgumentException, PreconditionNotMetException;
}
