package com.grorchestrator.orchestration.service.api;

import com.grorchestrator.orchestration.exception.PeerStateVersionConflictException;
import com.grorchestrator.orchestration.model.peerstate.VersionedValue;

import java.util.Map;
import java.util.Optional;

/**
 * Versioned key-value space shared by all nodes of one cluster.
 * <p>
 * Writes of one node are visible to this node right after call returns. Other nodes see them eventually, so readers must
 * tolerate stale values and re-check before acting. Store is not a lock: {@link #compareAndSet} only guarantees that a
 * write is based on the value which was read.
 */
public interface PeerStateStore {

    Optional<VersionedValue> get(String key);

    /**
     * @return entries with keys starting with prefix sorted by key
     */
    Map<String, VersionedValue> getByPrefix(String prefix);

    VersionedValue put(String key, String value);

    /**
     * Writes all values atomically.
     */
    void putAll(Map<String, String> values);

    /**
     * Writes value only if current version of the key is equal to expected.
     *
     * @param expectedVersion 0 if key is expected to be absent
     * @throws PeerStateVersionConflictException if key was modified concurrently
     */
    VersionedValue compareAndSet(String key, long expectedVersion, String value) throws PeerStateVersionConflictException;

    /**
     * @return true if key existed
     */
    boolean delete(String key);

    /**
     * Deletes key only if its version is equal to expected.
     *
     * @return true if deleted
     */
    boolean compareAndDelete(String key, long expectedVersion);

    /**
     * @return number of deleted keys
     */
    int deleteByPrefix(String prefix);
}
