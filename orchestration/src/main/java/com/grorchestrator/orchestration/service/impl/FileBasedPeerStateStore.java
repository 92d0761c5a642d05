package com.grorchestrator.orchestration.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grorchestrator.configuration.exception.ConfigurationInitializationException;
import com.grorchestrator.configuration.exception.PropertyModificationException;
import com.grorchestrator.configuration.exception.PropertyReadException;
import com.grorchestrator.configuration.producers.FilesPathsProducer;
import com.grorchestrator.configuration.properties.predefined.ClusterProperties;
import com.grorchestrator.orchestration.exception.PeerStateVersionConflictException;
import com.grorchestrator.orchestration.model.peerstate.VersionedValue;
import com.grorchestrator.orchestration.service.api.PeerStateStore;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Peer state kept as a single JSON file in a directory shared by all nodes. Every operation takes an in-process lock and
 * an exclusive file lock, re-reads the file and, for writes, replaces it atomically.
 */
@Slf4j
@ApplicationScoped
public class FileBasedPeerStateStore implements PeerStateStore {

    @Inject
    FilesPathsProducer filesPathsProducer;

    @Inject
    ClusterProperties clusterProperties;

    @Inject
    ObjectMapper objectMapper;

    private File stateFile;
    private File lockFile;
    private final ReentrantLock modificationLock = new ReentrantLock();

    // @formatter:off
    private static final TypeReference<TreeMap<String, VersionedValue>> STATE_TYPE_REF = new TypeReference<>() {};
    // @formatter:on

    @PostConstruct
    public void init() {
        stateFile = new File(filesPathsProducer.getPeerStateFilePath());
        lockFile = new File(stateFile.getPath() + ".lock");
        try {
            if (!stateFile.exists()) {
                FileUtils.writeStringToFile(stateFile, "{}", StandardCharsets.UTF_8);
            }
            if (!lockFile.exists()) {
                FileUtils.touch(lockFile);
            }
        } catch (IOException e) {
            throw new ConfigurationInitializationException("Failed to create peer state file " + stateFile.getPath(), e);
        }
    }

    @Override
    public Optional<VersionedValue> get(String key) {
        return withState(false, state -> Optional.ofNullable(state.get(key)));
    }

    @Override
    public Map<String, VersionedValue> getByPrefix(String prefix) {
        return withState(false, state -> {
            TreeMap<String, VersionedValue> ret = new TreeMap<>();
            state.tailMap(prefix, true).forEach((key, value) -> {
                if (key.startsWith(prefix)) {
                    ret.put(key, value);
                }
            });
            return ret;
        });
    }

    @Override
    public VersionedValue put(String key, String value) {
        return withState(true, state -> write(state, key, value));
    }

    @Override
    public void putAll(Map<String, String> values) {
        withState(true, state -> {
            values.forEach((key, value) -> write(state, key, value));
            return null;
        });
    }

    @Override
    public VersionedValue compareAndSet(String key, long expectedVersion, String value) throws PeerStateVersionConflictException {
        return withState(true, state -> {
            VersionedValue current = state.get(key);
            long currentVersion = current == null ? 0 : current.getVersion();
            if (currentVersion != expectedVersion) {
                throw new PeerStateVersionConflictException("Key '" + key + "' has version " + currentVersion + " but " + expectedVersion + " was expected");
            }
            return write(state, key, value);
        });
    }

    @Override
    public boolean delete(String key) {
        return withState(true, state -> state.remove(key) != null);
    }

    @Override
    public boolean compareAndDelete(String key, long expectedVersion) {
        return withState(true, state -> {
            VersionedValue current = state.get(key);
            if (current == null || current.getVersion() != expectedVersion) {
                return false;
            }
            state.remove(key);
            return true;
        });
    }

    @Override
    public int deleteByPrefix(String prefix) {
        return withState(true, state -> {
            int sizeBefore = state.size();
            state.keySet().removeIf(key -> key.startsWith(prefix));
            return sizeBefore - state.size();
        });
    }

    private VersionedValue write(TreeMap<String, VersionedValue> state, String key, String value) {
        VersionedValue current = state.get(key);
        VersionedValue updated = VersionedValue.builder()
                .value(value)
                .version(current == null ? 1 : current.getVersion() + 1)
                .updatedAt(Instant.now())
                .updatedBy(clusterProperties.nodeId())
                .build();
        state.put(key, updated);
        return updated;
    }

    private <T> T withState(boolean modify, Function<TreeMap<String, VersionedValue>, T> action) {
        modificationLock.lock();
        try (RandomAccessFile lockAccess = new RandomAccessFile(lockFile, "rw");
             FileChannel channel = lockAccess.getChannel();
             FileLock ignored = channel.lock()) {

            TreeMap<String, VersionedValue> state = readState();
            T result = action.apply(state);
            if (modify) {
                writeState(state);
            }
            return result;
        } catch (IOException e) {
            if (modify) {
                throw new PropertyModificationException("Error while modifying peer state file", e);
            }
            throw new PropertyReadException("Error while reading peer state file", e);
        } finally {
            modificationLock.unlock();
        }
    }

    private TreeMap<String, VersionedValue> readState() throws IOException {
        String content = FileUtils.readFileToString(stateFile, StandardCharsets.UTF_8);
        if (content.isBlank()) {
            return new TreeMap<>();
        }
        return objectMapper.readValue(content, STATE_TYPE_REF);
    }

    private void writeState(TreeMap<String, VersionedValue> state) throws IOException {
        File tmpFile = new File(stateFile.getPath() + ".tmp");
        FileUtils.writeByteArrayToFile(tmpFile, objectMapper.writeValueAsBytes(state), false);
        Files.move(tmpFile.toPath(), stateFile.toPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
