package com.grorchestrator.orchestration.util;

import com.grorchestrator.configuration.properties.predefined.ClusterProperties;
import com.grorchestrator.configuration.properties.predefined.EngineProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.lang.management.ManagementFactory;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calculates engine variables from deployment profile and available memory. Values are SQL literals.
 */
@Slf4j
@ApplicationScoped
public class EngineSettingsCalculator {
    static final long BYTES_1MB = 1024L * 1024L;
    static final long BYTES_1GB = 1024L * BYTES_1MB;
    static final long BUFFER_POOL_CHUNK_SIZE = 128L * BYTES_1MB;
    static final long TESTING_BUFFER_POOL_SIZE = 20L * BYTES_1MB;
    static final long TESTING_MESSAGE_CACHE_SIZE = 128L * BYTES_1MB;
    static final long MEMORY_PER_CONNECTION = 12L * BYTES_1MB;
    static final int MIN_MAX_CONNECTIONS = 100;

    @Inject
    ClusterProperties clusterProperties;

    @Inject
    EngineProperties engineProperties;

    public Map<String, String> calculateSettings() {
        return calculateSettings(resolveAvailableMemory());
    }

    public Map<String, String> calculateSettings(long availableMemory) {
        Map<String, String> settings = new LinkedHashMap<>();

        if (ClusterProperties.Profile.TESTING.equals(clusterProperties.profile())) {
            settings.put("innodb_buffer_pool_size", Long.toString(TESTING_BUFFER_POOL_SIZE));
            settings.put("group_replication_message_cache_size", Long.toString(TESTING_MESSAGE_CACHE_SIZE));
            settings.put("max_connections", Integer.toString(engineProperties.experimentalMaxConnections().orElse(MIN_MAX_CONNECTIONS)));
        } else {
            long bufferPoolSize = calculateBufferPoolSize(availableMemory);
            settings.put("innodb_buffer_pool_size", Long.toString(bufferPoolSize));
            long maxConnections = engineProperties.experimentalMaxConnections()
                    .map(Integer::longValue)
                    .orElseGet(() -> Math.max((availableMemory - bufferPoolSize) / MEMORY_PER_CONNECTION, MIN_MAX_CONNECTIONS));
            settings.put("max_connections", Long.toString(maxConnections));
        }

        settings.put("binlog_expire_logs_seconds", Long.toString(engineProperties.binlogRetentionDays() * 24L * 60L * 60L));

        if (engineProperties.audit().enabled()) {
            settings.put("audit_log_policy", "'" + engineProperties.audit().policy().name() + "'");
            String strategy = EngineProperties.AuditStrategy.SEMI_ASYNC.equals(engineProperties.audit().strategy()) ? "SEMISYNCHRONOUS" : "ASYNCHRONOUS";
            settings.put("audit_log_strategy", "'" + strategy + "'");
        }

        return settings;
    }

    long calculateBufferPoolSize(long availableMemory) {
        double share = availableMemory > 2 * BYTES_1GB ? 0.75 : 0.5;
        long size = (long) (availableMemory * share);
        long chunks = Math.max(size / BUFFER_POOL_CHUNK_SIZE, 1);
        return chunks * BUFFER_POOL_CHUNK_SIZE;
    }

    private long resolveAvailableMemory() {
        if (clusterProperties.profileLimitMemory().isPresent()) {
            return clusterProperties.profileLimitMemory().get() * BYTES_1MB;
        }
        long total = ((com.sun.management.OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean()).getTotalMemorySize();
        log.debug("Detected {} bytes of memory", total);
        return total;
    }
}
