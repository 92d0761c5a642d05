package com.grorchestrator.configuration.properties.predefined;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

@ConfigMapping(prefix = "gr-orchestrator.engine")
public interface EngineProperties {

    String mysqlshPath();

    @WithDefault("3306")
    int port();

    Duration callTimeout();

    AuditProperties audit();

    @WithDefault("7")
    int binlogRetentionDays();

    /**
     * Either 'auto' or number of days which is not less than 3.
     */
    @WithDefault("auto")
    String logsRetentionPeriod();

    LegacyRelationProperties legacyRelation();

    Optional<Integer> experimentalMaxConnections();

    ServiceProperties service();

    /**
     * Control of the local engine process. Used when data directory is replaced during restore.
     */
    interface ServiceProperties {
        /**
         * Command which starts the engine. Split on whitespace.
         */
        String startCommand();

        String stopCommand();

        String dataDirectory();

        String binlogDirectory();
    }

    interface AuditProperties {
        @WithDefault("true")
        boolean enabled();

        @WithDefault("async")
        AuditStrategy strategy();

        @WithDefault("logins")
        AuditPolicy policy();
    }

    interface LegacyRelationProperties {
        Optional<String> database();

        Optional<String> user();
    }

    enum AuditStrategy {
        ASYNC,
        SEMI_ASYNC
    }

    enum AuditPolicy {
        ALL,
        LOGINS,
        QUERIES
    }
}
