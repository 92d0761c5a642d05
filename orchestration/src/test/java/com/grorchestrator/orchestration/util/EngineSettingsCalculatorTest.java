package com.grorchestrator.orchestration.util;

import com.grorchestrator.configuration.properties.predefined.ClusterProperties;
import com.grorchestrator.configuration.properties.predefined.EngineProperties;
import com.grorchestrator.orchestration.testsupport.BeanWiring;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static com.grorchestrator.orchestration.util.EngineSettingsCalculator.BYTES_1GB;
import static com.grorchestrator.orchestration.util.EngineSettingsCalculator.BYTES_1MB;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EngineSettingsCalculatorTest {

    private final ClusterProperties clusterProperties = mock(ClusterProperties.class);
    private final EngineProperties engineProperties = mock(EngineProperties.class);
    private final EngineProperties.AuditProperties audit = mock(EngineProperties.AuditProperties.class);

    private EngineSettingsCalculator calculator;

    @BeforeEach
    void setUp() {
        when(clusterProperties.profile()).thenReturn(ClusterProperties.Profile.PRODUCTION);
        when(engineProperties.binlogRetentionDays()).thenReturn(7);
        when(engineProperties.experimentalMaxConnections()).thenReturn(Optional.empty());
        when(audit.enabled()).thenReturn(true);
        when(audit.policy()).thenReturn(EngineProperties.AuditPolicy.LOGINS);
        when(audit.strategy()).thenReturn(EngineProperties.AuditStrategy.ASYNC);
        when(engineProperties.audit()).thenReturn(audit);
        calculator = BeanWiring.wire(new EngineSettingsCalculator(), clusterProperties, engineProperties);
    }

    @Test
    void bufferPoolTakesThreeQuartersOfLargeMemory() {
        assertThat(calculator.calculateBufferPoolSize(8 * BYTES_1GB)).isEqualTo(6 * BYTES_1GB);
    }

    @Test
    void bufferPoolTakesHalfOfSmallMemory() {
        assertThat(calculator.calculateBufferPoolSize(BYTES_1GB)).isEqualTo(512 * BYTES_1MB);
    }

    @Test
    void bufferPoolIsAtLeastOneChunk() {
        assertThat(calculator.calculateBufferPoolSize(64 * BYTES_1MB)).isEqualTo(128 * BYTES_1MB);
    }

    @Test
    void productionSettingsAreDerivedFromMemory() {
        Map<String, String> settings = calculator.calculateSettings(8 * BYTES_1GB);

        assertThat(settings)
                .containsEntry("innodb_buffer_pool_size", Long.toString(6 * BYTES_1GB))
                .containsEntry("max_connections", "170")
                .containsEntry("binlog_expire_logs_seconds", "604800")
                .containsEntry("audit_log_policy", "'LOGINS'")
                .containsEntry("audit_log_strategy", "'ASYNCHRONOUS'");
    }

    @Test
    void maxConnectionsHaveLowerBound() {
        assertThat(calculator.calculateSettings(BYTES_1GB)).containsEntry("max_connections", "100");
    }

    @Test
    void explicitMaxConnectionsWin() {
        when(engineProperties.experimentalMaxConnections()).thenReturn(Optional.of(42));

        assertThat(calculator.calculateSettings(8 * BYTES_1GB)).containsEntry("max_connections", "42");
    }

    @Test
    void testingProfileUsesSmallFootprint() {
        when(clusterProperties.profile()).thenReturn(ClusterProperties.Profile.TESTING);
        when(audit.enabled()).thenReturn(false);
        when(audit.strategy()).thenReturn(EngineProperties.AuditStrategy.SEMI_ASYNC);

        Map<String, String> settings = calculator.calculateSettings(64 * BYTES_1GB);

        assertThat(settings)
                .containsEntry("innodb_buffer_pool_size", Long.toString(20 * BYTES_1MB))
                .containsEntry("group_replication_message_cache_size", Long.toString(128 * BYTES_1MB))
                .containsEntry("max_connections", "100")
                .doesNotContainKey("audit_log_policy");
    }

    @Test
    void semiAsyncAuditStrategyIsTranslated() {
        when(audit.strategy()).thenReturn(EngineProperties.AuditStrategy.SEMI_ASYNC);

        assertThat(calculator.calculateSettings(8 * BYTES_1GB)).containsEntry("audit_log_strategy", "'SEMISYNCHRONOUS'");
    }
}
