package com.grorchestrator.quarkusroot.validator;

import com.grorchestrator.configuration.properties.predefined.ClusterProperties;
import com.grorchestrator.configuration.properties.predefined.EngineProperties;
import com.grorchestrator.configuration.properties.predefined.OrchestrationProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

@Slf4j
@ApplicationScoped
public class ClusterConfigurationValidator implements ConfigurationValidator {
    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{0,62}$");
    private static final int ENGINE_MAX_MEMBERS = 9;
    private static final int MIN_LOGS_RETENTION_DAYS = 3;

    @Inject
    ClusterProperties clusterProperties;

    @Inject
    EngineProperties engineProperties;

    @Inject
    OrchestrationProperties orchestrationProperties;

    @Override
    public boolean validate() {
        boolean flag = true;

        if (StringUtils.isBlank(clusterProperties.nodeId()) || !NAME_PATTERN.matcher(clusterProperties.nodeId()).matches()) {
            log.error("Invalid configuration. Node id '{}' must consist of letters, digits, '-' and '_'.", clusterProperties.nodeId());
            flag = false;
        }

        if (clusterProperties.name().isPresent() && !NAME_PATTERN.matcher(clusterProperties.name().get()).matches()) {
            log.error("Invalid configuration. Cluster name '{}' must consist of letters, digits, '-' and '_'.", clusterProperties.name().get());
            flag = false;
        }

        if (clusterProperties.clusterSetName().isPresent() && !NAME_PATTERN.matcher(clusterProperties.clusterSetName().get()).matches()) {
            log.error("Invalid configuration. Cluster set name '{}' must consist of letters, digits, '-' and '_'.", clusterProperties.clusterSetName().get());
            flag = false;
        }

        if (clusterProperties.maxMembers() < 1 || clusterProperties.maxMembers() > ENGINE_MAX_MEMBERS) {
            log.error("Invalid configuration. Max members must be between 1 and {}.", ENGINE_MAX_MEMBERS);
            flag = false;
        }

        if (clusterProperties.profileLimitMemory().isPresent() && clusterProperties.profileLimitMemory().get() <= 0) {
            log.error("Invalid configuration. Profile memory limit must be positive.");
            flag = false;
        }

        if (!isValidLogsRetentionPeriod(engineProperties.logsRetentionPeriod())) {
            log.error("Invalid configuration. Logs retention period must be 'auto' or number of days not less than {}.", MIN_LOGS_RETENTION_DAYS);
            flag = false;
        }

        if (engineProperties.binlogRetentionDays() < 1) {
            log.error("Invalid configuration. Binlog retention must be at least 1 day.");
            flag = false;
        }

        if (engineProperties.experimentalMaxConnections().isPresent() && engineProperties.experimentalMaxConnections().get() < 1) {
            log.error("Invalid configuration. Experimental max connections must be positive.");
            flag = false;
        }

        OrchestrationProperties.CoordinationProperties coordination = orchestrationProperties.coordination();
        if (coordination.renewInterval().compareTo(coordination.leaseDuration()) >= 0) {
            log.error("Invalid configuration. Coordination lease must be renewed more often than it expires.");
            flag = false;
        }

        if (orchestrationProperties.engineRetry().attempts() < 1) {
            log.error("Invalid configuration. Engine retry attempts must be at least 1.");
            flag = false;
        }

        return flag;
    }

    static boolean isValidLogsRetentionPeriod(String value) {
        if ("auto".equals(value)) {
            return true;
        }
        if (!StringUtils.isNumeric(value)) {
            return false;
        }
        try {
            return Integer.parseInt(value) >= MIN_LOGS_RETENTION_DAYS;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
