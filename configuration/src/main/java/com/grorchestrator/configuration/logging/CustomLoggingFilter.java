package com.grorchestrator.configuration.logging;

import com.grorchestrator.configuration.constants.MDCConstants;
import com.grorchestrator.configuration.model.CoordinationRole;
import com.grorchestrator.configuration.properties.runtime.NodeRuntimeProperties;
import io.quarkus.logging.LoggingFilter;
import jakarta.inject.Inject;
import org.slf4j.MDC;

import java.util.logging.Filter;
import java.util.logging.LogRecord;

@LoggingFilter(name = "custom-filter")
public class CustomLoggingFilter implements Filter {
    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Override
    public boolean isLoggable(LogRecord record) {
        CoordinationRole coordinationRole = nodeRuntimeProperties.getCoordinationRole();
        if (coordinationRole != null) {
            MDC.put(MDCConstants.COORDINATION_ROLE, coordinationRole.getMdcValue());
        }
        if (nodeRuntimeProperties.getNodeId() != null) {
            MDC.put(MDCConstants.NODE_ID, nodeRuntimeProperties.getNodeId());
        }
        return true;
    }
}
