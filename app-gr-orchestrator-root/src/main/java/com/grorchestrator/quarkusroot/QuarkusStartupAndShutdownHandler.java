package com.grorchestrator.quarkusroot;

import com.grorchestrator.configuration.properties.predefined.BackupProperties;
import com.grorchestrator.configuration.properties.predefined.ClusterProperties;
import com.grorchestrator.configuration.properties.runtime.NodeRuntimeProperties;
import com.grorchestrator.orchestration.adapter.api.ObjectStorageAdapter;
import com.grorchestrator.orchestration.model.LifecycleEvent;
import com.grorchestrator.orchestration.service.api.LifecycleEventDispatcher;
import com.grorchestrator.orchestration.service.impl.LeaseCoordinationAuthority;
import com.grorchestrator.quarkusroot.validator.ConfigurationValidator;
import io.quarkus.arc.All;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.interceptor.Interceptor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@ApplicationScoped
public class QuarkusStartupAndShutdownHandler {

    @Inject
    @All
    List<ConfigurationValidator> configurationValidators;

    @Inject
    ClusterProperties clusterProperties;

    @Inject
    BackupProperties backupProperties;

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Inject
    Instance<ObjectStorageAdapter> objectStorageAdapter;

    @Inject
    LeaseCoordinationAuthority leaseCoordinationAuthority;

    @Inject
    LifecycleEventDispatcher lifecycleEventDispatcher;

    public void startup(@Observes @Priority(Interceptor.Priority.PLATFORM_BEFORE) StartupEvent startupEvent) {
        try {
            log.info("Checking provided configuration values...");
            AtomicBoolean configurationValid = new AtomicBoolean(true);
            configurationValidators.forEach(configurationValidator -> {
                if (!configurationValidator.validate()) {
                    configurationValid.set(false);
                }
            });

            if (!configurationValid.get()) {
                log.error("CONFIGURATION INVALID. GR ORCHESTRATOR FAILED TO START!");
                shutdownImmediately();
                return;
            }
            log.info("Provided configuration is valid!");

            nodeRuntimeProperties.setNodeId(clusterProperties.nodeId());

            if (backupProperties.enabled()) {
                try {
                    objectStorageAdapter.get().initializeAndValidate();
                } catch (Exception e) {
                    log.error("Failed to initialize object storage adapter!", e);
                    shutdownImmediately();
                    return;
                }
            } else {
                log.warn("Backups are disabled. Create-backup and restore commands will be rejected.");
            }

            nodeRuntimeProperties.setStarted(true);

            try {
                leaseCoordinationAuthority.renewOrAcquire();
            } catch (Exception e) {
                log.warn("Failed to acquire coordination lease on startup. Will retry on schedule. Cause: {}", e.getMessage());
            }

            lifecycleEventDispatcher.enqueue(LifecycleEvent.tick());
            log.info("GR orchestrator node {} started!", clusterProperties.nodeId());
        } catch (Throwable t) {
            log.error("Error while starting GR orchestrator up!", t);
            shutdownImmediately();
        }
    }

    public void shutdownImmediately() {
        log.error("Exceptional situation occurred and it is impossible to recover! Immediately shutting down GR orchestrator!");
        Quarkus.asyncExit(123);
    }

    public void shutdown(@Observes @Priority(Interceptor.Priority.PLATFORM_AFTER) ShutdownEvent shutdownEvent) {
        log.info("GR orchestrator is shutting down...");
        nodeRuntimeProperties.setStarted(false);
        lifecycleEventDispatcher.stop();

        try {
            leaseCoordinationAuthority.release();
        } catch (Exception e) {
            log.warn("Failed to release coordination lease. Other nodes will take over after it expires. Cause: {}", e.getMessage());
        }

        log.info("GR orchestrator was shut down.");
    }
}
