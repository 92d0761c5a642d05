package com.grorchestrator.orchestration.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.grorchestrator.configuration.properties.predefined.ClusterProperties;
import com.grorchestrator.configuration.properties.predefined.EngineProperties;
import com.grorchestrator.configuration.properties.predefined.OrchestrationProperties;
import com.grorchestrator.configuration.properties.runtime.NodeRuntimeProperties;
import com.grorchestrator.orchestration.model.LifecycleEvent;
import com.grorchestrator.orchestration.model.LifecycleEventType;
import com.grorchestrator.orchestration.model.ReconciliationPassResult;
import com.grorchestrator.orchestration.service.api.BackupRestoreCoordinator;
import com.grorchestrator.orchestration.service.api.TlsCertificateManager;
import com.grorchestrator.orchestration.service.impl.ClusterOperationsServiceImpl;
import com.grorchestrator.orchestration.service.impl.ClusterSetReplicationManagerImpl;
import com.grorchestrator.orchestration.service.impl.CredentialManagerImpl;
import com.grorchestrator.orchestration.service.impl.TopologyReconcilerImpl;
import com.grorchestrator.orchestration.util.*;
import lombok.Getter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Several orchestrator nodes sharing one peer state and one engine. Every node gets its own beans wired the same way the
 * container wires them. TLS and backups are mocked.
 */
public class ClusterSimulation {
    public static final String DEFAULT_CLUSTER_NAME = "cluster-a";
    public static final int ENGINE_PORT = 3306;

    @Getter
    private final String clusterName;

    @Getter
    private final InMemoryPeerStateStore peerStateStore = new InMemoryPeerStateStore();
    @Getter
    private final FakeClusterControlAdapter engine = new FakeClusterControlAdapter();
    private final AtomicReference<String> coordinatorHolder = new AtomicReference<>();
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final Map<String, SimulatedNode> nodes = new LinkedHashMap<>();
    private int maxMembers = 9;

    public ClusterSimulation() {
        this(DEFAULT_CLUSTER_NAME);
    }

    public ClusterSimulation(String clusterName) {
        this.clusterName = clusterName;
    }

    public ClusterSimulation withMaxMembers(int maxMembers) {
        this.maxMembers = maxMembers;
        return this;
    }

    public SimulatedNode addNode(String nodeId, String host) {
        SimulatedNode node = new SimulatedNode(nodeId, host);
        nodes.put(nodeId, node);
        return node;
    }

    public SimulatedNode node(String nodeId) {
        return nodes.get(nodeId);
    }

    public void setCoordinator(String nodeId) {
        coordinatorHolder.set(nodeId);
    }

    /**
     * Runs one update tick on every node which is alive, coordinator last.
     */
    public void tickAll() {
        String coordinator = coordinatorHolder.get();
        nodes.values().stream()
                .filter(node -> !node.getNodeId().equals(coordinator))
                .filter(SimulatedNode::isAlive)
                .forEach(SimulatedNode::tick);
        Optional.ofNullable(nodes.get(coordinator))
                .filter(SimulatedNode::isAlive)
                .ifPresent(SimulatedNode::tick);
    }

    /**
     * Ticks all nodes until coordinator pass applies nothing.
     *
     * @return number of rounds
     */
    public int converge(int maxRounds) {
        for (int round = 1; round <= maxRounds; round++) {
            tickAll();
            SimulatedNode coordinator = nodes.get(coordinatorHolder.get());
            if (coordinator != null && coordinator.getLastResult() != null && !coordinator.getLastResult().isOperationApplied()) {
                return round;
            }
        }
        throw new IllegalStateException("Cluster did not converge in " + maxRounds + " rounds");
    }

    public void kill(String nodeId) {
        SimulatedNode node = nodes.get(nodeId);
        node.setAlive(false);
        engine.kill(node.getEndpoint());
    }

    @Getter
    public class SimulatedNode {
        private final String nodeId;
        private final String endpoint;
        private final ClusterProperties clusterProperties = mock(ClusterProperties.class);
        private final EngineProperties engineProperties = mock(EngineProperties.class);
        private final OrchestrationProperties orchestrationProperties = mock(OrchestrationProperties.class);
        private final NodeRuntimeProperties nodeRuntimeProperties = new NodeRuntimeProperties();
        private final TlsCertificateManager tlsCertificateManager = mock(TlsCertificateManager.class);
        private final BackupRestoreCoordinator backupRestoreCoordinator = mock(BackupRestoreCoordinator.class);
        private final EngineSettingsCalculator engineSettingsCalculator = mock(EngineSettingsCalculator.class);

        private final PeerStateFunctionalityCombinator combinator = new PeerStateFunctionalityCombinator();
        private final EngineCallExecutor engineCallExecutor = new EngineCallExecutor();
        private final ClusterTopologyResolver topologyResolver = new ClusterTopologyResolver();
        private final ReconciliationPlanner planner = new ReconciliationPlanner();
        private final ReconciliationPassLock passLock = new ReconciliationPassLock();
        private final CredentialManagerImpl credentialManager = new CredentialManagerImpl();
        private final ClusterSetReplicationManagerImpl replicationManager = new ClusterSetReplicationManagerImpl();
        private final ClusterOperationsServiceImpl operationsService = new ClusterOperationsServiceImpl();
        private final TopologyReconcilerImpl reconciler = new TopologyReconcilerImpl();

        private boolean alive = true;
        private ReconciliationPassResult lastResult;

        SimulatedNode(String nodeId, String host) {
            this.nodeId = nodeId;
            this.endpoint = host + ":" + ENGINE_PORT;

            when(clusterProperties.nodeId()).thenReturn(nodeId);
            when(clusterProperties.nodeAddress()).thenReturn(host);
            when(clusterProperties.name()).thenReturn(Optional.of(clusterName));
            when(clusterProperties.clusterSetName()).thenReturn(Optional.empty());
            when(clusterProperties.maxMembers()).thenAnswer(invocation -> maxMembers);
            when(engineProperties.port()).thenReturn(ENGINE_PORT);

            EngineProperties.LegacyRelationProperties legacyRelation = mock(EngineProperties.LegacyRelationProperties.class);
            when(legacyRelation.user()).thenReturn(Optional.empty());
            when(legacyRelation.database()).thenReturn(Optional.empty());
            when(engineProperties.legacyRelation()).thenReturn(legacyRelation);

            OrchestrationProperties.EngineRetryProperties retry = mock(OrchestrationProperties.EngineRetryProperties.class);
            when(retry.attempts()).thenReturn(1);
            when(retry.initialBackoff()).thenReturn(Duration.ZERO);
            when(retry.maxBackoff()).thenReturn(Duration.ZERO);
            when(orchestrationProperties.engineRetry()).thenReturn(retry);
            when(orchestrationProperties.maintenanceTimeout()).thenReturn(Duration.ofHours(6));

            nodeRuntimeProperties.setNodeId(nodeId);
            nodeRuntimeProperties.setStarted(true);

            Object[] beans = {
                    peerStateStore, engine, new SettableCoordinationAuthority(nodeId, coordinatorHolder), objectMapper,
                    clusterProperties, engineProperties, orchestrationProperties, nodeRuntimeProperties,
                    tlsCertificateManager, backupRestoreCoordinator, engineSettingsCalculator,
                    combinator, engineCallExecutor, topologyResolver, planner, passLock,
                    credentialManager, replicationManager, operationsService
            };
            BeanWiring.wire(combinator, beans);
            BeanWiring.wire(engineCallExecutor, beans);
            BeanWiring.wire(topologyResolver, beans);
            BeanWiring.wire(credentialManager, beans);
            BeanWiring.wire(replicationManager, beans);
            BeanWiring.wire(operationsService, beans);
            BeanWiring.wire(reconciler, beans);
        }

        public ReconciliationPassResult tick() {
            return handle(LifecycleEvent.tick());
        }

        public ReconciliationPassResult handle(LifecycleEvent event) {
            lastResult = reconciler.reconcile(event);
            return lastResult;
        }

        public ReconciliationPassResult nodeRemoved(String removedNodeId) {
            return handle(LifecycleEvent.builder()
                    .type(LifecycleEventType.NODE_REMOVED)
                    .nodeId(removedNodeId)
                    .build());
        }

        void setAlive(boolean alive) {
            this.alive = alive;
        }
    }
}
