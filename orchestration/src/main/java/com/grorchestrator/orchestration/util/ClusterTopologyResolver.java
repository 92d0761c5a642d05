package com.grorchestrator.orchestration.util;

import com.grorchestrator.configuration.properties.predefined.ClusterProperties;
import com.grorchestrator.configuration.properties.predefined.EngineProperties;
import com.grorchestrator.orchestration.adapter.api.ClusterControlAdapter;
import com.grorchestrator.orchestration.exception.EngineOperationException;
import com.grorchestrator.orchestration.exception.PreconditionNotMetException;
import com.grorchestrator.orchestration.exception.TransientEngineException;
import com.grorchestrator.orchestration.model.ObservedClusterStatus;
import com.grorchestrator.orchestration.model.ObservedMember;
import com.grorchestrator.orchestration.model.peerstate.PersistedMemberInfo;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads cluster topology from the engine, falling back to other registered members when the local instance does not answer.
 */
@Slf4j
@ApplicationScoped
public class ClusterTopologyResolver {

    @Inject
    ClusterProperties clusterProperties;

    @Inject
    EngineProperties engineProperties;

    @Inject
    ClusterControlAdapter clusterControlAdapter;

    @Inject
    EngineCallExecutor engineCallExecutor;

    @Inject
    PeerStateFunctionalityCombinator peerStateFunctionalityCombinator;

    /**
     * @return address:port of the local engine instance
     */
    public String getSelfEndpoint() {
        return clusterProperties.nodeAddress() + ":" + engineProperties.port();
    }

    /**
     * Asks local instance first, then every other registered member. First answer which sees a cluster wins.
     *
     * @return observed status or {@link ObservedClusterStatus#noCluster()} if no reachable instance is part of a cluster
     * @throws TransientEngineException if no instance answered
     */
    public ObservedClusterStatus observe() throws TransientEngineException {
        List<String> addresses = new ArrayList<>();
        addresses.add(getSelfEndpoint());
        for (PersistedMemberInfo member : peerStateFunctionalityCombinator.getMembers().values()) {
            if (!addresses.contains(member.getAddress())) {
                addresses.add(member.getAddress());
            }
        }

        boolean anyAnswered = false;
        String lastError = null;

        for (String address : addresses) {
            try {
                ObservedClusterStatus status = engineCallExecutor.executeWithRetry("get cluster status via " + address, () -> clusterControlAdapter.getClusterStatus(address));
                anyAnswered = true;
                if (status.isClusterExists()) {
                    return status;
                }
            } catch (TransientEngineException | EngineOperationException e) {
                log.debug("Instance {} did not report cluster status: {}", address, e.getMessage());
                lastError = e.getMessage();
            }
        }

        if (!anyAnswered) {
            throw new TransientEngineException("No instance reported cluster status. Last error: " + lastError);
        }
        return ObservedClusterStatus.noCluster();
    }

    /**
     * @return address of the single online primary
     * @throws PreconditionNotMetException if cluster has no online primary
     */
    public String resolvePrimaryAddress() throws PreconditionNotMetException {
        return resolvePrimary(observe()).getAddress();
    }

    public ObservedMember resolvePrimary(ObservedClusterStatus status) throws PreconditionNotMetException {
        if (!status.isClusterExists()) {
            throw new PreconditionNotMetException("Cluster does not exist yet");
        }
        return status.getOnlinePrimary()
                .orElseThrow(() -> new PreconditionNotMetException("Cluster has no single online primary"));
    }
}
