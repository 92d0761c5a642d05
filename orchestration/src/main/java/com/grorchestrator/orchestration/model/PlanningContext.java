package com.grorchestrator.orchestration.model;

import com.grorchestrator.orchestration.model.peerstate.PersistedMemberInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Everything the planner needs for one decision. Built from the engine status and peer state at the beginning of a pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanningContext {
    private String coordinatorNodeId;
    private String clusterName;
    private ObservedClusterStatus observed;
    /**
     * Registered members sorted by node id.
     */
    @Builder.Default
    private Map<String, PersistedMemberInfo> members = new TreeMap<>();
    private boolean recreationPending;
    /**
     * Set when the last restore stopped after the cluster was dissolved.
     */
    private String restoreFailure;
    /**
     * True when all system credentials exist in peer state.
     */
    private boolean credentialsReady;
    private boolean tlsEnabled;
    private boolean caChainPresent;
    @Builder.Default
    private Set<String> configuredInstances = new HashSet<>();
    @Builder.Default
    private Set<String> nodesWithCertificate = new HashSet<>();
    /**
     * Oldest request first.
     */
    @Builder.Default
    private List<String> promotionRequests = new ArrayList<>();
    private int maxMembers;
    /**
     * Executed transaction counts of standalone instances, only filled while no cluster is reported.
     */
    @Builder.Default
    private Map<String, Long> standaloneTransactionCounts = new HashMap<>();
}
