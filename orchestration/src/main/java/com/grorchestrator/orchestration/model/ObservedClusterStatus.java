package com.grorchestrator.orchestration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Cluster topology as reported by the engine. Never persisted, re-read on every pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservedClusterStatus {
    /**
     * False if instance which was queried is not part of any cluster.
     */
    private boolean clusterExists;
    private String clusterName;
    @Builder.Default
    private List<ObservedMember> members = new ArrayList<>();

    public static ObservedClusterStatus noCluster() {
        return ObservedClusterStatus.builder().clusterExists(false).build();
    }

    public Optional<ObservedMember> findMember(String nodeId) {
        return members.stream()
                .filter(member -> member.getNodeId().equals(nodeId))
                .findFirst();
    }

    public List<ObservedMember> getOnlinePrimaries() {
        return members.stream()
                .filter(member -> member.isPrimary() && MemberState.ONLINE.equals(member.getState()))
                .collect(Collectors.toList());
    }

    public Optional<ObservedMember> getOnlinePrimary() {
        List<ObservedMember> primaries = getOnlinePrimaries();
        return primaries.size() == 1 ? Optional.of(primaries.get(0)) : Optional.empty();
    }

    public List<ObservedMember> getOnlineMembers() {
        return members.stream()
                .filter(member -> MemberState.ONLINE.equals(member.getState()))
                .collect(Collectors.toList());
    }

    public boolean hasRecoveringMember() {
        return members.stream().anyMatch(member -> MemberState.RECOVERING.equals(member.getState()));
    }
}
