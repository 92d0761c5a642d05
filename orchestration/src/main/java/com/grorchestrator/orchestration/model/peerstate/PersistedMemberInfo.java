package com.grorchestrator.orchestration.model.peerstate;

import com.grorchestrator.orchestration.model.NodeRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Provisioned node as known to peer state. Address and removal mark are written by the node itself (or by coordinator),
 * role is written by coordinator only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersistedMemberInfo {
    private String nodeId;
    private String address;
    private NodeRole role;
    private boolean markedForRemoval;
}
