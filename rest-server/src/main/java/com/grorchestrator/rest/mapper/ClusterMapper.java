package com.grorchestrator.rest.mapper;

import com.grorchestrator.configuration.model.ClusterHealth;
import com.grorchestrator.configuration.model.NodeStatusKind;
import com.grorchestrator.orchestration.model.ClusterStatusReport;
import com.grorchestrator.orchestration.model.NodeRole;
import com.grorchestrator.orchestration.model.PreUpgradeCheckResult;
import com.grorchestrator.orchestration.model.clusterset.ClusterSetMemberStatus;
import com.grorchestrator.orchestration.model.clusterset.ClusterSetStatus;
import com.grorchestrator.orchestration.model.clusterset.PromotionResult;
import com.grorchestrator.rest.model.api.cluster.ClusterStatusResponseDto;
import com.grorchestrator.rest.model.api.cluster.MemberDto;
import com.grorchestrator.rest.model.api.cluster.PreUpgradeCheckResponseDto;
import com.grorchestrator.rest.model.api.cluster.PromotionResponseDto;
import com.grorchestrator.rest.model.api.replication.ClusterSetMemberDto;
import com.grorchestrator.rest.model.api.replication.ClusterSetStatusDto;
import org.mapstruct.Mapper;

@Mapper
public abstract class ClusterMapper {
    public abstract ClusterStatusResponseDto from(ClusterStatusReport source);

    public abstract MemberDto from(ClusterStatusReport.MemberReport source);

    public abstract PreUpgradeCheckResponseDto from(PreUpgradeCheckResult source);

    public abstract PromotionResponseDto from(PromotionResult source);

    public abstract ClusterSetStatusDto from(ClusterSetStatus source);

    public abstract ClusterSetMemberDto from(ClusterSetMemberStatus source);

    protected String toValue(NodeRole role) {
        return role == null ? null : role.getValue();
    }

    protected String toValue(ClusterHealth health) {
        return health == null ? null : health.getValue();
    }

    protected String toValue(NodeStatusKind statusKind) {
        return statusKind == null ? null : statusKind.getValue();
    }
}
