package com.grorchestrator.rest.mapper;

import com.grorchestrator.orchestration.model.clusterset.LinkResult;
import com.grorchestrator.orchestration.model.clusterset.ReplicationHandle;
import com.grorchestrator.rest.model.api.replication.LinkResultDto;
import com.grorchestrator.rest.model.api.replication.ReplicationHandleDto;
import org.mapstruct.Mapper;

@Mapper
public abstract class ReplicationMapper {
    public abstract ReplicationHandleDto from(ReplicationHandle source);

    public abstract ReplicationHandle to(ReplicationHandleDto source);

    public abstract LinkResultDto from(LinkResult source);
}
