package com.grorchestrator.rest.mapper;

import com.grorchestrator.orchestration.model.Credential;
import com.grorchestrator.orchestration.model.tls.TlsStatus;
import com.grorchestrator.rest.model.api.credentials.SetPasswordResponseDto;
import com.grorchestrator.rest.model.api.tls.TlsStatusDto;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper
public abstract class SecurityMapper {
    @Mapping(target = "username", source = "name")
    public abstract SetPasswordResponseDto from(Credential source);

    public abstract TlsStatusDto from(TlsStatus source);
}
