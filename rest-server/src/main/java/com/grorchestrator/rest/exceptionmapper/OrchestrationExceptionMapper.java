package com.grorchestrator.rest.exceptionmapper;

import com.grorchestrator.orchestration.exception.ErrorCategory;
import com.grorchestrator.orchestration.exception.OrchestrationException;
import com.grorchestrator.rest.model.api.error.ErrorDto;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

@Slf4j
@Provider
public class OrchestrationExceptionMapper implements ExceptionMapper<OrchestrationException> {
    @Override
    public Response toResponse(OrchestrationException exception) {
        Response.Status status = resolveStatus(exception.getCategory());
        if (status.getFamily() == Response.Status.Family.SERVER_ERROR) {
            log.error("Operator command failed. Category: {}. Cause: {}", exception.getCategory(), exception.getMessage());
        } else {
            log.info("Operator command rejected. Category: {}. Cause: {}", exception.getCategory(), exception.getMessage());
        }

        return Response
                .status(status)
                .entity(
                        ErrorDto
                                .builder()
                                .status(status.getStatusCode())
                                .category(exception.getCategory().name())
                                .timestamp(Instant.now())
                                .message(exception.getMessage())
                                .build()
                )
                .build();
    }

    static Response.Status resolveStatus(ErrorCategory category) {
        return switch (category) {
            case INVALID_ARGUMENT -> Response.Status.BAD_REQUEST;
            case NOT_FOUND -> Response.Status.NOT_FOUND;
            case CONFLICTING_OPERATION -> Response.Status.CONFLICT;
            case PRECONDITION_NOT_MET, OPERATOR_PRECONDITION -> Response.Status.PRECONDITION_FAILED;
            case TRANSIENT_ENGINE_ERROR -> Response.Status.SERVICE_UNAVAILABLE;
            case STRUCTURAL_INCONSISTENCY -> Response.Status.INTERNAL_SERVER_ERROR;
        };
    }
}
