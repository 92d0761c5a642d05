package com.grorchestrator.rest.exceptionmapper;

import com.grorchestrator.rest.model.api.error.ErrorDto;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

@Slf4j
@Provider
public class ThrowableExceptionMapper implements ExceptionMapper<Throwable> {
    @Override
    public Response toResponse(Throwable exception) {
        log.error("Error processing REST request. ", exception);
        return Response
                .serverError()
                .entity(
                        ErrorDto
                                .builder()
                                .status(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode())
                                .category("INTERNAL_ERROR")
                                .timestamp(Instant.now())
                                .message("Unexpected error. Examine logs of node and retry.")
                                .build()
                )
                .build();
    }
}
