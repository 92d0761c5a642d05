package com.grorchestrator.rest.util;

import com.grorchestrator.orchestration.exception.InvalidArgumentException;

public class RequestUtils {

    public static <T> T requireBody(T requestDto) throws InvalidArgumentException {
        if (requestDto == null) {
            throw new InvalidArgumentException("Request body is required");
        }
        return requestDto;
    }

    private RequestUtils() {
    }
}
