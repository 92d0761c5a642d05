package com.grorchestrator.rest.constant;

public class ApiConstants {
    public static final String API_V1_PREFIX = "/api/v1";

    private ApiConstants() {
    }
}
