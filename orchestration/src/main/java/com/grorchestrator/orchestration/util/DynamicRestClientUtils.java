package com.grorchestrator.orchestration.util;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.rest.client.RestClientBuilder;

import java.io.Closeable;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Slf4j
@ApplicationScoped
public class DynamicRestClientUtils {
    public <T> T createRestClient(Class<T> clazz, String baseUrl, Duration timeout) {
        return RestClientBuilder.newBuilder()
                .baseUri(URI.create(baseUrl))
                .connectTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .build(clazz);
    }

    public void closeClient(Closeable client) {
        if (client == null) {
            return;
        }

        try {
            client.close();
        } catch (Exception e) {
            log.debug("Failed to close rest client", e);
        }
    }
}
