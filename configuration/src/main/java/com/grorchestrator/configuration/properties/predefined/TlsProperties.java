package com.grorchestrator.configuration.properties.predefined;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

@ConfigMapping(prefix = "gr-orchestrator.tls")
public interface TlsProperties {

    IssuerProperties issuer();

    Duration renewBefore();

    String localDirectory();

    @WithDefault("openssl")
    String opensslPath();

    interface IssuerProperties {
        String url();

        Duration timeout();
    }
}
