package com.clapgrow.fleet.session.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Connection settings for the protocol bridge that runs the chat protocol out of process.
 */
@Configuration
@ConfigurationProperties(prefix = "fleet.bridge")
@Data
public class BridgeProperties {

    private String baseUrl = "http://localhost:3100";

    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * Shared secret the bridge sends in X-Bridge-Secret when pushing events. Empty disables the check.
     */
    private String callbackSecret = "";
}
