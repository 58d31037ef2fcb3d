package com.clapgrow.fleet.session.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient bridgeWebClient(BridgeProperties bridgeProperties) {
        return WebClient.builder()
            .baseUrl(bridgeProperties.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
            .build();
    }
}
