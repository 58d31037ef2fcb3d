package com.clapgrow.fleet.session.bridge;

import com.clapgrow.fleet.common.protocol.ClientOptions;
import com.clapgrow.fleet.common.protocol.MessageLookup;
import com.clapgrow.fleet.common.protocol.ProtocolClient;
import com.clapgrow.fleet.common.protocol.ProtocolClientFactory;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.config.BridgeProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class BridgeProtocolClientFactory implements ProtocolClientFactory {

    private final WebClient bridgeWebClient;
    private final BridgeProperties bridgeProperties;
    private final BridgeClientDirectory directory;
    private final ObjectMapper objectMapper;

    @Override
    public ProtocolClient create(TenantId tenant, Optional<JsonNode> credentials,
                                 MessageLookup messageLookup, ClientOptions options) {
        BridgeProtocolClient client = new BridgeProtocolClient(tenant, bridgeWebClient,
            bridgeProperties.getRequestTimeout(), objectMapper, directory::remove);
        // Registered first so callbacks fired while the bridge opens the socket find the client
        directory.register(client, messageLookup);
        try {
            client.open(credentials, options);
        } catch (RuntimeException e) {
            directory.remove(client);
            throw e;
        }
        return client;
    }
}
