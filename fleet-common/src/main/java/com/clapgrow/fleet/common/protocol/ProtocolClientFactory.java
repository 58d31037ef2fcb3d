package com.clapgrow.fleet.common.protocol;

import com.clapgrow.fleet.common.tenant.TenantId;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Creates protocol clients ("sockets").
 * 
 * Abstraction over the external protocol library so the session supervisor can
 * be exercised without a network.
 */
public interface ProtocolClientFactory {

    /**
     * Open a new connection for a tenant.
     * 
     * @param tenant Tenant the connection belongs to
     * @param credentials Credential material to resume from; empty for a fresh pairing
     * @param messageLookup Callback the client uses to re-fetch previously seen messages
     * @param options Client options
     * @return Live client; events start flowing once listeners are attached
     * @throws ProtocolClientException if the connection cannot be created
     */
    ProtocolClient create(TenantId tenant,
                          Optional<JsonNode> credentials,
                          MessageLookup messageLookup,
                          ClientOptions options);
}
