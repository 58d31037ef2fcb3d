package com.clapgrow.fleet.session.bridge;

import com.clapgrow.fleet.common.protocol.MessageLookup;
import com.clapgrow.fleet.common.tenant.TenantId;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bridge clients currently open, so inbound bridge callbacks can find their session.
 */
@Component
public class BridgeClientDirectory {

    private record Entry(BridgeProtocolClient client, MessageLookup lookup) {
    }

    private final ConcurrentHashMap<TenantId, Entry> entries = new ConcurrentHashMap<>();

    void register(BridgeProtocolClient client, MessageLookup lookup) {
        Entry previous = entries.put(client.tenant(), new Entry(client, lookup));
        if (previous != null && previous.client() != client) {
            previous.client().close();
        }
    }

    void remove(BridgeProtocolClient client) {
        entries.computeIfPresent(client.tenant(), (tenant, entry) -> entry.client() == client ? null : entry);
    }

    public Optional<BridgeProtocolClient> client(TenantId tenant) {
        return Optional.ofNullable(entries.get(tenant)).map(Entry::client);
    }

    public Optional<MessageLookup> lookup(TenantId tenant) {
        return Optional.ofNullable(entries.get(tenant)).map(Entry::lookup);
    }
}
