package com.clapgrow.fleet.session.session;

import com.clapgrow.fleet.common.protocol.MessageLookup;
import com.clapgrow.fleet.common.protocol.event.InboundMessage;
import com.clapgrow.fleet.common.protocol.event.MessageKey;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.config.FleetProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Bounded memory of recently seen message content, used by protocol clients
 * to re-fetch originals (quoted media, deleted messages).
 */
@Component
public class RecentMessageStore {

    private final Cache<String, JsonNode> cache;

    public RecentMessageStore(FleetProperties fleetProperties) {
        FleetProperties.MessageCache settings = fleetProperties.getMessageCache();
        this.cache = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofMinutes(settings.getTtlMinutes()))
            .maximumSize(settings.getMaxSize())
            .build();
    }

    public void record(TenantId tenant, List<InboundMessage> messages) {
        for (InboundMessage message : messages) {
            if (message.key() != null && message.hasContent()) {
                cache.put(cacheKey(tenant, message.key()), message.message());
            }
        }
    }

    public Optional<JsonNode> find(TenantId tenant, MessageKey key) {
        return Optional.ofNullable(cache.getIfPresent(cacheKey(tenant, key)));
    }

    public MessageLookup lookupFor(TenantId tenant) {
        return key -> find(tenant, key);
    }

    public void forget(TenantId tenant) {
        String prefix = tenant.value() + "|";
        cache.asMap().keySet().removeIf(key -> key.startsWith(prefix));
    }

    public void clear() {
        cache.invalidateAll();
    }

    private static String cacheKey(TenantId tenant, MessageKey key) {
        return tenant.value() + "|" + key.remoteJid() + "|" + key.id();
    }
}
