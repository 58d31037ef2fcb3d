package com.clapgrow.fleet.session.bridge;

import com.clapgrow.fleet.common.protocol.event.MessageKey;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.config.BridgeProperties;
import com.clapgrow.fleet.session.exception.BadRequestException;
import com.clapgrow.fleet.session.exception.SessionNotFoundException;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HashMap;
import java.util.Map;

/**
 * Callback surface for the protocol bridge: event delivery and message lookup.
 */
@RestController
@RequestMapping("/bridge/sessions/{number}")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Bridge", description = "Callbacks used by the protocol bridge")
public class BridgeEventController {

    static final String SECRET_HEADER = "X-Bridge-Secret";

    private final BridgeClientDirectory directory;
    private final BridgeEventDecoder decoder;
    private final BridgeProperties bridgeProperties;

    @PostMapping("/events")
    @Operation(summary = "Deliver a session event", description = "Publishes the event on the session's event bus; events of one session are handled in arrival order.")
    public ResponseEntity<Map<String, Object>> receive(
            @PathVariable String number,
            @RequestHeader(value = SECRET_HEADER, required = false) String secret,
            @RequestBody BridgeEvent event) {
        checkSecret(secret);
        TenantId tenant = TenantId.of(number);
        BridgeProtocolClient client = directory.client(tenant)
            .orElseThrow(() -> new SessionNotFoundException(tenant));
        if (event.type() == null || event.payload() == null) {
            throw new BadRequestException("Event type and payload are required");
        }

        switch (event.type()) {
            case BridgeEvent.CONNECTION_UPDATE -> client.deliverConnectionUpdate(decoder.connectionUpdate(event.payload()));
            case BridgeEvent.CREDS_UPDATE -> client.events().publishCredentialsUpdate(event.payload());
            case BridgeEvent.CALL -> client.events().publishCalls(decoder.calls(event.payload()));
            case BridgeEvent.MESSAGES_UPSERT -> client.events().publishMessagesUpsert(decoder.messages(event.payload()));
            case BridgeEvent.MESSAGES_UPDATE -> client.events().publishMessagesUpdate(decoder.messageUpdates(event.payload()));
            default -> throw new BadRequestException("Unknown event type: " + event.type());
        }
        log.debug("Delivered {} for tenant {}", event.type(), tenant);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/messages/{remoteJid}/{id}")
    @Operation(summary = "Look up a recently seen message")
    public ResponseEntity<JsonNode> message(
            @PathVariable String number,
            @PathVariable String remoteJid,
            @PathVariable String id,
            @RequestHeader(value = SECRET_HEADER, required = false) String secret) {
        checkSecret(secret);
        TenantId tenant = TenantId.of(number);
        return directory.lookup(tenant)
            .flatMap(lookup -> lookup.loadMessage(new MessageKey(remoteJid, id, false, null)))
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private void checkSecret(String provided) {
        String expected = bridgeProperties.getCallbackSecret();
        if (expected == null || expected.isEmpty()) {
            return;
        }
        if (provided == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8))) {
            throw new SecurityException("Invalid bridge secret");
        }
    }
}
