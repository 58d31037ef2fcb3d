package com.clapgrow.fleet.session.bridge;

import com.clapgrow.fleet.common.protocol.ClientOptions;
import com.clapgrow.fleet.common.protocol.GroupMetadata;
import com.clapgrow.fleet.common.protocol.OutgoingMessage;
import com.clapgrow.fleet.common.protocol.Presence;
import com.clapgrow.fleet.common.protocol.ProtocolClient;
import com.clapgrow.fleet.common.protocol.ProtocolClientException;
import com.clapgrow.fleet.common.protocol.event.ClientEventBus;
import com.clapgrow.fleet.common.protocol.event.ConnectionUpdate;
import com.clapgrow.fleet.common.protocol.event.MessageKey;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Protocol client backed by the out-of-process protocol bridge.
 * 
 * Operations are blocking HTTP calls to {@code /sessions/{tenant}/...} on the bridge;
 * events arrive through {@link BridgeEventController} and are published on this
 * client's bus in arrival order.
 */
@Slf4j
public class BridgeProtocolClient implements ProtocolClient {

    private final TenantId tenant;
    private final WebClient webClient;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final ClientEventBus events;
    private final AtomicReference<String> selfJid = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Consumer<BridgeProtocolClient> onClose;

    public BridgeProtocolClient(TenantId tenant, WebClient webClient, Duration timeout,
                                ObjectMapper objectMapper, Consumer<BridgeProtocolClient> onClose) {
        this.tenant = tenant;
        this.webClient = webClient;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.onClose = onClose;
        this.events = new ClientEventBus("tenant " + tenant);
    }

    /**
     * Ask the bridge to open the socket.
     */
    void open(Optional<JsonNode> credentials, ClientOptions options) {
        ObjectNode body = objectMapper.createObjectNode();
        credentials.ifPresent(creds -> body.set("credentials", creds));
        ObjectNode optionNode = body.putObject("options");
        optionNode.put("pairingCode", options.pairingCodeMode());
        optionNode.put("printQRInTerminal", options.printQrInTerminal());
        optionNode.put("browser", options.browserName());
        optionNode.put("syncFullHistory", options.syncFullHistory());
        post("create session", "", body);
        log.info("Bridge session opened for tenant {} (pairingCode={})", tenant, options.pairingCodeMode());
    }

    @Override
    public ClientEventBus events() {
        return events;
    }

    @Override
    public Optional<String> selfJid() {
        return Optional.ofNullable(selfJid.get());
    }

    @Override
    public String requestPairingCode(String phoneNumber) {
        ObjectNode body = objectMapper.createObjectNode().put("phoneNumber", phoneNumber);
        JsonNode response = post("request pairing code", "/pairing-code", body);
        String code = response.path("code").asText("");
        if (code.isEmpty()) {
            throw new ProtocolClientException("Bridge returned no pairing code for tenant " + tenant);
        }
        return code;
    }

    @Override
    public void sendMessage(String jid, OutgoingMessage message, JsonNode quoted) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("jid", jid);
        body.set("content", toContent(message));
        if (quoted != null) {
            body.set("quoted", quoted);
        }
        post("send message", "/messages", body);
    }

    @Override
    public void sendStatusReaction(MessageKey key, String emoji, List<String> statusJidList) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("key", toKey(key));
        body.put("emoji", emoji);
        ArrayNode audience = body.putArray("statusJidList");
        statusJidList.forEach(audience::add);
        post("react to status", "/status-reactions", body);
    }

    @Override
    public void rejectCall(String callId, String from) {
        ObjectNode body = objectMapper.createObjectNode().put("callId", callId).put("from", from);
        post("reject call", "/calls/reject", body);
    }

    @Override
    public void readMessages(List<MessageKey> keys) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode keyArray = body.putArray("keys");
        keys.forEach(key -> keyArray.add(toKey(key)));
        post("read messages", "/read", body);
    }

    @Override
    public void sendPresenceUpdate(Presence presence, String jid) {
        ObjectNode body = objectMapper.createObjectNode().put("presence", presence.wireValue()).put("jid", jid);
        post("update presence", "/presence", body);
    }

    @Override
    public GroupMetadata groupMetadata(String groupJid) {
        JsonNode response = call("fetch group metadata", () -> webClient.get()
            .uri("/sessions/{tenant}/groups/{jid}", tenant.value(), groupJid)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout)
            .block());
        List<GroupMetadata.Participant> participants = new ArrayList<>();
        response.path("participants").forEach(p -> participants.add(new GroupMetadata.Participant(
            p.path("id").asText(), p.hasNonNull("admin") ? p.get("admin").asText() : null)));
        return new GroupMetadata(response.path("id").asText(groupJid), response.path("subject").asText(""), participants);
    }

    @Override
    public void newsletterReact(String newsletterJid, String serverId, String emoji) {
        ObjectNode body = objectMapper.createObjectNode()
            .put("jid", newsletterJid).put("serverId", serverId).put("emoji", emoji);
        post("react to channel post", "/newsletter-reactions", body);
    }

    @Override
    public byte[] downloadMedia(JsonNode mediaMessage, String mediaType) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("message", mediaMessage);
        body.put("mediaType", mediaType);
        return call("download media", () -> webClient.post()
            .uri("/sessions/{tenant}/media/download", tenant.value())
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_OCTET_STREAM)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(byte[].class)
            .timeout(timeout)
            .block());
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        onClose.accept(this);
        try {
            call("close session", () -> webClient.delete()
                .uri("/sessions/{tenant}", tenant.value())
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .block());
        } catch (ProtocolClientException e) {
            log.warn("Bridge close failed for tenant {}: {}", tenant, e.getMessage());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    TenantId tenant() {
        return tenant;
    }

    /**
     * Record the account JID from an open event, then publish it.
     */
    void deliverConnectionUpdate(ConnectionUpdate update) {
        if (update.isOpen() && update.selfJid() != null) {
            selfJid.set(update.selfJid());
        }
        events.publishConnectionUpdate(update);
    }

    private JsonNode post(String operation, String path, JsonNode body) {
        JsonNode response = call(operation, () -> webClient.post()
            .uri("/sessions/{tenant}" + path, tenant.value())
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout)
            .block());
        return response != null ? response : objectMapper.createObjectNode();
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (RuntimeException e) {
            throw BridgeErrors.translate(operation + " for tenant " + tenant, e);
        }
    }

    private ObjectNode toKey(MessageKey key) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("remoteJid", key.remoteJid());
        node.put("id", key.id());
        node.put("fromMe", key.fromMe());
        if (key.participant() != null) {
            node.put("participant", key.participant());
        }
        return node;
    }

    private ObjectNode toContent(OutgoingMessage message) {
        ObjectNode content = objectMapper.createObjectNode();
        if (message.text() != null) {
            content.put("text", message.text());
        }
        if (message.mediaKind() != null) {
            String field = message.mediaKind().name().toLowerCase();
            content.put(field, Base64.getEncoder().encodeToString(message.media()));
            content.put("mimetype", message.mimetype());
            if (message.caption() != null) {
                content.put("caption", message.caption());
            }
        }
        if (message.reactionEmoji() != null) {
            ObjectNode react = content.putObject("react");
            react.put("text", message.reactionEmoji());
            react.set("key", toKey(message.reactionKey()));
        }
        return content;
    }
}
