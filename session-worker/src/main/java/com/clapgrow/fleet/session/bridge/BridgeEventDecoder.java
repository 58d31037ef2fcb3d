package com.clapgrow.fleet.session.bridge;

import com.clapgrow.fleet.common.protocol.event.CallOffer;
import com.clapgrow.fleet.common.protocol.event.ConnectionState;
import com.clapgrow.fleet.common.protocol.event.ConnectionUpdate;
import com.clapgrow.fleet.common.protocol.event.InboundMessage;
import com.clapgrow.fleet.common.protocol.event.MessageKey;
import com.clapgrow.fleet.common.protocol.event.MessageUpdate;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes bridge event payloads into protocol event records.
 */
@Component
public class BridgeEventDecoder {

    public ConnectionUpdate connectionUpdate(JsonNode payload) {
        ConnectionState state = switch (payload.path("connection").asText("")) {
            case "open" -> ConnectionState.OPEN;
            case "close" -> ConnectionState.CLOSE;
            case "connecting" -> ConnectionState.CONNECTING;
            default -> null;
        };
        JsonNode lastDisconnect = payload.path("lastDisconnect");
        Integer statusCode = intOrNull(lastDisconnect.path("statusCode"));
        if (statusCode == null) {
            statusCode = intOrNull(payload.path("statusCode"));
        }
        String error = textOrNull(lastDisconnect.path("error"));
        if (error == null) {
            error = textOrNull(payload.path("error"));
        }
        String selfJid = textOrNull(payload.path("selfJid"));
        if (selfJid == null) {
            selfJid = textOrNull(payload.path("user").path("id"));
        }
        return new ConnectionUpdate(state, statusCode, error, selfJid);
    }

    public List<CallOffer> calls(JsonNode payload) {
        List<CallOffer> calls = new ArrayList<>();
        for (JsonNode call : payload) {
            calls.add(new CallOffer(textOrNull(call.path("id")), textOrNull(call.path("from")), textOrNull(call.path("status"))));
        }
        return calls;
    }

    public List<InboundMessage> messages(JsonNode payload) {
        JsonNode array = payload.isArray() ? payload : payload.path("messages");
        List<InboundMessage> messages = new ArrayList<>();
        for (JsonNode node : array) {
            JsonNode key = node.path("key");
            if (key.isMissingNode()) {
                continue;
            }
            MessageKey messageKey = messageKey(key);
            JsonNode content = node.get("message");
            messages.add(new InboundMessage(
                messageKey,
                content == null || content.isNull() ? null : content,
                textOrNull(node.path("pushName")),
                node.path("messageTimestamp").canConvertToLong() ? node.path("messageTimestamp").asLong() : null,
                textOrNull(node.path("newsletterServerId"))));
        }
        return messages;
    }

    public List<MessageUpdate> messageUpdates(JsonNode payload) {
        JsonNode array = payload.isArray() ? payload : payload.path("updates");
        List<MessageUpdate> updates = new ArrayList<>();
        for (JsonNode node : array) {
            JsonNode key = node.path("key");
            if (key.isMissingNode()) {
                continue;
            }
            JsonNode update = node.path("update");
            updates.add(new MessageUpdate(messageKey(key), update.isMissingNode() ? null : update));
        }
        return updates;
    }

    private static MessageKey messageKey(JsonNode key) {
        return new MessageKey(
            textOrNull(key.path("remoteJid")),
            textOrNull(key.path("id")),
            key.path("fromMe").asBoolean(false),
            textOrNull(key.path("participant")));
    }

    private static String textOrNull(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private static Integer intOrNull(JsonNode node) {
        return node.canConvertToInt() ? node.asInt() : null;
    }
}
