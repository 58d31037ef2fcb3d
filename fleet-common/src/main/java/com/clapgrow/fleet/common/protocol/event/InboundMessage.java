package com.clapgrow.fleet.common.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Message delivered by the transport.
 * 
 * @param key Message identity
 * @param message Raw content tree (null for protocol-only stubs)
 * @param pushName Display name of the sender, if announced
 * @param messageTimestamp Epoch seconds
 * @param newsletterServerId Server id of a broadcast-channel post (channel messages only)
 */
public record InboundMessage(
    MessageKey key,
    JsonNode message,
    String pushName,
    Long messageTimestamp,
    String newsletterServerId
) {

    public boolean hasContent() {
        return message != null && !message.isNull() && !message.isMissingNode();
    }

    public InboundMessage withMessage(JsonNode content) {
        return new InboundMessage(key, content, pushName, messageTimestamp, newsletterServerId);
    }

    /**
     * Key and content in the shape the protocol expects for a quoted reply.
     */
    public ObjectNode toQuotedNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        ObjectNode keyNode = node.putObject("key");
        keyNode.put("remoteJid", key.remoteJid());
        keyNode.put("id", key.id());
        keyNode.put("fromMe", key.fromMe());
        if (key.participant() != null) {
            keyNode.put("participant", key.participant());
        }
        if (hasContent()) {
            node.set("message", message);
        }
        return node;
    }
}
