package com.clapgrow.fleet.common.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Receiver of protocol client events. Every method defaults to a no-op so a
 * listener only overrides the events it cares about.
 */
public interface ClientEventListener {

    default void onConnectionUpdate(ConnectionUpdate update) {
    }

    /**
     * Credential material changed and must be persisted.
     */
    default void onCredentialsUpdate(JsonNode credentials) {
    }

    default void onCalls(List<CallOffer> calls) {
    }

    default void onMessagesUpsert(List<InboundMessage> messages) {
    }

    default void onMessagesUpdate(List<MessageUpdate> updates) {
    }
}
