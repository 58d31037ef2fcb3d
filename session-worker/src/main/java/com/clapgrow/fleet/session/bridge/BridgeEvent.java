package com.clapgrow.fleet.session.bridge;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Event pushed by the bridge: {@code {"type": "messages.upsert", "payload": {...}}}.
 */
public record BridgeEvent(String type, JsonNode payload) {

    public static final String CONNECTION_UPDATE = "connection.update";
    public static final String CREDS_UPDATE = "creds.update";
    public static final String CALL = "call";
    public static final String MESSAGES_UPSERT = "messages.upsert";
    public static final String MESSAGES_UPDATE = "messages.update";
}
