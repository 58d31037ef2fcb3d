package com.clapgrow.fleet.common.protocol;

import com.clapgrow.fleet.common.protocol.event.MessageKey;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Callback used by the protocol client to re-fetch the content of a message it has
 * already delivered (retries, quoted media, deleted-message recovery).
 */
@FunctionalInterface
public interface MessageLookup {

    Optional<JsonNode> loadMessage(MessageKey key);
}
