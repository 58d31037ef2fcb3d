package com.clapgrow.fleet.common.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Change to a message that was already delivered (edit, status receipt or deletion).
 * 
 * @param key Identity of the changed message
 * @param update Changed fields; a deletion clears {@code message} or carries the revoke stub type
 */
public record MessageUpdate(MessageKey key, JsonNode update) {

    /** Stub type of a message deleted for everyone. */
    public static final int REVOKE_STUB_TYPE = 1;

    public boolean isRevoke() {
        if (update == null || !update.isObject()) {
            return false;
        }
        JsonNode stubType = update.path("messageStubType");
        if (stubType.canConvertToInt() && stubType.asInt() == REVOKE_STUB_TYPE) {
            return true;
        }
        if ("REVOKE".equals(stubType.asText())) {
            return true;
        }
        return update.has("message") && update.get("message").isNull();
    }
}
