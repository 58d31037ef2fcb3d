package com.clapgrow.fleet.common.protocol.event;

/**
 * Connection state change.
 * 
 * @param state New transport state, or null for updates that only carry other fields
 * @param statusCode Status code of the last disconnect (close only, may be null)
 * @param errorMessage Message of the last disconnect error (close only, may be null)
 * @param selfJid JID of the logged-in account (open only, may be null)
 */
public record ConnectionUpdate(
    ConnectionState state,
    Integer statusCode,
    String errorMessage,
    String selfJid
) {

    public static ConnectionUpdate open(String selfJid) {
        return new ConnectionUpdate(ConnectionState.OPEN, null, null, selfJid);
    }

    public static ConnectionUpdate closed(Integer statusCode, String errorMessage) {
        return new ConnectionUpdate(ConnectionState.CLOSE, statusCode, errorMessage, null);
    }

    public boolean isOpen() {
        return state == ConnectionState.OPEN;
    }

    public boolean isClose() {
        return state == ConnectionState.CLOSE;
    }
}
