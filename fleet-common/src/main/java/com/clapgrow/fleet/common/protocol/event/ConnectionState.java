package com.clapgrow.fleet.common.protocol.event;

/**
 * Transport state reported in a connection update.
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSE
}
