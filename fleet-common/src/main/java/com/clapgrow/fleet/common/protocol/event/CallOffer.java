package com.clapgrow.fleet.common.protocol.event;

/**
 * Incoming call signal.
 * 
 * @param id Call id
 * @param from Caller JID
 * @param status Call status ("offer", "ringing", "timeout", "reject", "accept")
 */
public record CallOffer(String id, String from, String status) {

    public boolean isOffer() {
        return "offer".equals(status);
    }
}
