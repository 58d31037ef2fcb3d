package com.clapgrow.fleet.common.protocol;

import com.clapgrow.fleet.common.protocol.event.ClientEventBus;
import com.clapgrow.fleet.common.protocol.event.MessageKey;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * One live connection to the messaging network for one tenant.
 * 
 * The client owns the transport, the handshake and the encryption; callers only
 * see the operations below and the events published on {@link #events()}.
 * Implementations throw {@link ProtocolClientException} on failure.
 * 
 * Implementation guidelines:
 * - Publish events on {@link #events()} in the order the transport produces them
 * - Never log credential material
 * - {@link #close()} must be safe to call more than once
 */
public interface ProtocolClient {

    /**
     * Event bus of this connection (connection state, credential updates, calls, messages).
     */
    ClientEventBus events();

    /**
     * JID of the account this connection is logged in as, once known.
     */
    Optional<String> selfJid();

    /**
     * Request an 8-character pairing code for linking a new device to the given number.
     */
    String requestPairingCode(String phoneNumber);

    /**
     * Send a message.
     * 
     * @param jid Recipient JID
     * @param message Content to send
     * @param quoted Message being replied to, or null
     */
    void sendMessage(String jid, OutgoingMessage message, JsonNode quoted);

    default void sendMessage(String jid, OutgoingMessage message) {
        sendMessage(jid, message, null);
    }

    /**
     * Send a status reaction visible only to the listed JIDs.
     */
    void sendStatusReaction(MessageKey key, String emoji, List<String> statusJidList);

    void rejectCall(String callId, String from);

    void readMessages(List<MessageKey> keys);

    void sendPresenceUpdate(Presence presence, String jid);

    GroupMetadata groupMetadata(String groupJid);

    /**
     * React to a broadcast-channel post.
     */
    void newsletterReact(String newsletterJid, String serverId, String emoji);

    /**
     * Download and decrypt the media referenced by a media message node.
     * 
     * @param mediaMessage Inner media node (e.g. the value of {@code imageMessage})
     * @param mediaType Media type without the "Message" suffix (image, video, audio, sticker, document)
     * @return Decrypted bytes
     */
    byte[] downloadMedia(JsonNode mediaMessage, String mediaType);

    /**
     * Close the transport. Listeners are not detached; callers do that through {@link #events()}.
     */
    void close();
}
