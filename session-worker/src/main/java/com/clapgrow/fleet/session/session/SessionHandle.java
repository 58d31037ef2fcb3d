package com.clapgrow.fleet.session.session;

import com.clapgrow.fleet.common.jid.Jids;
import com.clapgrow.fleet.common.protocol.ProtocolClient;
import com.clapgrow.fleet.common.protocol.event.ClientEventBus;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * One live protocol connection of one tenant, with the helpers commands use on it.
 * At most one handle per tenant is registered at any time.
 */
public class SessionHandle {

    private final TenantId tenant;
    private final ProtocolClient client;
    private final Instant createdAt;
    private final boolean newPairing;
    private final MediaSaver mediaSaver;
    private volatile SessionPhase phase;
    private volatile Instant openedAt;

    public SessionHandle(TenantId tenant, ProtocolClient client, Instant createdAt,
                         boolean newPairing, MediaSaver mediaSaver) {
        this.tenant = tenant;
        this.client = client;
        this.createdAt = createdAt;
        this.newPairing = newPairing;
        this.mediaSaver = mediaSaver;
        this.phase = newPairing ? SessionPhase.PAIRING : SessionPhase.RESTORING;
    }

    public TenantId tenant() {
        return tenant;
    }

    public ProtocolClient client() {
        return client;
    }

    public ClientEventBus events() {
        return client.events();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isNewPairing() {
        return newPairing;
    }

    public SessionPhase phase() {
        return phase;
    }

    public boolean isOpen() {
        return phase == SessionPhase.OPEN;
    }

    public Optional<Instant> openedAt() {
        return Optional.ofNullable(openedAt);
    }

    /**
     * @return true if this call moved the handle to OPEN
     */
    public boolean markOpen(Instant when) {
        if (phase == SessionPhase.OPEN) {
            return false;
        }
        openedAt = when;
        phase = SessionPhase.OPEN;
        return true;
    }

    /**
     * JID the session is logged in as, falling back to the tenant's own user JID.
     */
    public String selfJid() {
        return client.selfJid().map(Jids::decode).orElse(tenant.userJid());
    }

    public String decodeJid(String jid) {
        return Jids.decode(jid);
    }

    /**
     * Download the media of a message and write it under the media directory.
     * 
     * @param message Message content node holding an image, video, audio, sticker or document
     * @param baseName File name without extension
     * @param attachExtension Append an extension derived from the mimetype or the content
     * @return Path of the written file
     */
    public Path downloadAndSaveMedia(JsonNode message, String baseName, boolean attachExtension) {
        return mediaSaver.save(client, message, baseName, attachExtension);
    }

    /**
     * Detach every listener and close the transport.
     */
    public void shutdown() {
        client.events().removeAllListeners();
        client.close();
    }

    @Override
    public String toString() {
        return "SessionHandle{" + tenant + ", " + phase + "}";
    }
}
