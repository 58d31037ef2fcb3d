package com.clapgrow.fleet.common.protocol;

import com.clapgrow.fleet.common.protocol.event.MessageKey;

/**
 * Content of a message to send. Exactly one of text, media or reaction is set,
 * except that a text message may carry a reaction as in the status auto-reply.
 */
public record OutgoingMessage(
    String text,
    MediaKind mediaKind,
    byte[] media,
    String mimetype,
    String caption,
    String reactionEmoji,
    MessageKey reactionKey
) {

    public enum MediaKind { IMAGE, VIDEO, AUDIO }

    public static OutgoingMessage text(String text) {
        return new OutgoingMessage(text, null, null, null, null, null, null);
    }

    public static OutgoingMessage image(byte[] bytes, String caption) {
        return new OutgoingMessage(null, MediaKind.IMAGE, bytes, "image/jpeg", caption, null, null);
    }

    public static OutgoingMessage video(byte[] bytes, String caption) {
        return new OutgoingMessage(null, MediaKind.VIDEO, bytes, "video/mp4", caption, null, null);
    }

    public static OutgoingMessage audio(byte[] bytes, String mimetype) {
        return new OutgoingMessage(null, MediaKind.AUDIO, bytes, mimetype, null, null, null);
    }

    public static OutgoingMessage reaction(String emoji, MessageKey key) {
        return new OutgoingMessage(null, null, null, null, null, emoji, key);
    }

    public OutgoingMessage withReaction(String emoji, MessageKey key) {
        return new OutgoingMessage(text, mediaKind, media, mimetype, caption, emoji, key);
    }

    public boolean isReaction() {
        return reactionEmoji != null && text == null && mediaKind == null;
    }
}
