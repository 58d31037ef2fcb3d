package com.clapgrow.fleet.common.message;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Optional;
import java.util.Set;

/**
 * Helpers over the raw message content tree delivered by the protocol client.
 * 
 * Content is a JSON object with exactly one meaningful key naming its type
 * (e.g. {@code conversation}, {@code extendedTextMessage}, {@code imageMessage}),
 * possibly accompanied by protocol bookkeeping keys that are skipped here.
 */
public final class MessageContent {

    public static final String CONVERSATION = "conversation";
    public static final String EXTENDED_TEXT = "extendedTextMessage";
    public static final String EPHEMERAL = "ephemeralMessage";
    public static final String IMAGE = "imageMessage";
    public static final String VIDEO = "videoMessage";
    public static final String AUDIO = "audioMessage";
    public static final String STICKER = "stickerMessage";

    private static final Set<String> BOOKKEEPING_KEYS = Set.of(
        "messageContextInfo", "senderKeyDistributionMessage");

    private MessageContent() {
        // Utility class - prevent instantiation
    }

    /**
     * Content type key of a message, ignoring protocol bookkeeping keys.
     * 
     * @param message Message content node (may be null)
     * @return Content type, or empty if the node carries no content
     */
    public static Optional<String> contentType(JsonNode message) {
        if (message == null || !message.isObject()) {
            return Optional.empty();
        }
        Iterator<String> names = message.fieldNames();
        String fallback = null;
        while (names.hasNext()) {
            String name = names.next();
            if (!BOOKKEEPING_KEYS.contains(name)) {
                return Optional.of(name);
            }
            if (fallback == null) {
                fallback = name;
            }
        }
        return Optional.ofNullable(fallback);
    }

    /**
     * Remove one layer of ephemeral-message envelope; non-ephemeral content is returned unchanged.
     */
    public static JsonNode unwrapEphemeral(JsonNode message) {
        if (message == null) {
            return null;
        }
        if (contentType(message).filter(EPHEMERAL::equals).isPresent()) {
            JsonNode inner = message.path(EPHEMERAL).path("message");
            if (!inner.isMissingNode() && !inner.isNull()) {
                return inner;
            }
        }
        return message;
    }

    /**
     * Plain text body of a text message; empty string for any other content type.
     */
    public static String body(JsonNode message) {
        String type = contentType(message).orElse("");
        if (CONVERSATION.equals(type)) {
            return message.path(CONVERSATION).asText("");
        }
        if (EXTENDED_TEXT.equals(type)) {
            return message.path(EXTENDED_TEXT).path("text").asText("");
        }
        return "";
    }

    /**
     * Caption of an image or video message, if any.
     */
    public static Optional<String> caption(JsonNode message) {
        String type = contentType(message).orElse("");
        if (IMAGE.equals(type) || VIDEO.equals(type)) {
            String caption = message.path(type).path("caption").asText("");
            return caption.isEmpty() ? Optional.empty() : Optional.of(caption);
        }
        return Optional.empty();
    }

    /**
     * Message quoted by an extended-text reply, if any.
     */
    public static Optional<JsonNode> quoted(JsonNode message) {
        if (!contentType(message).filter(EXTENDED_TEXT::equals).isPresent()) {
            return Optional.empty();
        }
        JsonNode quoted = message.path(EXTENDED_TEXT).path("contextInfo").path("quotedMessage");
        if (quoted.isMissingNode() || quoted.isNull() || quoted.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(quoted);
    }

    /**
     * Text carried by a quoted message (plain, extended or media caption).
     */
    public static Optional<String> quotedText(JsonNode message) {
        return quoted(message).flatMap(quoted -> {
            String text = body(quoted);
            if (!text.isEmpty()) {
                return Optional.of(text);
            }
            return caption(quoted);
        });
    }
}
