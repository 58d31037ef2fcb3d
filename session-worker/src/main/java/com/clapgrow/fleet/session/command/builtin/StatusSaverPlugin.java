package com.clapgrow.fleet.session.command.builtin;

import com.clapgrow.fleet.common.message.MessageContent;
import com.clapgrow.fleet.common.protocol.OutgoingMessage;
import com.clapgrow.fleet.session.command.CommandDescriptor;
import com.clapgrow.fleet.session.command.CommandInvocation;
import com.clapgrow.fleet.session.command.CommandPlugin;
import com.clapgrow.fleet.session.command.CommandTrigger;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Replying "send" (no prefix) to a status re-sends its media or text to the chat.
 */
@Component
public class StatusSaverPlugin implements CommandPlugin {

    static final Set<String> KEYWORDS = Set.of("send", "sendme", "sand");
    static final String NO_QUOTE_REPLY = "*🎐 Please reply to a status!*";

    @Override
    public List<CommandDescriptor> commands() {
        return List.of(CommandDescriptor.on(CommandTrigger.BODY, "status-saver",
            "Reply 'send' to a status to receive it", this::save));
    }

    void save(CommandInvocation invocation) {
        String keyword = invocation.context().body().trim().toLowerCase();
        if (!KEYWORDS.contains(keyword)) {
            return;
        }
        Optional<JsonNode> quoted = invocation.context().quoted();
        if (quoted.isEmpty()) {
            invocation.reply(NO_QUOTE_REPLY);
            return;
        }
        JsonNode content = quoted.get();
        String type = MessageContent.contentType(content).orElse("");
        JsonNode media = content.path(type);
        OutgoingMessage outgoing = switch (type) {
            case MessageContent.IMAGE -> OutgoingMessage.image(download(invocation, media, "image"), captionOf(media));
            case MessageContent.VIDEO -> OutgoingMessage.video(download(invocation, media, "video"), captionOf(media));
            case MessageContent.AUDIO -> OutgoingMessage.audio(download(invocation, media, "audio"), "audio/mp4");
            default -> OutgoingMessage.text(MessageContent.body(content));
        };
        invocation.client().sendMessage(invocation.context().from(), outgoing, invocation.message().toQuotedNode());
    }

    private static byte[] download(CommandInvocation invocation, JsonNode media, String mediaType) {
        return invocation.client().downloadMedia(media, mediaType);
    }

    private static String captionOf(JsonNode media) {
        String caption = media.path("caption").asText("");
        return caption.isEmpty() ? null : caption;
    }
}
