package com.clapgrow.fleet.session.dispatch;

import com.clapgrow.fleet.common.jid.Jids;
import com.clapgrow.fleet.common.message.MessageContent;
import com.clapgrow.fleet.common.protocol.GroupMetadata;
import com.clapgrow.fleet.common.protocol.event.InboundMessage;
import com.clapgrow.fleet.common.protocol.event.MessageKey;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.config.FleetProperties;
import com.clapgrow.fleet.session.session.SessionHandle;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
@Slf4j
public class MessageContextFactory {

    private final FleetProperties fleetProperties;

    public MessageContext create(SessionHandle handle, InboundMessage message) {
        MessageKey key = message.key();
        JsonNode content = message.message();
        String from = key.remoteJid();

        String contentType = MessageContent.contentType(content).orElse("");
        String body = MessageContent.body(content);
        if (body.isEmpty()) {
            body = MessageContent.caption(content).orElse("");
        }

        String prefix = fleetProperties.getCommandPrefix();
        boolean isCmd = !prefix.isEmpty() && body.startsWith(prefix);
        String command = isCmd ? firstWord(body.substring(prefix.length())).toLowerCase() : "";
        List<String> args = arguments(body);
        String q = String.join(" ", args);

        boolean isGroup = Jids.isGroup(from);
        String selfJid = handle.selfJid();
        String botNumber = Jids.userPart(selfJid);
        String botJid = Jids.normalizeUser(selfJid);

        String sender;
        if (key.fromMe()) {
            sender = Jids.userJid(botNumber);
        } else {
            sender = key.participant() != null ? key.participant() : from;
        }
        String senderNumber = Jids.userPart(sender);
        String pushName = message.pushName() != null ? message.pushName() : "User";
        boolean isMe = botNumber.equals(senderNumber);
        boolean isOwner = isMe || owners().contains(senderNumber);

        GroupLookup group = isGroup ? lookupGroup(handle, from) : GroupLookup.notAGroup();
        List<String> admins = group.admins().stream().map(Jids::normalizeUser).toList();

        return new MessageContext(
            from,
            contentType,
            body,
            isCmd,
            command,
            args,
            q,
            isGroup,
            sender,
            senderNumber,
            botNumber,
            botJid,
            pushName,
            isMe,
            isOwner,
            MessageContent.quoted(content),
            MessageContent.quotedText(content),
            group,
            admins.contains(Jids.normalizeUser(sender)),
            admins.contains(botJid));
    }

    private GroupLookup lookupGroup(SessionHandle handle, String groupJid) {
        try {
            GroupMetadata metadata = handle.client().groupMetadata(groupJid);
            return metadata == null ? GroupLookup.failed("no metadata returned") : GroupLookup.found(metadata);
        } catch (RuntimeException e) {
            log.debug("Group metadata lookup failed for {} on tenant {}: {}", groupJid, handle.tenant(), e.getMessage());
            return GroupLookup.failed(e.getMessage());
        }
    }

    private Set<String> owners() {
        return Arrays.stream(fleetProperties.getOwnerNumber().split(","))
            .map(TenantId::sanitize)
            .filter(number -> !number.isEmpty())
            .collect(Collectors.toSet());
    }

    private static String firstWord(String text) {
        String trimmed = text.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }

    private static List<String> arguments(String body) {
        String trimmed = body.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        String[] words = trimmed.split(" +");
        return Arrays.asList(words).subList(1, words.length);
    }
}
