package com.clapgrow.fleet.session.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Normalized view of one inbound message, handed to every handler.
 * 
 * @param from Chat JID the message arrived in
 * @param contentType Content type key (e.g. imageMessage)
 * @param body Text or media caption
 * @param isCmd Body starts with the command prefix
 * @param command Lower-cased first word after the prefix (empty when not a command)
 * @param args Words after the first one
 * @param q Arguments joined by a single space
 * @param isGroup Chat is a group
 * @param sender Author JID
 * @param senderNumber Author user part
 * @param botNumber User part of the session's own account
 * @param botJid Normalized JID of the session's own account
 * @param pushName Display name of the author
 * @param isMe Author is the session's own account
 * @param isOwner Author is a configured owner or the session itself
 * @param quoted Message the body replies to
 * @param quotedText Text of the quoted message
 * @param group Group metadata lookup result
 * @param isAdmins Author is a group admin
 * @param isBotAdmins Session account is a group admin
 */
public record MessageContext(
    String from,
    String contentType,
    String body,
    boolean isCmd,
    String command,
    List<String> args,
    String q,
    boolean isGroup,
    String sender,
    String senderNumber,
    String botNumber,
    String botJid,
    String pushName,
    boolean isMe,
    boolean isOwner,
    Optional<JsonNode> quoted,
    Optional<String> quotedText,
    GroupLookup group,
    boolean isAdmins,
    boolean isBotAdmins
) {

    public MessageContext {
        args = args == null ? List.of() : List.copyOf(args);
        quoted = quoted == null ? Optional.empty() : quoted;
        quotedText = quotedText == null ? Optional.empty() : quotedText;
        group = group == null ? GroupLookup.notAGroup() : group;
    }
}
