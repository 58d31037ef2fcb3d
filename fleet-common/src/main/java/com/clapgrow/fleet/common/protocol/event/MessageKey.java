package com.clapgrow.fleet.common.protocol.event;

/**
 * Identity of one message.
 * 
 * @param remoteJid Chat the message belongs to
 * @param id Message id, unique within the chat
 * @param fromMe Sent by the session's own account
 * @param participant Author inside a group or status broadcast (null in direct chats)
 */
public record MessageKey(String remoteJid, String id, boolean fromMe, String participant) {
}
