package com.clapgrow.fleet.session.command;

import com.clapgrow.fleet.common.protocol.OutgoingMessage;
import com.clapgrow.fleet.common.protocol.ProtocolClient;
import com.clapgrow.fleet.common.protocol.event.InboundMessage;
import com.clapgrow.fleet.session.dispatch.MessageContext;
import com.clapgrow.fleet.session.session.SessionHandle;

/**
 * Everything a handler gets for one event.
 */
public record CommandInvocation(SessionHandle session, InboundMessage message, MessageContext context) {

    public ProtocolClient client() {
        return session.client();
    }

    /**
     * Send text to the chat the event came from, quoting the event.
     */
    public void reply(String text) {
        client().sendMessage(context.from(), OutgoingMessage.text(text), message.toQuotedNode());
    }

    public void react(String emoji) {
        client().sendMessage(context.from(), OutgoingMessage.reaction(emoji, message.key()));
    }
}
