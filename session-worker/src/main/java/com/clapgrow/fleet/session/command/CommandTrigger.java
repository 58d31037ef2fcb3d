package com.clapgrow.fleet.session.command;

/**
 * What makes a command descriptor fire.
 */
public enum CommandTrigger {
    /** Prefixed text whose first word equals the pattern or an alias */
    COMMAND,
    /** Any message with a non-empty body */
    BODY,
    /** Any reply quoting a message that carries text */
    TEXT,
    /** Any image message */
    IMAGE,
    /** Any sticker message */
    STICKER;

    public boolean isPassive() {
        return this != COMMAND;
    }
}
