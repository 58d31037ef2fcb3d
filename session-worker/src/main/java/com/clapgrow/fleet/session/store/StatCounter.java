package com.clapgrow.fleet.session.store;

public enum StatCounter {
    COMMANDS_USED,
    MESSAGES_RECEIVED,
    GROUPS_INTERACTED
}
