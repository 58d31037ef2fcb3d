package com.clapgrow.fleet.session.store;

import java.util.Arrays;
import java.util.Optional;

/**
 * Keys a tenant may override through the configuration-update flow.
 */
public enum TenantConfigKey {
    AUTO_VIEW_STATUS(Kind.FLAG),
    AUTO_LIKE_STATUS(Kind.FLAG),
    AUTO_LIKE_EMOJI(Kind.EMOJI_LIST),
    AUTO_STATUS_REPLY(Kind.FLAG),
    AUTO_STATUS_MSG(Kind.TEXT),
    READ_MESSAGE(Kind.FLAG),
    AUTO_TYPING(Kind.FLAG),
    AUTO_RECORDING(Kind.FLAG),
    ANTI_CALL(Kind.FLAG),
    REJECT_MSG(Kind.TEXT),
    ANTI_DELETE(Kind.FLAG);

    public enum Kind { FLAG, TEXT, EMOJI_LIST }

    private final Kind kind;

    TenantConfigKey(Kind kind) {
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public static Optional<TenantConfigKey> fromKey(String key) {
        return Arrays.stream(values())
            .filter(k -> k.name().equals(key))
            .findFirst();
    }
}
