package com.clapgrow.fleet.session.store;

import com.clapgrow.fleet.session.config.TenantConfigDefaults;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Effective automation settings of one tenant: stored overrides merged over the defaults.
 * Read fresh for every inbound event.
 */
public record TenantConfig(
    boolean autoViewStatus,
    boolean autoLikeStatus,
    List<String> autoLikeEmojis,
    boolean autoStatusReply,
    String autoStatusMessage,
    boolean readMessage,
    boolean autoTyping,
    boolean autoRecording,
    boolean antiCall,
    String rejectMessage,
    boolean antiDelete
) {

    public TenantConfig {
        autoLikeEmojis = autoLikeEmojis == null ? List.of() : List.copyOf(autoLikeEmojis);
    }

    public static TenantConfig defaults(TenantConfigDefaults defaults) {
        return new TenantConfig(
            defaults.isAutoViewStatus(),
            defaults.isAutoLikeStatus(),
            defaults.getAutoLikeEmojis(),
            defaults.isAutoStatusReply(),
            defaults.getAutoStatusMessage(),
            defaults.isReadMessage(),
            defaults.isAutoTyping(),
            defaults.isAutoRecording(),
            defaults.isAntiCall(),
            defaults.getRejectMessage(),
            defaults.isAntiDelete());
    }

    /**
     * Merge stored overrides (keyed by {@link TenantConfigKey} names) over the defaults.
     * Unknown keys and values of the wrong shape are ignored.
     */
    public static TenantConfig merge(TenantConfigDefaults defaults, JsonNode overrides) {
        TenantConfig base = defaults(defaults);
        if (overrides == null || !overrides.isObject()) {
            return base;
        }
        return new TenantConfig(
            flag(overrides, TenantConfigKey.AUTO_VIEW_STATUS, base.autoViewStatus),
            flag(overrides, TenantConfigKey.AUTO_LIKE_STATUS, base.autoLikeStatus),
            emojis(overrides, base.autoLikeEmojis),
            flag(overrides, TenantConfigKey.AUTO_STATUS_REPLY, base.autoStatusReply),
            text(overrides, TenantConfigKey.AUTO_STATUS_MSG, base.autoStatusMessage),
            flag(overrides, TenantConfigKey.READ_MESSAGE, base.readMessage),
            flag(overrides, TenantConfigKey.AUTO_TYPING, base.autoTyping),
            flag(overrides, TenantConfigKey.AUTO_RECORDING, base.autoRecording),
            flag(overrides, TenantConfigKey.ANTI_CALL, base.antiCall),
            text(overrides, TenantConfigKey.REJECT_MSG, base.rejectMessage),
            flag(overrides, TenantConfigKey.ANTI_DELETE, base.antiDelete));
    }

    // Flags arrive either as JSON booleans or as "true"/"false" strings
    private static boolean flag(JsonNode overrides, TenantConfigKey key, boolean fallback) {
        JsonNode value = overrides.get(key.name());
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            String text = value.textValue().trim();
            if ("true".equalsIgnoreCase(text)) {
                return true;
            }
            if ("false".equalsIgnoreCase(text)) {
                return false;
            }
        }
        return fallback;
    }

    private static String text(JsonNode overrides, TenantConfigKey key, String fallback) {
        JsonNode value = overrides.get(key.name());
        if (value == null || !value.isTextual() || value.textValue().isBlank()) {
            return fallback;
        }
        return value.textValue();
    }

    private static List<String> emojis(JsonNode overrides, List<String> fallback) {
        JsonNode value = overrides.get(TenantConfigKey.AUTO_LIKE_EMOJI.name());
        if (value == null || !value.isArray() || value.isEmpty()) {
            return fallback;
        }
        List<String> result = new ArrayList<>();
        value.forEach(node -> {
            if (node.isTextual() && !node.textValue().isBlank()) {
                result.add(node.textValue());
            }
        });
        return result.isEmpty() ? fallback : result;
    }
}
