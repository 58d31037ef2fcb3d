package com.clapgrow.fleet.session.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Defaults for per-tenant automation flags. A tenant's stored overrides are
 * merged on top of these for every inbound event.
 * 
 * Maps to:
 * fleet:
 *   tenant-defaults:
 *     auto-view-status: true
 *     anti-call: false
 */
@Configuration
@ConfigurationProperties(prefix = "fleet.tenant-defaults")
@Data
public class TenantConfigDefaults {

    private boolean autoViewStatus = true;
    private boolean autoLikeStatus = true;
    private List<String> autoLikeEmojis = new ArrayList<>(
        List.of("❤️", "🌹", "😇", "💥", "🔥", "💫", "💎", "💙", "🌝", "💚"));
    private boolean autoStatusReply = false;
    private String autoStatusMessage = "Nice status! 🔥";
    private boolean readMessage = false;
    private boolean autoTyping = false;
    private boolean autoRecording = false;
    private boolean antiCall = false;
    private String rejectMessage = "*📞 Call rejected automatically. No calls allowed.*";
    private boolean antiDelete = false;
}
