package com.clapgrow.fleet.session.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Static settings of the session fleet.
 * 
 * Maps to:
 * fleet:
 *   command-prefix: "."
 *   work-type: public
 *   reconnect:
 *     backoff-ms: 10000
 *     max-attempts: 3
 */
@Configuration
@ConfigurationProperties(prefix = "fleet")
@Validated
@Data
public class FleetProperties {

    /**
     * Prefix that marks a message as a command (".menu").
     */
    @NotBlank
    private String commandPrefix = ".";

    /**
     * Mode label shown in the welcome message.
     */
    private String mode = "public";

    /**
     * "public" lets anyone run commands; "private" restricts them to the owner and the session itself.
     */
    @Pattern(regexp = "(?i)public|private")
    private String workType = "public";

    /**
     * Owner number(s), comma separated, allowed to run commands in private mode.
     */
    private String ownerNumber = "";

    private String botName = "SESSION-FLEET";

    /**
     * Root of the disposable local credential cache.
     */
    private String sessionDir = "session";

    @Valid
    private Pairing pairing = new Pairing();
    @Valid
    private Reconnect reconnect = new Reconnect();
    @Valid
    private Bulk bulk = new Bulk();
    @Valid
    private Otp otp = new Otp();
    @Valid
    private Http http = new Http();
    @Valid
    private Broadcast broadcast = new Broadcast();
    @Valid
    private MessageCache messageCache = new MessageCache();

    public boolean isPrivateWorkType() {
        return "private".equalsIgnoreCase(workType);
    }

    @Data
    public static class Pairing {
        /**
         * Delay between socket creation and the pairing-code request.
         */
        private long codeDelayMs = 3000;
    }

    @Data
    public static class Reconnect {
        private long backoffMs = 10000;
        @Min(0)
        private int maxAttempts = 3;
    }

    @Data
    public static class Bulk {
        /**
         * Spacing between tenants for an on-demand connect-all.
         */
        private long spacingMs = 1000;
        /**
         * Spacing between tenants for the startup connect-all.
         */
        private long startupSpacingMs = 2000;
        private long startupDelayMs = 3000;
        private boolean autoConnectOnStartup = true;
    }

    @Data
    public static class Otp {
        @Min(1)
        private long validityMinutes = 5;
        /**
         * Wrong guesses allowed before the pending code is discarded.
         */
        @Min(1)
        private int maxAttempts = 5;
    }

    @Data
    public static class Http {
        /**
         * How long a connect request waits for the pairing code before answering "in progress".
         */
        private long connectWaitMs = 30000;
    }

    @Data
    public static class Broadcast {
        /**
         * Broadcast channels whose posts get an automatic reaction.
         */
        private List<String> channelJids = new ArrayList<>(List.of("120363421104812135@newsletter"));
        private List<String> emojis = new ArrayList<>(List.of("❤️", "👍", "😮", "😎", "💀", "💫", "🔥", "👑"));
    }

    @Data
    public static class MessageCache {
        private long maxSize = 5000;
        private long ttlMinutes = 60;
    }
}
