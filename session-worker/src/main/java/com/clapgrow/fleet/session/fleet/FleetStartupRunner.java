package com.clapgrow.fleet.session.fleet;

import com.clapgrow.fleet.session.config.FleetProperties;
import com.clapgrow.fleet.session.session.LocalCredentialCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Discards the local credential cache and reconnects the roster once the application is ready.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FleetStartupRunner {

    private final FleetService fleetService;
    private final LocalCredentialCache localCache;
    private final FleetProperties fleetProperties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        try {
            localCache.purgeAll();
        } catch (RuntimeException e) {
            log.warn("Failed to purge local credential cache at startup: {}", e.getMessage());
        }

        FleetProperties.Bulk bulk = fleetProperties.getBulk();
        if (!bulk.isAutoConnectOnStartup()) {
            log.info("Automatic reconnect on startup is disabled");
            return;
        }
        log.info("Reconnecting known tenants in {} ms", bulk.getStartupDelayMs());
        taskScheduler.schedule(this::connectAll, clock.instant().plusMillis(bulk.getStartupDelayMs()));
    }

    void connectAll() {
        try {
            ConnectAllReport report = fleetService.connectAll(fleetProperties.getBulk().getStartupSpacingMs());
            log.info("Startup reconnect: {} tenant(s), {} already active", report.total(), report.skipped());
        } catch (RuntimeException e) {
            log.error("Startup reconnect failed: {}", e.getMessage(), e);
        }
    }
}
