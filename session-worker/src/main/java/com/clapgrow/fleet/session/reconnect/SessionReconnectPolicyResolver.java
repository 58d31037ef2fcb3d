package com.clapgrow.fleet.session.reconnect;

import com.clapgrow.fleet.common.retry.DisconnectClassification;
import com.clapgrow.fleet.common.retry.ReconnectPolicyResolver;
import com.clapgrow.fleet.session.config.FleetProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SessionReconnectPolicyResolver implements ReconnectPolicyResolver {

    private final FleetProperties fleetProperties;

    @Override
    public ReconnectPolicy resolve(DisconnectClassification classification) {
        return switch (classification) {
            case MANUAL_UNLINK -> ReconnectPolicy.purge();
            case EXPECTED_CLOSURE -> ReconnectPolicy.noRetry();
            case TRANSIENT -> ReconnectPolicy.fixedBackoff(
                fleetProperties.getReconnect().getBackoffMs(),
                fleetProperties.getReconnect().getMaxAttempts());
        };
    }
}
