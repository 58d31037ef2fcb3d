package com.clapgrow.fleet.session.fleet;

import java.util.List;

public record ConnectAllReport(int total, int skipped, List<TenantConnectOutcome> outcomes) {

    public ConnectAllReport {
        outcomes = List.copyOf(outcomes);
    }

    public boolean isEmpty() {
        return total == 0;
    }
}
