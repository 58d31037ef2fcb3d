package com.clapgrow.fleet.session.session;

/**
 * Receiver of a connect attempt's outcome. Only the first response counts.
 */
public interface ConnectResultSink {

    /**
     * @return true if this was the first response
     */
    boolean respond(ConnectResult result);

    boolean hasResponded();

    /**
     * Sink for background connects whose outcome nobody waits for.
     */
    static ConnectResultSink discard() {
        return new ConnectResultSink() {
            @Override
            public boolean respond(ConnectResult result) {
                return false;
            }

            @Override
            public boolean hasResponded() {
                return false;
            }
        };
    }
}
