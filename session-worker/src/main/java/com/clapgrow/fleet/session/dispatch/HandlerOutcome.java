package com.clapgrow.fleet.session.dispatch;

/**
 * Result of invoking one handler. Failures are returned, not thrown, so one
 * failing handler never stops the rest of the pipeline.
 */
public record HandlerOutcome(String unit, boolean success, RuntimeException failure) {

    public static HandlerOutcome invoke(String unit, Runnable handler) {
        try {
            handler.run();
            return new HandlerOutcome(unit, true, null);
        } catch (RuntimeException e) {
            return new HandlerOutcome(unit, false, e);
        }
    }
}
