package com.clapgrow.fleet.common.retry;

/**
 * Resolves the reconnect policy for a disconnect classification.
 * 
 * Maps classifications to actions:
 * - MANUAL_UNLINK: Purge the tenant, no retry
 * - EXPECTED_CLOSURE: No retry, keep credentials
 * - TRANSIENT: Retry after a fixed backoff, bounded by an attempt budget
 * 
 * Keeps classification separate from the retry decision so either can change
 * without touching the other.
 */
public interface ReconnectPolicyResolver {

    /**
     * Resolve reconnect policy for a given disconnect classification.
     * 
     * @param classification Disconnect classification
     * @return Reconnect policy
     */
    ReconnectPolicy resolve(DisconnectClassification classification);

    /**
     * Reconnect policy.
     * 
     * @param shouldRetry Schedule a reconnect when the budget allows
     * @param backoffMs Fixed delay before the reconnect attempt
     * @param maxAttempts Attempts allowed before manual intervention is required
     * @param purgeCredentials Erase stored credentials and roster entry
     */
    record ReconnectPolicy(
        boolean shouldRetry,
        long backoffMs,
        int maxAttempts,
        boolean purgeCredentials
    ) {
        /**
         * Terminal teardown (logged out).
         */
        public static ReconnectPolicy purge() {
            return new ReconnectPolicy(false, 0, 0, true);
        }

        /**
         * Leave the tenant alone.
         */
        public static ReconnectPolicy noRetry() {
            return new ReconnectPolicy(false, 0, 0, false);
        }

        /**
         * Fixed-backoff retry.
         */
        public static ReconnectPolicy fixedBackoff(long backoffMs, int maxAttempts) {
            return new ReconnectPolicy(true, backoffMs, maxAttempts, false);
        }

        /**
         * Whether another attempt fits in the budget after {@code attemptsSoFar} attempts.
         */
        public boolean allowsAttempt(int attemptsSoFar) {
            return shouldRetry && attemptsSoFar < maxAttempts;
        }
    }
}
