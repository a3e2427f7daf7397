package com.watcherbridge.common.infra;

/**
 * Exponential backoff computation.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * Backoff policy configuration.
     *
     * @param initialMs delay for attempt 1, also the floor
     * @param maxMs     ceiling
     * @param factor    multiplicative factor per attempt
     */
    public record Policy(long initialMs, long maxMs, double factor) {

        /** Device reconnect: 1s floor, doubling, 60s ceiling. */
        public static final Policy DEVICE_RECONNECT = new Policy(1_000, 60_000, 2.0);
    }

    /**
     * Compute the backoff delay for a given attempt.
     *
     * @param policy  backoff policy
     * @param attempt 1-based attempt number; values below 1 yield the floor
     * @return delay in milliseconds, capped at {@code policy.maxMs}
     */
    public static long compute(Policy policy, int attempt) {
        double base = policy.initialMs * Math.pow(policy.factor, Math.max(attempt - 1, 0));
        return Math.min(policy.maxMs, Math.round(base));
    }
}
