package tech.yump.reconciler.retry;

import java.time.Duration;

/**
 * Exponential backoff with proportional jitter, bounded by an attempt cap and an absolute deadline.
 *
 * @param maxAttempts  total attempts including the first one
 * @param initialDelay delay before the second attempt
 * @param maxDelay     upper bound for any single delay, before jitter
 * @param multiplier   growth factor between consecutive delays
 * @param jitter       fraction (0..1) by which a delay is randomly shortened or lengthened
 * @param deadline     total time budget measured from the first attempt
 */
public record BackoffPolicy(
        int maxAttempts,
        Duration initialDelay,
        Duration maxDelay,
        double multiplier,
        double jitter,
        Duration deadline
) {

    public BackoffPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be between 0.0 and 1.0");
        }
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     *
     * @param failedAttempt the attempt that just failed
     * @param random        a sample in [0, 1) used to spread the jitter
     */
    public Duration delayAfter(int failedAttempt, double random) {
        double base = initialDelay.toMillis() * Math.pow(multiplier, failedAttempt - 1);
        double capped = Math.min(base, maxDelay.toMillis());
        double spread = capped * jitter * (2.0 * random - 1.0);
        return Duration.ofMillis(Math.max(0L, Math.round(capped + spread)));
    }
}
