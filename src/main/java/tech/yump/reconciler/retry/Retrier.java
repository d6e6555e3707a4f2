package tech.yump.reconciler.retry;

import lombok.extern.slf4j.Slf4j;
import tech.yump.reconciler.core.ReconcilerException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;

/**
 * Runs an operation under a {@link BackoffPolicy}. Replaces fixed-sleep polling loops.
 */
@Slf4j
public class Retrier {

    private final BackoffPolicy policy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final DoubleSupplier random;

    public Retrier(BackoffPolicy policy, Sleeper sleeper, Clock clock) {
        this(policy, sleeper, clock, () -> ThreadLocalRandom.current().nextDouble());
    }

    public Retrier(BackoffPolicy policy, Sleeper sleeper, Clock clock, DoubleSupplier random) {
        this.policy = policy;
        this.sleeper = sleeper;
        this.clock = clock;
        this.random = random;
    }

    public BackoffPolicy policy() {
        return policy;
    }

    /**
     * Runs the operation, retrying failures accepted by {@code retryable} while attempts and time remain.
     * The last failure is rethrown unchanged once the budget is spent; other failures propagate at once.
     */
    public <T> T call(String description, RetryableOperation<T> operation, Predicate<RuntimeException> retryable) {
        Instant deadline = clock.instant().plus(policy.deadline());
        int attempt = 1;
        while (true) {
            try {
                return operation.run();
            } catch (RuntimeException e) {
                if (!retryable.test(e)) {
                    throw e;
                }
                Duration delay = policy.delayAfter(attempt, random.getAsDouble());
                boolean attemptsLeft = attempt < policy.maxAttempts();
                boolean timeLeft = clock.instant().plus(delay).isBefore(deadline);
                if (!attemptsLeft || !timeLeft) {
                    log.warn("Giving up on {} after {} attempt(s)", description, attempt);
                    throw e;
                }
                log.debug("Attempt {}/{} of {} failed ({}), retrying in {} ms",
                        attempt, policy.maxAttempts(), description, e.getClass().getSimpleName(), delay.toMillis());
                pause(description, delay);
                attempt++;
            }
        }
    }

    /**
     * Polls {@code condition} with backoff until it holds or the budget is spent.
     *
     * @return whether the condition held before giving up
     */
    public boolean await(String description, BooleanSupplier condition) {
        try {
            return call(description, () -> {
                if (!condition.getAsBoolean()) {
                    throw new NotReadyException();
                }
                return Boolean.TRUE;
            }, NotReadyException.class::isInstance);
        } catch (NotReadyException e) {
            return false;
        }
    }

    private void pause(String description, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ReconcilerException("Interrupted while retrying " + description, ie);
        }
    }

    private static final class NotReadyException extends RuntimeException {
        NotReadyException() {
            super(null, null, false, false);
        }
    }
}
