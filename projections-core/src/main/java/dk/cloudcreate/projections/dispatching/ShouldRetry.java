package dk.cloudcreate.projections.dispatching;

import java.time.Duration;

/**
 * Decides whether a batch of transactions should be handed to a {@link TransactionHandler} again after the handler failed.
 */
@FunctionalInterface
public interface ShouldRetry {
    /**
     * @param exception the exception thrown by the handler
     * @param attempts  the number of failed attempts so far (1 after the first failure)
     * @return true if the batch should be retried, false if the failure is fatal
     */
    boolean shouldRetry(Exception exception, int attempts);

    /**
     * How long to wait before the given retry attempt
     *
     * @param attempts the number of failed attempts so far
     */
    default Duration retryDelay(int attempts) {
        return Duration.ZERO;
    }

    /**
     * Every failure is fatal
     */
    static ShouldRetry never() {
        return (exception, attempts) -> false;
    }
}
