package dk.cloudcreate.projections.dispatching;

import java.time.Duration;
import java.util.function.Predicate;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * {@link ShouldRetry} with a bounded number of retries and a backoff between the retries.<br>
 * Only exceptions accepted by the {@link #retryableExceptions} predicate are retried, e.g. transient storage failures.
 */
public class BatchRetryPolicy implements ShouldRetry {
    public final Duration                       initialRetryDelay;
    public final Duration                       followupRetryDelay;
    public final double                         followupRetryDelayMultiplier;
    public final Duration                       followupRetryDelayIncrement;
    public final Duration                       maximumFollowupRetryDelay;
    public final int                            maximumNumberOfRetries;
    public final Predicate<? super Exception>   retryableExceptions;

    public BatchRetryPolicy(Duration initialRetryDelay,
                            Duration followupRetryDelay,
                            double followupRetryDelayMultiplier,
                            Duration maximumFollowupRetryDelay,
                            int maximumNumberOfRetries,
                            Predicate<? super Exception> retryableExceptions) {
        this(initialRetryDelay,
             followupRetryDelay,
             followupRetryDelayMultiplier,
             Duration.ZERO,
             maximumFollowupRetryDelay,
             maximumNumberOfRetries,
             retryableExceptions);
    }

    /**
     * @param followupRetryDelayIncrement added to the followup delay for every previous followup
     */
    public BatchRetryPolicy(Duration initialRetryDelay,
                            Duration followupRetryDelay,
                            double followupRetryDelayMultiplier,
                            Duration followupRetryDelayIncrement,
                            Duration maximumFollowupRetryDelay,
                            int maximumNumberOfRetries,
                            Predicate<? super Exception> retryableExceptions) {
        this.initialRetryDelay = requireNonNull(initialRetryDelay, "You must specify an initialRetryDelay");
        this.followupRetryDelay = requireNonNull(followupRetryDelay, "You must specify a followupRetryDelay");
        requireTrue(followupRetryDelayMultiplier >= 1.0d, "followupRetryDelayMultiplier must be 1.0 or larger");
        this.followupRetryDelayMultiplier = followupRetryDelayMultiplier;
        this.followupRetryDelayIncrement = requireNonNull(followupRetryDelayIncrement, "You must specify a followupRetryDelayIncrement");
        requireTrue(!followupRetryDelayIncrement.isNegative(), "followupRetryDelayIncrement must not be negative");
        this.maximumFollowupRetryDelay = requireNonNull(maximumFollowupRetryDelay, "You must specify a maximumFollowupRetryDelay");
        requireTrue(maximumNumberOfRetries >= 0, "maximumNumberOfRetries must be 0 or larger");
        this.maximumNumberOfRetries = maximumNumberOfRetries;
        this.retryableExceptions = requireNonNull(retryableExceptions, "You must specify the retryableExceptions predicate");
    }

    @Override
    public boolean shouldRetry(Exception exception, int attempts) {
        return attempts <= maximumNumberOfRetries && retryableExceptions.test(exception);
    }

    /**
     * The delay before the first retry is the {@link #initialRetryDelay}. Subsequent retries wait
     * {@link #followupRetryDelay} multiplied by {@link #followupRetryDelayMultiplier} and increased by
     * {@link #followupRetryDelayIncrement} for every previous followup, capped at {@link #maximumFollowupRetryDelay}
     */
    @Override
    public Duration retryDelay(int attempts) {
        requireTrue(attempts >= 1, "attempts must be 1 or larger");
        if (attempts == 1) {
            return initialRetryDelay;
        }
        var previousFollowups = attempts - 2;
        var calculatedDelay = Duration.ofMillis((long) (followupRetryDelay.toMillis() * Math.pow(followupRetryDelayMultiplier, previousFollowups)))
                                      .plus(followupRetryDelayIncrement.multipliedBy(previousFollowups));
        if (calculatedDelay.compareTo(maximumFollowupRetryDelay) >= 0) {
            return maximumFollowupRetryDelay;
        }
        return calculatedDelay;
    }

    public static BatchRetryPolicy none() {
        return fixedBackoff(Duration.ZERO, 0);
    }

    public static BatchRetryPolicy fixedBackoff(Duration retryDelay,
                                                int maximumNumberOfRetries) {
        return new BatchRetryPolicy(retryDelay,
                                    retryDelay,
                                    1.0d,
                                    retryDelay,
                                    maximumNumberOfRetries,
                                    exception -> true);
    }

    /**
     * Retry after <code>retryDelay</code>, then after twice the <code>retryDelay</code>, three times the <code>retryDelay</code> and so on,
     * capped at <code>maximumFollowupRetryDelay</code>
     */
    public static BatchRetryPolicy linearBackoff(Duration retryDelay,
                                                 Duration maximumFollowupRetryDelay,
                                                 int maximumNumberOfRetries) {
        requireNonNull(retryDelay, "You must specify a retryDelay");
        return new BatchRetryPolicy(retryDelay,
                                    retryDelay.multipliedBy(2),
                                    1.0d,
                                    retryDelay,
                                    maximumFollowupRetryDelay,
                                    maximumNumberOfRetries,
                                    exception -> true);
    }

    public static BatchRetryPolicy exponentialBackoff(Duration initialRetryDelay,
                                                      Duration followupRetryDelay,
                                                      double followupRetryDelayMultiplier,
                                                      Duration maximumFollowupRetryDelay,
                                                      int maximumNumberOfRetries) {
        return new BatchRetryPolicy(initialRetryDelay,
                                    followupRetryDelay,
                                    followupRetryDelayMultiplier,
                                    maximumFollowupRetryDelay,
                                    maximumNumberOfRetries,
                                    exception -> true);
    }

    /**
     * Create a copy of this policy that only retries the exceptions accepted by <code>retryableExceptions</code>
     */
    public BatchRetryPolicy retryingOnly(Predicate<? super Exception> retryableExceptions) {
        return new BatchRetryPolicy(initialRetryDelay,
                                    followupRetryDelay,
                                    followupRetryDelayMultiplier,
                                    followupRetryDelayIncrement,
                                    maximumFollowupRetryDelay,
                                    maximumNumberOfRetries,
                                    retryableExceptions);
    }

    @Override
    public String toString() {
        return "BatchRetryPolicy{" +
                "initialRetryDelay=" + initialRetryDelay +
                ", followupRetryDelay=" + followupRetryDelay +
                ", followupRetryDelayMultiplier=" + followupRetryDelayMultiplier +
                ", followupRetryDelayIncrement=" + followupRetryDelayIncrement +
                ", maximumFollowupRetryDelay=" + maximumFollowupRetryDelay +
                ", maximumNumberOfRetries=" + maximumNumberOfRetries +
                '}';
    }
}
