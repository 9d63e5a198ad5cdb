package dk.cloudcreate.projections.dispatching;

import dk.cloudcreate.projections.common.types.SubscriptionId;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Options for a {@link Dispatcher} subscription
 */
public final class SubscriptionOptions {
    public final SubscriptionId subscriptionId;
    /**
     * Restart the subscription from the beginning of the event source when the checkpoint the subscription starts from
     * is ahead of the event source
     */
    public final boolean        restartWhenAhead;
    /**
     * Called after the stale subscription has been closed and before the subscription is restarted from the beginning
     */
    public final Runnable       beforeRestarting;
    public final ShouldRetry    shouldRetry;

    private SubscriptionOptions(SubscriptionId subscriptionId,
                                boolean restartWhenAhead,
                                Runnable beforeRestarting,
                                ShouldRetry shouldRetry) {
        this.subscriptionId = requireNonNull(subscriptionId, "No subscriptionId provided");
        this.restartWhenAhead = restartWhenAhead;
        this.beforeRestarting = requireNonNull(beforeRestarting, "No beforeRestarting callback provided");
        this.shouldRetry = requireNonNull(shouldRetry, "No shouldRetry policy provided");
    }

    /**
     * Random subscription id, no restart when ahead and no retries
     */
    public static SubscriptionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "SubscriptionOptions{" +
                "subscriptionId=" + subscriptionId +
                ", restartWhenAhead=" + restartWhenAhead +
                ", shouldRetry=" + shouldRetry +
                '}';
    }

    public static final class Builder {
        private SubscriptionId subscriptionId;
        private boolean        restartWhenAhead;
        private Runnable       beforeRestarting = () -> {};
        private ShouldRetry    shouldRetry      = ShouldRetry.never();

        public Builder subscriptionId(SubscriptionId subscriptionId) {
            this.subscriptionId = subscriptionId;
            return this;
        }

        public Builder subscriptionId(CharSequence subscriptionId) {
            this.subscriptionId = SubscriptionId.of(subscriptionId);
            return this;
        }

        public Builder restartWhenAhead(boolean restartWhenAhead) {
            this.restartWhenAhead = restartWhenAhead;
            return this;
        }

        public Builder beforeRestarting(Runnable beforeRestarting) {
            this.beforeRestarting = beforeRestarting;
            return this;
        }

        public Builder shouldRetry(ShouldRetry shouldRetry) {
            this.shouldRetry = shouldRetry;
            return this;
        }

        public SubscriptionOptions build() {
            return new SubscriptionOptions(subscriptionId != null ? subscriptionId : SubscriptionId.random(),
                                           restartWhenAhead,
                                           beforeRestarting,
                                           shouldRetry);
        }
    }
}
