package dk.cloudcreate.projections.subscription;

import dk.cloudcreate.projections.common.types.SubscriptionId;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Details about the {@link Subscription} that delivers transactions to a {@link TransactionSubscriber}
 */
public final class SubscriptionInfo {
    public final SubscriptionId subscriptionId;
    /**
     * The subscription delivering the transactions. A subscriber may close it to stop the delivery
     */
    public final Subscription   subscription;

    public SubscriptionInfo(SubscriptionId subscriptionId, Subscription subscription) {
        this.subscriptionId = requireNonNull(subscriptionId, "No subscriptionId provided");
        this.subscription = requireNonNull(subscription, "No subscription provided");
    }

    @Override
    public String toString() {
        return "SubscriptionInfo{" +
                "subscriptionId=" + subscriptionId +
                '}';
    }
}
