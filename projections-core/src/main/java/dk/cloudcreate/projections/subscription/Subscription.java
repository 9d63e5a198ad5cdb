package dk.cloudcreate.projections.subscription;

import dk.cloudcreate.projections.common.types.SubscriptionId;

/**
 * Handle to an {@link EventSource} subscription
 */
public interface Subscription extends AutoCloseable {
    SubscriptionId subscriptionId();

    /**
     * @return true until the subscription is closed (either explicitly or because its worker failed)
     */
    boolean isActive();

    /**
     * Cancel the subscription. No transactions are delivered after this method returns.<br>
     * When called from any other thread than the subscription's own worker, the call blocks (for a bounded time) until the worker
     * has stopped. Closing an already closed subscription has no effect.
     */
    @Override
    void close();
}
