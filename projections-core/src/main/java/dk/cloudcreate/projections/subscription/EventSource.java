package dk.cloudcreate.projections.subscription;

import dk.cloudcreate.projections.Transaction;
import dk.cloudcreate.projections.common.types.SubscriptionId;

import java.util.Optional;

/**
 * A source of {@link Transaction}'s ordered by their checkpoint.
 */
public interface EventSource {
    /**
     * Subscribe to all transactions with a checkpoint after <code>lastProcessedCheckpoint</code>.<br>
     * Every subscription is served by its own worker, so a slow subscriber never delays other subscriptions.
     *
     * @param lastProcessedCheckpoint the checkpoint of the last transaction the subscriber has processed. If empty the subscription
     *                                starts from the first transaction in the source
     * @param subscriber              the subscriber that will receive the transactions
     * @param subscriptionId          the id of the subscription (used for logging and diagnostics)
     * @return the subscription. Closing it stops delivery of transactions to the subscriber
     */
    Subscription subscribe(Optional<Long> lastProcessedCheckpoint, TransactionSubscriber subscriber, SubscriptionId subscriptionId);

    /**
     * Subscribe using a random {@link SubscriptionId}
     *
     * @see #subscribe(Optional, TransactionSubscriber, SubscriptionId)
     */
    default Subscription subscribe(Optional<Long> lastProcessedCheckpoint, TransactionSubscriber subscriber) {
        return subscribe(lastProcessedCheckpoint, subscriber, SubscriptionId.random());
    }
}
