package dk.cloudcreate.projections.subscription;

import dk.cloudcreate.projections.Transaction;

import java.util.List;

/**
 * Receives the transactions of an {@link EventSource} subscription
 */
public interface TransactionSubscriber {
    /**
     * Handle a batch of transactions. The next batch isn't delivered until this method returns.
     *
     * @param transactions the transactions ordered by checkpoint
     * @param info         details about the subscription delivering the transactions
     */
    void handleTransactions(List<Transaction> transactions, SubscriptionInfo info);

    /**
     * Called (once, before any transactions are delivered) when the checkpoint the subscription was started from is ahead
     * of the last checkpoint known by the event source.<br>
     * The default implementation ignores the signal and the subscription will wait for the event source to catch up.
     *
     * @param info details about the subscription
     */
    default void noSuchCheckpoint(SubscriptionInfo info) {
    }
}
