package dk.cloudcreate.projections.dispatching;

import dk.cloudcreate.projections.Transaction;
import dk.cloudcreate.projections.subscription.SubscriptionInfo;

import java.util.List;

/**
 * Handles the transactions a {@link Dispatcher} subscription delivers. Any exception thrown is subject to the
 * subscription's {@link ShouldRetry} policy
 */
@FunctionalInterface
public interface TransactionHandler {
    void handle(List<Transaction> transactions, SubscriptionInfo info) throws Exception;
}
