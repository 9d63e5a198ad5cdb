package dk.cloudcreate.projections.paging;

import dk.cloudcreate.projections.Transaction;

import java.util.*;

/**
 * Pull based access to an event store that can only return the transactions after a given checkpoint, one page at a time.
 * Calls may block and may be slow; the {@link PagingEventStoreAdapter} never calls {@link #loadTransactionsAfter(long, int)}
 * concurrently.
 */
public interface TransactionPageSource extends AutoCloseable {
    /**
     * @param checkpoint              load the transactions with a checkpoint after this checkpoint
     * @param maxNumberOfTransactions the maximum number of transactions to return
     * @return the transactions ordered by checkpoint. An empty list if there are no transactions after <code>checkpoint</code>
     */
    List<Transaction> loadTransactionsAfter(long checkpoint, int maxNumberOfTransactions);

    /**
     * The checkpoint of the last transaction in the store, if the store can tell
     */
    default Optional<Long> lastCheckpoint() {
        return Optional.empty();
    }

    /**
     * Release the connection to the store. Called when the {@link PagingEventStoreAdapter} is closed
     */
    @Override
    default void close() {
    }
}
