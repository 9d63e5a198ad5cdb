package dk.cloudcreate.projections.inmemory;

import dk.cloudcreate.projections.*;
import dk.cloudcreate.projections.common.types.SubscriptionId;
import dk.cloudcreate.projections.subscription.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventSource} that keeps its transactions in memory. Intended for tests and for projections that are rebuilt on startup.
 * <p>
 * Transactions written without a checkpoint get the next checkpoint after the last written checkpoint. Transactions written
 * with an explicit checkpoint are kept as is (duplicates included) and move the last checkpoint to theirs.
 * <p>
 * Every subscription has its own worker thread that delivers the history in batches of at most <code>batchSize</code>
 * transactions and then waits for new transactions to be written.
 */
public class MemoryEventSource implements EventSource {
    private static final Logger log = LoggerFactory.getLogger(MemoryEventSource.class);

    public static final int DEFAULT_BATCH_SIZE = 10;

    private final int                     batchSize;
    private final Object                  lock          = new Object();
    private final List<Transaction>       history       = new ArrayList<>();
    private final Set<MemorySubscription> subscriptions = ConcurrentHashMap.newKeySet();

    private long                    lastCheckpoint;
    private CompletableFuture<Void> newTransactions = new CompletableFuture<>();

    public MemoryEventSource() {
        this(DEFAULT_BATCH_SIZE);
    }

    public MemoryEventSource(int batchSize) {
        requireTrue(batchSize > 0, msg("batchSize must be larger than 0 but was {}", batchSize));
        this.batchSize = batchSize;
    }

    /**
     * Write a single transaction containing the <code>events</code>
     *
     * @return the written transaction with its assigned checkpoint
     */
    public Transaction write(Object... events) {
        requireNonNull(events, "No events provided");
        var builder = Transaction.builder();
        for (var event : events) {
            builder.event(event);
        }
        return append(List.of(builder.build()), true).get(0);
    }

    /**
     * Write a single transaction containing one event with the given <code>headers</code>
     *
     * @return the written transaction with its assigned checkpoint
     */
    public Transaction writeWithHeaders(Object event, Map<String, Object> headers) {
        requireNonNull(event, "No event provided");
        requireNonNull(headers, "No headers provided");
        return append(List.of(Transaction.builder().event(event, headers).build()), true).get(0);
    }

    public List<Transaction> write(Transaction... transactions) {
        requireNonNull(transactions, "No transactions provided");
        return write(List.of(transactions));
    }

    /**
     * Append the transactions to the history and wake up the subscriptions waiting for new transactions
     *
     * @return the written transactions with their assigned checkpoints
     */
    public List<Transaction> write(List<Transaction> transactions) {
        requireNonNull(transactions, "No transactions provided");
        return append(transactions, false);
    }

    @Override
    public Subscription subscribe(Optional<Long> lastProcessedCheckpoint, TransactionSubscriber subscriber, SubscriptionId subscriptionId) {
        requireNonNull(lastProcessedCheckpoint, "No lastProcessedCheckpoint provided");
        requireNonNull(subscriber, "No subscriber provided");
        requireNonNull(subscriptionId, "No subscriptionId provided");
        var subscription = new MemorySubscription(this, lastProcessedCheckpoint, batchSize, subscriber, subscriptionId);
        subscriptions.add(subscription);
        subscription.start();
        return subscription;
    }

    /**
     * @return true if an active subscription with the given id exists
     */
    public boolean hasSubscriptionForId(SubscriptionId subscriptionId) {
        return subscriptions.stream().anyMatch(subscription -> subscription.subscriptionId().equals(subscriptionId) && subscription.isActive());
    }

    public long getLastCheckpoint() {
        synchronized (lock) {
            return lastCheckpoint;
        }
    }

    public List<Transaction> getHistory() {
        synchronized (lock) {
            return List.copyOf(history);
        }
    }

    // ------------------------------------------------------------------------------------------------------------------

    boolean isAhead(long checkpoint) {
        synchronized (lock) {
            return checkpoint > lastCheckpoint;
        }
    }

    /**
     * @return up to <code>maxNumberOfTransactions</code> transactions starting at position <code>index</code> in the history
     */
    List<Transaction> batchFrom(int index, int maxNumberOfTransactions) {
        synchronized (lock) {
            if (index >= history.size()) {
                return List.of();
            }
            return List.copyOf(history.subList(index, Math.min(history.size(), index + maxNumberOfTransactions)));
        }
    }

    /**
     * @return a future that completes when the history holds more than <code>knownNumberOfTransactions</code> transactions
     */
    CompletableFuture<Void> newTransactionsAfter(int knownNumberOfTransactions) {
        synchronized (lock) {
            if (history.size() > knownNumberOfTransactions) {
                return CompletableFuture.completedFuture(null);
            }
            return newTransactions;
        }
    }

    void subscriptionStopped(MemorySubscription subscription) {
        subscriptions.remove(subscription);
    }

    private List<Transaction> append(List<Transaction> transactions, boolean useCheckpointAsId) {
        List<Transaction>       written;
        CompletableFuture<Void> signal;
        synchronized (lock) {
            written = transactions.stream()
                                  .map(transaction -> assignCheckpoint(transaction, useCheckpointAsId))
                                  .collect(Collectors.toList());
            history.addAll(written);
            signal = newTransactions;
            newTransactions = new CompletableFuture<>();
        }
        log.trace("Wrote {} transaction(s)", written.size());
        signal.complete(null);
        return written;
    }

    private Transaction assignCheckpoint(Transaction transaction, boolean useCheckpointAsId) {
        requireNonNull(transaction, "Transactions cannot contain null");
        if (transaction.hasCheckpoint()) {
            lastCheckpoint = transaction.checkpoint();
            return transaction;
        }
        lastCheckpoint++;
        var withCheckpoint = transaction.withCheckpoint(lastCheckpoint);
        return useCheckpointAsId ? withCheckpoint.withId(String.valueOf(lastCheckpoint)) : withCheckpoint;
    }
}
