package dk.cloudcreate.projections.paging.test_data;

import dk.cloudcreate.projections.Transaction;
import dk.cloudcreate.projections.paging.TransactionPageSource;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In memory {@link TransactionPageSource} that counts the loads, can fail the next load (with any {@link Throwable}, checked
 * exceptions included) and can hold loads until released
 */
public class RecordingPageSource implements TransactionPageSource {
    private final List<Transaction> transactions = new CopyOnWriteArrayList<>();
    private final AtomicInteger     loadCount    = new AtomicInteger();

    private volatile CountDownLatch   gate;
    private volatile Throwable        nextFailure;
    private volatile boolean          closed;

    /**
     * Append <code>count</code> transactions with consecutive checkpoints
     */
    public RecordingPageSource append(int count) {
        var checkpoint = transactions.isEmpty() ? 0 : transactions.get(transactions.size() - 1).checkpoint();
        for (var i = 0; i < count; i++) {
            checkpoint++;
            transactions.add(Transaction.builder().checkpoint(checkpoint).event("Event-" + checkpoint).build());
        }
        return this;
    }

    /**
     * Append transactions with exactly the given checkpoints, in the given order
     */
    public RecordingPageSource appendCheckpoints(long... checkpoints) {
        for (var checkpoint : checkpoints) {
            transactions.add(Transaction.builder().checkpoint(checkpoint).event("Event-" + checkpoint).build());
        }
        return this;
    }

    /**
     * Hold every load until {@link #release()} is called
     */
    public void hold() {
        gate = new CountDownLatch(1);
    }

    public void release() {
        var currentGate = gate;
        if (currentGate != null) {
            currentGate.countDown();
        }
    }

    public void failNextLoad(Throwable failure) {
        nextFailure = failure;
    }

    public int loadCount() {
        return loadCount.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public List<Transaction> loadTransactionsAfter(long checkpoint, int maxNumberOfTransactions) {
        loadCount.incrementAndGet();
        var currentGate = gate;
        if (currentGate != null) {
            try {
                currentGate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while held", e);
            }
        }
        var failure = nextFailure;
        if (failure != null) {
            nextFailure = null;
            throwUnchecked(failure);
        }
        return transactions.stream()
                           .filter(transaction -> transaction.checkpoint() > checkpoint)
                           .limit(maxNumberOfTransactions)
                           .collect(Collectors.toList());
    }

    @Override
    public Optional<Long> lastCheckpoint() {
        return transactions.stream().map(Transaction::checkpoint).max(Long::compare);
    }

    @Override
    public void close() {
        closed = true;
    }

    @SuppressWarnings("unchecked")
    private static <T extends Throwable> void throwUnchecked(Throwable failure) throws T {
        throw (T) failure;
    }
}
