package dk.cloudcreate.projections.inmemory;

import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import dk.cloudcreate.projections.Transaction;
import dk.cloudcreate.projections.common.AlreadyDisposedException;
import dk.cloudcreate.projections.common.types.SubscriptionId;
import dk.cloudcreate.projections.subscription.*;
import org.slf4j.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link Subscription} to a {@link MemoryEventSource}
 */
public final class MemorySubscription implements Subscription {
    private static final Logger   log                  = LoggerFactory.getLogger(MemorySubscription.class);
    private static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(10);

    private final MemoryEventSource     eventSource;
    private final Optional<Long>        lastProcessedCheckpoint;
    private final int                   batchSize;
    private final TransactionSubscriber subscriber;
    private final SubscriptionId        subscriptionId;
    private final Object                lock         = new Object();
    private final Object                progressLock = new Object();

    private Thread           worker;
    private volatile boolean closed;
    private long             lastDeliveredCheckpoint;

    MemorySubscription(MemoryEventSource eventSource,
                       Optional<Long> lastProcessedCheckpoint,
                       int batchSize,
                       TransactionSubscriber subscriber,
                       SubscriptionId subscriptionId) {
        this.eventSource = eventSource;
        this.lastProcessedCheckpoint = lastProcessedCheckpoint;
        this.batchSize = batchSize;
        this.subscriber = subscriber;
        this.subscriptionId = subscriptionId;
        this.lastDeliveredCheckpoint = lastProcessedCheckpoint.orElse(Transaction.UNASSIGNED_CHECKPOINT);
    }

    void start() {
        synchronized (lock) {
            worker = new ThreadFactoryBuilder()
                    .nameFormat("MemorySubscription-" + subscriptionId + "-%d")
                    .daemon(true)
                    .build()
                    .newThread(this::deliverTransactions);
            worker.start();
        }
    }

    @Override
    public SubscriptionId subscriptionId() {
        return subscriptionId;
    }

    @Override
    public boolean isActive() {
        return !closed;
    }

    /**
     * Block until the subscriber has handled the transaction with the given checkpoint (or a later one)
     *
     * @throws TimeoutException         if the checkpoint wasn't reached within the <code>timeout</code>
     * @throws InterruptedException     if the calling thread was interrupted while waiting
     * @throws AlreadyDisposedException if the subscription is closed before the checkpoint was reached
     */
    public void waitUntilCheckpoint(long checkpoint, Duration timeout) throws InterruptedException, TimeoutException {
        requireNonNull(timeout, "No timeout provided");
        var deadline = System.nanoTime() + timeout.toNanos();
        synchronized (progressLock) {
            while (lastDeliveredCheckpoint < checkpoint) {
                if (closed) {
                    throw new AlreadyDisposedException(msg("[{}] Subscription was closed before checkpoint {} was reached. Last handled checkpoint is {}",
                                                           subscriptionId,
                                                           checkpoint,
                                                           lastDeliveredCheckpoint));
                }
                var remainingNanos = deadline - System.nanoTime();
                if (remainingNanos <= 0) {
                    throw new TimeoutException(msg("[{}] Checkpoint {} wasn't reached within {}. Last handled checkpoint is {}",
                                                   subscriptionId,
                                                   checkpoint,
                                                   timeout,
                                                   lastDeliveredCheckpoint));
                }
                TimeUnit.NANOSECONDS.timedWait(progressLock, remainingNanos);
            }
        }
    }

    @Override
    public void close() {
        Thread workerToStop;
        synchronized (lock) {
            closed = true;
            workerToStop = worker;
        }
        wakeUpWaiters();
        if (workerToStop == null || workerToStop == Thread.currentThread()) {
            eventSource.subscriptionStopped(this);
            return;
        }
        workerToStop.interrupt();
        try {
            workerToStop.join(DEFAULT_STOP_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void deliverTransactions() {
        var info = new SubscriptionInfo(subscriptionId, this);
        log.debug("[{}] Subscription started after checkpoint {}", subscriptionId, lastProcessedCheckpoint.map(String::valueOf).orElse("<beginning>"));
        try {
            if (lastProcessedCheckpoint.isPresent() && eventSource.isAhead(lastProcessedCheckpoint.get())) {
                subscriber.noSuchCheckpoint(info);
            }
            var index = 0;
            while (!closed) {
                var batch = eventSource.batchFrom(index, batchSize);
                if (batch.isEmpty()) {
                    eventSource.newTransactionsAfter(index).get();
                    continue;
                }
                index += batch.size();
                var transactions = lastProcessedCheckpoint.map(checkpoint -> after(checkpoint, batch)).orElse(batch);
                if (!transactions.isEmpty()) {
                    subscriber.handleTransactions(transactions, info);
                }
                if (!closed) {
                    markDelivered(batch.get(batch.size() - 1).checkpoint());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[{}] Subscription worker was interrupted", subscriptionId);
        } catch (ExecutionException | RuntimeException e) {
            if (!closed) {
                log.error(msg("[{}] Subscription failed and is cancelled", subscriptionId), e);
            }
        } finally {
            closed = true;
            wakeUpWaiters();
            eventSource.subscriptionStopped(this);
            log.debug("[{}] Subscription stopped", subscriptionId);
        }
    }

    private void markDelivered(long checkpoint) {
        synchronized (progressLock) {
            lastDeliveredCheckpoint = Math.max(lastDeliveredCheckpoint, checkpoint);
            progressLock.notifyAll();
        }
    }

    private void wakeUpWaiters() {
        synchronized (progressLock) {
            progressLock.notifyAll();
        }
    }

    private static List<Transaction> after(long checkpoint, List<Transaction> transactions) {
        return transactions.stream()
                           .filter(transaction -> transaction.checkpoint() > checkpoint)
                           .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "MemorySubscription{" +
                "subscriptionId=" + subscriptionId +
                ", closed=" + closed +
                '}';
    }
}
