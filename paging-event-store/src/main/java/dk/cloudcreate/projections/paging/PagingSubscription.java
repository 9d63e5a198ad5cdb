package dk.cloudcreate.projections.paging;

import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import dk.cloudcreate.projections.common.AlreadyDisposedException;
import dk.cloudcreate.projections.common.types.SubscriptionId;
import dk.cloudcreate.projections.subscription.*;
import org.slf4j.*;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link Subscription} served by a dedicated worker thread, which keeps asking the {@link PagingEventStoreAdapter} for the next
 * page and hands it to the {@link TransactionSubscriber}
 */
final class PagingSubscription implements Subscription {
    private static final Logger log = LoggerFactory.getLogger(PagingSubscription.class);

    private final PagingEventStoreAdapter adapter;
    private final long                    startCheckpoint;
    private final TransactionSubscriber   subscriber;
    private final SubscriptionId          subscriptionId;
    private final Runnable                onStopped;
    private final Duration                closeTimeout;
    private final Object                  lock = new Object();

    private Thread           worker;
    private volatile boolean closed;

    PagingSubscription(PagingEventStoreAdapter adapter,
                       long startCheckpoint,
                       TransactionSubscriber subscriber,
                       SubscriptionId subscriptionId,
                       Runnable onStopped,
                       Duration closeTimeout) {
        this.adapter = adapter;
        this.startCheckpoint = startCheckpoint;
        this.subscriber = subscriber;
        this.subscriptionId = subscriptionId;
        this.onStopped = onStopped;
        this.closeTimeout = closeTimeout;
    }

    void start() {
        synchronized (lock) {
            if (closed) {
                throw new AlreadyDisposedException(msg("Subscription '{}' has been closed", subscriptionId));
            }
            if (worker != null) {
                throw new IllegalStateException(msg("Subscription '{}' has already been started", subscriptionId));
            }
            worker = new ThreadFactoryBuilder()
                    .nameFormat("Subscription-" + subscriptionId + "-%d")
                    .daemon(true)
                    .build()
                    .newThread(this::pollForTransactions);
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

    @Override
    public void close() {
        Thread workerToStop;
        synchronized (lock) {
            closed = true;
            workerToStop = worker;
        }
        if (workerToStop == null || workerToStop == Thread.currentThread() || !workerToStop.isAlive()) {
            return;
        }
        log.debug("[{}] Closing subscription", subscriptionId);
        workerToStop.interrupt();
        try {
            workerToStop.join(closeTimeout.toMillis());
            if (workerToStop.isAlive()) {
                log.warn("[{}] Timed out after {} waiting for the subscription worker to stop", subscriptionId, closeTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void pollForTransactions() {
        var info = new SubscriptionInfo(subscriptionId, this);
        log.info("[{}] Subscription started after checkpoint {}", subscriptionId, startCheckpoint);
        try {
            if (adapter.isAheadOfPageSource(startCheckpoint)) {
                log.debug("[{}] Checkpoint {} is ahead of the event store", subscriptionId, startCheckpoint);
                subscriber.noSuchCheckpoint(info);
            }
            var previousCheckpoint = startCheckpoint;
            while (!closed) {
                var page = adapter.getNextPage(previousCheckpoint);
                if (closed || page.isEmpty()) {
                    continue;
                }
                subscriber.handleTransactions(page.transactions(), info);
                previousCheckpoint = page.lastCheckpoint().orElse(previousCheckpoint);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[{}] Subscription worker was interrupted", subscriptionId);
        } catch (AlreadyDisposedException e) {
            log.debug("[{}] The PagingEventStoreAdapter has been closed", subscriptionId);
        } catch (RuntimeException e) {
            if (!closed) {
                log.error(msg("[{}] The polling task has failed. The subscription is cancelled", subscriptionId), e);
            }
        } finally {
            closed = true;
            adapter.subscriptionStopped(this);
            onStopped.run();
            log.info("[{}] Subscription stopped", subscriptionId);
        }
    }

    @Override
    public String toString() {
        return "PagingSubscription{" +
                "subscriptionId=" + subscriptionId +
                ", startCheckpoint=" + startCheckpoint +
                ", closed=" + closed +
                '}';
    }
}
