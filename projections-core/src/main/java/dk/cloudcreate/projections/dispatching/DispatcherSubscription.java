package dk.cloudcreate.projections.dispatching;

import dk.cloudcreate.projections.Transaction;
import dk.cloudcreate.projections.common.types.SubscriptionId;
import dk.cloudcreate.projections.subscription.*;
import org.slf4j.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The {@link Subscription} returned by the {@link Dispatcher}. It stays valid when the underlying
 * event source subscription is replaced because the subscription was restarted from the beginning.
 */
public final class DispatcherSubscription implements Subscription, TransactionSubscriber {
    private static final Logger log = LoggerFactory.getLogger(DispatcherSubscription.class);

    private final EventSource                   eventSource;
    private final TransactionHandler            handler;
    private final SubscriptionOptions           options;
    private final AtomicReference<Subscription> current = new AtomicReference<>();
    private volatile boolean                    closed;
    private volatile Exception                  fatalException;

    DispatcherSubscription(EventSource eventSource, TransactionHandler handler, SubscriptionOptions options) {
        this.eventSource = eventSource;
        this.handler = handler;
        this.options = options;
    }

    /**
     * A restart calls this from the worker of the subscription being replaced, possibly before the initial call has returned
     */
    synchronized void connect(Optional<Long> lastProcessedCheckpoint) {
        log.debug("[{}] Subscribing from checkpoint {}", options.subscriptionId, lastProcessedCheckpoint.map(String::valueOf).orElse("<beginning>"));
        var subscription = eventSource.subscribe(lastProcessedCheckpoint, this, options.subscriptionId);
        current.set(subscription);
        if (closed) {
            subscription.close();
        }
    }

    @Override
    public void handleTransactions(List<Transaction> transactions, SubscriptionInfo info) {
        var attempts = 0;
        while (!closed) {
            try {
                handler.handle(transactions, info);
                return;
            } catch (Exception e) {
                attempts++;
                if (closed) {
                    log.debug(msg("[{}] Handler failed after the subscription was closed", options.subscriptionId), e);
                    return;
                }
                if (options.shouldRetry.shouldRetry(e, attempts)) {
                    var delay = options.shouldRetry.retryDelay(attempts);
                    log.warn(msg("[{}] Failed to handle {} transaction(s) with checkpoints {}-{} (attempt {}). Retrying in {}",
                                 options.subscriptionId,
                                 transactions.size(),
                                 firstCheckpoint(transactions),
                                 lastCheckpoint(transactions),
                                 attempts,
                                 delay), e);
                    if (!waitBeforeRetrying(delay)) {
                        return;
                    }
                } else {
                    log.error(msg("[{}] Fatal failure while handling {} transaction(s) with checkpoints {}-{} after {} attempt(s). The subscription is cancelled",
                                  options.subscriptionId,
                                  transactions.size(),
                                  firstCheckpoint(transactions),
                                  lastCheckpoint(transactions),
                                  attempts), e);
                    fatalException = e;
                    closed = true;
                    info.subscription.close();
                    return;
                }
            }
        }
    }

    @Override
    public void noSuchCheckpoint(SubscriptionInfo info) {
        if (!options.restartWhenAhead) {
            log.warn("[{}] The subscription checkpoint is ahead of the event source. Waiting for the event source to catch up", options.subscriptionId);
            return;
        }
        log.info("[{}] The subscription checkpoint is ahead of the event source. Restarting the subscription from the beginning", options.subscriptionId);
        info.subscription.close();
        try {
            options.beforeRestarting.run();
        } catch (RuntimeException e) {
            log.error(msg("[{}] Failed to prepare for restarting the subscription. The subscription is cancelled", options.subscriptionId), e);
            fatalException = e;
            closed = true;
            return;
        }
        if (!closed) {
            connect(Optional.empty());
        }
    }

    @Override
    public SubscriptionId subscriptionId() {
        return options.subscriptionId;
    }

    @Override
    public boolean isActive() {
        var subscription = current.get();
        return !closed && subscription != null && subscription.isActive();
    }

    /**
     * The exception that caused the subscription to be cancelled (if any)
     */
    public Optional<Exception> getFatalException() {
        return Optional.ofNullable(fatalException);
    }

    @Override
    public void close() {
        if (!closed) {
            log.info("[{}] Closing subscription", options.subscriptionId);
        }
        closed = true;
        var subscription = current.get();
        if (subscription != null) {
            subscription.close();
        }
    }

    private boolean waitBeforeRetrying(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static long firstCheckpoint(List<Transaction> transactions) {
        return transactions.isEmpty() ? Transaction.UNASSIGNED_CHECKPOINT : transactions.get(0).checkpoint();
    }

    private static long lastCheckpoint(List<Transaction> transactions) {
        return transactions.isEmpty() ? Transaction.UNASSIGNED_CHECKPOINT : transactions.get(transactions.size() - 1).checkpoint();
    }

    @Override
    public String toString() {
        return "DispatcherSubscription{" +
                "subscriptionId=" + options.subscriptionId +
                ", closed=" + closed +
                '}';
    }
}
