package dk.cloudcreate.projections.dispatching;

import dk.cloudcreate.projections.subscription.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Subscribes {@link TransactionHandler}'s to an {@link EventSource} and applies the failure policy of the subscription:
 * <ul>
 *     <li>If a handler throws, the {@link SubscriptionOptions#shouldRetry} policy decides if the batch is retried.
 *     Once the policy gives up, the failure is logged as fatal and the subscription is closed.</li>
 *     <li>If the subscription starts from a checkpoint that is ahead of the event source and {@link SubscriptionOptions#restartWhenAhead}
 *     is enabled, the stale subscription is closed, {@link SubscriptionOptions#beforeRestarting} is called and a new subscription
 *     is started from the beginning of the event source.</li>
 * </ul>
 */
public class Dispatcher {
    private final EventSource eventSource;

    public Dispatcher(EventSource eventSource) {
        this.eventSource = requireNonNull(eventSource, "No eventSource provided");
    }

    public DispatcherSubscription subscribe(Optional<Long> lastProcessedCheckpoint,
                                            TransactionHandler handler,
                                            SubscriptionOptions options) {
        requireNonNull(lastProcessedCheckpoint, "No lastProcessedCheckpoint provided");
        requireNonNull(handler, "No handler provided");
        requireNonNull(options, "No options provided");
        var subscription = new DispatcherSubscription(eventSource, handler, options);
        subscription.connect(lastProcessedCheckpoint);
        return subscription;
    }

    public DispatcherSubscription subscribe(Optional<Long> lastProcessedCheckpoint,
                                            TransactionHandler handler) {
        return subscribe(lastProcessedCheckpoint, handler, SubscriptionOptions.defaults());
    }
}
