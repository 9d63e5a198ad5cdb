package dk.cloudcreate.projections.tracking;

import dk.cloudcreate.projections.*;
import dk.cloudcreate.projections.common.Lifecycle;
import dk.cloudcreate.projections.common.types.*;
import dk.cloudcreate.projections.dispatching.*;
import dk.cloudcreate.projections.statistics.ProjectionStats;
import dk.cloudcreate.projections.subscription.*;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Keeps a {@link Projector} subscribed to an {@link EventSource}:
 * <ul>
 *     <li>On {@link #start()} the last checkpoint is loaded from the {@link CheckpointStore} and a {@link Dispatcher} subscription is started from it</li>
 *     <li>Every batch is projected and afterwards the checkpoint of the last transaction in the batch is saved and tracked in the {@link ProjectionStats}</li>
 *     <li>If the subscription is restarted from the beginning, the saved checkpoint is reset before the <code>beforeRestarting</code> callback runs</li>
 * </ul>
 */
public class ProjectorHost implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(ProjectorHost.class);

    private final ProjectorId     projectorId;
    private final Projector       projector;
    private final Dispatcher      dispatcher;
    private final CheckpointStore checkpointStore;
    private final ProjectionStats stats;
    private final boolean         restartWhenAhead;
    private final Runnable        beforeRestarting;
    private final ShouldRetry     shouldRetry;

    private volatile DispatcherSubscription subscription;

    public ProjectorHost(ProjectorId projectorId,
                         Projector projector,
                         EventSource eventSource,
                         CheckpointStore checkpointStore) {
        this(projectorId,
             projector,
             eventSource,
             checkpointStore,
             new ProjectionStats(),
             false,
             () -> {},
             ShouldRetry.never());
    }

    /**
     * @param projectorId      the id the checkpoint is saved under. Also used as subscription id
     * @param projector        the projector
     * @param eventSource      the event source to subscribe to
     * @param checkpointStore  the store keeping the projector's checkpoint
     * @param stats            statistics the projector's progress is tracked in
     * @param restartWhenAhead restart from the beginning if the saved checkpoint is ahead of the event source
     * @param beforeRestarting called before restarting from the beginning, e.g. to purge the projections
     * @param shouldRetry      retry policy for batches the projector failed to handle
     */
    public ProjectorHost(ProjectorId projectorId,
                         Projector projector,
                         EventSource eventSource,
                         CheckpointStore checkpointStore,
                         ProjectionStats stats,
                         boolean restartWhenAhead,
                         Runnable beforeRestarting,
                         ShouldRetry shouldRetry) {
        this.projectorId = requireNonNull(projectorId, "No projectorId provided");
        this.projector = requireNonNull(projector, "No projector provided");
        this.dispatcher = new Dispatcher(requireNonNull(eventSource, "No eventSource provided"));
        this.checkpointStore = requireNonNull(checkpointStore, "No checkpointStore provided");
        this.stats = requireNonNull(stats, "No stats provided");
        this.restartWhenAhead = restartWhenAhead;
        this.beforeRestarting = requireNonNull(beforeRestarting, "No beforeRestarting callback provided");
        this.shouldRetry = requireNonNull(shouldRetry, "No shouldRetry policy provided");
    }

    @Override
    public synchronized void start() {
        if (isStarted()) {
            return;
        }
        var lastCheckpoint = checkpointStore.loadCheckpoint(projectorId);
        log.info("[{}] Starting projector '{}' from checkpoint {}",
                 projectorId,
                 projector.getName(),
                 lastCheckpoint.map(String::valueOf).orElse("<beginning>"));
        var options = SubscriptionOptions.builder()
                                         .subscriptionId(SubscriptionId.of(projectorId))
                                         .restartWhenAhead(restartWhenAhead)
                                         .beforeRestarting(this::prepareForRestart)
                                         .shouldRetry(shouldRetry)
                                         .build();
        subscription = dispatcher.subscribe(lastCheckpoint, this::handleTransactions, options);
    }

    @Override
    public synchronized void stop() {
        var currentSubscription = subscription;
        if (currentSubscription == null) {
            return;
        }
        if (currentSubscription.isActive()) {
            log.info("[{}] Stopping projector '{}'", projectorId, projector.getName());
        }
        currentSubscription.close();
    }

    /**
     * @return true while the subscription is active. A projection failure the {@link ShouldRetry} policy gave up on
     * closes the subscription, after which the host is no longer started
     */
    @Override
    public boolean isStarted() {
        var currentSubscription = subscription;
        return currentSubscription != null && currentSubscription.isActive();
    }

    public ProjectorId getProjectorId() {
        return projectorId;
    }

    public ProjectionStats getStats() {
        return stats;
    }

    /**
     * The subscription of the host, once it has been started
     */
    public Optional<DispatcherSubscription> getSubscription() {
        return Optional.ofNullable(subscription);
    }

    private void handleTransactions(List<Transaction> transactions, SubscriptionInfo info) {
        if (transactions.isEmpty()) {
            return;
        }
        projector.handle(transactions);
        var lastCheckpoint = transactions.get(transactions.size() - 1).checkpoint();
        checkpointStore.saveCheckpoint(projectorId, lastCheckpoint);
        stats.trackProgress(projectorId, lastCheckpoint);
        log.debug("[{}] Projected {} transaction(s) up to checkpoint {}", projectorId, transactions.size(), lastCheckpoint);
    }

    private void prepareForRestart() {
        log.info("[{}] Resetting the checkpoint before restarting projector '{}' from the beginning", projectorId, projector.getName());
        checkpointStore.resetCheckpoint(projectorId);
        stats.logEvent(projectorId, "Restarted from the beginning because the checkpoint was ahead of the event source");
        beforeRestarting.run();
    }
}
