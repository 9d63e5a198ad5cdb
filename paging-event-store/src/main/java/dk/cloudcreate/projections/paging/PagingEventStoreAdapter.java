package dk.cloudcreate.projections.paging;

import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import dk.cloudcreate.projections.Transaction;
import dk.cloudcreate.projections.common.AlreadyDisposedException;
import dk.cloudcreate.projections.common.types.SubscriptionId;
import dk.cloudcreate.projections.subscription.*;
import org.slf4j.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Turns a pull based {@link TransactionPageSource} into a push based {@link EventSource}.
 * <p>
 * All subscriptions share one {@link CheckpointCache}, so subscribers that follow each other closely through the stream are mostly
 * served from memory. Loads from the page source are single-flight: while a load is in progress every other caller waits for
 * that load instead of starting its own.<br>
 * When the page source returns less than a full page, the adapter assumes it has caught up with the store and doesn't ask for
 * the transactions after that checkpoint again until the <code>pollInterval</code> has elapsed (measured using the supplied
 * {@link Clock}).<br>
 * Errors from the page source are logged and handled as if the store had no new transactions.
 * <p>
 * Closing the adapter closes all subscriptions, waits (for at most the <code>disposeTimeout</code>) for an in-flight load to complete
 * and finally closes the page source. After that every call fails with an {@link AlreadyDisposedException}.
 */
public class PagingEventStoreAdapter implements EventSource, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PagingEventStoreAdapter.class);

    public static final  int      DEFAULT_CACHE_CAPACITY    = 10_000;
    public static final  int      DEFAULT_MAX_PAGE_SIZE     = 100;
    public static final  Duration DEFAULT_POLL_INTERVAL     = Duration.ofMillis(500);
    public static final  Duration DEFAULT_DISPOSE_TIMEOUT   = Duration.ofSeconds(10);
    /**
     * The checkpoint a subscription without a last processed checkpoint starts after
     */
    public static final  long     FIRST_CHECKPOINT          = 0L;
    private static final long     MAX_THROTTLE_SLEEP_MILLIS = 50;

    private final TransactionPageSource pageSource;
    private final CheckpointCache       cache;
    private final Duration              pollInterval;
    private final int                   maxPageSize;
    private final Clock                 clock;
    private final Duration              disposeTimeout;
    private final ExecutorService       loaderExecutor;

    private final AtomicReference<CompletableFuture<Page>> currentLoader = new AtomicReference<>();
    private final Set<PagingSubscription>                  subscriptions = ConcurrentHashMap.newKeySet();
    private final Object                                   lifecycleLock = new Object();

    private volatile Future<?>                  inflightLoad;
    private volatile CheckpointRequestTimestamp lastExistingCheckpointRequest;
    private volatile boolean                    disposed;

    /**
     * Create an adapter using {@link #DEFAULT_CACHE_CAPACITY}, {@link #DEFAULT_POLL_INTERVAL}, {@link #DEFAULT_MAX_PAGE_SIZE},
     * the UTC system clock and {@link #DEFAULT_DISPOSE_TIMEOUT}
     */
    public PagingEventStoreAdapter(TransactionPageSource pageSource) {
        this(pageSource, DEFAULT_CACHE_CAPACITY, DEFAULT_POLL_INTERVAL, DEFAULT_MAX_PAGE_SIZE, Clock.systemUTC());
    }

    public PagingEventStoreAdapter(TransactionPageSource pageSource,
                                   int cacheCapacity,
                                   Duration pollInterval,
                                   int maxPageSize,
                                   Clock clock) {
        this(pageSource, cacheCapacity, pollInterval, maxPageSize, clock, DEFAULT_DISPOSE_TIMEOUT);
    }

    /**
     * @param pageSource     the store to load transactions from
     * @param cacheCapacity  the maximum number of transactions kept in the {@link CheckpointCache}
     * @param pollInterval   the minimum time between two requests for the transactions after the last known checkpoint
     * @param maxPageSize    the maximum number of transactions requested from the page source and delivered to a subscriber at a time
     * @param clock          the clock used to enforce the <code>pollInterval</code>
     * @param disposeTimeout the maximum time {@link #close()} waits for an in-flight load (and each subscription worker) to complete
     */
    public PagingEventStoreAdapter(TransactionPageSource pageSource,
                                   int cacheCapacity,
                                   Duration pollInterval,
                                   int maxPageSize,
                                   Clock clock,
                                   Duration disposeTimeout) {
        this.pageSource = requireNonNull(pageSource, "No pageSource provided");
        this.cache = new CheckpointCache(cacheCapacity);
        this.pollInterval = requireNonNull(pollInterval, "No pollInterval provided");
        requireTrue(!pollInterval.isNegative(), "pollInterval must not be negative");
        requireTrue(maxPageSize > 0, msg("maxPageSize must be larger than 0 but was {}", maxPageSize));
        this.maxPageSize = maxPageSize;
        this.clock = requireNonNull(clock, "No clock provided");
        this.disposeTimeout = requireNonNull(disposeTimeout, "No disposeTimeout provided");
        this.loaderExecutor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                                                                    .nameFormat("PagingEventStoreAdapter-Loader-%d")
                                                                    .daemon(true)
                                                                    .build());
    }

    @Override
    public Subscription subscribe(Optional<Long> lastProcessedCheckpoint, TransactionSubscriber subscriber, SubscriptionId subscriptionId) {
        return subscribe(lastProcessedCheckpoint, subscriber, subscriptionId, () -> {
        });
    }

    /**
     * Publish the pages following <code>lastProcessedCheckpoint</code> as a {@link Flux}.<br>
     * Every {@link org.reactivestreams.Subscriber} gets its own subscription, which is closed when the subscriber cancels.
     * The subscription worker only emits a page when the subscriber has requested one, so a slow subscriber holds back the
     * loading of further pages. The flux completes when the adapter is closed.
     *
     * @param lastProcessedCheckpoint the checkpoint of the last transaction already processed. If empty the flux starts from the first transaction
     * @return flux of non empty lists of transactions ordered by checkpoint
     */
    public Flux<List<Transaction>> pages(Optional<Long> lastProcessedCheckpoint) {
        requireNonNull(lastProcessedCheckpoint, "No lastProcessedCheckpoint provided");
        return Flux.create(sink -> {
            var demandSignal = new Object();
            sink.onRequest(requested -> {
                synchronized (demandSignal) {
                    demandSignal.notifyAll();
                }
            });
            var subscription = subscribe(lastProcessedCheckpoint,
                                         (transactions, info) -> {
                                             if (awaitDemand(sink, demandSignal)) {
                                                 sink.next(transactions);
                                             }
                                         },
                                         SubscriptionId.random(),
                                         sink::complete);
            sink.onDispose(subscription::close);
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    /**
     * Get the next non empty page of transactions following <code>previousCheckpoint</code>, blocking until the store has new
     * transactions. Pages are served from the cache when possible.
     *
     * @param previousCheckpoint the checkpoint of the last transaction already received
     * @return the next page. Only empty if the adapter was closed while waiting
     * @throws InterruptedException     if the calling thread is interrupted while waiting
     * @throws AlreadyDisposedException if the adapter has been closed
     */
    public Page getNextPage(long previousCheckpoint) throws InterruptedException {
        assertNotDisposed();
        while (true) {
            var page = loadNextPage(previousCheckpoint, false);
            if (!page.isEmpty() || disposed) {
                return page;
            }
        }
    }

    /**
     * Make a single attempt to get the page following <code>previousCheckpoint</code>: first from the cache and otherwise from the
     * page source (respecting the poll interval).
     *
     * @param previousCheckpoint the checkpoint of the last transaction already received
     * @return the page, which is empty if the store had no transactions after <code>previousCheckpoint</code> or couldn't be reached
     * @throws InterruptedException     if the calling thread is interrupted while waiting
     * @throws AlreadyDisposedException if the adapter has been closed
     */
    public Page loadNextPage(long previousCheckpoint) throws InterruptedException {
        assertNotDisposed();
        return loadNextPage(previousCheckpoint, false);
    }

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * Number of transactions currently in the cache
     */
    public int getCachedTransactionCount() {
        return cache.size();
    }

    /**
     * Close all subscriptions, wait for an in-flight load to complete and close the page source.
     * Closing an already closed adapter has no effect.
     */
    @Override
    public void close() {
        List<PagingSubscription> subscriptionsToClose;
        synchronized (lifecycleLock) {
            if (disposed) {
                return;
            }
            disposed = true;
            subscriptionsToClose = new ArrayList<>(subscriptions);
        }
        log.info("Closing PagingEventStoreAdapter with {} active subscription(s)", subscriptionsToClose.size());

        var loader = currentLoader.get();
        if (loader != null) {
            loader.complete(Page.empty(FIRST_CHECKPOINT - 1));
        }
        subscriptionsToClose.forEach(PagingSubscription::close);
        awaitInflightLoad();

        loaderExecutor.shutdownNow();
        try {
            pageSource.close();
        } catch (Exception e) {
            log.error("Failed to close the TransactionPageSource", e);
        }
        log.info("Closed PagingEventStoreAdapter");
    }

    // ------------------------------------------------------------------------------------------------------------------

    Subscription subscribe(Optional<Long> lastProcessedCheckpoint,
                           TransactionSubscriber subscriber,
                           SubscriptionId subscriptionId,
                           Runnable onStopped) {
        requireNonNull(lastProcessedCheckpoint, "No lastProcessedCheckpoint provided");
        requireNonNull(subscriber, "No subscriber provided");
        requireNonNull(subscriptionId, "No subscriptionId provided");
        requireNonNull(onStopped, "No onStopped callback provided");
        synchronized (lifecycleLock) {
            assertNotDisposed();
            var subscription = new PagingSubscription(this,
                                                      lastProcessedCheckpoint.orElse(FIRST_CHECKPOINT),
                                                      subscriber,
                                                      subscriptionId,
                                                      onStopped,
                                                      disposeTimeout);
            subscriptions.add(subscription);
            subscription.start();
            return subscription;
        }
    }

    void subscriptionStopped(PagingSubscription subscription) {
        subscriptions.remove(subscription);
    }

    /**
     * @return true if the page source knows its last checkpoint and <code>checkpoint</code> is after it
     */
    boolean isAheadOfPageSource(long checkpoint) {
        try {
            return pageSource.lastCheckpoint()
                             .map(lastCheckpoint -> checkpoint > lastCheckpoint)
                             .orElse(false);
        } catch (RuntimeException e) {
            log.warn(msg("Failed to resolve the last checkpoint of the TransactionPageSource while checking checkpoint {}", checkpoint), e);
            return false;
        }
    }

    private Page loadNextPage(long previousCheckpoint, boolean preloading) throws InterruptedException {
        var cachedPage = tryGetNextPageFromCache(previousCheckpoint, !preloading);
        if (!cachedPage.isEmpty()) {
            return cachedPage;
        }

        waitForPollIntervalIfCaughtUp(previousCheckpoint);
        if (disposed) {
            return Page.empty(previousCheckpoint);
        }

        var page = loadNextPageSingleFlight(previousCheckpoint, preloading);
        if (page.previousCheckpoint() == previousCheckpoint) {
            return page;
        }
        // Somebody else's load completed, which may have added the transactions we need to the cache
        return tryGetNextPageFromCache(previousCheckpoint, !preloading);
    }

    private Page tryGetNextPageFromCache(long previousCheckpoint, boolean preloadMissingTransactions) {
        var transactions = new ArrayList<Transaction>();
        var checkpoint   = previousCheckpoint;
        while (transactions.size() < maxPageSize) {
            var transaction = cache.tryGet(checkpoint);
            if (transaction.isEmpty()) {
                break;
            }
            transactions.add(transaction.get());
            checkpoint = transaction.get().checkpoint();
        }
        if (preloadMissingTransactions && !transactions.isEmpty() && transactions.size() < maxPageSize) {
            startPreloadingNextPage(checkpoint);
        }
        return new Page(previousCheckpoint, transactions);
    }

    private void waitForPollIntervalIfCaughtUp(long previousCheckpoint) throws InterruptedException {
        while (!disposed) {
            var lastRequest = lastExistingCheckpointRequest;
            if (lastRequest == null || lastRequest.checkpoint != previousCheckpoint) {
                return;
            }
            var remaining = pollInterval.minus(Duration.between(lastRequest.timestamp, clock.instant()));
            if (remaining.isNegative() || remaining.isZero()) {
                return;
            }
            // Sleep in short steps so a clock that is moved forward (or a close) is noticed quickly
            Thread.sleep(Math.max(1, Math.min(remaining.toMillis(), MAX_THROTTLE_SLEEP_MILLIS)));
        }
    }

    private Page loadNextPageSingleFlight(long previousCheckpoint, boolean preloading) throws InterruptedException {
        var loader = currentLoader.get();
        if (loader == null) {
            var newLoader = new CompletableFuture<Page>();
            if (currentLoader.compareAndSet(null, newLoader)) {
                loader = newLoader;
                try {
                    inflightLoad = loaderExecutor.submit(() -> loadNextPageAndCompleteLoader(previousCheckpoint, newLoader, !preloading));
                } catch (RejectedExecutionException e) {
                    currentLoader.compareAndSet(newLoader, null);
                    newLoader.complete(Page.empty(previousCheckpoint));
                }
            } else {
                loader = currentLoader.get();
                if (loader == null) {
                    // The competing load has already completed
                    return Page.empty(previousCheckpoint);
                }
            }
        }

        try {
            return loader.get();
        } catch (ExecutionException e) {
            log.error(msg("Failed to load the transactions after checkpoint {}", previousCheckpoint), e.getCause());
            return Page.empty(previousCheckpoint);
        }
    }

    private void loadNextPageAndCompleteLoader(long previousCheckpoint, CompletableFuture<Page> loader, boolean preloadWhenFull) {
        var page = Page.empty(previousCheckpoint);
        try {
            page = tryLoadNextPage(previousCheckpoint);
        } catch (Error e) {
            log.error(msg("Loading the transactions after checkpoint {} failed with an error", previousCheckpoint), e);
            lastExistingCheckpointRequest = new CheckpointRequestTimestamp(previousCheckpoint, clock.instant());
            throw e;
        } finally {
            currentLoader.compareAndSet(loader, null);
            loader.complete(page);
        }

        if (preloadWhenFull && page.size() == maxPageSize) {
            page.lastCheckpoint().ifPresent(this::startPreloadingNextPage);
        }
    }

    private Page tryLoadNextPage(long previousCheckpoint) {
        // The previous load may have loaded our transactions while we were waiting for it
        var cachedPage = tryGetNextPageFromCache(previousCheckpoint, false);
        if (!cachedPage.isEmpty()) {
            return cachedPage;
        }

        List<Transaction> loaded;
        try {
            log.trace("Loading transactions after checkpoint {}", previousCheckpoint);
            loaded = pageSource.loadTransactionsAfter(previousCheckpoint, maxPageSize);
            if (loaded == null) {
                loaded = List.of();
            }
        } catch (Exception e) {
            log.warn(msg("Failed to load transactions after checkpoint {} from the TransactionPageSource. Will try again after {}",
                          previousCheckpoint,
                          pollInterval), e);
            loaded = List.of();
        }
        if (loaded.size() > maxPageSize) {
            loaded = loaded.subList(0, maxPageSize);
        }
        var transactions = inCheckpointOrder(previousCheckpoint, loaded);

        if (transactions.isEmpty()) {
            lastExistingCheckpointRequest = new CheckpointRequestTimestamp(previousCheckpoint, clock.instant());
            return Page.empty(previousCheckpoint);
        }

        var page = new Page(previousCheckpoint, transactions);
        if (loaded.size() < maxPageSize) {
            lastExistingCheckpointRequest = new CheckpointRequestTimestamp(page.lastCheckpoint().get(), clock.instant());
        }
        // Inserting from the back means a cached transaction always has its successors cached as well
        for (var index = transactions.size() - 1; index > 0; index--) {
            cache.set(transactions.get(index - 1).checkpoint(), transactions.get(index));
        }
        cache.set(previousCheckpoint, transactions.get(0));
        log.debug("Loaded {} transaction(s) after checkpoint {}", transactions.size(), previousCheckpoint);
        return page;
    }

    /**
     * Skip the transactions a store replays (or returns out of order), so checkpoints are strictly increasing and
     * every cache key leads to a later checkpoint
     */
    private List<Transaction> inCheckpointOrder(long previousCheckpoint, List<Transaction> loaded) {
        var transactions   = new ArrayList<Transaction>(loaded.size());
        var lastCheckpoint = previousCheckpoint;
        for (var transaction : loaded) {
            if (transaction.checkpoint() > lastCheckpoint) {
                transactions.add(transaction);
                lastCheckpoint = transaction.checkpoint();
            }
        }
        if (transactions.size() < loaded.size()) {
            log.debug("Skipped {} transaction(s) after checkpoint {} that didn't follow the previous checkpoint",
                      loaded.size() - transactions.size(),
                      previousCheckpoint);
        }
        return transactions;
    }

    private void startPreloadingNextPage(long previousCheckpoint) {
        if (disposed) {
            return;
        }
        try {
            loaderExecutor.execute(() -> {
                try {
                    if (!disposed) {
                        loadNextPage(previousCheckpoint, true);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    log.debug(msg("Preloading the transactions after checkpoint {} failed", previousCheckpoint), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.trace("Skipping preload of the transactions after checkpoint {} as the adapter is closing", previousCheckpoint);
        }
    }

    private void awaitInflightLoad() {
        var load = inflightLoad;
        if (load == null) {
            return;
        }
        try {
            load.get(disposeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Timed out after {} waiting for the in-flight load to complete", disposeTimeout);
        } catch (ExecutionException e) {
            log.debug("The in-flight load failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (CancellationException e) {
            log.debug("The in-flight load was cancelled");
        }
    }

    /**
     * Block the subscription worker until the subscriber has requested more pages
     *
     * @return false if the sink was cancelled or the worker was interrupted while waiting
     */
    private static boolean awaitDemand(FluxSink<List<Transaction>> sink, Object demandSignal) {
        synchronized (demandSignal) {
            while (sink.requestedFromDownstream() == 0 && !sink.isCancelled()) {
                try {
                    demandSignal.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return !sink.isCancelled();
    }

    private void assertNotDisposed() {
        if (disposed) {
            throw new AlreadyDisposedException("The PagingEventStoreAdapter has been closed");
        }
    }
}
