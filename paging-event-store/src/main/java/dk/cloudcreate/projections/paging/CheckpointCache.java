package dk.cloudcreate.projections.paging;

import dk.cloudcreate.projections.Transaction;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.FailFast.requireTrue;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Bounded least recently used cache of {@link Transaction}'s keyed by the checkpoint of the <b>preceding</b> transaction.<br>
 * Following the chain <code>tryGet(checkpoint) -> transaction -> tryGet(transaction.checkpoint()) -> ...</code> replays a contiguous
 * part of the event stream for as long as every link is present.
 * <p>
 * Reads never lock: a hit only stamps the entry with the current tick. When a {@link #set(long, Transaction)} makes the cache
 * exceed its capacity, the entries with the oldest ticks are evicted until the cache is down to 90% of its capacity.
 */
public class CheckpointCache {
    public static final int MINIMUM_CAPACITY = 10;

    private final int                        capacity;
    private final int                        targetCountAfterEviction;
    private final ConcurrentHashMap<Long, Entry> entries;
    private final AtomicLong                 ticks        = new AtomicLong();
    private final Object                     evictionLock = new Object();

    /**
     * @param capacity the maximum number of transactions in the cache. Must be larger than {@link #MINIMUM_CAPACITY}
     */
    public CheckpointCache(int capacity) {
        requireTrue(capacity > MINIMUM_CAPACITY, msg("capacity must be larger than {} but was {}", MINIMUM_CAPACITY, capacity));
        this.capacity = capacity;
        this.targetCountAfterEviction = (int) (capacity * 9L / 10);
        this.entries = new ConcurrentHashMap<>(capacity);
    }

    /**
     * Cache the transaction that follows <code>previousCheckpoint</code>
     */
    public void set(long previousCheckpoint, Transaction transaction) {
        requireNonNull(transaction, "No transaction provided");
        entries.put(previousCheckpoint, new Entry(transaction, ticks.incrementAndGet()));
        if (entries.size() > capacity) {
            evict();
        }
    }

    /**
     * @return the transaction that follows <code>previousCheckpoint</code> if it's cached
     */
    public Optional<Transaction> tryGet(long previousCheckpoint) {
        var entry = entries.get(previousCheckpoint);
        if (entry == null) {
            return Optional.empty();
        }
        entry.lastAccessTick = ticks.incrementAndGet();
        return Optional.of(entry.transaction);
    }

    public int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }

    int getTargetCountAfterEviction() {
        return targetCountAfterEviction;
    }

    private void evict() {
        synchronized (evictionLock) {
            if (entries.size() <= capacity) {
                return;
            }
            // Ticks are copied before sorting as concurrent readers keep updating them
            var snapshot = new ArrayList<long[]>(entries.size());
            entries.forEach((key, entry) -> snapshot.add(new long[]{key, entry.lastAccessTick}));
            snapshot.sort(Comparator.comparingLong(keyAndTick -> keyAndTick[1]));
            for (var keyAndTick : snapshot) {
                if (entries.size() <= targetCountAfterEviction) {
                    break;
                }
                entries.remove(keyAndTick[0]);
            }
        }
    }

    private static final class Entry {
        final Transaction transaction;
        volatile long     lastAccessTick;

        Entry(Transaction transaction, long lastAccessTick) {
            this.transaction = transaction;
            this.lastAccessTick = lastAccessTick;
        }
    }
}
