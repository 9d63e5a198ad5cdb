package dk.cloudcreate.projections.inmemory;

import dk.cloudcreate.projections.mapping.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link ProjectionStorage} that keeps the projections in a map keyed by the projection key
 *
 * @param <P> the projection type
 * @param <C> the context type
 */
public class InMemoryProjectionStorage<P, C> implements ProjectionStorage<P, C> {
    private final ConcurrentHashMap<String, P> projections = new ConcurrentHashMap<>();
    private final Function<String, P>          projectionFactory;

    /**
     * @param projectionFactory creates a new, empty projection for a key
     */
    public InMemoryProjectionStorage(Function<String, P> projectionFactory) {
        this.projectionFactory = requireNonNull(projectionFactory, "No projectionFactory provided");
    }

    @Override
    public synchronized ProjectionOutcome create(String key, C context, Consumer<P> mutation, DuplicateResolver<P> onDuplicate) {
        var existing = projections.get(key);
        if (existing != null) {
            switch (onDuplicate.resolve(existing)) {
                case OVERWRITE:
                    mutation.accept(existing);
                    return ProjectionOutcome.UPDATED;
                case IGNORE:
                    return ProjectionOutcome.SKIPPED;
                default:
                    return ProjectionOutcome.REJECTED;
            }
        }
        createAndStore(key, mutation);
        return ProjectionOutcome.CREATED;
    }

    @Override
    public synchronized ProjectionOutcome update(String key, C context, Consumer<P> mutation, MissResolver onMissing) {
        var existing = projections.get(key);
        if (existing != null) {
            mutation.accept(existing);
            return ProjectionOutcome.UPDATED;
        }
        switch (onMissing.resolve(key)) {
            case CREATE:
                createAndStore(key, mutation);
                return ProjectionOutcome.CREATED;
            case IGNORE:
                return ProjectionOutcome.SKIPPED;
            default:
                return ProjectionOutcome.REJECTED;
        }
    }

    @Override
    public synchronized boolean delete(String key, C context) {
        return projections.remove(key) != null;
    }

    public Optional<P> get(String key) {
        return Optional.ofNullable(projections.get(requireNonNull(key, "No key provided")));
    }

    /**
     * Snapshot of all projections keyed by their key
     */
    public Map<String, P> getAll() {
        return Map.copyOf(projections);
    }

    public int count() {
        return projections.size();
    }

    /**
     * Remove all projections, e.g. before the projections are rebuilt from the beginning of the event source
     */
    public synchronized void clear() {
        projections.clear();
    }

    private void createAndStore(String key, Consumer<P> mutation) {
        var projection = requireNonNull(projectionFactory.apply(key), "projectionFactory returned null");
        // The projection only becomes visible if the mutation succeeds
        mutation.accept(projection);
        projections.put(key, projection);
    }
}
