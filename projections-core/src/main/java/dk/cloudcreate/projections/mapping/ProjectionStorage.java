package dk.cloudcreate.projections.mapping;

import java.util.function.Consumer;

/**
 * The primitive storage operations an {@link EventMap} expresses its create, update, delete and custom actions in.<br>
 * An {@link EventMap} never touches the storage directly: it only decides which primitive to call, with which key and with
 * which mutation. Implementations translate the primitives to their concrete storage (a database session, an in-memory map, ...).
 *
 * @param <P> the projection type
 * @param <C> the context type passed along with each event
 */
public interface ProjectionStorage<P, C> {
    /**
     * Create a new projection with the given key and apply the <code>mutation</code> to it.<br>
     * If a projection with the key already exists, <code>onDuplicate</code> decides whether the existing projection
     * is mutated ({@link DuplicateResolution#OVERWRITE}), left untouched ({@link DuplicateResolution#IGNORE}) or whether the
     * create is rejected ({@link DuplicateResolution#REJECT}).
     *
     * @return {@link ProjectionOutcome#CREATED}, {@link ProjectionOutcome#UPDATED} (overwritten), {@link ProjectionOutcome#SKIPPED}
     * or {@link ProjectionOutcome#REJECTED}
     */
    ProjectionOutcome create(String key, C context, Consumer<P> mutation, DuplicateResolver<P> onDuplicate);

    /**
     * Apply the <code>mutation</code> to the existing projection with the given key.<br>
     * If no such projection exists, <code>onMissing</code> decides whether a new projection is created and mutated
     * ({@link MissResolution#CREATE}), the update is skipped ({@link MissResolution#IGNORE}) or rejected ({@link MissResolution#REJECT}).
     *
     * @return {@link ProjectionOutcome#UPDATED}, {@link ProjectionOutcome#CREATED}, {@link ProjectionOutcome#SKIPPED}
     * or {@link ProjectionOutcome#REJECTED}
     */
    ProjectionOutcome update(String key, C context, Consumer<P> mutation, MissResolver onMissing);

    /**
     * Delete the projection with the given key
     *
     * @return true if a projection was deleted, false if no projection with the key exists
     */
    boolean delete(String key, C context);

    /**
     * Run a custom action. Implementations can override this to wrap the action, e.g. in a unit of work
     */
    default void custom(C context, Runnable action) {
        action.run();
    }

    @FunctionalInterface
    interface DuplicateResolver<P> {
        DuplicateResolution resolve(P existingProjection);
    }

    @FunctionalInterface
    interface MissResolver {
        MissResolution resolve(String key);
    }
}
