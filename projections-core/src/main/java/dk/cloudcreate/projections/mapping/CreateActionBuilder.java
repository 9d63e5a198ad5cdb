package dk.cloudcreate.projections.mapping;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Configures how an event creates a projection. By default, creating a projection that already exists fails with a
 * {@link dk.cloudcreate.projections.ProjectionException}
 */
public class CreateActionBuilder<P, C, E> {
    private final EventMapBuilder<P, C> parent;
    private final EventMapping<P, C, E> mapping;

    CreateActionBuilder(EventMapBuilder<P, C> parent, EventMapping<P, C, E> mapping) {
        this.parent = parent;
        this.mapping = mapping;
    }

    /**
     * Initialize the new projection from the event
     */
    public CreateActionBuilder<P, C, E> using(ProjectionMutator<P, E, C> mutator) {
        requireNonNull(mutator, "No mutator provided");
        parent.assertNotBuilt();
        mapping.mutator = mutator;
        return this;
    }

    public CreateActionBuilder<P, C, E> throwingOnDuplicates() {
        return duplicatePolicy(EventMapping.DuplicatePolicy.THROW, null);
    }

    /**
     * Leave an existing projection untouched
     */
    public CreateActionBuilder<P, C, E> ignoringDuplicates() {
        return duplicatePolicy(EventMapping.DuplicatePolicy.IGNORE, null);
    }

    /**
     * Apply the mutator to the existing projection
     */
    public CreateActionBuilder<P, C, E> overwritingDuplicates() {
        return duplicatePolicy(EventMapping.DuplicatePolicy.OVERWRITE, null);
    }

    /**
     * Let the <code>handler</code> decide whether the existing projection is overwritten
     */
    public CreateActionBuilder<P, C, E> handlingDuplicatesUsing(DuplicateHandler<P, E, C> handler) {
        requireNonNull(handler, "No handler provided");
        return duplicatePolicy(EventMapping.DuplicatePolicy.CUSTOM, handler);
    }

    private CreateActionBuilder<P, C, E> duplicatePolicy(EventMapping.DuplicatePolicy policy, DuplicateHandler<P, E, C> handler) {
        parent.assertNotBuilt();
        mapping.duplicatePolicy = policy;
        mapping.duplicateHandler = handler;
        return this;
    }
}
