package dk.cloudcreate.projections.mapping;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Configures how an event updates a projection. By default, updating a projection that doesn't exist fails with a
 * {@link dk.cloudcreate.projections.ProjectionException}
 */
public class UpdateActionBuilder<P, C, E> {
    private final EventMapBuilder<P, C> parent;
    private final EventMapping<P, C, E> mapping;

    UpdateActionBuilder(EventMapBuilder<P, C> parent, EventMapping<P, C, E> mapping) {
        this.parent = parent;
        this.mapping = mapping;
    }

    public UpdateActionBuilder<P, C, E> using(ProjectionMutator<P, E, C> mutator) {
        requireNonNull(mutator, "No mutator provided");
        parent.assertNotBuilt();
        mapping.mutator = mutator;
        return this;
    }

    public UpdateActionBuilder<P, C, E> throwingIfMissing() {
        return missPolicy(EventMapping.MissPolicy.THROW, null);
    }

    public UpdateActionBuilder<P, C, E> ignoringMisses() {
        return missPolicy(EventMapping.MissPolicy.IGNORE, null);
    }

    /**
     * Create the missing projection and apply the mutator to it
     */
    public UpdateActionBuilder<P, C, E> creatingIfMissing() {
        return missPolicy(EventMapping.MissPolicy.CREATE, null);
    }

    /**
     * Let the <code>handler</code> decide whether the missing projection is created
     */
    public UpdateActionBuilder<P, C, E> handlingMissesUsing(UpdateMissHandler<C> handler) {
        requireNonNull(handler, "No handler provided");
        return missPolicy(EventMapping.MissPolicy.CUSTOM, handler);
    }

    private UpdateActionBuilder<P, C, E> missPolicy(EventMapping.MissPolicy policy, UpdateMissHandler<C> handler) {
        parent.assertNotBuilt();
        mapping.missPolicy = policy;
        mapping.updateMissHandler = handler;
        return this;
    }
}
