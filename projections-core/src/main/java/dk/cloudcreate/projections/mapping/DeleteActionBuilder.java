package dk.cloudcreate.projections.mapping;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Configures how an event deletes a projection. By default, deleting a projection that doesn't exist fails with a
 * {@link dk.cloudcreate.projections.ProjectionException}
 */
public class DeleteActionBuilder<P, C, E> {
    private final EventMapBuilder<P, C> parent;
    private final EventMapping<P, C, E> mapping;

    DeleteActionBuilder(EventMapBuilder<P, C> parent, EventMapping<P, C, E> mapping) {
        this.parent = parent;
        this.mapping = mapping;
    }

    public DeleteActionBuilder<P, C, E> throwingIfMissing() {
        return missPolicy(EventMapping.MissPolicy.THROW, null);
    }

    public DeleteActionBuilder<P, C, E> ignoringMisses() {
        return missPolicy(EventMapping.MissPolicy.IGNORE, null);
    }

    public DeleteActionBuilder<P, C, E> handlingMissesUsing(DeleteMissHandler<C> handler) {
        requireNonNull(handler, "No handler provided");
        return missPolicy(EventMapping.MissPolicy.CUSTOM, handler);
    }

    private DeleteActionBuilder<P, C, E> missPolicy(EventMapping.MissPolicy policy, DeleteMissHandler<C> handler) {
        parent.assertNotBuilt();
        mapping.missPolicy = policy;
        mapping.deleteMissHandler = handler;
        return this;
    }
}
