package dk.cloudcreate.projections.mapping;

/**
 * The handler an {@link EventMap} resolved for a specific event
 */
@FunctionalInterface
public interface MappedEventHandler<C> {
    /**
     * @return true if the mapping's action was applied, false if one of the predicates rejected the event
     */
    boolean handle(C context);
}
