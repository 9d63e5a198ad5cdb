package dk.cloudcreate.projections.mapping;

import dk.cloudcreate.projections.common.types.EventType;

import java.util.*;

/**
 * Immutable dispatch table from {@link EventType} to the action configured for it in an {@link EventMapBuilder}
 *
 * @param <C> the context type passed along with each event
 */
public interface EventMap<C> {
    /**
     * Resolve the handler for an event based on the event's exact type
     *
     * @return the handler or {@link Optional#empty()} if the map has no mapping for the event type
     */
    Optional<MappedEventHandler<C>> getHandler(EventType eventType, Object event);

    default Optional<MappedEventHandler<C>> getHandler(Object event) {
        return getHandler(EventType.of(event), event);
    }

    /**
     * Handle the event if the map contains a mapping for its type and both the global filter and the mapping's predicates accept it
     *
     * @return true if an action was applied to the event, false if the event was skipped
     */
    boolean handle(EventType eventType, Object event, C context);

    default boolean handle(Object event, C context) {
        return handle(EventType.of(event), event, context);
    }

    /**
     * The event types the map has mappings for
     */
    Set<EventType> getMappedEventTypes();
}
