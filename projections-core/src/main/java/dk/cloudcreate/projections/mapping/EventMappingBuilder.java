package dk.cloudcreate.projections.mapping;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Configures the mapping of a single event type: zero or more {@link #when(EventPredicate)} predicates followed by exactly one action
 */
public class EventMappingBuilder<P, C, E> {
    private final EventMapBuilder<P, C>   parent;
    private final EventMapping<P, C, E>   mapping;

    EventMappingBuilder(EventMapBuilder<P, C> parent, EventMapping<P, C, E> mapping) {
        this.parent = parent;
        this.mapping = mapping;
    }

    /**
     * Only apply the action if the predicate accepts the event. All predicates must accept the event,
     * they're evaluated in the order they were added and evaluation stops at the first predicate that rejects the event
     */
    public EventMappingBuilder<P, C, E> when(EventPredicate<E, C> predicate) {
        requireNonNull(predicate, "No predicate provided");
        parent.assertNotBuilt();
        mapping.predicates.add(predicate);
        return this;
    }

    /**
     * The event creates the projection with the key returned by <code>keySelector</code>
     */
    public CreateActionBuilder<P, C, E> asCreateOf(KeySelector<E> keySelector) {
        assignAction(EventMapping.Verb.CREATE, keySelector);
        return new CreateActionBuilder<>(parent, mapping);
    }

    /**
     * The event updates the projection with the key returned by <code>keySelector</code>
     */
    public UpdateActionBuilder<P, C, E> asUpdateOf(KeySelector<E> keySelector) {
        assignAction(EventMapping.Verb.UPDATE, keySelector);
        return new UpdateActionBuilder<>(parent, mapping);
    }

    /**
     * The event deletes the projection with the key returned by <code>keySelector</code>
     */
    public DeleteActionBuilder<P, C, E> asDeleteOf(KeySelector<E> keySelector) {
        assignAction(EventMapping.Verb.DELETE, keySelector);
        return new DeleteActionBuilder<>(parent, mapping);
    }

    /**
     * The event is handled by a custom action
     */
    public void as(CustomAction<E, C> action) {
        requireNonNull(action, "No action provided");
        assignAction(EventMapping.Verb.CUSTOM, null);
        mapping.customAction = action;
    }

    private void assignAction(EventMapping.Verb verb, KeySelector<E> keySelector) {
        if (verb != EventMapping.Verb.CUSTOM) {
            requireNonNull(keySelector, "No keySelector provided");
        }
        parent.assertNotBuilt();
        if (mapping.verb != null) {
            throw new IllegalStateException(msg("Events of type '{}' have already been mapped as {}", mapping.eventType, mapping.verb));
        }
        mapping.verb = verb;
        mapping.keySelector = keySelector;
    }
}
