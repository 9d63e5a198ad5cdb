package dk.cloudcreate.projections.mapping;

import dk.cloudcreate.projections.common.types.EventType;

import java.util.*;

/**
 * Pending configuration of a single event type, filled in by the fluent builders and compiled by {@link EventMapBuilder#build}
 */
final class EventMapping<P, C, E> {
    enum Verb {
        CREATE,
        UPDATE,
        DELETE,
        CUSTOM
    }

    enum DuplicatePolicy {
        THROW,
        IGNORE,
        OVERWRITE,
        CUSTOM
    }

    enum MissPolicy {
        THROW,
        IGNORE,
        CREATE,
        CUSTOM
    }

    final EventType                       eventType;
    final Class<E>                        eventClass;
    final List<EventPredicate<E, C>>      predicates      = new ArrayList<>();
    Verb                                  verb;
    KeySelector<E>                        keySelector;
    ProjectionMutator<P, E, C>            mutator         = (projection, event, context) -> {};
    DuplicatePolicy                       duplicatePolicy = DuplicatePolicy.THROW;
    DuplicateHandler<P, E, C>             duplicateHandler;
    MissPolicy                            missPolicy      = MissPolicy.THROW;
    UpdateMissHandler<C>                  updateMissHandler;
    DeleteMissHandler<C>                  deleteMissHandler;
    CustomAction<E, C>                    customAction;

    EventMapping(EventType eventType, Class<E> eventClass) {
        this.eventType = eventType;
        this.eventClass = eventClass;
    }

    boolean isStorageAction() {
        return verb == Verb.CREATE || verb == Verb.UPDATE || verb == Verb.DELETE;
    }

    @Override
    public String toString() {
        return "EventMapping{" +
                "eventType=" + eventType +
                ", verb=" + verb +
                ", predicates=" + predicates.size() +
                '}';
    }
}
