package dk.cloudcreate.projections.mapping;

import dk.cloudcreate.projections.ProjectionException;
import dk.cloudcreate.projections.common.types.EventType;

import java.util.List;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * An {@link EventMapping} compiled into the predicates and action that are executed for each matching event
 */
final class CompiledMapping<C> {
    @FunctionalInterface
    private interface Action<C> {
        void apply(Object event, C context);
    }

    private final EventType                  eventType;
    private final Class<?>                   eventClass;
    private final List<EventPredicate<?, C>> predicates;
    private final Action<C>                  action;

    private CompiledMapping(EventType eventType, Class<?> eventClass, List<EventPredicate<?, C>> predicates, Action<C> action) {
        this.eventType = eventType;
        this.eventClass = eventClass;
        this.predicates = predicates;
        this.action = action;
    }

    static <P, C, E> CompiledMapping<C> compile(EventMapping<P, C, E> mapping, ProjectionStorage<P, C> storage) {
        Action<C> action;
        switch (mapping.verb) {
            case CREATE:
                action = (event, context) -> create(mapping, mapping.eventClass.cast(event), context, storage);
                break;
            case UPDATE:
                action = (event, context) -> update(mapping, mapping.eventClass.cast(event), context, storage);
                break;
            case DELETE:
                action = (event, context) -> delete(mapping, mapping.eventClass.cast(event), context, storage);
                break;
            case CUSTOM:
                action = (event, context) -> {
                    var typedEvent = mapping.eventClass.cast(event);
                    if (storage != null) {
                        storage.custom(context, () -> mapping.customAction.handle(typedEvent, context));
                    } else {
                        mapping.customAction.handle(typedEvent, context);
                    }
                };
                break;
            default:
                throw new IllegalStateException(msg("Unsupported action {}", mapping.verb));
        }
        return new CompiledMapping<>(mapping.eventType, mapping.eventClass, List.<EventPredicate<?, C>>copyOf(mapping.predicates), action);
    }

    /**
     * @return true if the action was applied, false if a predicate rejected the event
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    boolean handle(Object event, C context) {
        if (!eventClass.isInstance(event)) {
            throw new ProjectionException(msg("Event mapped as '{}' is of type '{}' which isn't a '{}'",
                                              eventType,
                                              event.getClass().getName(),
                                              eventClass.getName()));
        }
        for (EventPredicate predicate : predicates) {
            if (!predicate.test(event, context)) {
                return false;
            }
        }
        action.apply(event, context);
        return true;
    }

    private static <P, C, E> void create(EventMapping<P, C, E> mapping, E event, C context, ProjectionStorage<P, C> storage) {
        var key = resolveKey(mapping, event);
        var outcome = storage.create(key,
                                     context,
                                     projection -> mapping.mutator.mutate(projection, event, context),
                                     existingProjection -> resolveDuplicate(mapping, existingProjection, event, context));
        if (outcome == ProjectionOutcome.REJECTED) {
            throw new ProjectionException(msg("Projection with key '{}' already exists", key));
        }
    }

    private static <P, C, E> DuplicateResolution resolveDuplicate(EventMapping<P, C, E> mapping, P existingProjection, E event, C context) {
        switch (mapping.duplicatePolicy) {
            case IGNORE:
                return DuplicateResolution.IGNORE;
            case OVERWRITE:
                return DuplicateResolution.OVERWRITE;
            case CUSTOM:
                return mapping.duplicateHandler.shouldOverwrite(existingProjection, event, context) ? DuplicateResolution.OVERWRITE : DuplicateResolution.IGNORE;
            default:
                return DuplicateResolution.REJECT;
        }
    }

    private static <P, C, E> void update(EventMapping<P, C, E> mapping, E event, C context, ProjectionStorage<P, C> storage) {
        var key = resolveKey(mapping, event);
        var outcome = storage.update(key,
                                     context,
                                     projection -> mapping.mutator.mutate(projection, event, context),
                                     missingKey -> resolveUpdateMiss(mapping, missingKey, context));
        if (outcome == ProjectionOutcome.REJECTED) {
            throw new ProjectionException(msg("Failed to find projection with key '{}'", key));
        }
    }

    private static <P, C, E> MissResolution resolveUpdateMiss(EventMapping<P, C, E> mapping, String key, C context) {
        switch (mapping.missPolicy) {
            case IGNORE:
                return MissResolution.IGNORE;
            case CREATE:
                return MissResolution.CREATE;
            case CUSTOM:
                return mapping.updateMissHandler.shouldCreate(key, context) ? MissResolution.CREATE : MissResolution.IGNORE;
            default:
                return MissResolution.REJECT;
        }
    }

    private static <P, C, E> void delete(EventMapping<P, C, E> mapping, E event, C context, ProjectionStorage<P, C> storage) {
        var key = resolveKey(mapping, event);
        if (storage.delete(key, context)) {
            return;
        }
        switch (mapping.missPolicy) {
            case IGNORE:
                break;
            case CUSTOM:
                mapping.deleteMissHandler.handleMiss(key, context);
                break;
            default:
                throw new ProjectionException(msg("Cannot delete projection with key '{}'. The projection does not exist", key));
        }
    }

    private static <P, C, E> String resolveKey(EventMapping<P, C, E> mapping, E event) {
        var key = mapping.keySelector.keyOf(event);
        if (key == null || key.isEmpty()) {
            throw new ProjectionException(msg("The projection key is missing for event of type '{}'", mapping.eventType));
        }
        return key;
    }

    @Override
    public String toString() {
        return "CompiledMapping{" +
                "eventType=" + eventType +
                '}';
    }
}
