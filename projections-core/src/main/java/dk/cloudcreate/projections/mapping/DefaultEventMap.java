package dk.cloudcreate.projections.mapping;

import dk.cloudcreate.projections.common.types.EventType;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

final class DefaultEventMap<C> implements EventMap<C> {
    private final Map<EventType, CompiledMapping<C>> mappings;
    private final EventPredicate<Object, C>          filter;

    DefaultEventMap(Map<EventType, CompiledMapping<C>> mappings, EventPredicate<Object, C> filter) {
        this.mappings = Collections.unmodifiableMap(mappings);
        this.filter = filter != null ? filter : (event, context) -> true;
    }

    @Override
    public Optional<MappedEventHandler<C>> getHandler(EventType eventType, Object event) {
        requireNonNull(eventType, "No eventType provided");
        requireNonNull(event, "No event provided");
        var mapping = mappings.get(eventType);
        if (mapping == null) {
            return Optional.empty();
        }
        return Optional.of(context -> filter.test(event, context) && mapping.handle(event, context));
    }

    @Override
    public boolean handle(EventType eventType, Object event, C context) {
        requireNonNull(eventType, "No eventType provided");
        requireNonNull(event, "No event provided");
        if (!filter.test(event, context)) {
            return false;
        }
        var mapping = mappings.get(eventType);
        return mapping != null && mapping.handle(event, context);
    }

    @Override
    public Set<EventType> getMappedEventTypes() {
        return mappings.keySet();
    }

    @Override
    public String toString() {
        return "EventMap{" +
                "mappings=" + mappings.keySet() +
                '}';
    }
}
