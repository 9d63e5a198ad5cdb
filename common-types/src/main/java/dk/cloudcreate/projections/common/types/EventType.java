package dk.cloudcreate.projections.common.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Stable discriminator for an event payload. Event maps register and look up handlers by {@link EventType},
 * which by default is the Fully Qualified Class Name of the event.<br>
 * Two events with the same {@link EventType} are handled by the same mapping, sub types are <b>not</b> matched
 * by their super type's {@link EventType}.
 */
public class EventType extends CharSequenceType<EventType> {
    public EventType(CharSequence value) {
        super(value);
    }

    public static EventType of(CharSequence value) {
        return new EventType(value);
    }

    public static EventType of(Class<?> eventType) {
        requireNonNull(eventType, "No eventType provided");
        return new EventType(eventType.getName());
    }

    public static EventType of(Object event) {
        requireNonNull(event, "No event provided");
        return of(event.getClass());
    }

    /**
     * The Java type name this {@link EventType} was created from (if it was created from a class)
     */
    public String getJavaTypeName() {
        return toString();
    }
}
