package dk.cloudcreate.projections;

import dk.cloudcreate.projections.common.types.EventType;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Wraps a single business event that is part of a {@link Transaction}.<br>
 * The {@link #body()} is opaque to the projection pipeline: event maps dispatch on the {@link #eventType()}, which
 * defaults to the Fully Qualified Class Name of the body.
 */
public final class EventEnvelope {
    private final EventType           eventType;
    private final Object              body;
    private final Map<String, Object> headers;

    public EventEnvelope(EventType eventType, Object body, Map<String, Object> headers) {
        this.body = requireNonNull(body, "No event body provided");
        this.eventType = eventType != null ? eventType : EventType.of(body);
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(headers, "No headers provided")));
    }

    public static EventEnvelope of(Object body) {
        return new EventEnvelope(null, body, Map.of());
    }

    public static EventEnvelope of(Object body, Map<String, Object> headers) {
        return new EventEnvelope(null, body, headers);
    }

    public EventType eventType() {
        return eventType;
    }

    public Object body() {
        return body;
    }

    /**
     * Event scoped headers (as opposed to the {@link Transaction#headers()})
     */
    public Map<String, Object> headers() {
        return headers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventEnvelope)) return false;
        var that = (EventEnvelope) o;
        return eventType.equals(that.eventType) && body.equals(that.body) && headers.equals(that.headers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, body);
    }

    @Override
    public String toString() {
        return "EventEnvelope{" +
                "eventType=" + eventType +
                ", body=" + body +
                '}';
    }
}
