package dk.cloudcreate.projections.mapping;

import dk.cloudcreate.projections.common.types.EventType;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Fluent builder for an {@link EventMap}:
 * <pre>{@code
 * var builder = new EventMapBuilder<ProductCatalogEntry, ProjectionContext>();
 * builder.map(ProductAdded.class)
 *        .when((event, context) -> !event.isDraft())
 *        .asCreateOf(event -> event.productKey)
 *        .ignoringDuplicates()
 *        .using((entry, event, context) -> entry.category = event.category);
 * builder.map(ProductDiscontinued.class)
 *        .asDeleteOf(event -> event.productKey)
 *        .ignoringMisses();
 * EventMap<ProjectionContext> eventMap = builder.build(storage);
 * }</pre>
 * Each event type can only have a single mapping, mapping the same type again replaces the previous mapping.<br>
 * After {@link #build(ProjectionStorage)} the builder, and every builder it has handed out, rejects further changes with an
 * {@link IllegalStateException}.
 *
 * @param <P> the projection type
 * @param <C> the context type passed along with each event
 */
public class EventMapBuilder<P, C> {
    private static final Logger log = LoggerFactory.getLogger(EventMapBuilder.class);

    private final Map<EventType, EventMapping<P, C, ?>> mappings = new LinkedHashMap<>();
    private       EventPredicate<Object, C>             filter;
    private       boolean                               built;

    /**
     * Start a mapping for events of the given type (matched by the type's {@link EventType})
     */
    public <E> EventMappingBuilder<P, C, E> map(Class<E> eventClass) {
        requireNonNull(eventClass, "No eventClass provided");
        return map(EventType.of(eventClass), eventClass);
    }

    /**
     * Start a mapping for events carrying the given {@link EventType}, which may differ from the Java type name of the event
     */
    public synchronized <E> EventMappingBuilder<P, C, E> map(EventType eventType, Class<E> eventClass) {
        requireNonNull(eventType, "No eventType provided");
        requireNonNull(eventClass, "No eventClass provided");
        assertNotBuilt();
        var mapping = new EventMapping<P, C, E>(eventType, eventClass);
        if (mappings.put(eventType, mapping) != null) {
            log.debug("Replacing the existing mapping for event type '{}'", eventType);
        }
        return new EventMappingBuilder<>(this, mapping);
    }

    /**
     * Install a global filter that is evaluated before the mapping for an event is looked up.
     * Events the filter rejects are skipped. Only one filter can be installed.
     */
    public synchronized EventMapBuilder<P, C> where(EventPredicate<Object, C> filter) {
        requireNonNull(filter, "No filter provided");
        assertNotBuilt();
        if (this.filter != null) {
            throw new IllegalStateException("A global filter has already been installed");
        }
        this.filter = filter;
        return this;
    }

    /**
     * Build an {@link EventMap} that only contains custom ({@link EventMappingBuilder#as(CustomAction)}) mappings
     *
     * @throws IllegalStateException if the builder contains create, update or delete mappings
     */
    public EventMap<C> build() {
        return build(null);
    }

    /**
     * Compile the mappings into an immutable {@link EventMap} that performs its create, update and delete actions through
     * the <code>storage</code>
     *
     * @throws IllegalStateException if the map has already been built, if a mapping has no action, or if <code>storage</code>
     *                               is null and there are create, update or delete mappings
     */
    public synchronized EventMap<C> build(ProjectionStorage<P, C> storage) {
        assertNotBuilt();
        for (var mapping : mappings.values()) {
            if (mapping.verb == null) {
                throw new IllegalStateException(msg("No action has been configured for events of type '{}'", mapping.eventType));
            }
            if (storage == null && mapping.isStorageAction()) {
                throw new IllegalStateException(msg("The {} action for events of type '{}' requires a {}",
                                                    mapping.verb,
                                                    mapping.eventType,
                                                    ProjectionStorage.class.getSimpleName()));
            }
        }
        built = true;
        var compiledMappings = new LinkedHashMap<EventType, CompiledMapping<C>>();
        mappings.forEach((eventType, mapping) -> compiledMappings.put(eventType, CompiledMapping.compile(mapping, storage)));
        log.debug("Built event map with {} mapping(s): {}", compiledMappings.size(), compiledMappings.keySet());
        return new DefaultEventMap<>(compiledMappings, filter);
    }

    public synchronized boolean isBuilt() {
        return built;
    }

    synchronized void assertNotBuilt() {
        if (built) {
            throw new IllegalStateException("The event map has already been built and can no longer be changed");
        }
    }
}
