package dk.cloudcreate.projections;

import dk.cloudcreate.projections.mapping.EventMap;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Applies an {@link EventMap} to batches of {@link Transaction}'s.<br>
 * Transactions, and the events within each transaction, are processed strictly sequentially in the order they're received.
 * Every event is first handed to the child projectors (in the order they were registered) and then to this projector's own event map.
 * <br>
 * Any failure is raised as a {@link ProjectionException} that identifies the projector, the event, the transaction and the batch.
 */
public class Projector {
    private static final Logger log = LoggerFactory.getLogger(Projector.class);

    private final String                        name;
    private final EventMap<ProjectionContext>   eventMap;
    private final List<Projector>               children;

    public Projector(EventMap<ProjectionContext> eventMap, Projector... children) {
        this(null, eventMap, Arrays.asList(requireNonNull(children, "No children provided")));
    }

    /**
     * @param name     name used in logging and in {@link ProjectionException}'s. Defaults to the simple class name
     * @param eventMap the event map
     * @param children child projectors that handle each event before this projector
     */
    public Projector(String name, EventMap<ProjectionContext> eventMap, List<Projector> children) {
        this.eventMap = requireNonNull(eventMap, "No eventMap provided");
        requireNonNull(children, "No children provided");
        for (var child : children) {
            requireNonNull(child, "There is a null reference in the children of the projector");
        }
        this.children = List.copyOf(children);
        this.name = name != null ? name : getClass().getSimpleName();
    }

    public String getName() {
        return name;
    }

    public List<Projector> getChildren() {
        return children;
    }

    /**
     * Project all events in the transactions
     *
     * @param transactions the transactions ordered by checkpoint
     * @throws ProjectionException if an event couldn't be projected
     */
    public void handle(List<Transaction> transactions) {
        requireNonNull(transactions, "No transactions provided");
        for (var transaction : transactions) {
            for (var event : transaction.events()) {
                try {
                    projectEvent(event, createContext(transaction, event));
                } catch (ProjectionException e) {
                    e.setProjector(name);
                    e.setCurrentEvent(event);
                    e.setTransactionId(transaction.id());
                    e.setTransactionBatch(transactions);
                    throw e;
                } catch (RuntimeException e) {
                    throw new ProjectionException(msg("Projector '{}' failed to project event of type '{}' in transaction '{}' with checkpoint {}",
                                                      name,
                                                      event.eventType(),
                                                      transaction.id(),
                                                      transaction.checkpoint()), e)
                            .setProjector(name)
                            .setCurrentEvent(event)
                            .setTransactionId(transaction.id())
                            .setTransactionBatch(transactions);
                }
            }
        }
        if (log.isTraceEnabled() && !transactions.isEmpty()) {
            log.trace("[{}] Projected {} transaction(s) up to checkpoint {}", name, transactions.size(), transactions.get(transactions.size() - 1).checkpoint());
        }
    }

    /**
     * Create the context passed to the event handlers. Override to provide a specialized {@link ProjectionContext}
     */
    protected ProjectionContext createContext(Transaction transaction, EventEnvelope event) {
        return ProjectionContext.from(transaction, event);
    }

    /**
     * Project a single event through the children and then through this projector's event map
     */
    protected void projectEvent(EventEnvelope event, ProjectionContext context) {
        for (var child : children) {
            try {
                child.projectEvent(event, context);
            } catch (ProjectionException e) {
                if (e.getChildProjector().isEmpty()) {
                    e.setChildProjector(child.getName());
                }
                throw e;
            } catch (RuntimeException e) {
                throw new ProjectionException(msg("Child projector '{}' failed to project event of type '{}'", child.getName(), event.eventType()), e)
                        .setChildProjector(child.getName());
            }
        }
        eventMap.handle(event.eventType(), event.body(), context);
    }

    @Override
    public String toString() {
        return "Projector{" +
                "name='" + name + '\'' +
                ", children=" + children.size() +
                '}';
    }
}
