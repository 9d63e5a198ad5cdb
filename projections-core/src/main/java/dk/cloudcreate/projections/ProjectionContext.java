package dk.cloudcreate.projections;

import java.time.OffsetDateTime;
import java.util.Map;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Ambient metadata passed to every event handler invocation. A new instance is created for each event
 * and it's never persisted.<br>
 * Storage implementations may subclass it to carry e.g. the current unit of work.
 */
public class ProjectionContext {
    private final String              transactionId;
    private final String              streamId;
    private final OffsetDateTime      timestamp;
    private final long                checkpoint;
    private final Map<String, Object> eventHeaders;
    private final Map<String, Object> transactionHeaders;

    public ProjectionContext(String transactionId,
                             String streamId,
                             OffsetDateTime timestamp,
                             long checkpoint,
                             Map<String, Object> eventHeaders,
                             Map<String, Object> transactionHeaders) {
        this.transactionId = requireNonNull(transactionId, "No transactionId provided");
        this.streamId = streamId;
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
        this.checkpoint = checkpoint;
        this.eventHeaders = requireNonNull(eventHeaders, "No eventHeaders provided");
        this.transactionHeaders = requireNonNull(transactionHeaders, "No transactionHeaders provided");
    }

    public static ProjectionContext from(Transaction transaction, EventEnvelope event) {
        requireNonNull(transaction, "No transaction provided");
        requireNonNull(event, "No event provided");
        return new ProjectionContext(transaction.id(),
                                     transaction.streamId(),
                                     transaction.timestamp(),
                                     transaction.checkpoint(),
                                     event.headers(),
                                     transaction.headers());
    }

    public String transactionId() {
        return transactionId;
    }

    public String streamId() {
        return streamId;
    }

    public OffsetDateTime timestamp() {
        return timestamp;
    }

    public long checkpoint() {
        return checkpoint;
    }

    public Map<String, Object> eventHeaders() {
        return eventHeaders;
    }

    public Map<String, Object> transactionHeaders() {
        return transactionHeaders;
    }

    @Override
    public String toString() {
        return "ProjectionContext{" +
                "transactionId='" + transactionId + '\'' +
                ", streamId='" + streamId + '\'' +
                ", checkpoint=" + checkpoint +
                '}';
    }
}
