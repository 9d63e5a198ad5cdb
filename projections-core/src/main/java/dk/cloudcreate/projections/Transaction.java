package dk.cloudcreate.projections;

import java.time.*;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An atomically committed batch of one or more events sharing the same {@link #checkpoint()}.<br>
 * The checkpoint is the total order token of the event stream: within the transactions a single subscriber
 * processes, checkpoints never decrease. An event source may however replay a checkpoint after a restart, so
 * handlers of transactions must be idempotent.
 */
public final class Transaction {
    /**
     * Checkpoint value used for transactions that haven't been assigned a checkpoint by an event source yet
     */
    public static final long UNASSIGNED_CHECKPOINT = -1;

    private final String              id;
    private final long                checkpoint;
    private final String              streamId;
    private final OffsetDateTime      timestamp;
    private final List<EventEnvelope> events;
    private final Map<String, Object> headers;

    public Transaction(String id,
                       long checkpoint,
                       String streamId,
                       OffsetDateTime timestamp,
                       List<EventEnvelope> events,
                       Map<String, Object> headers) {
        this.id = requireNonNull(id, "No transaction id provided");
        this.checkpoint = checkpoint;
        this.streamId = streamId;
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
        this.events = List.copyOf(requireNonNull(events, "No events provided"));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(headers, "No headers provided")));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Unique id of the transaction across all streams
     */
    public String id() {
        return id;
    }

    public long checkpoint() {
        return checkpoint;
    }

    public boolean hasCheckpoint() {
        return checkpoint != UNASSIGNED_CHECKPOINT;
    }

    public String streamId() {
        return streamId;
    }

    /**
     * The (UTC) time the transaction was committed
     */
    public OffsetDateTime timestamp() {
        return timestamp;
    }

    public List<EventEnvelope> events() {
        return events;
    }

    public Map<String, Object> headers() {
        return headers;
    }

    /**
     * Create a copy of this transaction that has the given checkpoint
     */
    public Transaction withCheckpoint(long checkpoint) {
        return new Transaction(id, checkpoint, streamId, timestamp, events, headers);
    }

    /**
     * Create a copy of this transaction that has the given id
     */
    public Transaction withId(String id) {
        return new Transaction(id, checkpoint, streamId, timestamp, events, headers);
    }

    public Builder toBuilder() {
        return new Builder().id(id)
                            .checkpoint(checkpoint)
                            .streamId(streamId)
                            .timestamp(timestamp)
                            .events(events)
                            .headers(headers);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transaction)) return false;
        var that = (Transaction) o;
        return checkpoint == that.checkpoint &&
                id.equals(that.id) &&
                Objects.equals(streamId, that.streamId) &&
                events.equals(that.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, checkpoint);
    }

    @Override
    public String toString() {
        return "Transaction{" +
                "id='" + id + '\'' +
                ", checkpoint=" + checkpoint +
                ", streamId='" + streamId + '\'' +
                ", events=" + events.size() +
                '}';
    }

    public static final class Builder {
        private String              id;
        private long                checkpoint = UNASSIGNED_CHECKPOINT;
        private String              streamId;
        private OffsetDateTime      timestamp;
        private List<EventEnvelope> events     = new ArrayList<>();
        private Map<String, Object> headers    = new LinkedHashMap<>();

        /**
         * Transaction id. If not specified the {@link #checkpoint(long)} is used as id (if one was assigned),
         * otherwise a random id is generated
         */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder checkpoint(long checkpoint) {
            this.checkpoint = checkpoint;
            return this;
        }

        public Builder streamId(String streamId) {
            this.streamId = streamId;
            return this;
        }

        /**
         * Commit timestamp. Defaults to now (UTC)
         */
        public Builder timestamp(OffsetDateTime timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder event(Object body) {
            events.add(body instanceof EventEnvelope ? (EventEnvelope) body : EventEnvelope.of(body));
            return this;
        }

        public Builder event(Object body, Map<String, Object> headers) {
            events.add(EventEnvelope.of(body, headers));
            return this;
        }

        public Builder events(List<EventEnvelope> events) {
            this.events = new ArrayList<>(requireNonNull(events, "No events provided"));
            return this;
        }

        public Builder header(String key, Object value) {
            headers.put(requireNonNull(key, "No header key provided"), value);
            return this;
        }

        public Builder headers(Map<String, Object> headers) {
            this.headers = new LinkedHashMap<>(requireNonNull(headers, "No headers provided"));
            return this;
        }

        public Transaction build() {
            var transactionId = id;
            if (transactionId == null || transactionId.isEmpty()) {
                transactionId = checkpoint != UNASSIGNED_CHECKPOINT ? Long.toString(checkpoint) : UUID.randomUUID().toString();
            }
            return new Transaction(transactionId,
                                   checkpoint,
                                   streamId,
                                   timestamp != null ? timestamp : OffsetDateTime.now(ZoneOffset.UTC),
                                   events,
                                   headers);
        }
    }
}
