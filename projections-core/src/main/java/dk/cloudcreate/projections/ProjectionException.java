package dk.cloudcreate.projections;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Raised when an event couldn't be projected, either because a handler failed or because the event
 * violated the duplicate/miss policy of its mapping.<br>
 * As the exception travels up from the event map to the {@link Projector} it gets enriched with the
 * {@link #getCurrentEvent()}, the {@link #getTransactionId()}, the {@link #getTransactionBatch()} and the name of the
 * projector(s) involved. Each of these can only be assigned once.
 */
public class ProjectionException extends RuntimeException {
    private String              projector;
    private String              childProjector;
    private EventEnvelope       currentEvent;
    private String              transactionId;
    private List<Transaction>   transactionBatch = List.of();

    public ProjectionException() {
    }

    public ProjectionException(String message) {
        super(message);
    }

    public ProjectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public ProjectionException(Throwable cause) {
        super(cause);
    }

    public ProjectionException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }

    /**
     * Name of the projector that was handling the event
     */
    public Optional<String> getProjector() {
        return Optional.ofNullable(projector);
    }

    public ProjectionException setProjector(String projector) {
        this.projector = assignOnce("projector", this.projector, projector);
        return this;
    }

    /**
     * Name of the child projector that failed (if the failure happened in one of the projector's children)
     */
    public Optional<String> getChildProjector() {
        return Optional.ofNullable(childProjector);
    }

    public ProjectionException setChildProjector(String childProjector) {
        this.childProjector = assignOnce("childProjector", this.childProjector, childProjector);
        return this;
    }

    public Optional<EventEnvelope> getCurrentEvent() {
        return Optional.ofNullable(currentEvent);
    }

    public ProjectionException setCurrentEvent(EventEnvelope currentEvent) {
        this.currentEvent = assignOnce("currentEvent", this.currentEvent, currentEvent);
        return this;
    }

    public Optional<String> getTransactionId() {
        return Optional.ofNullable(transactionId);
    }

    public ProjectionException setTransactionId(String transactionId) {
        this.transactionId = assignOnce("transactionId", this.transactionId, transactionId);
        return this;
    }

    /**
     * All the transactions in the batch the projector was handling when the failure occurred
     */
    public List<Transaction> getTransactionBatch() {
        return transactionBatch;
    }

    public ProjectionException setTransactionBatch(List<Transaction> transactionBatch) {
        requireNonNull(transactionBatch, "No transactionBatch provided");
        if (!this.transactionBatch.isEmpty() && !this.transactionBatch.equals(transactionBatch)) {
            throw new IllegalStateException("transactionBatch has already been assigned");
        }
        this.transactionBatch = List.copyOf(transactionBatch);
        return this;
    }

    @Override
    public String getMessage() {
        var message = super.getMessage();
        if (projector == null && transactionId == null && currentEvent == null) {
            return message;
        }
        return msg("{} [projector: '{}'{}, transactionId: '{}', event: {}]",
                   message,
                   projector,
                   childProjector != null ? msg(", childProjector: '{}'", childProjector) : "",
                   transactionId,
                   currentEvent != null ? currentEvent.eventType() : null);
    }

    private static <T> T assignOnce(String name, T currentValue, T newValue) {
        requireNonNull(newValue, msg("No {} provided", name));
        if (currentValue != null && !currentValue.equals(newValue)) {
            throw new IllegalStateException(msg("{} has already been assigned the value '{}'", name, currentValue));
        }
        return newValue;
    }
}
