package dk.cloudcreate.projections.statistics;

import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A notable occurrence a projector has reported, e.g. that it was restarted
 */
public final class ProjectorEvent {
    public final String         body;
    public final OffsetDateTime timestamp;

    public ProjectorEvent(String body, OffsetDateTime timestamp) {
        this.body = requireNonNull(body, "No body provided");
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    @Override
    public String toString() {
        return timestamp + ": " + body;
    }
}
