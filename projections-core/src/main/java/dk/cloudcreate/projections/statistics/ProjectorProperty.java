package dk.cloudcreate.projections.statistics;

import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A named value a projector has reported, e.g. the number of projections it maintains
 */
public final class ProjectorProperty {
    public final String         value;
    public final OffsetDateTime timestamp;

    public ProjectorProperty(String value, OffsetDateTime timestamp) {
        this.value = value;
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    @Override
    public String toString() {
        return "ProjectorProperty{" +
                "value='" + value + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
