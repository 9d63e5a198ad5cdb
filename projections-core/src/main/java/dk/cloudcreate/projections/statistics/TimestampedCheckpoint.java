package dk.cloudcreate.projections.statistics;

import java.time.OffsetDateTime;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

public final class TimestampedCheckpoint {
    public final long           checkpoint;
    public final OffsetDateTime timestamp;

    public TimestampedCheckpoint(long checkpoint, OffsetDateTime timestamp) {
        this.checkpoint = checkpoint;
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimestampedCheckpoint)) return false;
        var that = (TimestampedCheckpoint) o;
        return checkpoint == that.checkpoint && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(checkpoint, timestamp);
    }

    @Override
    public String toString() {
        return checkpoint + "@" + timestamp;
    }
}
