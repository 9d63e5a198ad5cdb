package dk.cloudcreate.projections.paging;

import java.time.Instant;

/**
 * When the store was last asked for the transactions after a checkpoint that turned out to be the last checkpoint in the store
 */
final class CheckpointRequestTimestamp {
    final long    checkpoint;
    final Instant timestamp;

    CheckpointRequestTimestamp(long checkpoint, Instant timestamp) {
        this.checkpoint = checkpoint;
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return checkpoint + "@" + timestamp;
    }
}
