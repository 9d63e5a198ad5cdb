package dk.cloudcreate.projections.tracking;

import dk.cloudcreate.projections.common.types.ProjectorId;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Raised by a {@link CheckpointStore} that failed to load or save a checkpoint
 */
public class CheckpointStoreException extends RuntimeException {
    public final ProjectorId projectorId;

    public CheckpointStoreException(ProjectorId projectorId, String message, Throwable cause) {
        super(msg("[{}] {}", projectorId, message), cause);
        this.projectorId = projectorId;
    }

    public CheckpointStoreException(ProjectorId projectorId, String message) {
        this(projectorId, message, null);
    }
}
