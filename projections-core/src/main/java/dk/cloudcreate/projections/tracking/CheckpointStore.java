package dk.cloudcreate.projections.tracking;

import dk.cloudcreate.projections.common.types.ProjectorId;

import java.util.Optional;

/**
 * Persists the checkpoint of the last transaction a projector has processed, so the projector can resume from it after a restart
 */
public interface CheckpointStore {
    /**
     * @return the last checkpoint saved for the projector, or {@link Optional#empty()} if the projector hasn't processed anything yet
     */
    Optional<Long> loadCheckpoint(ProjectorId projectorId);

    void saveCheckpoint(ProjectorId projectorId, long checkpoint);

    /**
     * Forget the checkpoint of the projector, so it will start from the beginning
     */
    void resetCheckpoint(ProjectorId projectorId);
}
