package dk.cloudcreate.projections.inmemory;

import dk.cloudcreate.projections.common.types.ProjectorId;
import dk.cloudcreate.projections.tracking.CheckpointStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

public class InMemoryCheckpointStore implements CheckpointStore {
    private final ConcurrentHashMap<ProjectorId, Long> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Optional<Long> loadCheckpoint(ProjectorId projectorId) {
        return Optional.ofNullable(checkpoints.get(requireNonNull(projectorId, "No projectorId provided")));
    }

    @Override
    public void saveCheckpoint(ProjectorId projectorId, long checkpoint) {
        checkpoints.put(requireNonNull(projectorId, "No projectorId provided"), checkpoint);
    }

    @Override
    public void resetCheckpoint(ProjectorId projectorId) {
        checkpoints.remove(requireNonNull(projectorId, "No projectorId provided"));
    }
}
