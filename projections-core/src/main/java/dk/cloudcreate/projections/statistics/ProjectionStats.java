package dk.cloudcreate.projections.statistics;

import dk.cloudcreate.projections.common.types.ProjectorId;

import java.time.*;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Thread safe registry of the progress, properties and events of all projectors in the process.
 * Timestamps are taken from the {@link Clock} the registry is created with.
 */
public class ProjectionStats {
    private final Clock                                 clock;
    private final Map<ProjectorId, ProjectorStats>      stats = new ConcurrentHashMap<>();

    public ProjectionStats() {
        this(Clock.systemUTC());
    }

    public ProjectionStats(Clock clock) {
        this.clock = requireNonNull(clock, "No clock provided");
    }

    public void trackProgress(ProjectorId projectorId, long checkpoint) {
        get(projectorId).trackProgress(checkpoint, now());
    }

    public void storeProperty(ProjectorId projectorId, String key, String value) {
        get(projectorId).storeProperty(key, value, now());
    }

    public void logEvent(ProjectorId projectorId, String body) {
        get(projectorId).logEvent(body, now());
    }

    /**
     * @see ProjectorStats#getSpeed()
     */
    public OptionalDouble getSpeed(ProjectorId projectorId) {
        return get(projectorId).getSpeed();
    }

    /**
     * @see ProjectorStats#getTimeToReach(long)
     */
    public Optional<Duration> getTimeToReach(ProjectorId projectorId, long targetCheckpoint) {
        return get(projectorId).getTimeToReach(targetCheckpoint);
    }

    /**
     * Get (or create) the stats for the projector
     */
    public ProjectorStats get(ProjectorId projectorId) {
        requireNonNull(projectorId, "No projectorId provided");
        return stats.computeIfAbsent(projectorId, id -> new ProjectorStats(id, now()));
    }

    public List<ProjectorStats> getForAllProjectors() {
        return List.copyOf(stats.values());
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
