package dk.cloudcreate.projections.statistics;

import dk.cloudcreate.projections.common.types.ProjectorId;

import java.time.*;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Progress, properties and events reported for a single projector
 */
public class ProjectorStats {
    /**
     * The number of events retained per projector. Older events are discarded
     */
    public static final int MAX_NUMBER_OF_EVENTS = 100;

    private final ProjectorId                               projectorId;
    private final Map<String, ProjectorProperty>            properties         = new ConcurrentHashMap<>();
    private final Deque<ProjectorEvent>                     events             = new ArrayDeque<>();
    private final WeightedProjectionSpeedCalculator         lastMinuteSamples  = new WeightedProjectionSpeedCalculator(12, Duration.ofSeconds(5));
    private final WeightedProjectionSpeedCalculator         last10MinuteSamples = new WeightedProjectionSpeedCalculator(9, Duration.ofMinutes(1));
    private       TimestampedCheckpoint                     lastCheckpoint;

    public ProjectorStats(ProjectorId projectorId, OffsetDateTime now) {
        this.projectorId = requireNonNull(projectorId, "No projectorId provided");
        this.lastCheckpoint = new TimestampedCheckpoint(0, requireNonNull(now, "No now timestamp provided"));
    }

    public ProjectorId getProjectorId() {
        return projectorId;
    }

    public synchronized TimestampedCheckpoint getLastCheckpoint() {
        return lastCheckpoint;
    }

    public synchronized void trackProgress(long checkpoint, OffsetDateTime timestamp) {
        lastMinuteSamples.record(checkpoint, timestamp);
        last10MinuteSamples.record(checkpoint, timestamp);
        lastCheckpoint = new TimestampedCheckpoint(checkpoint, timestamp);
    }

    /**
     * The projection speed in transactions per second
     */
    public synchronized OptionalDouble getSpeed() {
        var speed = lastMinuteSamples.getWeightedSpeed();
        if (speed.isEmpty()) {
            return last10MinuteSamples.getWeightedSpeed();
        }
        return last10MinuteSamples.getWeightedSpeedIncluding(speed.getAsDouble());
    }

    /**
     * Estimate how long it takes before the projector reaches <code>targetCheckpoint</code>
     *
     * @return {@link Duration#ZERO} if the projector has already reached the checkpoint, {@link Optional#empty()} if the speed is unknown
     */
    public synchronized Optional<Duration> getTimeToReach(long targetCheckpoint) {
        if (targetCheckpoint <= lastCheckpoint.checkpoint) {
            return Optional.of(Duration.ZERO);
        }
        var speed = getSpeed();
        if (speed.isEmpty() || speed.getAsDouble() <= 0) {
            return Optional.empty();
        }
        var seconds = (targetCheckpoint - lastCheckpoint.checkpoint) / speed.getAsDouble();
        if (seconds > Long.MAX_VALUE) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofSeconds((long) seconds));
    }

    public void storeProperty(String key, String value, OffsetDateTime timestamp) {
        requireNonNull(key, "No property key provided");
        properties.put(key, new ProjectorProperty(value, timestamp));
    }

    public Map<String, ProjectorProperty> getProperties() {
        return Map.copyOf(properties);
    }

    public void logEvent(String body, OffsetDateTime timestamp) {
        synchronized (events) {
            events.addLast(new ProjectorEvent(body, timestamp));
            while (events.size() > MAX_NUMBER_OF_EVENTS) {
                events.removeFirst();
            }
        }
    }

    public List<ProjectorEvent> getEvents() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    @Override
    public String toString() {
        return "ProjectorStats{" +
                "projectorId=" + projectorId +
                ", lastCheckpoint=" + getLastCheckpoint() +
                '}';
    }
}
