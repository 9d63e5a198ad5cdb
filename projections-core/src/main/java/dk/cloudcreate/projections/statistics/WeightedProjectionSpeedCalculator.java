package dk.cloudcreate.projections.statistics;

import java.time.*;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Calculates the projection speed (transactions per second) as a weighted average over the most recent samples,
 * where newer samples weigh more than older samples.<br>
 * A sample is only taken when more than the configured threshold has passed since the previous sample.
 * Not thread safe, callers must synchronize access.
 */
public class WeightedProjectionSpeedCalculator {
    private final int            maxNumberOfSamples;
    private final Duration       threshold;
    private final Deque<Double>  samples = new ArrayDeque<>();
    private       OffsetDateTime lastSampleTimestamp;
    private       long           lastCheckpoint;

    public WeightedProjectionSpeedCalculator(int maxNumberOfSamples, Duration threshold) {
        requireTrue(maxNumberOfSamples > 0, "maxNumberOfSamples must be larger than 0");
        this.maxNumberOfSamples = maxNumberOfSamples;
        this.threshold = requireNonNull(threshold, "No threshold provided");
    }

    public void record(long checkpoint, OffsetDateTime timestamp) {
        requireNonNull(timestamp, "No timestamp provided");
        if (lastSampleTimestamp == null) {
            lastCheckpoint = checkpoint;
            lastSampleTimestamp = timestamp;
            return;
        }

        var interval = Duration.between(lastSampleTimestamp, timestamp);
        if (interval.compareTo(threshold) > 0) {
            var delta = checkpoint - lastCheckpoint;
            samples.addLast(delta / (interval.toMillis() / 1000.0d));
            lastCheckpoint = checkpoint;
            lastSampleTimestamp = timestamp;
            while (samples.size() > maxNumberOfSamples) {
                samples.removeFirst();
            }
        }
    }

    public OptionalDouble getWeightedSpeed() {
        return weightedAverage(samples);
    }

    /**
     * The weighted speed if <code>sample</code> was added as the most recent sample
     */
    public OptionalDouble getWeightedSpeedIncluding(double sample) {
        var effectiveSamples = new ArrayList<>(samples);
        effectiveSamples.add(sample);
        return weightedAverage(effectiveSamples);
    }

    private static OptionalDouble weightedAverage(Collection<Double> effectiveSamples) {
        var weightedSum = 0.0d;
        var weights     = 0;
        var weight      = 0;
        for (var sample : effectiveSamples) {
            weight++;
            weights += weight;
            weightedSum += sample * weight;
        }
        return weights == 0 ? OptionalDouble.empty() : OptionalDouble.of(weightedSum / weights);
    }
}
