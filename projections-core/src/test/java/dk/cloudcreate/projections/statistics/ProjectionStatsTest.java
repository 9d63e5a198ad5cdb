package dk.cloudcreate.projections.statistics;

import dk.cloudcreate.projections.common.types.ProjectorId;
import dk.cloudcreate.projections.test_data.MutableClock;
import org.junit.jupiter.api.*;

import java.time.*;

import static org.assertj.core.api.Assertions.*;

class ProjectionStatsTest {
    private static final ProjectorId CATALOG = ProjectorId.of("Catalog");

    private MutableClock    clock;
    private ProjectionStats stats;

    @BeforeEach
    void setup() {
        clock = new MutableClock(Instant.parse("2022-01-01T10:00:00Z"));
        stats = new ProjectionStats(clock);
    }

    @Test
    void the_last_checkpoint_is_tracked() {
        // When
        stats.trackProgress(CATALOG, 1000);

        // Then
        var lastCheckpoint = stats.get(CATALOG).getLastCheckpoint();
        assertThat(lastCheckpoint.checkpoint).isEqualTo(1000);
        assertThat(lastCheckpoint.timestamp).isEqualTo(OffsetDateTime.now(clock));
    }

    @Test
    void the_speed_is_unknown_until_a_sample_has_been_taken() {
        // When
        stats.trackProgress(CATALOG, 1000);

        // Then
        assertThat(stats.getSpeed(CATALOG)).isEmpty();
        assertThat(stats.getTimeToReach(CATALOG, 2000)).isEmpty();
    }

    @Test
    void the_speed_is_calculated_from_the_progress_over_time() {
        // Given
        stats.trackProgress(CATALOG, 1000);

        // When
        clock.advance(Duration.ofSeconds(10));
        stats.trackProgress(CATALOG, 2000);

        // Then
        assertThat(stats.getSpeed(CATALOG)).hasValue(100.0d);
        assertThat(stats.getTimeToReach(CATALOG, 3000)).contains(Duration.ofSeconds(10));
    }

    @Test
    void newer_samples_weigh_more_than_older_samples() {
        // Given
        stats.trackProgress(CATALOG, 0);
        clock.advance(Duration.ofSeconds(10));
        stats.trackProgress(CATALOG, 1000);

        // When
        clock.advance(Duration.ofSeconds(10));
        stats.trackProgress(CATALOG, 1500);

        // Then
        // (100 * 1 + 50 * 2) / 3
        assertThat(stats.getSpeed(CATALOG).getAsDouble()).isCloseTo(66.66d, within(0.01d));
    }

    @Test
    void a_checkpoint_that_has_been_reached_takes_no_time() {
        // Given
        stats.trackProgress(CATALOG, 1000);

        // Then
        assertThat(stats.getTimeToReach(CATALOG, 1000)).contains(Duration.ZERO);
        assertThat(stats.getTimeToReach(CATALOG, 10)).contains(Duration.ZERO);
    }

    @Test
    void properties_and_events_are_stored_per_projector() {
        // When
        stats.storeProperty(CATALOG, "entries", "10");
        stats.storeProperty(CATALOG, "entries", "11");
        stats.logEvent(CATALOG, "Restarted");
        stats.trackProgress(ProjectorId.of("Other"), 5);

        // Then
        assertThat(stats.get(CATALOG).getProperties()).containsOnlyKeys("entries");
        assertThat(stats.get(CATALOG).getProperties().get("entries").value).isEqualTo("11");
        assertThat(stats.get(CATALOG).getEvents()).extracting(event -> event.body).containsExactly("Restarted");
        assertThat(stats.getForAllProjectors()).hasSize(2);
    }

    @Test
    void only_the_most_recent_events_are_retained() {
        // When
        for (var i = 0; i < ProjectorStats.MAX_NUMBER_OF_EVENTS + 5; i++) {
            stats.logEvent(CATALOG, "event-" + i);
        }

        // Then
        var events = stats.get(CATALOG).getEvents();
        assertThat(events).hasSize(ProjectorStats.MAX_NUMBER_OF_EVENTS);
        assertThat(events.get(0).body).isEqualTo("event-5");
    }
}
