package dk.cloudcreate.projections.paging;

import dk.cloudcreate.projections.Transaction;
import org.junit.jupiter.api.Test;

import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.*;

class CheckpointCacheTest {
    @Test
    void capacity_must_be_larger_than_the_minimum_capacity() {
        assertThatThrownBy(() -> new CheckpointCache(CheckpointCache.MINIMUM_CAPACITY))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new CheckpointCache(CheckpointCache.MINIMUM_CAPACITY + 1).getCapacity()).isEqualTo(11);
    }

    @Test
    void eviction_target_is_90_percent_of_a_very_large_capacity() {
        // When
        var cache = new CheckpointCache(Integer.MAX_VALUE);

        // Then
        assertThat(cache.getTargetCountAfterEviction()).isEqualTo(1_932_735_282);
        assertThat(new CheckpointCache(300_000_000).getTargetCountAfterEviction()).isEqualTo(270_000_000);
    }

    @Test
    void transactions_can_be_followed_as_a_chain_of_checkpoints() {
        // Given
        var cache = new CheckpointCache(100);
        LongStream.rangeClosed(1, 5).forEach(checkpoint -> cache.set(checkpoint - 1, transaction(checkpoint)));

        // When
        var checkpoint = 0L;
        var count      = 0;
        var next       = cache.tryGet(checkpoint);
        while (next.isPresent()) {
            assertThat(next.get().checkpoint()).isEqualTo(checkpoint + 1);
            checkpoint = next.get().checkpoint();
            count++;
            next = cache.tryGet(checkpoint);
        }

        // Then
        assertThat(count).isEqualTo(5);
        assertThat(cache.tryGet(42)).isEmpty();
    }

    @Test
    void exceeding_the_capacity_evicts_the_least_recently_used_transactions_down_to_90_percent() {
        // Given
        var cache = new CheckpointCache(20);
        LongStream.range(0, 20).forEach(previousCheckpoint -> cache.set(previousCheckpoint, transaction(previousCheckpoint + 1)));
        LongStream.range(0, 5).forEach(cache::tryGet);

        // When
        cache.set(20, transaction(21));

        // Then
        assertThat(cache.size()).isEqualTo(18);
        assertThat(cache.tryGet(5)).isEmpty();
        assertThat(cache.tryGet(6)).isEmpty();
        assertThat(cache.tryGet(7)).isEmpty();
        LongStream.range(0, 5).forEach(previousCheckpoint -> assertThat(cache.tryGet(previousCheckpoint)).isPresent());
        LongStream.rangeClosed(8, 20).forEach(previousCheckpoint -> assertThat(cache.tryGet(previousCheckpoint)).isPresent());
    }

    @Test
    void the_size_never_exceeds_the_capacity() {
        var cache = new CheckpointCache(50);
        for (var previousCheckpoint = 0L; previousCheckpoint < 1000; previousCheckpoint++) {
            cache.set(previousCheckpoint, transaction(previousCheckpoint + 1));
            assertThat(cache.size()).isLessThanOrEqualTo(50);
        }
    }

    @Test
    void setting_an_existing_key_replaces_the_transaction() {
        var cache = new CheckpointCache(20);
        cache.set(1, transaction(2));
        cache.set(1, transaction(3));

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.tryGet(1)).hasValueSatisfying(transaction -> assertThat(transaction.checkpoint()).isEqualTo(3));
    }

    private static Transaction transaction(long checkpoint) {
        return Transaction.builder().checkpoint(checkpoint).event("Event-" + checkpoint).build();
    }
}
