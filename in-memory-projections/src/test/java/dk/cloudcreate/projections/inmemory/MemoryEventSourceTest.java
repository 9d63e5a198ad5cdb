package dk.cloudcreate.projections.inmemory;

import dk.cloudcreate.projections.Transaction;
import dk.cloudcreate.projections.common.AlreadyDisposedException;
import dk.cloudcreate.projections.common.types.SubscriptionId;
import dk.cloudcreate.projections.subscription.*;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class MemoryEventSourceTest {
    private final List<Subscription> subscriptions = new ArrayList<>();

    @AfterEach
    void cleanup() {
        subscriptions.forEach(Subscription::close);
    }

    @Test
    void transactions_without_a_checkpoint_get_the_next_checkpoint() {
        var eventSource = new MemoryEventSource();

        var first  = eventSource.write("Event-1");
        var second = eventSource.write("Event-2", "Event-3");

        assertThat(first.checkpoint()).isEqualTo(1);
        assertThat(first.id()).isEqualTo("1");
        assertThat(second.checkpoint()).isEqualTo(2);
        assertThat(second.events()).hasSize(2);
        assertThat(eventSource.getLastCheckpoint()).isEqualTo(2);
    }

    @Test
    void a_transaction_with_an_explicit_checkpoint_moves_the_last_checkpoint() {
        var eventSource = new MemoryEventSource();

        eventSource.write(Transaction.builder().checkpoint(100).id("explicit").event("Event-1").build());
        var next = eventSource.write("Event-2");

        assertThat(eventSource.getHistory()).extracting(Transaction::id).containsExactly("explicit", "101");
        assertThat(next.checkpoint()).isEqualTo(101);
    }

    @Test
    void headers_are_written_with_the_event() {
        var eventSource = new MemoryEventSource();

        var transaction = eventSource.writeWithHeaders("Event-1", Map.of("user", "jane"));

        assertThat(transaction.events().get(0).headers()).containsEntry("user", "jane");
    }

    @Test
    void a_subscription_only_receives_transactions_after_its_checkpoint() throws Exception {
        // Given
        var eventSource = new MemoryEventSource();
        eventSource.write(Transaction.builder().checkpoint(123).event("Event-1").build(),
                          Transaction.builder().checkpoint(456).event("Event-2").build());
        var received = new CopyOnWriteArrayList<Long>();

        // When
        var subscription = subscribe(eventSource, Optional.of(123L), received);

        // Then
        ((MemorySubscription) subscription).waitUntilCheckpoint(456, Duration.ofSeconds(5));
        assertThat(received).containsExactly(456L);
    }

    @Test
    void replayed_transactions_are_delivered_in_checkpoint_order() throws Exception {
        // Given
        var eventSource = new MemoryEventSource();
        var received    = new CopyOnWriteArrayList<Long>();
        var subscription = (MemorySubscription) subscribe(eventSource, Optional.of(10L), received);

        // When
        eventSource.write(Transaction.builder().checkpoint(10).event("Event-0").build(),
                          Transaction.builder().checkpoint(11).event("Event-1").build(),
                          Transaction.builder().checkpoint(13).event("Event-2").build(),
                          Transaction.builder().checkpoint(13).event("Event-3").build(),
                          Transaction.builder().checkpoint(17).event("Event-4").build());

        // Then
        subscription.waitUntilCheckpoint(17, Duration.ofSeconds(5));
        assertThat(received).containsExactly(11L, 13L, 13L, 17L);
        assertThat(received).isSorted();
    }

    @Test
    void transactions_are_delivered_in_batches() throws Exception {
        // Given
        var eventSource = new MemoryEventSource(3);
        for (var i = 0; i < 7; i++) {
            eventSource.write("Event-" + i);
        }
        var batchSizes = new CopyOnWriteArrayList<Integer>();

        // When
        var subscription = (MemorySubscription) eventSource.subscribe(Optional.empty(), (transactions, info) -> batchSizes.add(transactions.size()));
        subscriptions.add(subscription);

        // Then
        subscription.waitUntilCheckpoint(7, Duration.ofSeconds(5));
        assertThat(batchSizes).containsExactly(3, 3, 1);
    }

    @Test
    void a_subscription_receives_transactions_written_after_it_was_started() throws Exception {
        // Given
        var eventSource  = new MemoryEventSource();
        var received     = new CopyOnWriteArrayList<Long>();
        var subscription = (MemorySubscription) subscribe(eventSource, Optional.empty(), received);

        // When
        eventSource.write("Event-1");
        eventSource.write("Event-2");

        // Then
        subscription.waitUntilCheckpoint(2, Duration.ofSeconds(5));
        assertThat(received).containsExactly(1L, 2L);
    }

    @Test
    void waiting_for_a_checkpoint_that_is_never_reached_times_out() {
        var eventSource  = new MemoryEventSource();
        var subscription = (MemorySubscription) subscribe(eventSource, Optional.empty(), new CopyOnWriteArrayList<>());

        assertThatThrownBy(() -> subscription.waitUntilCheckpoint(5, Duration.ofMillis(100)))
                .isInstanceOf(TimeoutException.class);
    }

    @Test
    void waiting_for_a_checkpoint_fails_as_soon_as_the_subscription_is_closed() throws Exception {
        // Given
        var eventSource  = new MemoryEventSource();
        var subscription = (MemorySubscription) subscribe(eventSource, Optional.empty(), new CopyOnWriteArrayList<>());
        var executor     = Executors.newSingleThreadExecutor();
        try {
            var waiting = executor.submit(() -> {
                subscription.waitUntilCheckpoint(5, Duration.ofSeconds(30));
                return null;
            });

            // When
            subscription.close();

            // Then
            assertThatThrownBy(() -> waiting.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(AlreadyDisposedException.class);
            assertThatThrownBy(() -> subscription.waitUntilCheckpoint(5, Duration.ofSeconds(30)))
                    .isInstanceOf(AlreadyDisposedException.class);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void subscribing_ahead_of_the_last_checkpoint_signals_no_such_checkpoint() {
        // Given
        var eventSource = new MemoryEventSource();
        eventSource.write("Event-1");
        var noSuchCheckpoint = new AtomicBoolean();

        // When
        subscriptions.add(eventSource.subscribe(Optional.of(5L), new TransactionSubscriber() {
            @Override
            public void handleTransactions(List<Transaction> transactions, SubscriptionInfo info) {
            }

            @Override
            public void noSuchCheckpoint(SubscriptionInfo info) {
                noSuchCheckpoint.set(true);
            }
        }));

        // Then
        await().atMost(Duration.ofSeconds(5)).untilTrue(noSuchCheckpoint);
    }

    @Test
    void a_closed_subscription_is_no_longer_registered() {
        var eventSource    = new MemoryEventSource();
        var subscriptionId = SubscriptionId.of("catalog");
        var subscription   = eventSource.subscribe(Optional.empty(), (transactions, info) -> {
        }, subscriptionId);
        assertThat(eventSource.hasSubscriptionForId(subscriptionId)).isTrue();

        subscription.close();

        assertThat(subscription.isActive()).isFalse();
        assertThat(eventSource.hasSubscriptionForId(subscriptionId)).isFalse();
    }

    private Subscription subscribe(MemoryEventSource eventSource, Optional<Long> lastProcessedCheckpoint, List<Long> received) {
        var subscription = eventSource.subscribe(lastProcessedCheckpoint,
                                                 (transactions, info) -> received.addAll(transactions.stream()
                                                                                                     .map(Transaction::checkpoint)
                                                                                                     .collect(Collectors.toList())));
        subscriptions.add(subscription);
        return subscription;
    }
}
