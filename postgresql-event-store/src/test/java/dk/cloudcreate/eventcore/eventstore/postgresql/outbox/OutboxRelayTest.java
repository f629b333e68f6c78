package dk.cloudcreate.eventcore.eventstore.postgresql.outbox;

import dk.cloudcreate.eventcore.common.delivery.RedeliveryPolicy;
import dk.cloudcreate.eventcore.common.result.*;
import dk.cloudcreate.eventcore.common.types.SubscriberId;
import dk.cloudcreate.eventcore.eventstore.postgresql.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.bus.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.subscription.PersistedEventHandler;
import dk.cloudcreate.eventcore.eventstore.postgresql.test_data.*;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class OutboxRelayTest {
    private static final AggregateType ORDERS = AggregateType.of("Orders");

    private Jdbi                 jdbi;
    private PostgresqlEventStore eventStore;
    private RecordingEventBus    eventBus;
    private OutboxRelay          outboxRelay;

    @BeforeEach
    void setup() {
        jdbi = TestDatabase.createH2Jdbi();
        eventStore = PostgresqlEventStore.create(jdbi, EventStoreConfiguration.defaultConfiguration());
        eventBus = new RecordingEventBus();
    }

    @AfterEach
    void cleanup() {
        if (outboxRelay != null) {
            outboxRelay.stop();
        }
    }

    @Test
    void events_are_relayed_in_global_sequence_order_and_marked_dispatched() {
        // Given
        var order1 = OrderId.random();
        var order2 = OrderId.random();
        eventStore.append(ORDERS, order1, 0, List.of(new OrderEvent.OrderAdded(order1, CustomerId.random(), 1))).orElseThrow();
        eventStore.append(ORDERS, order2, 0, List.of(new OrderEvent.OrderAdded(order2, CustomerId.random(), 2))).orElseThrow();
        eventStore.append(ORDERS, order1, 1, List.of(new OrderEvent.OrderAccepted(order1))).orElseThrow();
        outboxRelay = new OutboxRelay(eventStore, eventBus, relayConfiguration(RedeliveryPolicy.fixedBackoff(Duration.ofMillis(50), 3)));

        // When
        outboxRelay.start();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(eventBus.publishedSequences()).containsExactly(1L, 2L, 3L));
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(outboxRelay.outboxRepository().entriesWithStatus(OutboxEntryStatus.DISPATCHED, 10)).hasSize(3));
        var entry = outboxRelay.outboxRepository().entry(1).orElseThrow();
        assertThat(entry.dispatchAttempts).isEqualTo(1);
        assertThat(entry.lastAttemptAt).isPresent();
        assertThat(outboxRelay.outboxRepository().lastRelayedSequence(OutboxRelayConfiguration.DEFAULT_RELAY_NAME)).isEqualTo(3);

        // And When
        var order3 = OrderId.random();
        eventStore.append(ORDERS, order3, 0, List.of(new OrderEvent.OrderAdded(order3, CustomerId.random(), 3))).orElseThrow();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(eventBus.publishedSequences()).containsExactly(1L, 2L, 3L, 4L));
    }

    @Test
    void a_batch_that_exhausts_the_redelivery_policy_is_marked_failed_and_still_retried() {
        // Given
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1),
                                                     new OrderEvent.OrderAccepted(orderId))).orElseThrow();
        eventBus.failPublishingOf(2);
        outboxRelay = new OutboxRelay(eventStore, eventBus, relayConfiguration(RedeliveryPolicy.fixedBackoff(Duration.ofMillis(20), 2)));

        // When
        outboxRelay.start();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> {
                    var entry = outboxRelay.outboxRepository().entry(2).orElseThrow();
                    assertThat(entry.status).isEqualTo(OutboxEntryStatus.FAILED);
                    assertThat(entry.dispatchAttempts).isEqualTo(3);
                    assertThat(entry.lastError).hasValueSatisfying(error -> assertThat(error).contains("Bus unavailable"));
                });
        assertThat(outboxRelay.outboxRepository().entry(1).orElseThrow().status).isEqualTo(OutboxEntryStatus.FAILED);
        // Retries resume at the failing event
        assertThat(eventBus.publishedSequences()).containsExactly(1L);

        // And When
        eventBus.stopFailing();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> {
                    var entry = outboxRelay.outboxRepository().entry(2).orElseThrow();
                    assertThat(entry.status).isEqualTo(OutboxEntryStatus.DISPATCHED);
                    assertThat(entry.dispatchAttempts).isGreaterThan(3);
                });
        assertThat(eventBus.publishedSequences()).containsExactly(1L, 2L);
    }

    @Test
    void a_restarted_relay_resumes_after_its_cursor() {
        // Given
        var order1 = OrderId.random();
        eventStore.append(ORDERS, order1, 0, List.of(new OrderEvent.OrderAdded(order1, CustomerId.random(), 1))).orElseThrow();
        outboxRelay = new OutboxRelay(eventStore, eventBus, relayConfiguration(RedeliveryPolicy.fixedBackoff(Duration.ofMillis(50), 3)));
        outboxRelay.start();
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(outboxRelay.outboxRepository().lastRelayedSequence(OutboxRelayConfiguration.DEFAULT_RELAY_NAME)).isEqualTo(1));
        outboxRelay.stop();

        var order2 = OrderId.random();
        eventStore.append(ORDERS, order2, 0, List.of(new OrderEvent.OrderAdded(order2, CustomerId.random(), 2))).orElseThrow();

        // When
        var restartedBus = new RecordingEventBus();
        outboxRelay = new OutboxRelay(eventStore, restartedBus, relayConfiguration(RedeliveryPolicy.fixedBackoff(Duration.ofMillis(50), 3)));
        outboxRelay.start();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(restartedBus.publishedSequences()).containsExactly(2L));
        assertThat(eventBus.publishedSequences()).containsExactly(1L);
    }

    @Test
    void a_relay_that_stops_after_publishing_but_before_advancing_its_cursor_publishes_the_batch_again() {
        // Given
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1))).orElseThrow();
        outboxRelay = new OutboxRelay(eventStore, eventBus, relayConfiguration(RedeliveryPolicy.fixedBackoff(Duration.ofMillis(50), 3)));
        outboxRelay.start();
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(outboxRelay.outboxRepository().lastRelayedSequence(OutboxRelayConfiguration.DEFAULT_RELAY_NAME)).isEqualTo(1));
        // The cursor update fails once event 3 has been acknowledged
        eventBus.afterPublishing(3, () -> renameTable(OutboxRelayConfiguration.DEFAULT_CURSOR_TABLE_NAME, "moved_relay_cursors"));

        // When
        eventStore.append(ORDERS, orderId, 1, List.of(new OrderEvent.ProductAddedToOrder(orderId, ProductId.random(), 1),
                                                     new OrderEvent.OrderAccepted(orderId))).orElseThrow();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(eventBus.publishedSequences()).containsExactly(1L, 2L, 3L));
        await().during(Duration.ofMillis(300))
               .atMost(Duration.ofSeconds(2))
               .untilAsserted(() -> assertThat(outboxRelay.outboxRepository().entry(2).orElseThrow().status).isNotEqualTo(OutboxEntryStatus.DISPATCHED));
        outboxRelay.stop();
        renameTable("moved_relay_cursors", OutboxRelayConfiguration.DEFAULT_CURSOR_TABLE_NAME);

        // And When
        var restartedBus = new RecordingEventBus();
        outboxRelay = new OutboxRelay(eventStore, restartedBus, relayConfiguration(RedeliveryPolicy.fixedBackoff(Duration.ofMillis(50), 3)));
        outboxRelay.start();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(restartedBus.publishedSequences()).containsExactly(2L, 3L));
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(outboxRelay.outboxRepository().lastRelayedSequence(OutboxRelayConfiguration.DEFAULT_RELAY_NAME)).isEqualTo(3));
        assertThat(outboxRelay.outboxRepository().entriesWithStatus(OutboxEntryStatus.DISPATCHED, 10)).hasSize(3);
    }

    @Test
    void a_publish_that_throws_is_treated_as_a_publish_failure() {
        // Given
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1))).orElseThrow();
        eventBus.throwWhilePublishing();
        outboxRelay = new OutboxRelay(eventStore, eventBus, relayConfiguration(RedeliveryPolicy.fixedBackoff(Duration.ofMillis(20), 0)));

        // When
        outboxRelay.start();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> {
                    var entry = outboxRelay.outboxRepository().entry(1).orElseThrow();
                    assertThat(entry.status).isEqualTo(OutboxEntryStatus.FAILED);
                    assertThat(entry.lastError).hasValueSatisfying(error -> assertThat(error).contains("global sequence 1"));
                });
        assertThat(outboxRelay.isStarted()).isTrue();
    }

    private static OutboxRelayConfiguration relayConfiguration(RedeliveryPolicy redeliveryPolicy) {
        return OutboxRelayConfiguration.defaultConfiguration()
                                       .withBatchSize(10)
                                       .withPollingInterval(Duration.ofMillis(50))
                                       .withPublishRedeliveryPolicy(redeliveryPolicy);
    }

    private void renameTable(String tableName, String newTableName) {
        jdbi.useHandle(handle -> handle.execute("ALTER TABLE " + tableName + " RENAME TO " + newTableName));
    }

    /**
     * Records published events. Publishing can be made to fail for one global sequence or to throw
     */
    private static class RecordingEventBus implements EventBus {
        private final List<PersistedEvent> published = new CopyOnWriteArrayList<>();
        private volatile long              failingSequence = -1;
        private volatile boolean           throwing;
        private final Map<Long, Runnable>  afterPublishing = new ConcurrentHashMap<>();

        /**
         * Run <code>action</code> once, right after the event with <code>globalSequence</code> has been acknowledged
         */
        void afterPublishing(long globalSequence, Runnable action) {
            afterPublishing.put(globalSequence, action);
        }

        void failPublishingOf(long globalSequence) {
            failingSequence = globalSequence;
        }

        void throwWhilePublishing() {
            throwing = true;
        }

        void stopFailing() {
            failingSequence = -1;
            throwing = false;
        }

        List<Long> publishedSequences() {
            return published.stream().map(PersistedEvent::globalSequence).collect(Collectors.toList());
        }

        @Override
        public Result<Void> publish(PersistedEvent event) {
            if (throwing) {
                throw new IllegalStateException("Connection reset");
            }
            if (event.globalSequence() == failingSequence) {
                return Result.failure(FailureKind.PUBLISH_ERROR, new PublishException("Bus unavailable"));
            }
            published.add(event);
            var action = afterPublishing.remove(event.globalSequence());
            if (action != null) {
                action.run();
            }
            return Result.ok();
        }

        @Override
        public void subscribe(TopicPattern topicPattern, PersistedEventHandler handler, SubscriberId subscriberId, SubscriptionOptions options) {
            throw new UnsupportedOperationException();
        }

        @Override
        public boolean unsubscribe(SubscriberId subscriberId) {
            return false;
        }

        @Override
        public boolean isSubscribed(SubscriberId subscriberId) {
            return false;
        }
    }
}
