package dk.cloudcreate.eventcore.bus.postgresql;

import dk.cloudcreate.eventcore.common.delivery.RedeliveryPolicy;
import dk.cloudcreate.eventcore.common.result.FailureKind;
import dk.cloudcreate.eventcore.common.types.SubscriberId;
import dk.cloudcreate.eventcore.eventstore.postgresql.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.bus.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.outbox.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.subscription.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.test_data.*;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

/**
 * Event bus behaviour shared by the H2 backed {@link PostgresqlEventBusTest} and the PostgreSQL backed {@link PostgresqlEventBusIT}
 */
abstract class AbstractPostgresqlEventBusTest {
    protected static final AggregateType ORDERS    = AggregateType.of("Orders");
    protected static final AggregateType CUSTOMERS = AggregateType.of("Customers");

    protected Jdbi                 jdbi;
    protected PostgresqlEventStore eventStore;
    protected PostgresqlEventBus   eventBus;
    private   PostgresqlEventBus   restartedEventBus;
    private   OutboxRelay          outboxRelay;

    protected abstract Jdbi createJdbi();

    @BeforeEach
    void setupEventBus() {
        jdbi = createJdbi();
        eventStore = PostgresqlEventStore.create(jdbi, EventStoreConfiguration.defaultConfiguration());
        eventBus = new PostgresqlEventBus(eventStore, busConfiguration());
    }

    @AfterEach
    void cleanup() {
        if (outboxRelay != null) {
            outboxRelay.stop();
        }
        eventBus.stop();
        if (restartedEventBus != null) {
            restartedEventBus.stop();
        }
    }

    private static PostgresqlEventBusConfiguration busConfiguration() {
        return PostgresqlEventBusConfiguration.defaultConfiguration().withPollingInterval(Duration.ofMillis(50));
    }

    private static SubscriptionOptions fastRetries(int maximumNumberOfRedeliveries) {
        return SubscriptionOptions.defaultOptions()
                                  .withRedeliveryPolicy(RedeliveryPolicy.fixedBackoff(Duration.ofMillis(10), maximumNumberOfRedeliveries));
    }

    @Test
    void events_are_delivered_in_global_sequence_order_to_every_matching_subscriber() {
        // Given
        var orderHandler    = new RecordingEventHandler();
        var allHandler      = new RecordingEventHandler();
        var customerHandler = new RecordingEventHandler();
        eventBus.subscribe(TopicPattern.forAggregateType(ORDERS), orderHandler, SubscriberId.of("OrderHandler"));
        eventBus.subscribe(TopicPattern.all(), allHandler, SubscriberId.of("AllHandler"));
        eventBus.subscribe(TopicPattern.forAggregateType(CUSTOMERS), customerHandler, SubscriberId.of("CustomerHandler"));
        eventBus.start();
        var order1 = OrderId.random();
        var order2 = OrderId.random();
        eventStore.append(ORDERS, order1, 0, List.of(new OrderEvent.OrderAdded(order1, CustomerId.random(), 1))).orElseThrow();
        eventStore.append(ORDERS, order2, 0, List.of(new OrderEvent.OrderAdded(order2, CustomerId.random(), 2))).orElseThrow();
        eventStore.append(ORDERS, order1, 1, List.of(new OrderEvent.ProductAddedToOrder(order1, ProductId.random(), 2))).orElseThrow();
        eventStore.append(ORDERS, order2, 1, List.of(new OrderEvent.OrderAccepted(order2))).orElseThrow();
        eventStore.append(ORDERS, order1, 2, List.of(new OrderEvent.OrderAccepted(order1))).orElseThrow();

        // When
        publishAll();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> {
                    assertThat(orderHandler.handledSequences()).containsExactly(1L, 2L, 3L, 4L, 5L);
                    assertThat(allHandler.handledSequences()).containsExactly(1L, 2L, 3L, 4L, 5L);
                });
        assertThat(orderHandler.handled.stream()
                                       .filter(event -> event.aggregateId().equals(order1.toString()))
                                       .map(PersistedEvent::aggregateVersion)
                                       .collect(Collectors.toList())).containsExactly(1L, 2L, 3L);
        assertThat(customerHandler.handled).isEmpty();
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(eventBus.subscriptionManager().checkpoint(SubscriberId.of("OrderHandler")).orElseThrow().lastDispatchedSequence).isEqualTo(5));
        assertThat(eventBus.storage().pendingDeliveries(SubscriberId.of("OrderHandler"))).isZero();
    }

    @Test
    void an_event_type_subscriber_only_receives_events_of_that_type() {
        // Given
        var handler = new RecordingEventHandler();
        eventBus.subscribe(TopicPattern.forEventType(OrderEvent.OrderAccepted.class), handler, SubscriberId.of("AcceptedOrders"));
        eventBus.start();
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1),
                                                     new OrderEvent.OrderAccepted(orderId))).orElseThrow();

        // When
        publishAll();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(2L));
    }

    @Test
    void publishing_the_same_event_twice_delivers_it_once() {
        // Given
        var handler = new RecordingEventHandler();
        eventBus.subscribe(TopicPattern.forAggregateType(ORDERS), handler, SubscriberId.of("OrderHandler"));
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1))).orElseThrow();
        var event = eventStore.readAll(1, 1).findFirst().orElseThrow();

        // When
        assertThat(eventBus.publish(event).isSuccess()).isTrue();
        assertThat(eventBus.publish(event).isSuccess()).isTrue();

        // Then
        assertThat(eventBus.storage().pendingDeliveries(SubscriberId.of("OrderHandler"))).isEqualTo(1);

        // And When
        eventBus.start();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(1L));
        // Already processed events are not queued again
        assertThat(eventBus.publish(event).isSuccess()).isTrue();
        assertThat(eventBus.storage().pendingDeliveries(SubscriberId.of("OrderHandler"))).isZero();
    }

    @Test
    void a_poison_event_is_dead_lettered_once_the_redelivery_policy_is_exhausted_and_delivery_continues() {
        // Given
        var subscriberId = SubscriberId.of("PoisonedHandler");
        var handler      = new RecordingEventHandler().failFor(2L);
        eventBus.subscribe(TopicPattern.forAggregateType(ORDERS), handler, subscriberId, fastRetries(2));
        eventBus.start();
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1),
                                                     new OrderEvent.ProductAddedToOrder(orderId, ProductId.random(), 1),
                                                     new OrderEvent.OrderAccepted(orderId))).orElseThrow();

        // When
        publishAll();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(1L, 3L));
        assertThat(handler.attemptsFor(2)).isEqualTo(3);
        var deadLetters = eventBus.subscriptionManager().deadLetters(subscriberId);
        assertThat(deadLetters).hasSize(1);
        var deadLetter = deadLetters.get(0);
        assertThat(deadLetter.globalSequence).isEqualTo(2);
        assertThat(deadLetter.aggregateId).isEqualTo(orderId.toString());
        assertThat(deadLetter.deliveryAttempts).isEqualTo(3);
        assertThat(deadLetter.lastError).hasValueSatisfying(error -> assertThat(error).contains("Can't handle event with global sequence 2"));
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(eventBus.subscriptionManager().checkpoint(subscriberId).orElseThrow().lastDispatchedSequence).isEqualTo(3));
        var metrics = eventBus.subscriptionManager().metrics(subscriberId).orElseThrow();
        assertThat(metrics.deadLetters()).isEqualTo(1);
        assertThat(metrics.failures()).isEqualTo(3);

        // And When
        handler.stopFailing();
        var redelivered = eventBus.subscriptionManager().redeliverDeadLetter(subscriberId, 2);

        // Then
        assertThat(redelivered.isSuccess()).isTrue();
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(1L, 3L, 2L));
        assertThat(eventBus.subscriptionManager().deadLetters(subscriberId)).isEmpty();
        assertThat(eventBus.subscriptionManager().checkpoint(subscriberId).orElseThrow().lastDispatchedSequence).isEqualTo(3);
        assertThat(eventBus.subscriptionManager().redeliverDeadLetter(subscriberId, 2).isFailureOfKind(FailureKind.NOT_FOUND)).isTrue();
    }

    @Test
    void a_failing_event_is_retried_until_it_succeeds_before_later_events_are_delivered() {
        // Given
        var subscriberId = SubscriberId.of("FlakyHandler");
        var handler      = new RecordingEventHandler().failFor(1L);
        eventBus.subscribe(TopicPattern.forAggregateType(ORDERS), handler, subscriberId,
                           SubscriptionOptions.defaultOptions().withRedeliveryPolicy(RedeliveryPolicy.fixedBackoff(Duration.ofMillis(100), 50)));
        eventBus.start();
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1),
                                                     new OrderEvent.OrderAccepted(orderId))).orElseThrow();
        publishAll();
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.attemptsFor(1)).isGreaterThanOrEqualTo(2));

        // When
        handler.stopFailing();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(1L, 2L));
        assertThat(eventBus.subscriptionManager().deadLetters(subscriberId)).isEmpty();
    }

    @Test
    void a_slow_subscriber_does_not_delay_other_subscribers() throws InterruptedException {
        // Given
        var slowHandler = new RecordingEventHandler();
        var fastHandler = new RecordingEventHandler();
        var release     = slowHandler.blockUntilReleased();
        eventBus.subscribe(TopicPattern.all(), slowHandler, SubscriberId.of("SlowHandler"));
        eventBus.subscribe(TopicPattern.all(), fastHandler, SubscriberId.of("FastHandler"));
        eventBus.start();
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1),
                                                     new OrderEvent.OrderAccepted(orderId))).orElseThrow();

        try {
            // When
            publishAll();

            // Then
            waitAtMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(fastHandler.handledSequences()).containsExactly(1L, 2L));
            waitAtMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(slowHandler.attemptsFor(1)).isEqualTo(1));
            assertThat(slowHandler.handled).isEmpty();
        } finally {
            release.countDown();
        }

        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(slowHandler.handledSequences()).containsExactly(1L, 2L));
    }

    @Test
    void a_handler_invocation_that_exceeds_the_handler_timeout_counts_as_a_failure() {
        // Given
        var subscriberId = SubscriberId.of("HangingHandler");
        var handler      = new RecordingEventHandler().delayEachInvocation(Duration.ofSeconds(2));
        eventBus.subscribe(TopicPattern.all(),
                           handler,
                           subscriberId,
                           fastRetries(0).withHandlerTimeout(Duration.ofMillis(200)));
        eventBus.start();
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1))).orElseThrow();

        // When
        publishAll();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(eventBus.subscriptionManager().deadLetters(subscriberId)).hasSize(1));
        var deadLetter = eventBus.subscriptionManager().deadLetters(subscriberId).get(0);
        assertThat(deadLetter.deliveryAttempts).isEqualTo(1);
        assertThat(deadLetter.lastError).hasValueSatisfying(error -> assertThat(error).contains("didn't complete within"));
        assertThat(handler.handled).isEmpty();
    }

    @Test
    void a_restarted_subscriber_resumes_after_its_checkpoint() {
        // Given
        var subscriberId = SubscriberId.of("OrderProjection");
        var handler      = new RecordingEventHandler();
        eventBus.subscribe(TopicPattern.forAggregateType(ORDERS), handler, subscriberId);
        eventBus.start();
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1),
                                                     new OrderEvent.ProductAddedToOrder(orderId, ProductId.random(), 1))).orElseThrow();
        publishAll();
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(eventBus.subscriptionManager().checkpoint(subscriberId).orElseThrow().lastDispatchedSequence).isEqualTo(2));
        eventBus.stop();

        // Events are published while the subscriber is down
        eventStore.append(ORDERS, orderId, 2, List.of(new OrderEvent.ProductAddedToOrder(orderId, ProductId.random(), 2),
                                                     new OrderEvent.OrderAccepted(orderId))).orElseThrow();
        publishAll();

        // When
        var restartedHandler = new RecordingEventHandler();
        restartedEventBus = new PostgresqlEventBus(eventStore, busConfiguration());
        restartedEventBus.subscribe(TopicPattern.forAggregateType(ORDERS), restartedHandler, subscriberId);
        restartedEventBus.start();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(restartedHandler.handledSequences()).containsExactly(3L, 4L));
        assertThat(handler.handledSequences()).containsExactly(1L, 2L);
    }

    @Test
    void a_paused_subscriber_receives_no_events_until_it_is_resumed() {
        // Given
        var subscriberId = SubscriberId.of("PausedHandler");
        var handler      = new RecordingEventHandler();
        eventBus.subscribe(TopicPattern.all(), handler, subscriberId);
        eventBus.start();
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1))).orElseThrow();
        publishAll();
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(1L));

        // When
        assertThat(eventBus.subscriptionManager().pause(subscriberId).isSuccess()).isTrue();
        eventStore.append(ORDERS, orderId, 1, List.of(new OrderEvent.OrderAccepted(orderId))).orElseThrow();
        publishAll();

        // Then
        assertThat(eventBus.subscriptionManager().checkpoint(subscriberId).orElseThrow().status).isEqualTo(SubscriptionStatus.PAUSED);
        await().during(Duration.ofMillis(300))
               .atMost(Duration.ofSeconds(2))
               .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(1L));
        assertThat(eventBus.storage().pendingDeliveries(subscriberId)).isEqualTo(1);

        // And When
        assertThat(eventBus.subscriptionManager().resume(subscriberId).isSuccess()).isTrue();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(1L, 2L));
        assertThat(eventBus.subscriptionManager().checkpoint(subscriberId).orElseThrow().status).isEqualTo(SubscriptionStatus.ACTIVE);
    }

    @Test
    void replay_resets_the_checkpoint_notifies_the_handler_and_delivers_the_events_again() {
        // Given
        var subscriberId = SubscriberId.of("ReplayedHandler");
        var handler      = new RecordingEventHandler();
        eventBus.subscribe(TopicPattern.forAggregateType(ORDERS), handler, subscriberId);
        eventBus.start();
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1),
                                                     new OrderEvent.ProductAddedToOrder(orderId, ProductId.random(), 1),
                                                     new OrderEvent.OrderAccepted(orderId))).orElseThrow();
        publishAll();
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(1L, 2L, 3L));

        // When
        var result = eventBus.subscriptionManager().replay(subscriberId, 2);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(handler.resets).containsExactly(2L);
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(1L, 2L, 3L, 2L, 3L));
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(eventBus.subscriptionManager().checkpoint(subscriberId).orElseThrow().lastDispatchedSequence).isEqualTo(3));
    }

    @Test
    void replay_of_a_subscriber_that_is_not_subscribed_in_this_process_queues_the_events_again() {
        // Given
        var subscriberId = SubscriberId.of("RemoteHandler");
        var handler      = new RecordingEventHandler();
        eventBus.subscribe(TopicPattern.forAggregateType(ORDERS), handler, subscriberId);
        eventBus.start();
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1),
                                                     new OrderEvent.OrderAccepted(orderId))).orElseThrow();
        publishAll();
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(1L, 2L));
        assertThat(eventBus.unsubscribe(subscriberId)).isTrue();
        assertThat(eventBus.isSubscribed(subscriberId)).isFalse();

        // When
        var result = eventBus.subscriptionManager().replay(subscriberId, 1);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(handler.resets).isEmpty();
        assertThat(eventBus.subscriptionManager().checkpoint(subscriberId).orElseThrow().lastDispatchedSequence).isZero();
        assertThat(eventBus.storage().pendingDeliveries(subscriberId)).isEqualTo(2);

        // And When
        eventBus.subscribe(TopicPattern.forAggregateType(ORDERS), handler, subscriberId);

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(1L, 2L, 1L, 2L));
    }

    @Test
    void replay_from_a_sequence_above_the_pending_deliveries_keeps_the_lower_deliveries() {
        // Given
        var subscriberId = SubscriberId.of("LaggingHandler");
        var handler      = new RecordingEventHandler();
        eventBus.subscribe(TopicPattern.forAggregateType(ORDERS), handler, subscriberId);
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1),
                                                     new OrderEvent.ProductAddedToOrder(orderId, ProductId.random(), 1),
                                                     new OrderEvent.OrderAccepted(orderId))).orElseThrow();
        publishAll();
        assertThat(eventBus.storage().pendingDeliveries(subscriberId)).isEqualTo(3);

        // When
        var result = eventBus.subscriptionManager().replay(subscriberId, 3);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(handler.resets).containsExactly(3L);
        assertThat(eventBus.subscriptionManager().checkpoint(subscriberId).orElseThrow().lastDispatchedSequence).isZero();
        assertThat(eventBus.storage().pendingDeliveries(subscriberId)).isEqualTo(3);

        // And When
        eventBus.start();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(1L, 2L, 3L));
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(eventBus.subscriptionManager().checkpoint(subscriberId).orElseThrow().lastDispatchedSequence).isEqualTo(3));
    }

    @Test
    void history_that_fails_to_be_queued_is_delivered_before_newer_events() {
        // Given
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1),
                                                     new OrderEvent.ProductAddedToOrder(orderId, ProductId.random(), 1))).orElseThrow();
        var failingEventStore = new FailingHistoryReadEventStore(eventStore, 2);
        restartedEventBus = new PostgresqlEventBus(failingEventStore, busConfiguration());
        var subscriberId = SubscriberId.of("HistoryHandler");
        var handler      = new RecordingEventHandler();
        restartedEventBus.subscribe(TopicPattern.forAggregateType(ORDERS), handler, subscriberId);
        eventStore.append(ORDERS, orderId, 2, List.of(new OrderEvent.OrderAccepted(orderId))).orElseThrow();
        eventStore.readAll(3, 1).forEach(event -> restartedEventBus.publish(event).orElseThrow());

        // When
        restartedEventBus.start();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(1L, 2L, 3L));
        assertThat(failingEventStore.failedReads()).isEqualTo(2);
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(restartedEventBus.subscriptionManager().checkpoint(subscriberId).orElseThrow().lastDispatchedSequence).isEqualTo(3));
    }

    @Test
    void a_timed_out_invocation_that_ignores_the_interrupt_is_never_overlapped_by_another_invocation() {
        // Given
        var subscriberId = SubscriberId.of("StuckHandler");
        var handler      = new RecordingEventHandler();
        var release      = handler.blockIgnoringInterruptsUntilReleased();
        eventBus.subscribe(TopicPattern.all(),
                           handler,
                           subscriberId,
                           fastRetries(3).withHandlerTimeout(Duration.ofMillis(200)));
        eventBus.start();
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1),
                                                     new OrderEvent.OrderAccepted(orderId))).orElseThrow();

        // When
        publishAll();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(eventBus.subscriptionManager().checkpoint(subscriberId).orElseThrow().status).isEqualTo(SubscriptionStatus.FAILED));
        await().during(Duration.ofMillis(300))
               .atMost(Duration.ofSeconds(2))
               .untilAsserted(() -> {
                   assertThat(handler.attemptsFor(1)).isEqualTo(1);
                   assertThat(handler.attemptsFor(2)).isZero();
               });
        assertThat(eventBus.storage().pendingDeliveries(subscriberId)).isEqualTo(2);

        // And When
        release.countDown();
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(1L));
        assertThat(eventBus.subscriptionManager().resume(subscriberId).isSuccess()).isTrue();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(handler.handledSequences()).containsExactly(1L, 1L, 2L));
        assertThat(handler.maxConcurrentInvocations()).isEqualTo(1);
        assertThat(eventBus.subscriptionManager().checkpoint(subscriberId).orElseThrow().status).isEqualTo(SubscriptionStatus.ACTIVE);
    }

    @Test
    void subscribing_twice_with_the_same_subscriber_id_is_rejected() {
        // Given
        var subscriberId = SubscriberId.of("OrderHandler");
        eventBus.subscribe(TopicPattern.forAggregateType(ORDERS), new RecordingEventHandler(), subscriberId);

        // When / Then
        assertThatThrownBy(() -> eventBus.subscribe(TopicPattern.all(), new RecordingEventHandler(), subscriberId))
                .isInstanceOf(EventBusException.class)
                .hasMessageContaining("already subscribed");
        assertThat(eventBus.subscriptionManager().checkpoint(subscriberId).orElseThrow().topicPattern)
                .isEqualTo(TopicPattern.forAggregateType(ORDERS));
    }

    @Test
    void a_new_subscriber_starting_at_latest_only_receives_events_appended_after_it_subscribed() {
        // Given
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1),
                                                     new OrderEvent.ProductAddedToOrder(orderId, ProductId.random(), 1))).orElseThrow();
        var latestHandler    = new RecordingEventHandler();
        var beginningHandler = new RecordingEventHandler();
        eventBus.subscribe(TopicPattern.all(), latestHandler, SubscriberId.of("LatestHandler"),
                           SubscriptionOptions.defaultOptions().withStartPosition(StartPosition.LATEST));
        eventBus.subscribe(TopicPattern.all(), beginningHandler, SubscriberId.of("BeginningHandler"),
                           SubscriptionOptions.defaultOptions().withStartPosition(StartPosition.BEGINNING));
        eventBus.start();
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(beginningHandler.handledSequences()).containsExactly(1L, 2L));

        // When
        eventStore.append(ORDERS, orderId, 2, List.of(new OrderEvent.OrderAccepted(orderId))).orElseThrow();
        publishAll();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> {
                    assertThat(latestHandler.handledSequences()).containsExactly(3L);
                    assertThat(beginningHandler.handledSequences()).containsExactly(1L, 2L, 3L);
                });
    }

    @Test
    void operations_on_an_unknown_subscriber_fail_with_not_found() {
        var unknown = SubscriberId.of("Unknown");

        assertThat(eventBus.subscriptionManager().checkpoint(unknown)).isEmpty();
        assertThat(eventBus.subscriptionManager().pause(unknown).isFailureOfKind(FailureKind.NOT_FOUND)).isTrue();
        assertThat(eventBus.subscriptionManager().resume(unknown).isFailureOfKind(FailureKind.NOT_FOUND)).isTrue();
        assertThat(eventBus.subscriptionManager().replay(unknown, 1).isFailureOfKind(FailureKind.NOT_FOUND)).isTrue();
        assertThat(eventBus.subscriptionManager().redeliverDeadLetter(unknown, 1).isFailureOfKind(FailureKind.NOT_FOUND)).isTrue();
        assertThat(eventBus.subscriptionManager().deadLetters(unknown)).isEmpty();
        assertThat(eventBus.subscriptionManager().metrics(unknown)).isEmpty();
        assertThat(eventBus.unsubscribe(unknown)).isFalse();
        assertThatThrownBy(() -> eventBus.subscriptionManager().replay(unknown, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void publish_returns_a_publish_error_when_the_event_can_not_be_queued() {
        // Given
        eventBus.subscribe(TopicPattern.all(), new RecordingEventHandler(), SubscriberId.of("OrderHandler"));
        jdbi.useHandle(handle -> handle.execute("DROP TABLE " + PostgresqlEventBusConfiguration.DEFAULT_DELIVERIES_TABLE_NAME));
        var orderId = OrderId.random();

        // When
        var result = eventBus.publish(TestEvents.persistedEvent(ORDERS, orderId, 1, 1, new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1)));

        // Then
        assertThat(result.isFailureOfKind(FailureKind.PUBLISH_ERROR)).isTrue();
        assertThat(result.failure().cause()).isInstanceOf(PublishException.class);
        assertThat(result.failure().kind().isRetryable()).isTrue();
    }

    @Test
    void a_delivery_for_an_event_missing_from_the_event_store_marks_the_subscription_failed() {
        // Given
        var subscriberId = SubscriberId.of("OrderHandler");
        var handler      = new RecordingEventHandler();
        eventBus.subscribe(TopicPattern.forAggregateType(ORDERS), handler, subscriberId);
        eventBus.start();
        var orderId = OrderId.random();

        // When
        eventBus.publish(TestEvents.persistedEvent(ORDERS, orderId, 1, 42, new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1))).orElseThrow();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(eventBus.subscriptionManager().checkpoint(subscriberId).orElseThrow().status).isEqualTo(SubscriptionStatus.FAILED));
        assertThat(handler.attempts).isEmpty();
        assertThat(eventBus.storage().pendingDeliveries(subscriberId)).isEqualTo(1);
    }

    @Test
    void metrics_are_recorded_per_subscriber() {
        // Given
        var subscriberId = SubscriberId.of("MeasuredHandler");
        var handler      = new RecordingEventHandler();
        eventBus.subscribe(TopicPattern.all(), handler, subscriberId);
        eventBus.start();
        var orderId = OrderId.random();
        eventStore.append(ORDERS, orderId, 0, List.of(new OrderEvent.OrderAdded(orderId, CustomerId.random(), 1),
                                                     new OrderEvent.OrderAccepted(orderId))).orElseThrow();

        // When
        publishAll();

        // Then
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(eventBus.subscriptionManager().metrics(subscriberId).orElseThrow().successes()).isEqualTo(2));
        var metrics = eventBus.subscriptionManager().metrics(subscriberId).orElseThrow();
        assertThat(metrics.invocations()).isEqualTo(2);
        assertThat(metrics.failures()).isZero();
        assertThat(metrics.deadLetters()).isZero();
        assertThat(metrics.lastInvokedAt()).isPresent();
        assertThat(metrics.maxProcessingTime()).isGreaterThanOrEqualTo(metrics.minProcessingTime());
    }

    @Test
    void events_appended_in_a_unit_of_work_reach_a_projection_through_the_outbox_relay() {
        // Given
        var projection = new OrderProjection();
        eventBus.subscribe(TopicPattern.forAggregateType(ORDERS), projection, SubscriberId.of("OrderProjection"));
        eventBus.start();
        outboxRelay = new OutboxRelay(eventStore,
                                      eventBus,
                                      OutboxRelayConfiguration.defaultConfiguration()
                                                              .withBatchSize(10)
                                                              .withPollingInterval(Duration.ofMillis(50)));
        outboxRelay.start();
        var order1 = OrderId.random();
        var order2 = OrderId.random();

        // When
        eventStore.getUnitOfWorkFactory().usingUnitOfWork(unitOfWork -> {
            eventStore.append(ORDERS, order1, 0, List.of(new OrderEvent.OrderAdded(order1, CustomerId.random(), 1),
                                                        new OrderEvent.ProductAddedToOrder(order1, ProductId.random(), 2))).orElseThrow();
            eventStore.append(ORDERS, order2, 0, List.of(new OrderEvent.OrderAdded(order2, CustomerId.random(), 2))).orElseThrow();
        });
        eventStore.append(ORDERS, order1, 2, List.of(new OrderEvent.ProductAddedToOrder(order1, ProductId.random(), 3),
                                                    new OrderEvent.OrderAccepted(order1))).orElseThrow();

        // Then
        waitAtMost(Duration.ofSeconds(10))
                .untilAsserted(() -> {
                    assertThat(projection.quantities).containsEntry(order1.toString(), 5).containsEntry(order2.toString(), 0);
                    assertThat(projection.acceptedOrders).containsExactly(order1.toString());
                });
        waitAtMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(outboxRelay.outboxRepository().entriesWithStatus(OutboxEntryStatus.DISPATCHED, 10)).hasSize(5));
    }

    /**
     * Publish every event in the event store directly, bypassing the outbox relay
     */
    private void publishAll() {
        eventStore.readAll(1, 1000).forEach(event -> eventBus.publish(event).orElseThrow());
    }

    private static class OrderProjection extends PatternMatchingPersistedEventHandler {
        private final ConcurrentMap<String, Integer> quantities     = new ConcurrentHashMap<>();
        private final List<String>                   acceptedOrders = new CopyOnWriteArrayList<>();

        @SubscriptionEventHandler
        private void on(OrderEvent.OrderAdded event) {
            quantities.putIfAbsent(event.orderId.toString(), 0);
        }

        @SubscriptionEventHandler
        private void on(OrderEvent.ProductAddedToOrder event, PersistedEvent persistedEvent) {
            quantities.merge(persistedEvent.aggregateId(), event.quantity, Integer::sum);
        }

        @SubscriptionEventHandler
        private void on(OrderEvent.OrderAccepted event) {
            acceptedOrders.add(event.orderId.toString());
        }

        @Override
        public void onResetFrom(long globalSequence) {
            quantities.clear();
            acceptedOrders.clear();
        }
    }
}
