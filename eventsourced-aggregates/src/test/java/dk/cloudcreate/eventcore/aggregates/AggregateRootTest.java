package dk.cloudcreate.eventcore.aggregates;

import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.AggregateType;
import dk.cloudcreate.eventcore.eventstore.postgresql.test_data.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.test_data.OrderEvent.*;
import org.junit.jupiter.api.*;

import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.stream.Stream;

import static dk.cloudcreate.eventcore.eventstore.postgresql.test_data.TestEvents.persistedEvent;
import static org.assertj.core.api.Assertions.*;

class AggregateRootTest {
    private static final AggregateType ORDERS = AggregateType.of("Orders");

    @Test
    void verify_applied_events_are_staged_as_uncommitted_changes() {
        // Given
        var orderId    = OrderId.random();
        var customerId = CustomerId.random();
        var productId  = ProductId.random();

        // When
        var order = new Order(orderId, customerId, 123);
        order.addProduct(productId, 10);

        // Then
        assertThat((CharSequence) order.aggregateId()).isEqualTo(orderId);
        assertThat(order.version()).isEqualTo(0);
        assertThat(order.hasBeenRehydrated()).isFalse();
        assertThat(order.productAndQuantity.get(productId)).isEqualTo(10);
        assertThat(order.uncommittedChanges()).hasSize(2);
        assertThat(order.uncommittedChanges().get(0)).isInstanceOf(OrderAdded.class);
        var orderAdded = (OrderAdded) order.uncommittedChanges().get(0);
        assertThat((CharSequence) orderAdded.orderingCustomerId).isEqualTo(customerId);
        assertThat(orderAdded.orderNumber).isEqualTo(123);
        assertThat(order.uncommittedChanges().get(1)).isInstanceOf(ProductAddedToOrder.class);
    }

    @Test
    void verify_markChangesAsCommitted_advances_the_version_and_clears_uncommitted_changes() {
        // Given
        var order = new Order(OrderId.random(), CustomerId.random(), 123);
        order.addProduct(ProductId.random(), 2);

        // When
        order.markChangesAsCommitted();

        // Then
        assertThat(order.uncommittedChanges()).isEmpty();
        assertThat(order.version()).isEqualTo(2);

        // And When
        order.accept();
        order.markChangesAsCommitted();

        // Then
        assertThat(order.version()).isEqualTo(3);
        assertThat(order.accepted).isTrue();
    }

    @Test
    void test_rehydrating_aggregate_from_persisted_events() {
        // Given
        var orderId   = OrderId.random();
        var productId = ProductId.random();
        var history = Stream.of(persistedEvent(ORDERS, orderId, 1, 1, new OrderAdded(orderId, CustomerId.random(), 1)),
                                persistedEvent(ORDERS, orderId, 2, 5, new ProductAddedToOrder(orderId, productId, 3)),
                                persistedEvent(ORDERS, orderId, 3, 9, new ProductAddedToOrder(orderId, productId, 4)));

        // When
        var order = AggregateRootInstanceFactory.defaultConstructorFactory()
                                                .create(orderId, Order.class)
                                                .rehydrate(orderId, history);

        // Then
        assertThat((CharSequence) order.aggregateId()).isEqualTo(orderId);
        assertThat(order.version()).isEqualTo(3);
        assertThat(order.hasBeenRehydrated()).isTrue();
        assertThat(order.uncommittedChanges()).isEmpty();
        assertThat(order.productAndQuantity.get(productId)).isEqualTo(7);
    }

    @Test
    void test_rehydrating_aggregate_and_then_modifying_the_aggregate_state() {
        // Given
        var orderId   = OrderId.random();
        var productId = ProductId.random();
        var order = AggregateRootInstanceFactory.objenesisAggregateRootFactory()
                                                .create(orderId, Order.class)
                                                .rehydrateFromEvents(orderId,
                                                                     Stream.of(new OrderAdded(orderId, CustomerId.random(), 1),
                                                                               new ProductAddedToOrder(orderId, productId, 3)));

        // When
        order.removeProduct(productId);
        order.accept();

        // Then
        assertThat(order.version()).isEqualTo(2);
        assertThat(order.uncommittedChanges()).hasSize(2);
        assertThat(order.uncommittedChanges().get(0)).isInstanceOf(ProductRemovedFromOrder.class);
        assertThat(order.uncommittedChanges().get(1)).isInstanceOf(OrderAccepted.class);
        assertThat(order.productAndQuantity).isEmpty();
        assertThatThrownBy(() -> order.addProduct(productId, 1))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void verify_rehydration_rejects_a_history_with_a_version_gap() {
        // Given
        var orderId = OrderId.random();
        var history = Stream.of(persistedEvent(ORDERS, orderId, 1, 1, new OrderAdded(orderId, CustomerId.random(), 1)),
                                persistedEvent(ORDERS, orderId, 3, 2, new OrderAccepted(orderId)));

        // When
        var order = new Order();

        // Then
        assertThatThrownBy(() -> order.rehydrate(orderId, history))
                .isInstanceOf(AggregateException.class)
                .hasMessageContaining("expected an event with version 2 but got version 3");
    }

    @Test
    void verify_rehydration_rejects_the_history_of_another_aggregate() {
        // Given
        var order        = new Order(OrderId.random(), CustomerId.random(), 1);
        var otherOrderId = OrderId.random();

        // Then
        assertThatThrownBy(() -> order.rehydrate(otherOrderId, Stream.empty()))
                .isInstanceOf(AggregateException.class);
    }

    @Test
    void verify_a_discarded_aggregate_rejects_new_events() {
        // Given
        var order = new Order(OrderId.random(), CustomerId.random(), 1);

        // When
        order.discard();

        // Then
        assertThat(order.isDiscarded()).isTrue();
        assertThat(order.uncommittedChanges()).isEmpty();
        assertThatThrownBy(order::accept)
                .isInstanceOf(AggregateException.class)
                .hasMessageContaining("discarded");
    }

    @Test
    void verify_objenesis_can_create_an_aggregate_without_a_default_constructor() {
        // Given
        var customerId = CustomerId.random();

        // When
        var customer = AggregateRootInstanceFactory.objenesisAggregateRootFactory()
                                                   .create(customerId, Customer.class)
                                                   .rehydrateFromEvents(customerId,
                                                                        Stream.of(new CustomerEvent.CustomerRegistered(customerId, "x")));
        customer.rename("y");

        // Then
        assertThat(customer.name()).isEqualTo("y");
        assertThat(customer.version()).isEqualTo(1);
        assertThat(customer.uncommittedChanges()).hasSize(1);
    }

    @Test
    void verify_the_default_constructor_factory_requires_a_no_arguments_constructor() {
        assertThatThrownBy(() -> AggregateRootInstanceFactory.defaultConstructorFactory().create(CustomerId.random(), Customer.class))
                .isInstanceOf(AggregateException.class);
    }

    @Test
    void verify_event_handlers_with_more_than_one_parameter_are_rejected() {
        assertThatThrownBy(InvalidAggregate::new)
                .isInstanceOf(AggregateException.class)
                .hasMessageContaining("'on'")
                .hasMessageContaining("exactly one parameter");
    }

    @Test
    void verify_an_aggregate_created_without_a_constructor_validates_its_event_handlers_on_the_first_event() {
        // Given
        var orderId   = OrderId.random();
        var aggregate = AggregateRootInstanceFactory.objenesisAggregateRootFactory().create(orderId, InvalidAggregate.class);

        // When
        var events = Stream.of(new OrderAdded(orderId, CustomerId.random(), 1));

        // Then
        assertThatThrownBy(() -> aggregate.rehydrateFromEvents(orderId, events))
                .isInstanceOf(AggregateException.class)
                .hasMessageContaining("exactly one parameter");
    }

    @Test
    void verify_aggregate_roots_keep_no_state_shared_between_instances() {
        assertThat(Arrays.stream(AggregateRoot.class.getDeclaredFields())
                         .filter(field -> Modifier.isStatic(field.getModifiers())))
                .isEmpty();
    }

    @Test
    void verify_events_without_a_matching_event_handler_are_ignored() {
        // Given
        var aggregate = new AggregateWithoutHandlers(OrderId.random());

        // When
        aggregate.record(new OrderAccepted(aggregate.aggregateId()));

        // Then
        assertThat(aggregate.uncommittedChanges()).hasSize(1);
    }

    private static class InvalidAggregate extends AggregateRoot<OrderId, OrderEvent, InvalidAggregate> {
        InvalidAggregate() {
            super(OrderId.random());
        }

        @EventHandler
        private void on(OrderAdded e, String unexpected) {
        }
    }

    private static class AggregateWithoutHandlers extends AggregateRoot<OrderId, OrderEvent, AggregateWithoutHandlers> {
        AggregateWithoutHandlers(OrderId orderId) {
            super(orderId);
        }

        void record(OrderEvent event) {
            apply(event);
        }
    }
}
