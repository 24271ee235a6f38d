package io.github.suppierk.eventsourcing.application;

import static io.github.suppierk.test.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import io.github.suppierk.eventsourcing.decider.Pair;
import io.github.suppierk.eventsourcing.decider.ValidationException;
import io.github.suppierk.eventsourcing.domain.Command;
import io.github.suppierk.eventsourcing.domain.Event;
import io.github.suppierk.eventsourcing.domain.Order;
import io.github.suppierk.eventsourcing.domain.OrderEvent.OrderCreatedEvent;
import io.github.suppierk.eventsourcing.domain.OrderId;
import io.github.suppierk.eventsourcing.domain.OrderingDomain;
import io.github.suppierk.eventsourcing.domain.Restaurant;
import io.github.suppierk.eventsourcing.domain.RestaurantCommand.CreateRestaurantCommand;
import io.github.suppierk.eventsourcing.domain.RestaurantCommand.PlaceOrderCommand;
import io.github.suppierk.eventsourcing.domain.RestaurantEvent.OrderPlacedAtRestaurantEvent;
import io.github.suppierk.eventsourcing.domain.RestaurantId;
import io.github.suppierk.test.TestDatabase;
import java.time.Clock;
import org.jooq.DSLContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SagaManagerTest {
  static final TestDatabase DATABASE = TestDatabase.create();
  static final DSLContext DSL_CONTEXT = DATABASE.dsl();
  static final Aggregate<Command, Pair<Restaurant, Order>, Event> AGGREGATE =
      aggregateWithoutSaga(DSL_CONTEXT, Clock.systemUTC());
  static final SagaManager<Event, Command> SAGA_MANAGER =
      new SagaManager<>(OrderingDomain.saga(), AGGREGATE);

  final RestaurantId restaurantId = RestaurantId.random();
  final OrderId orderId = OrderId.random();

  @BeforeEach
  void setUp() {
    DATABASE.clear();
  }

  @AfterAll
  static void tearDown() {
    DATABASE.close();
  }

  @Test
  void aggregate_without_saga_does_not_cascade() {
    AGGREGATE.handle(new CreateRestaurantCommand(restaurantId, RESTAURANT_NAME, restaurantMenu()));

    final var envelopes =
        AGGREGATE.handle(new PlaceOrderCommand(restaurantId, orderId, orderLineItems()));

    assertEquals(1, envelopes.size());
    assertTrue(chainOf(DSL_CONTEXT, orderId).isEmpty());
  }

  @Test
  void when_event_causes_commands_they_are_published_to_the_aggregate() {
    final var placed = new OrderPlacedAtRestaurantEvent(restaurantId, orderLineItems(), orderId);

    DSL_CONTEXT.transaction(trx -> SAGA_MANAGER.handle(trx.dsl(), placed));

    final var orderChain = chainOf(DSL_CONTEXT, orderId);
    assertEquals(1, orderChain.size());
    assertEquals(
        new OrderCreatedEvent(orderId, orderLineItems(), restaurantId), orderChain.get(0).event());
  }

  @Test
  void when_published_command_is_rejected_the_exception_reaches_the_caller() {
    final var placed = new OrderPlacedAtRestaurantEvent(restaurantId, orderLineItems(), orderId);
    DSL_CONTEXT.transaction(trx -> SAGA_MANAGER.handle(trx.dsl(), placed));

    assertThrows(
        ValidationException.class,
        () -> DSL_CONTEXT.transaction(trx -> SAGA_MANAGER.handle(trx.dsl(), placed)));
    assertEquals(1, chainOf(DSL_CONTEXT, orderId).size());
  }
}
