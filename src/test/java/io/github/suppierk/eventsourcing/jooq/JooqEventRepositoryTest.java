package io.github.suppierk.eventsourcing.jooq;

import static io.github.suppierk.test.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import io.github.suppierk.eventsourcing.application.ConcurrencyException;
import io.github.suppierk.eventsourcing.application.EventEnvelope;
import io.github.suppierk.eventsourcing.decider.ValidationException;
import io.github.suppierk.eventsourcing.domain.Event;
import io.github.suppierk.eventsourcing.domain.OrderEvent;
import io.github.suppierk.eventsourcing.domain.OrderEvent.OrderCreatedEvent;
import io.github.suppierk.eventsourcing.domain.OrderEvent.OrderPreparedEvent;
import io.github.suppierk.eventsourcing.domain.OrderId;
import io.github.suppierk.eventsourcing.domain.RestaurantEvent;
import io.github.suppierk.eventsourcing.domain.RestaurantEvent.RestaurantCreatedEvent;
import io.github.suppierk.eventsourcing.domain.RestaurantEvent.RestaurantMenuChangedEvent;
import io.github.suppierk.eventsourcing.domain.RestaurantId;
import io.github.suppierk.eventsourcing.stream.Lock;
import io.github.suppierk.test.MutableClock;
import io.github.suppierk.test.TestDatabase;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.jooq.DSLContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JooqEventRepositoryTest {
  static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
  static final OffsetDateTime EPOCH = OffsetDateTime.ofInstant(Instant.EPOCH, ZoneOffset.UTC);
  static final TestDatabase DATABASE = TestDatabase.create();
  static final DSLContext DSL_CONTEXT = DATABASE.dsl();

  final MutableClock clock = new MutableClock(NOW);
  final JooqEventRepository<Event> repository = eventRepository(clock);
  final JooqViewRepository viewRepository = new JooqViewRepository(clock);
  final JooqLockRepository<Event> lockRepository =
      new JooqLockRepository<>(serializer(), clock, Duration.ofSeconds(5));

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

  EventEnvelope<Event> append(final Event event, final UUID previousId) {
    return DSL_CONTEXT.transactionResult(
        trx ->
            repository.append(trx.dsl(), EventEnvelope.of(event, UUID.randomUUID(), previousId)));
  }

  EventEnvelope<Event> menuChangedAfter(final EventEnvelope<Event> head) {
    return EventEnvelope.of(
        new RestaurantMenuChangedEvent(restaurantId, restaurantMenu()),
        UUID.randomUUID(),
        head.eventId());
  }

  @Nested
  class Append {
    @Test
    void first_event_is_stored_with_time_and_offset() {
      final var created =
          append(new RestaurantCreatedEvent(restaurantId, RESTAURANT_NAME, restaurantMenu()), null);

      assertNotNull(created.offset());
      assertEquals(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC), created.createdAt());
      assertEquals("Restaurant", created.aggregateType());
      assertEquals(restaurantId.toString(), created.aggregateId());
      assertNull(created.previousId());
      assertFalse(created.isFinal());
    }

    @Test
    void offsets_grow_across_aggregates() {
      final var restaurant =
          append(new RestaurantCreatedEvent(restaurantId, RESTAURANT_NAME, restaurantMenu()), null);
      final var order =
          append(new OrderCreatedEvent(orderId, orderLineItems(), restaurantId), null);
      final var menuChanged =
          append(
              new RestaurantMenuChangedEvent(restaurantId, restaurantMenu()), restaurant.eventId());

      assertTrue(restaurant.offset() < order.offset());
      assertTrue(order.offset() < menuChanged.offset());
    }

    @Test
    void stale_previous_id_is_rejected() {
      final var created =
          append(new RestaurantCreatedEvent(restaurantId, RESTAURANT_NAME, restaurantMenu()), null);
      append(new RestaurantMenuChangedEvent(restaurantId, restaurantMenu()), created.eventId());

      final var stale = new RestaurantMenuChangedEvent(restaurantId, restaurantMenu());
      final var exception =
          assertThrows(ConcurrencyException.class, () -> append(stale, created.eventId()));

      assertEquals(409, exception.getStatusCode());
      assertEquals(2, chainOf(DSL_CONTEXT, restaurantId).size());
    }

    @Test
    void concurrent_writers_on_the_same_head_let_only_one_through() throws Exception {
      final var created =
          append(new RestaurantCreatedEvent(restaurantId, RESTAURANT_NAME, restaurantMenu()), null);
      final var firstInserted = new CountDownLatch(1);
      final var executor = Executors.newFixedThreadPool(2);

      try {
        final Future<Boolean> first =
            executor.submit(
                () ->
                    DSL_CONTEXT.transactionResult(
                        trx -> {
                          repository.append(trx.dsl(), menuChangedAfter(created));
                          firstInserted.countDown();
                          // Row stays uncommitted while the second writer reaches the insert
                          TimeUnit.MILLISECONDS.sleep(300);
                          return true;
                        }));
        final Future<Boolean> second =
            executor.submit(
                () -> {
                  assertTrue(firstInserted.await(5, TimeUnit.SECONDS));
                  try {
                    DSL_CONTEXT.transaction(
                        trx -> repository.append(trx.dsl(), menuChangedAfter(created)));
                    return true;
                  } catch (ConcurrencyException e) {
                    return false;
                  }
                });

        assertTrue(first.get(10, TimeUnit.SECONDS));
        assertFalse(second.get(10, TimeUnit.SECONDS));
      } finally {
        executor.shutdownNow();
      }

      final var chain = chainOf(DSL_CONTEXT, restaurantId);
      assertEquals(2, chain.size());
      assertEquals(created.eventId(), chain.get(1).previousId());
    }

    @Test
    void second_root_event_is_rejected() {
      append(new RestaurantCreatedEvent(restaurantId, RESTAURANT_NAME, restaurantMenu()), null);

      final var secondRoot =
          new RestaurantCreatedEvent(restaurantId, RESTAURANT_NAME, restaurantMenu());
      assertThrows(ConcurrencyException.class, () -> append(secondRoot, null));
    }

    @Test
    void final_aggregate_cannot_be_changed() {
      final var created =
          append(new OrderCreatedEvent(orderId, orderLineItems(), restaurantId), null);
      final var prepared = append(new OrderPreparedEvent(orderId), created.eventId());

      assertTrue(prepared.isFinal());

      final var afterFinal = new OrderPreparedEvent(orderId);
      assertThrows(ValidationException.class, () -> append(afterFinal, prepared.eventId()));
    }

    @Test
    void null_envelope_is_rejected() {
      assertThrows(IllegalArgumentException.class, () -> repository.append(DSL_CONTEXT, null));
    }
  }

  @Nested
  class Fetch {
    @Test
    void events_come_back_in_append_order() {
      final var created =
          append(new RestaurantCreatedEvent(restaurantId, RESTAURANT_NAME, restaurantMenu()), null);
      final var changed =
          append(new RestaurantMenuChangedEvent(restaurantId, restaurantMenu()), created.eventId());

      final var fetched =
          repository.fetch(DSL_CONTEXT, RestaurantEvent.AGGREGATE_TYPE, restaurantId.toString());

      assertEquals(2, fetched.size());
      assertEquals(created, fetched.get(0));
      assertEquals(changed, fetched.get(1));
      assertNull(fetched.get(0).previousId());
      assertEquals(created.eventId(), fetched.get(1).previousId());
    }

    @Test
    void unknown_aggregate_has_no_events() {
      assertTrue(
          repository.fetch(DSL_CONTEXT, RestaurantEvent.AGGREGATE_TYPE, "unknown").isEmpty());
      assertEquals(
          Optional.empty(),
          repository.getLastEventId(DSL_CONTEXT, RestaurantEvent.AGGREGATE_TYPE, "unknown"));
    }

    @Test
    void chains_are_scoped_by_aggregate_type() {
      final var sharedId = OrderId.of(restaurantId.value());
      final var restaurant =
          append(new RestaurantCreatedEvent(restaurantId, RESTAURANT_NAME, restaurantMenu()), null);
      final var order =
          append(new OrderCreatedEvent(sharedId, orderLineItems(), restaurantId), null);

      assertEquals(List.of(restaurant), chainOf(DSL_CONTEXT, restaurantId));
      assertEquals(List.of(order), chainOf(DSL_CONTEXT, sharedId));
      assertEquals(
          Optional.of(order.eventId()),
          repository.getLastEventId(DSL_CONTEXT, OrderEvent.AGGREGATE_TYPE, sharedId.toString()));
    }

    @Test
    void last_event_id_is_the_head_of_the_chain() {
      final var created =
          append(new RestaurantCreatedEvent(restaurantId, RESTAURANT_NAME, restaurantMenu()), null);
      final var changed =
          append(new RestaurantMenuChangedEvent(restaurantId, restaurantMenu()), created.eventId());

      assertEquals(
          Optional.of(changed.eventId()),
          repository.getLastEventId(
              DSL_CONTEXT, RestaurantEvent.AGGREGATE_TYPE, restaurantId.toString()));
    }
  }

  @Nested
  class LockBookkeeping {
    @Test
    void appends_do_not_create_locks_without_views() {
      append(new OrderCreatedEvent(orderId, orderLineItems(), restaurantId), null);

      assertTrue(lockRepository.findAll(DSL_CONTEXT).isEmpty());
    }

    @Test
    void appends_move_last_offset_of_every_view() {
      viewRepository.registerView(DSL_CONTEXT, "first", 100, EPOCH);
      viewRepository.registerView(DSL_CONTEXT, "second", 100, EPOCH);

      final var created =
          append(new OrderCreatedEvent(orderId, orderLineItems(), restaurantId), null);
      final var prepared = append(new OrderPreparedEvent(orderId), created.eventId());

      final var locks = lockRepository.findAll(DSL_CONTEXT);
      assertEquals(2, locks.size());
      for (Lock lock : locks) {
        assertEquals(orderId.toString(), lock.aggregateId());
        assertEquals(Lock.INITIAL_OFFSET, lock.offset());
        assertEquals(prepared.offset(), lock.lastOffset());
        assertTrue(lock.offsetFinal());
        assertNull(lock.lockedUntil());
      }
    }

    @Test
    void rejected_append_does_not_touch_locks() {
      viewRepository.registerView(DSL_CONTEXT, "view", 100, EPOCH);
      final var created =
          append(new OrderCreatedEvent(orderId, orderLineItems(), restaurantId), null);

      final var duplicate = new OrderCreatedEvent(orderId, orderLineItems(), restaurantId);
      assertThrows(ConcurrencyException.class, () -> append(duplicate, null));

      final var lock = lockRepository.findAll(DSL_CONTEXT, "view").get(0);
      assertEquals(created.offset(), lock.lastOffset());
      assertFalse(lock.offsetFinal());
    }
  }
}
