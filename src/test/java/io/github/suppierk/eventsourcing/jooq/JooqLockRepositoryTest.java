package io.github.suppierk.eventsourcing.jooq;

import static io.github.suppierk.test.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import io.github.suppierk.eventsourcing.application.EventEnvelope;
import io.github.suppierk.eventsourcing.domain.Event;
import io.github.suppierk.eventsourcing.domain.OrderEvent.OrderCreatedEvent;
import io.github.suppierk.eventsourcing.domain.OrderEvent.OrderPreparedEvent;
import io.github.suppierk.eventsourcing.domain.OrderId;
import io.github.suppierk.eventsourcing.domain.RestaurantEvent.RestaurantCreatedEvent;
import io.github.suppierk.eventsourcing.domain.RestaurantId;
import io.github.suppierk.eventsourcing.stream.Lock;
import io.github.suppierk.eventsourcing.stream.LockAction.Ack;
import io.github.suppierk.eventsourcing.stream.LockAction.Nack;
import io.github.suppierk.eventsourcing.stream.LockAction.ScheduleNack;
import io.github.suppierk.test.MutableClock;
import io.github.suppierk.test.TestDatabase;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.jooq.DSLContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JooqLockRepositoryTest {
  static final String VIEW = "restaurant-view";
  static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
  static final OffsetDateTime EPOCH = OffsetDateTime.ofInstant(Instant.EPOCH, ZoneOffset.UTC);
  static final Duration LEASE = Duration.ofSeconds(5);
  static final TestDatabase DATABASE = TestDatabase.create();
  static final DSLContext DSL_CONTEXT = DATABASE.dsl();

  final MutableClock clock = new MutableClock(NOW);
  final JooqEventRepository<Event> eventRepository = eventRepository(clock);
  final JooqViewRepository viewRepository = new JooqViewRepository(clock);
  final JooqLockRepository<Event> repository =
      new JooqLockRepository<>(serializer(), clock, LEASE);

  final RestaurantId restaurantId = RestaurantId.random();
  final OrderId orderId = OrderId.random();

  @BeforeEach
  void setUp() {
    DATABASE.clear();
    viewRepository.registerView(DSL_CONTEXT, VIEW, 100, EPOCH);
  }

  @AfterAll
  static void tearDown() {
    DATABASE.close();
  }

  EventEnvelope<Event> append(final Event event, final UUID previousId) {
    return DSL_CONTEXT.transactionResult(
        trx ->
            eventRepository.append(
                trx.dsl(), EventEnvelope.of(event, UUID.randomUUID(), previousId)));
  }

  EventEnvelope<Event> createRestaurant() {
    return append(
        new RestaurantCreatedEvent(restaurantId, RESTAURANT_NAME, restaurantMenu()), null);
  }

  EventEnvelope<Event> createOrder() {
    return append(new OrderCreatedEvent(orderId, orderLineItems(), restaurantId), null);
  }

  Optional<EventEnvelope<Event>> acquire() {
    return repository.acquireNext(DSL_CONTEXT, VIEW);
  }

  Lock lockOf(final String aggregateId) {
    return repository.findAll(DSL_CONTEXT, VIEW).stream()
        .filter(lock -> lock.aggregateId().equals(aggregateId))
        .findFirst()
        .orElseThrow();
  }

  @Nested
  class AcquireNext {
    @Test
    void nothing_to_acquire_without_events() {
      assertEquals(Optional.empty(), acquire());
    }

    @Test
    void lowest_offset_is_delivered_first() {
      final var restaurant = createRestaurant();
      final var order = createOrder();

      assertEquals(Optional.of(restaurant), acquire());
      assertEquals(Optional.of(order), acquire());
      assertEquals(Optional.empty(), acquire());
    }

    @Test
    void partition_is_leased_until_the_lease_expires() {
      final var created = createOrder();

      final var acquired = acquire();
      assertEquals(Optional.of(created), acquired);
      assertEquals(
          OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plus(LEASE),
          lockOf(orderId.toString()).lockedUntil());

      clock.advance(LEASE.minusMillis(1));
      assertEquals(Optional.empty(), acquire());

      clock.advance(Duration.ofMillis(1));
      assertEquals(Optional.of(created), acquire());
    }

    @Test
    void later_events_of_a_partition_wait_for_the_earlier_ones() {
      final var created = createOrder();
      append(new OrderPreparedEvent(orderId), created.eventId());

      assertEquals(Optional.of(created), acquire());
      assertEquals(Optional.empty(), acquire());
    }

    @Test
    void events_created_before_start_at_are_skipped() {
      final OffsetDateTime inAnHour = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusHours(1);
      viewRepository.registerView(DSL_CONTEXT, "late-view", 100, inAnHour);
      createOrder();

      assertEquals(Optional.empty(), repository.acquireNext(DSL_CONTEXT, "late-view"));
      assertTrue(acquire().isPresent());
    }

    @Test
    void only_one_of_concurrent_consumers_gets_the_partition() throws Exception {
      createOrder();

      final int consumers = 8;
      final CountDownLatch start = new CountDownLatch(1);
      final ExecutorService executor = Executors.newFixedThreadPool(consumers);
      try {
        final List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < consumers; i++) {
          final Callable<Boolean> consumer =
              () -> {
                start.await();
                try {
                  return DSL_CONTEXT.transactionResult(
                      trx -> repository.acquireNext(trx.dsl(), VIEW).isPresent());
                } catch (RuntimeException e) {
                  // Losing a write conflict means not getting the partition
                  return false;
                }
              };
          results.add(executor.submit(consumer));
        }

        start.countDown();

        int acquired = 0;
        for (Future<Boolean> result : results) {
          if (result.get(30, TimeUnit.SECONDS)) {
            acquired++;
          }
        }

        assertEquals(1, acquired);
      } finally {
        executor.shutdownNow();
      }
    }
  }

  @Nested
  class Actions {
    @Test
    void ack_moves_offset_and_releases_the_lease() {
      final var created = createOrder();
      final var prepared = append(new OrderPreparedEvent(orderId), created.eventId());
      acquire();

      final var lock =
          repository.executeAction(
              DSL_CONTEXT, VIEW, new Ack(created.offset(), orderId.toString()));

      assertTrue(lock.isPresent());
      assertEquals(created.offset(), lock.get().offset());
      assertNull(lock.get().lockedUntil());
      assertEquals(Optional.of(prepared), acquire());
    }

    @Test
    void fully_acknowledged_partition_is_not_delivered() {
      final var created = createOrder();
      acquire();
      repository.executeAction(DSL_CONTEXT, VIEW, new Ack(created.offset(), orderId.toString()));

      assertEquals(Optional.empty(), acquire());
    }

    @Test
    void stale_ack_is_ignored() {
      final var created = createOrder();
      final var prepared = append(new OrderPreparedEvent(orderId), created.eventId());
      repository.executeAction(DSL_CONTEXT, VIEW, new Ack(prepared.offset(), orderId.toString()));

      final var ignored =
          repository.executeAction(
              DSL_CONTEXT, VIEW, new Ack(created.offset(), orderId.toString()));

      assertEquals(Optional.empty(), ignored);
      assertEquals(prepared.offset(), lockOf(orderId.toString()).offset());
    }

    @Test
    void nack_releases_the_lease_immediately() {
      final var created = createOrder();
      acquire();

      final var lock = repository.executeAction(DSL_CONTEXT, VIEW, new Nack(orderId.toString()));

      assertTrue(lock.isPresent());
      assertNull(lock.get().lockedUntil());
      assertEquals(Lock.INITIAL_OFFSET, lock.get().offset());
      assertEquals(Optional.of(created), acquire());
    }

    @Test
    void scheduled_nack_delays_the_redelivery() {
      final var created = createOrder();
      acquire();

      repository.executeAction(DSL_CONTEXT, VIEW, new ScheduleNack(orderId.toString(), 10_000));

      clock.advance(LEASE);
      assertEquals(Optional.empty(), acquire());

      clock.advance(Duration.ofSeconds(5));
      assertEquals(Optional.of(created), acquire());
    }

    @Test
    void action_on_unknown_partition_changes_nothing() {
      assertEquals(
          Optional.empty(), repository.executeAction(DSL_CONTEXT, VIEW, new Nack("unknown")));
    }

    @Test
    void negative_delay_is_rejected() {
      assertThrows(
          IllegalArgumentException.class, () -> new ScheduleNack(orderId.toString(), -1));
    }
  }

  @Nested
  class FindAll {
    @Test
    void locks_are_listed_per_view() {
      viewRepository.registerView(DSL_CONTEXT, "another-view", 100, EPOCH);
      createRestaurant();
      createOrder();

      assertEquals(4, repository.findAll(DSL_CONTEXT).size());
      assertEquals(2, repository.findAll(DSL_CONTEXT, VIEW).size());
      assertTrue(
          repository.findAll(DSL_CONTEXT, "another-view").stream()
              .allMatch(lock -> lock.view().equals("another-view")));
    }

    @Test
    void blank_view_is_rejected() {
      assertThrows(IllegalArgumentException.class, () -> repository.findAll(DSL_CONTEXT, " "));
    }
  }
}
