package io.github.suppierk.test;

import io.github.suppierk.eventsourcing.application.Aggregate;
import io.github.suppierk.eventsourcing.application.EventEnvelope;
import io.github.suppierk.eventsourcing.decider.Pair;
import io.github.suppierk.eventsourcing.decider.Saga;
import io.github.suppierk.eventsourcing.domain.Command;
import io.github.suppierk.eventsourcing.domain.Event;
import io.github.suppierk.eventsourcing.domain.MenuItem;
import io.github.suppierk.eventsourcing.domain.Order;
import io.github.suppierk.eventsourcing.domain.OrderEvent;
import io.github.suppierk.eventsourcing.domain.OrderId;
import io.github.suppierk.eventsourcing.domain.OrderLineItem;
import io.github.suppierk.eventsourcing.domain.OrderingDomain;
import io.github.suppierk.eventsourcing.domain.Restaurant;
import io.github.suppierk.eventsourcing.domain.RestaurantEvent;
import io.github.suppierk.eventsourcing.domain.RestaurantId;
import io.github.suppierk.eventsourcing.domain.RestaurantMenu;
import io.github.suppierk.eventsourcing.jooq.JooqEventRepository;
import io.github.suppierk.eventsourcing.json.EventSerializer;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import org.jooq.DSLContext;

/** Restaurant "ce-vap" with a single menu item, and an order of that item. */
public final class Fixtures {
  public static final String RESTAURANT_NAME = "ce-vap";
  public static final String MENU_ITEM_ID = "item1";
  public static final String MENU_ITEM_NAME = "menuItemName";

  private Fixtures() {}

  public static RestaurantMenu restaurantMenu() {
    return RestaurantMenu.of(List.of(new MenuItem(MENU_ITEM_ID, MENU_ITEM_NAME, BigDecimal.TEN)));
  }

  public static List<OrderLineItem> orderLineItems() {
    return List.of(new OrderLineItem("1", 1, MENU_ITEM_ID, MENU_ITEM_NAME));
  }

  public static EventSerializer<Event> serializer() {
    return new EventSerializer<>(Event.class);
  }

  public static JooqEventRepository<Event> eventRepository(final Clock clock) {
    return new JooqEventRepository<>(serializer(), clock);
  }

  public static Aggregate<Command, Pair<Restaurant, Order>, Event> aggregate(
      final DSLContext dsl, final Clock clock) {
    return new Aggregate<>(
        dsl, OrderingDomain.decider(), OrderingDomain.saga(), eventRepository(clock));
  }

  public static Aggregate<Command, Pair<Restaurant, Order>, Event> aggregateWithoutSaga(
      final DSLContext dsl, final Clock clock) {
    return new Aggregate<>(dsl, OrderingDomain.decider(), Saga.empty(), eventRepository(clock));
  }

  public static List<EventEnvelope<Event>> chainOf(final DSLContext dsl, final RestaurantId id) {
    return eventRepository(Clock.systemUTC())
        .fetch(dsl, RestaurantEvent.AGGREGATE_TYPE, id.toString());
  }

  public static List<EventEnvelope<Event>> chainOf(final DSLContext dsl, final OrderId id) {
    return eventRepository(Clock.systemUTC()).fetch(dsl, OrderEvent.AGGREGATE_TYPE, id.toString());
  }
}
