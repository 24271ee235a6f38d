/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.eventsourcing.jooq;

import io.github.suppierk.eventsourcing.application.MaterializedViewStateRepository;
import io.github.suppierk.eventsourcing.decider.Pair;
import io.github.suppierk.eventsourcing.domain.Event;
import io.github.suppierk.eventsourcing.domain.MenuItem;
import io.github.suppierk.eventsourcing.domain.OrderEvent;
import io.github.suppierk.eventsourcing.domain.OrderId;
import io.github.suppierk.eventsourcing.domain.OrderLineItem;
import io.github.suppierk.eventsourcing.domain.OrderStatus;
import io.github.suppierk.eventsourcing.domain.OrderViewState;
import io.github.suppierk.eventsourcing.domain.RestaurantEvent;
import io.github.suppierk.eventsourcing.domain.RestaurantId;
import io.github.suppierk.eventsourcing.domain.RestaurantMenu;
import io.github.suppierk.eventsourcing.domain.RestaurantMenuCuisine;
import io.github.suppierk.eventsourcing.domain.RestaurantViewState;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.MenuItems;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.OrderItems;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Orders;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Restaurants;
import io.github.suppierk.eventsourcing.support.Suspicious;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jooq.DSLContext;
import org.jooq.Record;

/**
 * Stores restaurant and order snapshots in relational tables, so that they can be queried without
 * replaying events.
 *
 * <p>Menu and line items are replaced as a whole on every save, their order is kept in the {@code
 * position} column.
 */
public final class JooqRestaurantOrderViewRepository extends Suspicious
    implements MaterializedViewStateRepository<Pair<RestaurantViewState, OrderViewState>, Event> {

  @Override
  public Pair<RestaurantViewState, OrderViewState> fetchState(
      final DSLContext dsl, final Event event) {
    final DSLContext nonNullDsl = throwIllegalArgumentIfNull(dsl, "DSL");
    final Event nonNullEvent = throwIllegalArgumentIfNull(event, "Event");

    if (nonNullEvent instanceof RestaurantEvent restaurantEvent) {
      return new Pair<>(findRestaurant(nonNullDsl, restaurantEvent.id()).orElse(null), null);
    }

    if (nonNullEvent instanceof OrderEvent orderEvent) {
      return new Pair<>(null, findOrder(nonNullDsl, orderEvent.id()).orElse(null));
    }

    return new Pair<>(null, null);
  }

  @Override
  public Pair<RestaurantViewState, OrderViewState> save(
      final DSLContext dsl, final Pair<RestaurantViewState, OrderViewState> state) {
    final DSLContext nonNullDsl = throwIllegalArgumentIfNull(dsl, "DSL");
    final Pair<RestaurantViewState, OrderViewState> nonNullState =
        throwIllegalArgumentIfNull(state, "State");

    if (nonNullState.left() != null) {
      saveRestaurant(nonNullDsl, nonNullState.left());
    }

    if (nonNullState.right() != null) {
      saveOrder(nonNullDsl, nonNullState.right());
    }

    return nonNullState;
  }

  /**
   * @param dsl to run in
   * @param id of the restaurant
   * @return projected restaurant, if any
   */
  public Optional<RestaurantViewState> findRestaurant(final DSLContext dsl, final RestaurantId id) {
    final DSLContext nonNullDsl = throwIllegalArgumentIfNull(dsl, "DSL");
    return nonNullDsl
        .select(Restaurants.ID, Restaurants.NAME, Restaurants.MENU_ID, Restaurants.CUISINE)
        .from(Restaurants.TABLE)
        .where(Restaurants.ID.eq(throwIllegalArgumentIfNull(id, "Restaurant ID").value()))
        .fetchOptional(dbRecord -> toRestaurant(nonNullDsl, dbRecord));
  }

  /**
   * @param dsl to run in
   * @return every projected restaurant ordered by name
   */
  public List<RestaurantViewState> findAllRestaurants(final DSLContext dsl) {
    final DSLContext nonNullDsl = throwIllegalArgumentIfNull(dsl, "DSL");
    return nonNullDsl
        .select(Restaurants.ID, Restaurants.NAME, Restaurants.MENU_ID, Restaurants.CUISINE)
        .from(Restaurants.TABLE)
        .orderBy(Restaurants.NAME.asc(), Restaurants.ID.asc())
        .fetch(dbRecord -> toRestaurant(nonNullDsl, dbRecord));
  }

  /**
   * @param dsl to run in
   * @param id of the order
   * @return projected order, if any
   */
  public Optional<OrderViewState> findOrder(final DSLContext dsl, final OrderId id) {
    final DSLContext nonNullDsl = throwIllegalArgumentIfNull(dsl, "DSL");
    return nonNullDsl
        .select(Orders.ID, Orders.RESTAURANT_ID, Orders.STATUS)
        .from(Orders.TABLE)
        .where(Orders.ID.eq(throwIllegalArgumentIfNull(id, "Order ID").value()))
        .fetchOptional(dbRecord -> toOrder(nonNullDsl, dbRecord));
  }

  /**
   * @param dsl to run in
   * @param restaurantId the orders were placed at
   * @return projected orders of the restaurant
   */
  public List<OrderViewState> findOrders(final DSLContext dsl, final RestaurantId restaurantId) {
    final DSLContext nonNullDsl = throwIllegalArgumentIfNull(dsl, "DSL");
    return nonNullDsl
        .select(Orders.ID, Orders.RESTAURANT_ID, Orders.STATUS)
        .from(Orders.TABLE)
        .where(
            Orders.RESTAURANT_ID.eq(
                throwIllegalArgumentIfNull(restaurantId, "Restaurant ID").value()))
        .orderBy(Orders.ID.asc())
        .fetch(dbRecord -> toOrder(nonNullDsl, dbRecord));
  }

  private void saveRestaurant(final DSLContext dsl, final RestaurantViewState restaurant) {
    final UUID id = throwIllegalStateIfNull(restaurant.id(), "Restaurant ID").value();
    final RestaurantMenu menu = throwIllegalStateIfNull(restaurant.menu(), "Restaurant menu");

    final int updated =
        dsl.update(Restaurants.TABLE)
            .set(Restaurants.NAME, restaurant.name())
            .set(Restaurants.MENU_ID, menu.menuId())
            .set(Restaurants.CUISINE, menu.cuisine().name())
            .where(Restaurants.ID.eq(id))
            .execute();

    if (updated == 0) {
      dsl.insertInto(Restaurants.TABLE)
          .set(Restaurants.ID, id)
          .set(Restaurants.NAME, restaurant.name())
          .set(Restaurants.MENU_ID, menu.menuId())
          .set(Restaurants.CUISINE, menu.cuisine().name())
          .execute();
    }

    dsl.deleteFrom(MenuItems.TABLE).where(MenuItems.RESTAURANT_ID.eq(id)).execute();

    int position = 0;
    for (MenuItem menuItem : menu.menuItems()) {
      dsl.insertInto(MenuItems.TABLE)
          .set(MenuItems.RESTAURANT_ID, id)
          .set(MenuItems.MENU_ITEM_ID, menuItem.menuItemId())
          .set(MenuItems.POSITION, position++)
          .set(MenuItems.NAME, menuItem.name())
          .set(MenuItems.PRICE, menuItem.price())
          .execute();
    }
  }

  private void saveOrder(final DSLContext dsl, final OrderViewState order) {
    final UUID id = throwIllegalStateIfNull(order.id(), "Order ID").value();
    final UUID restaurantId =
        throwIllegalStateIfNull(order.restaurantId(), "Order's restaurant ID").value();
    final String status = throwIllegalStateIfNull(order.status(), "Order status").name();

    final int updated =
        dsl.update(Orders.TABLE)
            .set(Orders.RESTAURANT_ID, restaurantId)
            .set(Orders.STATUS, status)
            .where(Orders.ID.eq(id))
            .execute();

    if (updated == 0) {
      dsl.insertInto(Orders.TABLE)
          .set(Orders.ID, id)
          .set(Orders.RESTAURANT_ID, restaurantId)
          .set(Orders.STATUS, status)
          .execute();
    }

    dsl.deleteFrom(OrderItems.TABLE).where(OrderItems.ORDER_ID.eq(id)).execute();

    int position = 0;
    for (OrderLineItem lineItem : order.lineItems()) {
      dsl.insertInto(OrderItems.TABLE)
          .set(OrderItems.ORDER_ID, id)
          .set(OrderItems.ID, lineItem.id())
          .set(OrderItems.POSITION, position++)
          .set(OrderItems.QUANTITY, lineItem.quantity())
          .set(OrderItems.MENU_ITEM_ID, lineItem.menuItemId())
          .set(OrderItems.NAME, lineItem.name())
          .execute();
    }
  }

  private static RestaurantViewState toRestaurant(final DSLContext dsl, final Record dbRecord) {
    final UUID id = dbRecord.get(Restaurants.ID);
    final List<MenuItem> menuItems =
        dsl.select(MenuItems.MENU_ITEM_ID, MenuItems.NAME, MenuItems.PRICE)
            .from(MenuItems.TABLE)
            .where(MenuItems.RESTAURANT_ID.eq(id))
            .orderBy(MenuItems.POSITION.asc())
            .fetch(
                menuItem ->
                    new MenuItem(
                        menuItem.get(MenuItems.MENU_ITEM_ID),
                        menuItem.get(MenuItems.NAME),
                        menuItem.get(MenuItems.PRICE)));

    return new RestaurantViewState(
        RestaurantId.of(id),
        dbRecord.get(Restaurants.NAME),
        new RestaurantMenu(
            menuItems,
            dbRecord.get(Restaurants.MENU_ID),
            RestaurantMenuCuisine.valueOf(dbRecord.get(Restaurants.CUISINE))));
  }

  private static OrderViewState toOrder(final DSLContext dsl, final Record dbRecord) {
    final UUID id = dbRecord.get(Orders.ID);
    final List<OrderLineItem> lineItems =
        dsl.select(
                OrderItems.ID, OrderItems.QUANTITY, OrderItems.MENU_ITEM_ID, OrderItems.NAME)
            .from(OrderItems.TABLE)
            .where(OrderItems.ORDER_ID.eq(id))
            .orderBy(OrderItems.POSITION.asc())
            .fetch(
                lineItem ->
                    new OrderLineItem(
                        lineItem.get(OrderItems.ID),
                        lineItem.get(OrderItems.QUANTITY),
                        lineItem.get(OrderItems.MENU_ITEM_ID),
                        lineItem.get(OrderItems.NAME)));

    return new OrderViewState(
        OrderId.of(id),
        RestaurantId.of(dbRecord.get(Orders.RESTAURANT_ID)),
        OrderStatus.valueOf(dbRecord.get(Orders.STATUS)),
        lineItems);
  }
}
