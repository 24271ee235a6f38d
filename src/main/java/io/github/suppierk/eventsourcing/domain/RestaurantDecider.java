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

package io.github.suppierk.eventsourcing.domain;

import io.github.suppierk.eventsourcing.decider.Decider;
import io.github.suppierk.eventsourcing.decider.ValidationException;
import io.github.suppierk.eventsourcing.domain.RestaurantCommand.ChangeRestaurantMenuCommand;
import io.github.suppierk.eventsourcing.domain.RestaurantCommand.CreateRestaurantCommand;
import io.github.suppierk.eventsourcing.domain.RestaurantCommand.PlaceOrderCommand;
import io.github.suppierk.eventsourcing.domain.RestaurantEvent.OrderPlacedAtRestaurantEvent;
import io.github.suppierk.eventsourcing.domain.RestaurantEvent.RestaurantCreatedEvent;
import io.github.suppierk.eventsourcing.domain.RestaurantEvent.RestaurantMenuChangedEvent;
import java.util.List;

/**
 * Rules of the restaurant aggregate.
 *
 * <p>The state is {@code null} until the restaurant has been created.
 */
public final class RestaurantDecider
    implements Decider<RestaurantCommand, Restaurant, RestaurantEvent> {
  @Override
  public Restaurant initialState() {
    return null;
  }

  @Override
  public List<RestaurantEvent> decide(final RestaurantCommand command, final Restaurant state) {
    if (command instanceof CreateRestaurantCommand create) {
      if (state != null) {
        throw new ValidationException("Restaurant %s already exists".formatted(create.id()));
      }

      if (create.name() == null || create.name().isBlank()) {
        throw new ValidationException("Restaurant %s must have a name".formatted(create.id()));
      }

      requireValidMenu(create.id(), create.menu());
      return List.of(new RestaurantCreatedEvent(create.id(), create.name(), create.menu()));
    }

    if (command instanceof ChangeRestaurantMenuCommand change) {
      requireExisting(change.id(), state);
      requireValidMenu(change.id(), change.menu());
      return List.of(new RestaurantMenuChangedEvent(change.id(), change.menu()));
    }

    if (command instanceof PlaceOrderCommand place) {
      requireExisting(place.id(), state);

      if (place.orderId() == null) {
        throw new ValidationException(
            "Order placed at restaurant %s must have an ID".formatted(place.id()));
      }

      OrderLineItem.findDuplicateId(place.lineItems())
          .ifPresent(
              lineItemId -> {
                throw new ValidationException(
                    "Order %s lists line item %s more than once"
                        .formatted(place.orderId(), lineItemId));
              });

      for (var lineItem : place.lineItems()) {
        if (!state.menu().offers(lineItem.menuItemId())) {
          throw new ValidationException(
              "Restaurant %s does not offer menu item %s"
                  .formatted(place.id(), lineItem.menuItemId()));
        }
      }

      return List.of(
          new OrderPlacedAtRestaurantEvent(place.id(), place.lineItems(), place.orderId()));
    }

    throw new IllegalArgumentException(
        "Unsupported restaurant command %s".formatted(command.getClass().getSimpleName()));
  }

  @Override
  public Restaurant evolve(final Restaurant state, final RestaurantEvent event) {
    if (event instanceof RestaurantCreatedEvent created) {
      return new Restaurant(created.id(), created.name(), created.menu());
    }

    if (event instanceof RestaurantMenuChangedEvent changed) {
      return state == null ? null : state.withMenu(changed.menu());
    }

    // Placing an order does not change the restaurant itself
    return state;
  }

  private static void requireValidMenu(final RestaurantId id, final RestaurantMenu menu) {
    if (menu == null) {
      throw new ValidationException("Restaurant %s must have a menu".formatted(id));
    }

    menu.findDuplicateMenuItemId()
        .ifPresent(
            menuItemId -> {
              throw new ValidationException(
                  "Menu of restaurant %s lists item %s more than once".formatted(id, menuItemId));
            });
  }

  private static void requireExisting(final RestaurantId id, final Restaurant state) {
    if (state == null) {
      throw new ValidationException("Restaurant %s does not exist".formatted(id));
    }
  }
}
