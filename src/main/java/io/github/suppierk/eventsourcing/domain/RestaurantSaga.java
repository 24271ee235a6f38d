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

import io.github.suppierk.eventsourcing.decider.Saga;
import io.github.suppierk.eventsourcing.domain.OrderCommand.CreateOrderCommand;
import io.github.suppierk.eventsourcing.domain.RestaurantEvent.OrderPlacedAtRestaurantEvent;
import java.util.List;

/** Creates an order aggregate for every order placed at a restaurant. */
public final class RestaurantSaga implements Saga<RestaurantEvent, OrderCommand> {
  @Override
  public List<OrderCommand> react(final RestaurantEvent event) {
    if (event instanceof OrderPlacedAtRestaurantEvent placed) {
      return List.of(new CreateOrderCommand(placed.orderId(), placed.id(), placed.lineItems()));
    }

    return List.of();
  }
}
