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

import java.util.List;

/** Commands targeting a restaurant aggregate. */
public sealed interface RestaurantCommand extends Command {
  RestaurantId id();

  @Override
  default String aggregateId() {
    return id().toString();
  }

  @Override
  default String aggregateType() {
    return RestaurantEvent.AGGREGATE_TYPE;
  }

  /**
   * @param id of the restaurant to create
   * @param name of the restaurant
   * @param menu the restaurant starts with
   */
  record CreateRestaurantCommand(RestaurantId id, String name, RestaurantMenu menu)
      implements RestaurantCommand {}

  /**
   * @param id of the existing restaurant
   * @param menu replacing the current one
   */
  record ChangeRestaurantMenuCommand(RestaurantId id, RestaurantMenu menu)
      implements RestaurantCommand {}

  /**
   * @param id of the restaurant receiving the order
   * @param orderId of the order to be created
   * @param lineItems ordered
   */
  record PlaceOrderCommand(RestaurantId id, OrderId orderId, List<OrderLineItem> lineItems)
      implements RestaurantCommand {
    public PlaceOrderCommand {
      lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
    }
  }
}
