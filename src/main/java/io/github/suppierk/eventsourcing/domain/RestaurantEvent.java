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

/** Facts about a restaurant aggregate. */
public sealed interface RestaurantEvent extends Event {
  String AGGREGATE_TYPE = "Restaurant";

  RestaurantId id();

  @Override
  default String aggregateId() {
    return id().toString();
  }

  @Override
  default String aggregateType() {
    return AGGREGATE_TYPE;
  }

  /**
   * @param id of the new restaurant
   * @param name of the restaurant
   * @param menu the restaurant starts with
   */
  record RestaurantCreatedEvent(RestaurantId id, String name, RestaurantMenu menu)
      implements RestaurantEvent {}

  /**
   * @param id of the restaurant
   * @param menu replacing the previous one
   */
  record RestaurantMenuChangedEvent(RestaurantId id, RestaurantMenu menu)
      implements RestaurantEvent {}

  /**
   * @param id of the restaurant
   * @param lineItems ordered
   * @param orderId of the order to be created
   */
  record OrderPlacedAtRestaurantEvent(
      RestaurantId id, List<OrderLineItem> lineItems, OrderId orderId)
      implements RestaurantEvent {
    public OrderPlacedAtRestaurantEvent {
      lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
    }
  }
}
