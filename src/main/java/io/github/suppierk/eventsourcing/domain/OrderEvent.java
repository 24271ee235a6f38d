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

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/** Facts about an order aggregate. */
public sealed interface OrderEvent extends Event {
  String AGGREGATE_TYPE = "Order";

  OrderId id();

  @Override
  default String aggregateId() {
    return id().toString();
  }

  @Override
  default String aggregateType() {
    return AGGREGATE_TYPE;
  }

  /**
   * @param id of the new order
   * @param lineItems ordered
   * @param restaurantId the order was placed at
   */
  record OrderCreatedEvent(OrderId id, List<OrderLineItem> lineItems, RestaurantId restaurantId)
      implements OrderEvent {
    public OrderCreatedEvent {
      lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
    }
  }

  /** Terminal event, nothing happens to the order afterwards. */
  record OrderPreparedEvent(OrderId id) implements OrderEvent {
    @JsonIgnore
    @Override
    public boolean isFinal() {
      return true;
    }
  }
}
