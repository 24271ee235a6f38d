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

/** Commands targeting an order aggregate. */
public sealed interface OrderCommand extends Command {
  OrderId id();

  @Override
  default String aggregateId() {
    return id().toString();
  }

  @Override
  default String aggregateType() {
    return OrderEvent.AGGREGATE_TYPE;
  }

  /**
   * @param id of the order to create
   * @param restaurantId the order was placed at
   * @param lineItems ordered
   */
  record CreateOrderCommand(OrderId id, RestaurantId restaurantId, List<OrderLineItem> lineItems)
      implements OrderCommand {
    public CreateOrderCommand {
      lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
    }
  }

  /**
   * @param id of the order the kitchen finished
   */
  record MarkOrderAsPreparedCommand(OrderId id) implements OrderCommand {}
}
