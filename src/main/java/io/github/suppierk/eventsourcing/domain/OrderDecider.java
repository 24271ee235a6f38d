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
import io.github.suppierk.eventsourcing.domain.OrderCommand.CreateOrderCommand;
import io.github.suppierk.eventsourcing.domain.OrderCommand.MarkOrderAsPreparedCommand;
import io.github.suppierk.eventsourcing.domain.OrderEvent.OrderCreatedEvent;
import io.github.suppierk.eventsourcing.domain.OrderEvent.OrderPreparedEvent;
import java.util.List;

/**
 * Rules of the order aggregate.
 *
 * <p>The state is {@code null} until the order has been created.
 */
public final class OrderDecider implements Decider<OrderCommand, Order, OrderEvent> {
  @Override
  public Order initialState() {
    return null;
  }

  @Override
  public List<OrderEvent> decide(final OrderCommand command, final Order state) {
    if (command instanceof CreateOrderCommand create) {
      if (state != null) {
        throw new ValidationException("Order %s already exists".formatted(create.id()));
      }

      if (create.restaurantId() == null) {
        throw new ValidationException(
            "Order %s must belong to a restaurant".formatted(create.id()));
      }

      OrderLineItem.findDuplicateId(create.lineItems())
          .ifPresent(
              lineItemId -> {
                throw new ValidationException(
                    "Order %s lists line item %s more than once"
                        .formatted(create.id(), lineItemId));
              });

      return List.of(
          new OrderCreatedEvent(create.id(), create.lineItems(), create.restaurantId()));
    }

    if (command instanceof MarkOrderAsPreparedCommand prepare) {
      if (state == null) {
        throw new ValidationException("Order %s does not exist".formatted(prepare.id()));
      }

      if (state.status() != OrderStatus.CREATED) {
        throw new ValidationException(
            "Order %s cannot be prepared in status %s".formatted(prepare.id(), state.status()));
      }

      return List.of(new OrderPreparedEvent(prepare.id()));
    }

    throw new IllegalArgumentException(
        "Unsupported order command %s".formatted(command.getClass().getSimpleName()));
  }

  @Override
  public Order evolve(final Order state, final OrderEvent event) {
    if (event instanceof OrderCreatedEvent created) {
      return new Order(
          created.id(), created.restaurantId(), OrderStatus.CREATED, created.lineItems());
    }

    if (event instanceof OrderPreparedEvent) {
      return state == null ? null : state.withStatus(OrderStatus.PREPARED);
    }

    return state;
  }
}
