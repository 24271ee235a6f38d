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

import io.github.suppierk.eventsourcing.decider.Projection;
import io.github.suppierk.eventsourcing.domain.OrderEvent.OrderCreatedEvent;
import io.github.suppierk.eventsourcing.domain.OrderEvent.OrderPreparedEvent;

/** Folds order events into the {@link OrderViewState} shown to readers. */
public final class OrderView implements Projection<OrderViewState, OrderEvent> {
  @Override
  public OrderViewState initialState() {
    return null;
  }

  @Override
  public OrderViewState evolve(final OrderViewState state, final OrderEvent event) {
    if (event instanceof OrderCreatedEvent created) {
      return new OrderViewState(
          created.id(), created.restaurantId(), OrderStatus.CREATED, created.lineItems());
    }

    if (event instanceof OrderPreparedEvent && state != null) {
      return new OrderViewState(
          state.id(), state.restaurantId(), OrderStatus.PREPARED, state.lineItems());
    }

    return state;
  }
}
