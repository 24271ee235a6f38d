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
import io.github.suppierk.eventsourcing.decider.Pair;
import io.github.suppierk.eventsourcing.decider.Projection;
import io.github.suppierk.eventsourcing.decider.Saga;

/**
 * Composition of the restaurant and order rules into single units working on {@link Command} and
 * {@link Event}.
 *
 * <p>Restaurant always occupies the left side of the {@link Pair}, order the right one.
 */
public final class OrderingDomain {
  private OrderingDomain() {}

  /**
   * @return decider accepting any {@link Command}
   */
  public static Decider<Command, Pair<Restaurant, Order>, Event> decider() {
    return Decider.combine(
        RestaurantCommand.class,
        RestaurantEvent.class,
        new RestaurantDecider(),
        OrderCommand.class,
        OrderEvent.class,
        new OrderDecider());
  }

  /**
   * @return saga reacting on any {@link Event}
   */
  public static Saga<Event, Command> saga() {
    return Saga.combine(
        RestaurantEvent.class, new RestaurantSaga(), OrderEvent.class, new OrderSaga());
  }

  /**
   * @return projection folding any {@link Event} into restaurant and order snapshots
   */
  public static Projection<Pair<RestaurantViewState, OrderViewState>, Event> projection() {
    return Projection.combine(
        RestaurantEvent.class, new RestaurantView(), OrderEvent.class, new OrderView());
  }
}
