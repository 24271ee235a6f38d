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
import io.github.suppierk.eventsourcing.domain.RestaurantEvent.RestaurantCreatedEvent;
import io.github.suppierk.eventsourcing.domain.RestaurantEvent.RestaurantMenuChangedEvent;

/**
 * Folds restaurant events into the {@link RestaurantViewState} shown to readers.
 *
 * <p>Orders placed at the restaurant are tracked by {@link OrderView}, so they leave the state
 * untouched.
 */
public final class RestaurantView implements Projection<RestaurantViewState, RestaurantEvent> {
  @Override
  public RestaurantViewState initialState() {
    return null;
  }

  @Override
  public RestaurantViewState evolve(final RestaurantViewState state, final RestaurantEvent event) {
    if (event instanceof RestaurantCreatedEvent created) {
      return new RestaurantViewState(created.id(), created.name(), created.menu());
    }

    if (event instanceof RestaurantMenuChangedEvent changed && state != null) {
      return new RestaurantViewState(state.id(), state.name(), changed.menu());
    }

    return state;
  }
}
