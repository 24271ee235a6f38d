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

package io.github.suppierk.eventsourcing.decider;

import java.util.List;

/**
 * Pure read-side fold: how events change a projection snapshot.
 *
 * <p>Same determinism requirements as for {@link Decider#evolve(Object, Object)} apply.
 *
 * @param <S> snapshot type
 * @param <E> event type
 */
public interface Projection<S, E> {
  /**
   * @return the snapshot before any event was applied
   */
  S initialState();

  /**
   * @param state current snapshot
   * @param event to apply
   * @return the next snapshot
   */
  S evolve(S state, E event);

  /**
   * @param events ordered events to replay from {@link #initialState()}
   * @return the snapshot reached after all events were applied
   */
  default S fold(List<? extends E> events) {
    S state = initialState();
    for (E event : events) {
      state = evolve(state, event);
    }
    return state;
  }

  /**
   * Combines two projections over different event types. Each event is routed to the projection
   * owning its type, the other side of the {@link Pair} is passed through unchanged.
   *
   * @param leftEvents event type of the first projection
   * @param left first projection
   * @param rightEvents event type of the second projection
   * @param right second projection
   * @return combined projection
   */
  static <E, S1, E1 extends E, S2, E2 extends E> Projection<Pair<S1, S2>, E> combine(
      final Class<E1> leftEvents,
      final Projection<S1, E1> left,
      final Class<E2> rightEvents,
      final Projection<S2, E2> right) {
    if (leftEvents == null || left == null || rightEvents == null || right == null) {
      throw new IllegalArgumentException("Combined projection components cannot be null");
    }

    return new Projection<>() {
      @Override
      public Pair<S1, S2> initialState() {
        return new Pair<>(left.initialState(), right.initialState());
      }

      @Override
      public Pair<S1, S2> evolve(final Pair<S1, S2> state, final E event) {
        if (leftEvents.isInstance(event)) {
          return state.withLeft(left.evolve(state.left(), leftEvents.cast(event)));
        }

        if (rightEvents.isInstance(event)) {
          return state.withRight(right.evolve(state.right(), rightEvents.cast(event)));
        }

        return state;
      }
    };
  }
}
