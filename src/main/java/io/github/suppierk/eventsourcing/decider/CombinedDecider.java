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

import java.util.ArrayList;
import java.util.List;

/**
 * Router behind {@link Decider#combine(Class, Class, Decider, Class, Class, Decider)}.
 *
 * <p>Events of unknown types are ignored by {@link #evolve(Pair, Object)}, which keeps the fold
 * total. Commands of unknown types cannot be decided upon and are rejected.
 */
@SuppressWarnings("squid:S119")
final class CombinedDecider<C, E, C1 extends C, S1, E1 extends E, C2 extends C, S2, E2 extends E>
    implements Decider<C, Pair<S1, S2>, E> {
  private final Class<C1> leftCommands;
  private final Class<E1> leftEvents;
  private final Decider<C1, S1, E1> left;
  private final Class<C2> rightCommands;
  private final Class<E2> rightEvents;
  private final Decider<C2, S2, E2> right;

  CombinedDecider(
      final Class<C1> leftCommands,
      final Class<E1> leftEvents,
      final Decider<C1, S1, E1> left,
      final Class<C2> rightCommands,
      final Class<E2> rightEvents,
      final Decider<C2, S2, E2> right) {
    this.leftCommands = requireNonNull(leftCommands, "Left command class");
    this.leftEvents = requireNonNull(leftEvents, "Left event class");
    this.left = requireNonNull(left, "Left decider");
    this.rightCommands = requireNonNull(rightCommands, "Right command class");
    this.rightEvents = requireNonNull(rightEvents, "Right event class");
    this.right = requireNonNull(right, "Right decider");
  }

  @Override
  public Pair<S1, S2> initialState() {
    return new Pair<>(left.initialState(), right.initialState());
  }

  @Override
  public List<E> decide(final C command, final Pair<S1, S2> state) {
    if (leftCommands.isInstance(command)) {
      return new ArrayList<>(left.decide(leftCommands.cast(command), state.left()));
    }

    if (rightCommands.isInstance(command)) {
      return new ArrayList<>(right.decide(rightCommands.cast(command), state.right()));
    }

    throw new IllegalArgumentException(
        "No decider accepts command of type '%s'"
            .formatted(command == null ? null : command.getClass().getSimpleName()));
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

  private static <T> T requireNonNull(final T value, final String whatMustNotBeNull) {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }
}
