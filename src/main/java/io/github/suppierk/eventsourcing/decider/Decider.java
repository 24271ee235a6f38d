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
 * Pure rules of one aggregate type: how commands become events and how events fold into state.
 *
 * <p>Implementations must be stateless, free of I/O and deterministic - given the same ordered
 * prefix of events {@link #evolve(Object, Object)} folded left-to-right must always reach the same
 * state, this is what makes replays and projection rebuilds correct.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 */
public interface Decider<C, S, E> {
  /**
   * @return the state of an aggregate which has no events yet
   */
  S initialState();

  /**
   * @param command to decide upon
   * @param state current state of the aggregate
   * @return new events, possibly none
   * @throws ValidationException if the command cannot be accepted in the given state
   */
  List<E> decide(C command, S state);

  /**
   * @param state current state of the aggregate
   * @param event to apply
   * @return the next state
   */
  S evolve(S state, E event);

  /**
   * Replays events from {@link #initialState()}.
   *
   * @param events ordered history of the aggregate
   * @return the state reached after all events were applied
   */
  default S fold(List<? extends E> events) {
    S state = initialState();
    for (E event : events) {
      state = evolve(state, event);
    }
    return state;
  }

  /**
   * Combines two deciders of different aggregate types into one, operating on the union of their
   * commands and events. Every command and event is routed to the decider owning its type, the
   * sub-state of the other decider stays untouched.
   *
   * @param leftCommands command type of the first decider
   * @param leftEvents event type of the first decider
   * @param left first decider
   * @param rightCommands command type of the second decider
   * @param rightEvents event type of the second decider
   * @param right second decider
   * @return combined decider with the {@link Pair} of both states
   */
  @SuppressWarnings("squid:S119")
  static <C, E, C1 extends C, S1, E1 extends E, C2 extends C, S2, E2 extends E>
      Decider<C, Pair<S1, S2>, E> combine(
          final Class<C1> leftCommands,
          final Class<E1> leftEvents,
          final Decider<C1, S1, E1> left,
          final Class<C2> rightCommands,
          final Class<E2> rightEvents,
          final Decider<C2, S2, E2> right) {
    return new CombinedDecider<>(
        leftCommands, leftEvents, left, rightCommands, rightEvents, right);
  }
}
