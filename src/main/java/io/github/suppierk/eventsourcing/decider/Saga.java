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
 * Pure reaction to a fact: which commands have to be issued once something happened.
 *
 * <p>Used for the coordination across aggregates, e.g. a placed order at a restaurant leads to the
 * creation of an order aggregate.
 *
 * @param <AR> action result type - typically an event
 * @param <A> action type - typically a command
 */
@SuppressWarnings("squid:S119")
@FunctionalInterface
public interface Saga<AR, A> {
  /**
   * @param actionResult which happened
   * @return commands to issue, possibly none
   */
  List<A> react(AR actionResult);

  /**
   * @param <AR> action result type
   * @param <A> action type
   * @return an instance which never reacts
   */
  static <AR, A> Saga<AR, A> empty() {
    return actionResult -> List.of();
  }

  /**
   * Combines two sagas reacting on different action result types into one, operating on the union
   * of both. If no saga accepts the action result, no actions are issued.
   *
   * @param leftResults action result type of the first saga
   * @param left first saga
   * @param rightResults action result type of the second saga
   * @param right second saga
   * @return combined saga
   */
  static <AR, A, AR1 extends AR, A1 extends A, AR2 extends AR, A2 extends A> Saga<AR, A> combine(
      final Class<AR1> leftResults,
      final Saga<AR1, A1> left,
      final Class<AR2> rightResults,
      final Saga<AR2, A2> right) {
    if (leftResults == null || left == null || rightResults == null || right == null) {
      throw new IllegalArgumentException("Combined saga components cannot be null");
    }

    return actionResult -> {
      final List<A> actions = new ArrayList<>();

      if (leftResults.isInstance(actionResult)) {
        actions.addAll(left.react(leftResults.cast(actionResult)));
      }

      if (rightResults.isInstance(actionResult)) {
        actions.addAll(right.react(rightResults.cast(actionResult)));
      }

      return actions;
    };
  }
}
