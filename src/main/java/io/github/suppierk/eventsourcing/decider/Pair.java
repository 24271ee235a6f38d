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

/**
 * Labeled product of two sub-states, used as the state of combined deciders and projections.
 *
 * <p>Either side can be {@code null} - this is how "not created yet" is represented by the
 * domain.
 *
 * @param left sub-state owned by the first combined component
 * @param right sub-state owned by the second combined component
 * @param <L> type of the first sub-state
 * @param <R> type of the second sub-state
 */
public record Pair<L, R>(L left, R right) {
  /**
   * @param left to replace
   * @return a copy with the new left side
   */
  public Pair<L, R> withLeft(L left) {
    return new Pair<>(left, right);
  }

  /**
   * @param right to replace
   * @return a copy with the new right side
   */
  public Pair<L, R> withRight(R right) {
    return new Pair<>(left, right);
  }
}
