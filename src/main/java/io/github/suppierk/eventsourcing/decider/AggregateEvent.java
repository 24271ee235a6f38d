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

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A fact which happened to a single aggregate - the unit which is persisted and streamed.
 *
 * <p>Defined as {@code aggregateId()} rather than {@code getAggregateId()} because the latter is
 * not friendly towards Java {@link Record}s.
 */
public interface AggregateEvent {
  /**
   * @return the identifier of the aggregate this event belongs to
   */
  String aggregateId();

  /**
   * @return the name of the aggregate type, identical for all events of one decider
   */
  String aggregateType();

  /**
   * @return the name this event is stored under, simple class name by default
   */
  @JsonIgnore
  default String eventType() {
    return getClass().getSimpleName();
  }

  /**
   * @return {@code true} if the aggregate reached its terminal state with this event
   */
  @JsonIgnore
  default boolean isFinal() {
    return false;
  }
}
