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
 * A command addressed to a single aggregate.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 */
public interface AggregateCommand {
  /**
   * @return the identifier of the aggregate this command targets
   */
  String aggregateId();

  /**
   * Aggregate identifiers are only unique within their type.
   *
   * @return the type of the aggregate this command targets
   */
  String aggregateType();
}
