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

package io.github.suppierk.eventsourcing.application;

import org.jooq.DSLContext;

/**
 * Storage of read-model snapshots.
 *
 * @param <S> snapshot type
 * @param <E> event type
 */
public interface MaterializedViewStateRepository<S, E> {
  /**
   * @param dsl to run in
   * @param event whose aggregate the snapshot belongs to
   * @return the snapshot of the event's aggregate, {@code null} if nothing was projected yet
   */
  S fetchState(DSLContext dsl, E event);

  /**
   * Inserts or updates the snapshot.
   *
   * @param dsl to run in
   * @param state to store
   * @return stored snapshot
   */
  S save(DSLContext dsl, S state);
}
