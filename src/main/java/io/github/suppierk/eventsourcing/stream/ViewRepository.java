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

package io.github.suppierk.eventsourcing.stream;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import org.jooq.DSLContext;

/** Registry of consumer groups. */
public interface ViewRepository {
  /**
   * Creates or updates the view.
   *
   * <p>Repeated registration with the same arguments changes nothing but {@link View#updatedAt()}.
   * Aggregates which already have events get a lock for the view, so existing history is delivered
   * as well.
   *
   * @param dsl to run in
   * @param name of the view
   * @param pollingDelayMs how long consumers wait when there is nothing to process
   * @param startAt earliest creation time of delivered events
   * @return registered view
   */
  View registerView(DSLContext dsl, String name, long pollingDelayMs, OffsetDateTime startAt);

  /**
   * @param dsl to run in
   * @param name of the view
   * @return the view, if registered
   */
  Optional<View> findById(DSLContext dsl, String name);

  /**
   * @param dsl to run in
   * @return every registered view
   */
  List<View> findAll(DSLContext dsl);
}
