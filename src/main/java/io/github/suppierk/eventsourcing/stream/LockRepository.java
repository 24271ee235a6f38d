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

import io.github.suppierk.eventsourcing.application.EventEnvelope;
import io.github.suppierk.eventsourcing.decider.AggregateEvent;
import java.util.List;
import java.util.Optional;
import org.jooq.DSLContext;

/**
 * Lease coordinator shared by all consumers of all views.
 *
 * @param <E> event type
 */
public interface LockRepository<E extends AggregateEvent> {
  /**
   * Leases the partition holding the globally oldest undelivered event of the view.
   *
   * <p>Only partitions which are not leased (or whose lease expired) are considered, and only
   * events created at or after {@link View#startAt()}. At most one of many concurrent callers gets
   * a given event.
   *
   * @param dsl to run in
   * @param view to read for
   * @return the leased event, empty if there is nothing to process right now
   */
  Optional<EventEnvelope<E>> acquireNext(DSLContext dsl, String view);

  /**
   * @param dsl to run in
   * @param view the action is reported for
   * @param action to apply
   * @return the lock after the action, empty if the action changed nothing
   */
  Optional<Lock> executeAction(DSLContext dsl, String view, LockAction action);

  /**
   * @param dsl to run in
   * @return every lock of every view
   */
  List<Lock> findAll(DSLContext dsl);

  /**
   * @param dsl to run in
   * @param view to look up
   * @return every lock of the view
   */
  List<Lock> findAll(DSLContext dsl, String view);
}
