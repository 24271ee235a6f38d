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

import io.github.suppierk.eventsourcing.decider.AggregateEvent;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jooq.DSLContext;

/**
 * Durable, append-only storage of aggregate event chains.
 *
 * <p>Every operation runs in the given {@link DSLContext}, which lets the caller decide on the
 * transaction boundaries.
 *
 * @param <E> event type
 */
public interface EventRepository<E extends AggregateEvent> {
  /**
   * Appends the event to the chain of its aggregate.
   *
   * @param dsl to run in
   * @param envelope to append, {@link EventEnvelope#previousId()} must point to the current head
   * @return the envelope with the assigned creation time and offset
   * @throws ConcurrencyException if the chain head differs from the expected one
   */
  EventEnvelope<E> append(DSLContext dsl, EventEnvelope<E> envelope);

  /**
   * @param dsl to run in
   * @param aggregateType of the aggregate
   * @param aggregateId to fetch events for
   * @return the chain of the aggregate ordered by offset, empty if there are no events
   */
  List<EventEnvelope<E>> fetch(DSLContext dsl, String aggregateType, String aggregateId);

  /**
   * @param dsl to run in
   * @param aggregateType of the aggregate
   * @param aggregateId to look up
   * @return the identifier of the chain head, if any
   */
  Optional<UUID> getLastEventId(DSLContext dsl, String aggregateType, String aggregateId);
}
