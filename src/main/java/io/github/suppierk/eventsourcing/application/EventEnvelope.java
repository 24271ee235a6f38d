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
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Persisted form of an {@link AggregateEvent} together with its position in the causal chain of
 * its aggregate.
 *
 * <p>Envelopes of one aggregate form a singly linked list through {@code previousId -> eventId}.
 * {@code createdAt} and {@code offset} are assigned by the {@link EventRepository} on append and
 * are {@code null} before that.
 *
 * @param aggregateType of the event
 * @param aggregateId of the event
 * @param eventType name the payload is stored under
 * @param event payload
 * @param eventId unique identifier of this event
 * @param commandId of the command which produced the event
 * @param previousId of the event this one follows, {@code null} for the first event
 * @param isFinal whether the aggregate reached its terminal state
 * @param createdAt when the event was appended
 * @param offset global position of the event in the store
 * @param <E> event type
 */
public record EventEnvelope<E extends AggregateEvent>(
    String aggregateType,
    String aggregateId,
    String eventType,
    E event,
    UUID eventId,
    UUID commandId,
    UUID previousId,
    boolean isFinal,
    OffsetDateTime createdAt,
    Long offset) {

  /**
   * @param event to wrap
   * @param commandId which produced the event
   * @param previousId expected head of the aggregate chain, {@code null} if there is none
   * @param <E> event type
   * @return an envelope ready to be appended
   */
  public static <E extends AggregateEvent> EventEnvelope<E> of(
      final E event, final UUID commandId, final UUID previousId) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    return new EventEnvelope<>(
        event.aggregateType(),
        event.aggregateId(),
        event.eventType(),
        event,
        UUID.randomUUID(),
        commandId,
        previousId,
        event.isFinal(),
        null,
        null);
  }

  /**
   * @param createdAt assigned by the store
   * @param offset assigned by the store
   * @return a copy of this envelope as it was appended
   */
  public EventEnvelope<E> appended(final OffsetDateTime createdAt, final long offset) {
    return new EventEnvelope<>(
        aggregateType,
        aggregateId,
        eventType,
        event,
        eventId,
        commandId,
        previousId,
        isFinal,
        createdAt,
        offset);
  }
}
