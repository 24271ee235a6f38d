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

package io.github.suppierk.eventsourcing.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.eventsourcing.decider.AggregateEvent;

/**
 * Converts events to and from the JSON text stored in the event table.
 *
 * <p>The event class is expected to carry Jackson polymorphic type information, so that the root
 * type is enough to read back any of its subtypes.
 *
 * @param <E> event type
 */
public final class EventSerializer<E extends AggregateEvent> {
  private final ObjectMapper objectMapper;
  private final Class<E> eventClass;

  /**
   * @param eventClass root type of the events
   */
  public EventSerializer(final Class<E> eventClass) {
    this(defaultObjectMapper(), eventClass);
  }

  public EventSerializer(final ObjectMapper objectMapper, final Class<E> eventClass) {
    if (objectMapper == null) {
      throw new IllegalArgumentException("Object mapper cannot be null");
    }

    if (eventClass == null) {
      throw new IllegalArgumentException("Event class cannot be null");
    }

    this.objectMapper = objectMapper;
    this.eventClass = eventClass;
  }

  /**
   * @return mapper tolerating properties it does not know, so that older readers survive newer
   *     events
   */
  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * @param event to write
   * @return JSON text
   * @throws EventSerializationException if the event cannot be written
   */
  public String serialize(final E event) {
    try {
      return objectMapper.writerFor(eventClass).writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new EventSerializationException(
          "Failed to serialize %s".formatted(event.eventType()), e);
    }
  }

  /**
   * @param eventType name the event was stored under
   * @param data JSON text
   * @return the event
   * @throws EventSerializationException if the text cannot be read or contains another event type
   */
  public E deserialize(final String eventType, final String data) {
    final E event;
    try {
      event = objectMapper.readValue(data, eventClass);
    } catch (JsonProcessingException e) {
      throw new EventSerializationException("Failed to deserialize %s".formatted(eventType), e);
    }

    if (eventType != null && !eventType.equals(event.eventType())) {
      throw new EventSerializationException(
          "Stored as %s, but read as %s".formatted(eventType, event.eventType()));
    }

    return event;
  }
}
