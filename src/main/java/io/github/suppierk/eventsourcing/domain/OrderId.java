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

package io.github.suppierk.eventsourcing.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.UUID;

/**
 * Identifier of an order aggregate, serialized as a plain UUID.
 *
 * @param value of the order identifier
 */
public record OrderId(@JsonValue UUID value) {
  public OrderId {
    if (value == null) {
      throw new IllegalArgumentException("Order ID cannot be null");
    }
  }

  /**
   * @param value of the identifier
   * @return identifier wrapping the value
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static OrderId of(final UUID value) {
    return new OrderId(value);
  }

  /**
   * @return a new unique order identifier
   */
  public static OrderId random() {
    return new OrderId(UUID.randomUUID());
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
