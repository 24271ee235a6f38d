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

import java.io.Serial;

/** Thrown when an event cannot be written to or read from its stored JSON form. */
public class EventSerializationException extends RuntimeException {
  @Serial private static final long serialVersionUID = -4387203695531108822L;

  public EventSerializationException() {
    super();
  }

  public EventSerializationException(String message) {
    super(message);
  }

  public EventSerializationException(String message, Throwable cause) {
    super(message, cause);
  }

  public EventSerializationException(Throwable cause) {
    super(cause);
  }

  /**
   * Convenience method for the transport layers.
   *
   * @return HTTP 500 Internal Server Error
   */
  public int getStatusCode() {
    return 500;
  }
}
