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

import java.io.Serial;

/**
 * A specific {@link Exception} to be thrown when an event is appended on top of a stale chain head,
 * meaning that another writer changed the aggregate in the meantime.
 *
 * <p>Never retried internally, the caller may reload the aggregate and issue the command again.
 */
public class ConcurrencyException extends RuntimeException {
  @Serial private static final long serialVersionUID = 6021395782114310451L;

  public ConcurrencyException() {
    super();
  }

  public ConcurrencyException(String message) {
    super(message);
  }

  public ConcurrencyException(String message, Throwable cause) {
    super(message, cause);
  }

  public ConcurrencyException(Throwable cause) {
    super(cause);
  }

  /**
   * Convenience method for the transport layers.
   *
   * @return HTTP 409 Conflict
   */
  public int getStatusCode() {
    return 409;
  }
}
