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

import java.io.Serial;

/**
 * A specific {@link Exception} to be thrown if a {@link Decider} rejects a command given the
 * current state.
 *
 * <p>Never retried, the caller must change the command.
 */
public class ValidationException extends RuntimeException {
  @Serial private static final long serialVersionUID = -2961183476212014877L;

  /**
   * Constructs a new runtime exception with {@code null} as its detail message.
   *
   * <p>The cause is not initialized, and may subsequently be initialized by a call to {@link
   * #initCause}.
   */
  public ValidationException() {
    super();
  }

  /**
   * Constructs a new runtime exception with the specified detail message.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  public ValidationException(String message) {
    super(message);
  }

  /**
   * Constructs a new runtime exception with the specified detail message and cause.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   */
  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Constructs a new runtime exception with the specified cause.
   *
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   */
  public ValidationException(Throwable cause) {
    super(cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/422">422 Unprocessable
   *     Content</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 422;
  }
}
