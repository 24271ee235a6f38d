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

package io.github.suppierk.eventsourcing.support;

/**
 * Common argument and state checks shared by application services, stream processors and
 * repositories.
 *
 * <p>Whichever parameters can be controlled must be covered with null checks and {@code final}
 * (if possible), whichever parameters are expected to be provided by consumer must be checked with
 * the help of these methods.
 */
public abstract class Suspicious {
  /**
   * This method must be used whenever we deal with properties of classes or with values returned
   * by collaborators.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalStateException when the value is {@code null}
   */
  protected final <T> T throwIllegalStateIfNull(T value, String whatMustNotBeNull)
      throws IllegalStateException {
    if (value == null) {
      throw new IllegalStateException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * This method must be used whenever we deal with method arguments only. When we need to check
   * method argument properties use {@link #throwIllegalStateIfNull(Object, String)} instead.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalArgumentException when the value is {@code null}
   */
  protected final <T> T throwIllegalArgumentIfNull(T value, String whatMustNotBeNull)
      throws IllegalArgumentException {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * Same as {@link #throwIllegalArgumentIfNull(Object, String)}, but also rejects strings which
   * consist of whitespace only - typical for names and identifiers.
   *
   * @param value which must not be {@code null} or blank
   * @param whatMustNotBeBlank is the parameter name
   * @return value if it was not blank
   * @throws IllegalArgumentException when the value is {@code null} or blank
   */
  protected final String throwIllegalArgumentIfBlank(String value, String whatMustNotBeBlank)
      throws IllegalArgumentException {
    if (throwIllegalArgumentIfNull(value, whatMustNotBeBlank).isBlank()) {
      throw new IllegalArgumentException("%s cannot be blank".formatted(whatMustNotBeBlank));
    }

    return value;
  }
}
