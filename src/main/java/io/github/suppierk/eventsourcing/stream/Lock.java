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

/**
 * Progress of one view over the events of one aggregate.
 *
 * <p>While {@code lockedUntil} is in the future the row is leased by some consumer and nobody else
 * may claim it.
 *
 * @param view the lock belongs to
 * @param aggregateId partition of the stream
 * @param offset of the last acknowledged event, {@code -1} if none
 * @param lastOffset of the last appended event of the aggregate
 * @param lockedUntil end of the current lease, {@code null} if the row is not leased
 * @param offsetFinal whether the last appended event was final
 * @param createdAt when the row was created
 * @param updatedAt when the row was changed for the last time
 */
public record Lock(
    String view,
    String aggregateId,
    long offset,
    long lastOffset,
    OffsetDateTime lockedUntil,
    boolean offsetFinal,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt) {
  /** Offset of a lock which has not acknowledged anything yet. */
  public static final long INITIAL_OFFSET = -1L;

  /**
   * @param now current time
   * @return {@code true} if the row is unlocked or its lease has expired
   */
  public boolean isAvailableAt(final OffsetDateTime now) {
    return lockedUntil == null || !now.isBefore(lockedUntil);
  }
}
