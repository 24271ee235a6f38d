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

/** Outcome a consumer reports back after it received a leased event. */
public sealed interface LockAction {
  String aggregateId();

  /**
   * Marks the event as processed and releases the lease. Ignored if a newer offset was already
   * acknowledged.
   *
   * @param offset of the processed event
   * @param aggregateId partition the event belongs to
   */
  record Ack(long offset, String aggregateId) implements LockAction {}

  /**
   * Releases the lease immediately, the same event will be delivered again.
   *
   * @param aggregateId partition to release
   */
  record Nack(String aggregateId) implements LockAction {}

  /**
   * Keeps the partition leased for the given delay, after which the same event will be delivered
   * again.
   *
   * @param aggregateId partition to back off
   * @param delayMs how long to wait before the redelivery
   */
  record ScheduleNack(String aggregateId, long delayMs) implements LockAction {
    public ScheduleNack {
      if (delayMs < 0) {
        throw new IllegalArgumentException("Delay cannot be negative");
      }
    }
  }
}
