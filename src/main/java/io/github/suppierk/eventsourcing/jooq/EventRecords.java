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

package io.github.suppierk.eventsourcing.jooq;

import io.github.suppierk.eventsourcing.application.EventEnvelope;
import io.github.suppierk.eventsourcing.decider.AggregateEvent;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Events;
import io.github.suppierk.eventsourcing.json.EventSerializer;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.jooq.Field;
import org.jooq.Record;

/** Row mapping shared by the event and lock repositories. */
final class EventRecords {
  static final List<Field<?>> FIELDS =
      List.of(
          Events.AGGREGATE_TYPE,
          Events.AGGREGATE_ID,
          Events.EVENT_TYPE,
          Events.DATA,
          Events.EVENT_ID,
          Events.COMMAND_ID,
          Events.PREVIOUS_ID,
          Events.FINAL,
          Events.CREATED_AT,
          Events.OFFSET);

  private EventRecords() {}

  static <E extends AggregateEvent> EventEnvelope<E> toEnvelope(
      final Record dbRecord, final EventSerializer<E> serializer) {
    final String eventType = dbRecord.get(Events.EVENT_TYPE);
    final UUID previousId = dbRecord.get(Events.PREVIOUS_ID);

    return new EventEnvelope<>(
        dbRecord.get(Events.AGGREGATE_TYPE),
        dbRecord.get(Events.AGGREGATE_ID),
        eventType,
        serializer.deserialize(eventType, dbRecord.get(Events.DATA)),
        dbRecord.get(Events.EVENT_ID),
        dbRecord.get(Events.COMMAND_ID),
        Events.ROOT.equals(previousId) ? null : previousId,
        Boolean.TRUE.equals(dbRecord.get(Events.FINAL)),
        dbRecord.get(Events.CREATED_AT),
        dbRecord.get(Events.OFFSET));
  }

  /** Current time of the clock, always in UTC. */
  static OffsetDateTime now(final Clock clock) {
    return OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
  }
}
