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

import io.github.suppierk.eventsourcing.application.ConcurrencyException;
import io.github.suppierk.eventsourcing.application.EventEnvelope;
import io.github.suppierk.eventsourcing.application.EventRepository;
import io.github.suppierk.eventsourcing.decider.AggregateEvent;
import io.github.suppierk.eventsourcing.decider.ValidationException;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Events;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Locks;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Views;
import io.github.suppierk.eventsourcing.json.EventSerializer;
import io.github.suppierk.eventsourcing.stream.Lock;
import io.github.suppierk.eventsourcing.support.Suspicious;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.jooq.DSLContext;
import org.jooq.Record2;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventRepository} on top of the {@code events} table.
 *
 * <p>The chain of every aggregate is protected twice: the head is checked before the insert, and
 * the unique {@code (aggregate_type, aggregate_id, previous_id)} constraint rejects whichever of
 * two concurrent writers commits second. Both cases end in a {@link ConcurrencyException}.
 *
 * <p>Every append also moves {@code last_offset} of the aggregate locks of all registered views,
 * which is what makes the event visible to the stream.
 *
 * @param <E> event type
 */
public final class JooqEventRepository<E extends AggregateEvent> extends Suspicious
    implements EventRepository<E> {
  private static final Logger LOGGER = LoggerFactory.getLogger(JooqEventRepository.class);

  private final EventSerializer<E> serializer;
  private final Clock clock;

  public JooqEventRepository(final EventSerializer<E> serializer, final Clock clock) {
    this.serializer = throwIllegalArgumentIfNull(serializer, "Serializer");
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
  }

  @Override
  public EventEnvelope<E> append(final DSLContext dsl, final EventEnvelope<E> envelope) {
    final DSLContext nonNullDsl = throwIllegalArgumentIfNull(dsl, "DSL");
    final EventEnvelope<E> nonNullEnvelope = throwIllegalArgumentIfNull(envelope, "Envelope");
    final E event = throwIllegalStateIfNull(nonNullEnvelope.event(), "Envelope's event");

    verifyHead(nonNullDsl, nonNullEnvelope);

    final OffsetDateTime createdAt = EventRecords.now(clock);
    try {
      nonNullDsl
          .insertInto(Events.TABLE)
          .set(Events.AGGREGATE_TYPE, nonNullEnvelope.aggregateType())
          .set(Events.AGGREGATE_ID, nonNullEnvelope.aggregateId())
          .set(Events.EVENT_TYPE, nonNullEnvelope.eventType())
          .set(Events.DATA, serializer.serialize(event))
          .set(Events.EVENT_ID, nonNullEnvelope.eventId())
          .set(Events.COMMAND_ID, nonNullEnvelope.commandId())
          .set(
              Events.PREVIOUS_ID,
              Objects.requireNonNullElse(nonNullEnvelope.previousId(), Events.ROOT))
          .set(Events.FINAL, nonNullEnvelope.isFinal())
          .set(Events.CREATED_AT, createdAt)
          .execute();
    } catch (DataAccessException e) {
      if (e.sqlStateClass() == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
        throw new ConcurrencyException(
            "Aggregate %s %s was changed concurrently"
                .formatted(nonNullEnvelope.aggregateType(), nonNullEnvelope.aggregateId()),
            e);
      }

      throw e;
    }

    final long offset =
        throwIllegalStateIfNull(
            nonNullDsl
                .select(Events.OFFSET)
                .from(Events.TABLE)
                .where(Events.EVENT_ID.eq(nonNullEnvelope.eventId()))
                .fetchOne(Events.OFFSET),
            "Appended event offset");

    final EventEnvelope<E> appended = nonNullEnvelope.appended(createdAt, offset);
    updateLocks(nonNullDsl, appended);

    LOGGER.debug(
        "Appended {} #{} to aggregate {}",
        appended.eventType(),
        appended.offset(),
        appended.aggregateId());
    return appended;
  }

  @Override
  public List<EventEnvelope<E>> fetch(
      final DSLContext dsl, final String aggregateType, final String aggregateId) {
    return throwIllegalArgumentIfNull(dsl, "DSL")
        .select(EventRecords.FIELDS)
        .from(Events.TABLE)
        .where(
            Events.AGGREGATE_TYPE.eq(throwIllegalArgumentIfNull(aggregateType, "Aggregate type")))
        .and(Events.AGGREGATE_ID.eq(throwIllegalArgumentIfNull(aggregateId, "Aggregate ID")))
        .orderBy(Events.OFFSET.asc())
        .fetch(dbRecord -> EventRecords.toEnvelope(dbRecord, serializer));
  }

  @Override
  public Optional<UUID> getLastEventId(
      final DSLContext dsl, final String aggregateType, final String aggregateId) {
    return throwIllegalArgumentIfNull(dsl, "DSL")
        .select(Events.EVENT_ID)
        .from(Events.TABLE)
        .where(
            Events.AGGREGATE_TYPE.eq(throwIllegalArgumentIfNull(aggregateType, "Aggregate type")))
        .and(Events.AGGREGATE_ID.eq(throwIllegalArgumentIfNull(aggregateId, "Aggregate ID")))
        .orderBy(Events.OFFSET.desc())
        .limit(1)
        .fetchOptional(Events.EVENT_ID);
  }

  private void verifyHead(final DSLContext dsl, final EventEnvelope<E> envelope) {
    final Optional<Record2<UUID, Boolean>> head =
        dsl.select(Events.EVENT_ID, Events.FINAL)
            .from(Events.TABLE)
            .where(Events.AGGREGATE_TYPE.eq(envelope.aggregateType()))
            .and(Events.AGGREGATE_ID.eq(envelope.aggregateId()))
            .orderBy(Events.OFFSET.desc())
            .limit(1)
            .fetchOptional();

    final UUID headId = head.map(Record2::value1).orElse(null);
    if (!Objects.equals(headId, envelope.previousId())) {
      throw new ConcurrencyException(
          "Aggregate %s %s is at %s, but %s was expected"
              .formatted(
                  envelope.aggregateType(),
                  envelope.aggregateId(),
                  headId,
                  envelope.previousId()));
    }

    if (head.map(Record2::value2).orElse(false)) {
      throw new ValidationException(
          "Aggregate %s %s is final and cannot be changed"
              .formatted(envelope.aggregateType(), envelope.aggregateId()));
    }
  }

  private void updateLocks(final DSLContext dsl, final EventEnvelope<E> appended) {
    final OffsetDateTime now = appended.createdAt();

    for (String view : dsl.select(Views.VIEW).from(Views.TABLE).fetch(Views.VIEW)) {
      final int updated =
          dsl.update(Locks.TABLE)
              .set(Locks.LAST_OFFSET, appended.offset())
              .set(Locks.OFFSET_FINAL, appended.isFinal())
              .set(Locks.UPDATED_AT, now)
              .where(Locks.VIEW.eq(view))
              .and(Locks.AGGREGATE_ID.eq(appended.aggregateId()))
              .execute();

      if (updated == 0) {
        dsl.insertInto(Locks.TABLE)
            .set(Locks.VIEW, view)
            .set(Locks.AGGREGATE_ID, appended.aggregateId())
            .set(Locks.OFFSET, Lock.INITIAL_OFFSET)
            .set(Locks.LAST_OFFSET, appended.offset())
            .set(Locks.OFFSET_FINAL, appended.isFinal())
            .set(Locks.CREATED_AT, now)
            .set(Locks.UPDATED_AT, now)
            .execute();
      }
    }
  }
}
