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

import static org.jooq.impl.DSL.noCondition;

import io.github.suppierk.eventsourcing.application.EventEnvelope;
import io.github.suppierk.eventsourcing.decider.AggregateEvent;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Events;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Locks;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Views;
import io.github.suppierk.eventsourcing.json.EventSerializer;
import io.github.suppierk.eventsourcing.stream.Lock;
import io.github.suppierk.eventsourcing.stream.LockAction;
import io.github.suppierk.eventsourcing.stream.LockAction.Ack;
import io.github.suppierk.eventsourcing.stream.LockAction.Nack;
import io.github.suppierk.eventsourcing.stream.LockAction.ScheduleNack;
import io.github.suppierk.eventsourcing.stream.LockRepository;
import io.github.suppierk.eventsourcing.support.Suspicious;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LockRepository} on top of the {@code locks} table.
 *
 * <p>Leasing is a compare-and-set: candidates are read without any locking and then claimed with
 * an update which only succeeds if the row still has the offset that was read and is not leased.
 * Whoever loses the race moves on to the next candidate.
 *
 * @param <E> event type
 */
public final class JooqLockRepository<E extends AggregateEvent> extends Suspicious
    implements LockRepository<E> {
  private static final Logger LOGGER = LoggerFactory.getLogger(JooqLockRepository.class);

  /** How many candidates are read at once before trying to claim them. */
  static final int CANDIDATES = 16;

  private static final List<Field<?>> LOCK_FIELDS =
      List.of(
          Locks.VIEW,
          Locks.AGGREGATE_ID,
          Locks.OFFSET,
          Locks.LAST_OFFSET,
          Locks.LOCKED_UNTIL,
          Locks.OFFSET_FINAL,
          Locks.CREATED_AT,
          Locks.UPDATED_AT);

  private final EventSerializer<E> serializer;
  private final Clock clock;
  private final Duration leaseDuration;

  /**
   * @param serializer to read leased events with
   * @param clock deciding whether leases expired
   * @param leaseDuration how long an acquired partition stays leased
   */
  public JooqLockRepository(
      final EventSerializer<E> serializer, final Clock clock, final Duration leaseDuration) {
    this.serializer = throwIllegalArgumentIfNull(serializer, "Serializer");
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
    this.leaseDuration = throwIllegalArgumentIfNull(leaseDuration, "Lease duration");
  }

  @Override
  public Optional<EventEnvelope<E>> acquireNext(final DSLContext dsl, final String view) {
    final DSLContext nonNullDsl = throwIllegalArgumentIfNull(dsl, "DSL");
    final String nonBlankView = throwIllegalArgumentIfBlank(view, "View");
    final OffsetDateTime now = EventRecords.now(clock);

    final List<Field<?>> fields = new ArrayList<>(EventRecords.FIELDS);
    fields.add(Locks.OFFSET);

    final List<Record> candidates =
        nonNullDsl
            .select(fields)
            .from(Locks.TABLE)
            .join(Views.TABLE)
            .on(Views.VIEW.eq(Locks.VIEW))
            .join(Events.TABLE)
            .on(Events.AGGREGATE_ID.eq(Locks.AGGREGATE_ID))
            .and(Events.OFFSET.gt(Locks.OFFSET))
            .where(Locks.VIEW.eq(nonBlankView))
            .and(Locks.OFFSET.lt(Locks.LAST_OFFSET))
            .and(isAvailable(now))
            .and(Events.CREATED_AT.ge(Views.START_AT))
            .orderBy(Events.OFFSET.asc())
            .limit(CANDIDATES)
            .fetch();

    final Set<String> seenPartitions = new HashSet<>();
    for (Record candidate : candidates) {
      final String aggregateId = candidate.get(Events.AGGREGATE_ID);

      // Later events of a partition are never delivered before the earliest one
      if (!seenPartitions.add(aggregateId)) {
        continue;
      }

      final int claimed =
          nonNullDsl
              .update(Locks.TABLE)
              .set(Locks.LOCKED_UNTIL, now.plus(leaseDuration))
              .set(Locks.UPDATED_AT, now)
              .where(Locks.VIEW.eq(nonBlankView))
              .and(Locks.AGGREGATE_ID.eq(aggregateId))
              .and(Locks.OFFSET.eq(candidate.get(Locks.OFFSET)))
              .and(isAvailable(now))
              .execute();

      if (claimed == 1) {
        final EventEnvelope<E> envelope = EventRecords.toEnvelope(candidate, serializer);
        LOGGER.debug(
            "View '{}' leased {} #{} of aggregate {}",
            nonBlankView,
            envelope.eventType(),
            envelope.offset(),
            aggregateId);
        return Optional.of(envelope);
      }
    }

    return Optional.empty();
  }

  @Override
  public Optional<Lock> executeAction(
      final DSLContext dsl, final String view, final LockAction action) {
    final DSLContext nonNullDsl = throwIllegalArgumentIfNull(dsl, "DSL");
    final String nonBlankView = throwIllegalArgumentIfBlank(view, "View");
    final LockAction nonNullAction = throwIllegalArgumentIfNull(action, "Action");
    final String aggregateId =
        throwIllegalStateIfNull(nonNullAction.aggregateId(), "Action's aggregate ID");
    final OffsetDateTime now = EventRecords.now(clock);

    final Condition partition = Locks.VIEW.eq(nonBlankView).and(Locks.AGGREGATE_ID.eq(aggregateId));
    final int updated;

    if (nonNullAction instanceof Ack ack) {
      updated =
          nonNullDsl
              .update(Locks.TABLE)
              .set(Locks.OFFSET, ack.offset())
              .set(Locks.LOCKED_UNTIL, (OffsetDateTime) null)
              .set(Locks.UPDATED_AT, now)
              .where(partition)
              .and(Locks.OFFSET.le(ack.offset()))
              .execute();
    } else if (nonNullAction instanceof Nack) {
      updated =
          nonNullDsl
              .update(Locks.TABLE)
              .set(Locks.LOCKED_UNTIL, (OffsetDateTime) null)
              .set(Locks.UPDATED_AT, now)
              .where(partition)
              .execute();
    } else if (nonNullAction instanceof ScheduleNack scheduleNack) {
      updated =
          nonNullDsl
              .update(Locks.TABLE)
              .set(Locks.LOCKED_UNTIL, now.plus(Duration.ofMillis(scheduleNack.delayMs())))
              .set(Locks.UPDATED_AT, now)
              .where(partition)
              .execute();
    } else {
      throw new IllegalArgumentException(
          "Unsupported lock action %s".formatted(nonNullAction.getClass().getSimpleName()));
    }

    if (updated == 0) {
      LOGGER.debug("View '{}' ignored {}", nonBlankView, nonNullAction);
      return Optional.empty();
    }

    return nonNullDsl
        .select(LOCK_FIELDS)
        .from(Locks.TABLE)
        .where(partition)
        .fetchOptional(JooqLockRepository::toLock);
  }

  @Override
  public List<Lock> findAll(final DSLContext dsl) {
    return findAll(dsl, noCondition());
  }

  @Override
  public List<Lock> findAll(final DSLContext dsl, final String view) {
    return findAll(dsl, Locks.VIEW.eq(throwIllegalArgumentIfBlank(view, "View")));
  }

  private List<Lock> findAll(final DSLContext dsl, final Condition condition) {
    return throwIllegalArgumentIfNull(dsl, "DSL")
        .select(LOCK_FIELDS)
        .from(Locks.TABLE)
        .where(condition)
        .orderBy(Locks.VIEW.asc(), Locks.AGGREGATE_ID.asc())
        .fetch(JooqLockRepository::toLock);
  }

  private static Condition isAvailable(final OffsetDateTime now) {
    return Locks.LOCKED_UNTIL.isNull().or(Locks.LOCKED_UNTIL.le(now));
  }

  private static Lock toLock(final Record dbRecord) {
    return new Lock(
        dbRecord.get(Locks.VIEW),
        dbRecord.get(Locks.AGGREGATE_ID),
        dbRecord.get(Locks.OFFSET),
        dbRecord.get(Locks.LAST_OFFSET),
        dbRecord.get(Locks.LOCKED_UNTIL),
        Boolean.TRUE.equals(dbRecord.get(Locks.OFFSET_FINAL)),
        dbRecord.get(Locks.CREATED_AT),
        dbRecord.get(Locks.UPDATED_AT));
  }
}
