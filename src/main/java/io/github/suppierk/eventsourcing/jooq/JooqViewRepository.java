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

import static org.jooq.impl.DSL.max;

import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Events;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Locks;
import io.github.suppierk.eventsourcing.jooq.EventSourcingTables.Views;
import io.github.suppierk.eventsourcing.stream.Lock;
import io.github.suppierk.eventsourcing.stream.View;
import io.github.suppierk.eventsourcing.stream.ViewRepository;
import io.github.suppierk.eventsourcing.support.Suspicious;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Record3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link ViewRepository} on top of the {@code views} table. */
public final class JooqViewRepository extends Suspicious implements ViewRepository {
  private static final Logger LOGGER = LoggerFactory.getLogger(JooqViewRepository.class);

  private static final List<Field<?>> VIEW_FIELDS =
      List.of(
          Views.VIEW, Views.POLLING_DELAY_MS, Views.START_AT, Views.CREATED_AT, Views.UPDATED_AT);

  private final Clock clock;

  public JooqViewRepository(final Clock clock) {
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
  }

  @Override
  public View registerView(
      final DSLContext dsl,
      final String name,
      final long pollingDelayMs,
      final OffsetDateTime startAt) {
    final DSLContext nonNullDsl = throwIllegalArgumentIfNull(dsl, "DSL");
    final String nonBlankName = throwIllegalArgumentIfBlank(name, "View name");
    final OffsetDateTime nonNullStartAt = throwIllegalArgumentIfNull(startAt, "Start at");

    if (pollingDelayMs < 0) {
      throw new IllegalArgumentException("Polling delay cannot be negative");
    }

    final OffsetDateTime now = EventRecords.now(clock);
    final int updated =
        nonNullDsl
            .update(Views.TABLE)
            .set(Views.POLLING_DELAY_MS, pollingDelayMs)
            .set(Views.START_AT, nonNullStartAt)
            .set(Views.UPDATED_AT, now)
            .where(Views.VIEW.eq(nonBlankName))
            .execute();

    if (updated == 0) {
      nonNullDsl
          .insertInto(Views.TABLE)
          .set(Views.VIEW, nonBlankName)
          .set(Views.POLLING_DELAY_MS, pollingDelayMs)
          .set(Views.START_AT, nonNullStartAt)
          .set(Views.CREATED_AT, now)
          .set(Views.UPDATED_AT, now)
          .execute();
      LOGGER.info("Created view '{}'", nonBlankName);
    }

    backfillLocks(nonNullDsl, nonBlankName, now);

    return findById(nonNullDsl, nonBlankName)
        .orElseThrow(
            () -> new IllegalStateException("View '%s' was not stored".formatted(nonBlankName)));
  }

  @Override
  public Optional<View> findById(final DSLContext dsl, final String name) {
    return throwIllegalArgumentIfNull(dsl, "DSL")
        .select(VIEW_FIELDS)
        .from(Views.TABLE)
        .where(Views.VIEW.eq(throwIllegalArgumentIfBlank(name, "View name")))
        .fetchOptional(JooqViewRepository::toView);
  }

  @Override
  public List<View> findAll(final DSLContext dsl) {
    return throwIllegalArgumentIfNull(dsl, "DSL")
        .select(VIEW_FIELDS)
        .from(Views.TABLE)
        .orderBy(Views.VIEW.asc())
        .fetch(JooqViewRepository::toView);
  }

  /** Creates locks for aggregates which had events before the view existed. */
  private void backfillLocks(final DSLContext dsl, final String view, final OffsetDateTime now) {
    final Set<String> locked =
        new HashSet<>(
            dsl.select(Locks.AGGREGATE_ID)
                .from(Locks.TABLE)
                .where(Locks.VIEW.eq(view))
                .fetch(Locks.AGGREGATE_ID));

    final List<Record3<String, Long, Boolean>> heads =
        dsl.select(Events.AGGREGATE_ID, Events.OFFSET, Events.FINAL)
            .from(Events.TABLE)
            .where(
                Events.OFFSET.in(
                    dsl.select(max(Events.OFFSET))
                        .from(Events.TABLE)
                        .groupBy(Events.AGGREGATE_ID)))
            .fetch();

    int created = 0;
    for (Record3<String, Long, Boolean> head : heads) {
      if (locked.contains(head.value1())) {
        continue;
      }

      dsl.insertInto(Locks.TABLE)
          .set(Locks.VIEW, view)
          .set(Locks.AGGREGATE_ID, head.value1())
          .set(Locks.OFFSET, Lock.INITIAL_OFFSET)
          .set(Locks.LAST_OFFSET, head.value2())
          .set(Locks.OFFSET_FINAL, Boolean.TRUE.equals(head.value3()))
          .set(Locks.CREATED_AT, now)
          .set(Locks.UPDATED_AT, now)
          .execute();
      created++;
    }

    if (created > 0) {
      LOGGER.info("View '{}' picked up {} existing aggregate(s)", view, created);
    }
  }

  private static View toView(final Record dbRecord) {
    return new View(
        dbRecord.get(Views.VIEW),
        dbRecord.get(Views.POLLING_DELAY_MS),
        dbRecord.get(Views.START_AT),
        dbRecord.get(Views.CREATED_AT),
        dbRecord.get(Views.UPDATED_AT));
  }
}
