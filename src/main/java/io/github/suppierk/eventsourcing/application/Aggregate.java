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

import io.github.suppierk.eventsourcing.decider.AggregateCommand;
import io.github.suppierk.eventsourcing.decider.AggregateEvent;
import io.github.suppierk.eventsourcing.decider.Decider;
import io.github.suppierk.eventsourcing.decider.Saga;
import io.github.suppierk.eventsourcing.decider.ValidationException;
import io.github.suppierk.eventsourcing.support.Suspicious;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command side entry point: loads the event chain of the target aggregate, asks the {@link
 * Decider} for new events, appends them and feeds every new event to the {@link Saga}.
 *
 * <p>Commands issued by the saga are handled recursively within the same transaction, so either the
 * whole cascade is stored or nothing is. Conflicting writers are detected by the {@link
 * EventRepository} on append and reported as {@link ConcurrencyException}, which is never retried
 * here.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 */
public final class Aggregate<C extends AggregateCommand, S, E extends AggregateEvent>
    extends Suspicious {
  private static final Logger LOGGER = LoggerFactory.getLogger(Aggregate.class);

  private final DSLContext dsl;
  private final Decider<C, S, E> decider;
  private final Saga<E, C> saga;
  private final EventRepository<E> eventRepository;

  /**
   * @param dsl used to open a transaction per command
   * @param decider with the rules of the aggregate
   * @param saga reacting on newly appended events, see {@link Saga#empty()}
   * @param eventRepository storing the events
   * @throws IllegalArgumentException if any of the parameters is {@code null}
   */
  public Aggregate(
      final DSLContext dsl,
      final Decider<C, S, E> decider,
      final Saga<E, C> saga,
      final EventRepository<E> eventRepository) {
    this.dsl = throwIllegalArgumentIfNull(dsl, "DSL");
    this.decider = throwIllegalArgumentIfNull(decider, "Decider");
    this.saga = throwIllegalArgumentIfNull(saga, "Saga");
    this.eventRepository = throwIllegalArgumentIfNull(eventRepository, "Event repository");
  }

  /**
   * Handles the command in its own transaction.
   *
   * @param command to handle
   * @return every event appended by the command and the commands it caused, in append order
   * @throws ValidationException if the command or any caused command was rejected
   * @throws ConcurrencyException if another writer changed one of the affected aggregates
   */
  public List<EventEnvelope<E>> handle(final C command) {
    final C nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    return dsl.transactionResult((final Configuration trx) -> handle(trx.dsl(), nonNullCommand));
  }

  /**
   * Handles commands one after another, each in its own transaction.
   *
   * <p>Stops at the first failure, events of previously handled commands stay stored.
   *
   * @param commands to handle
   * @return concatenated results of {@link #handle(AggregateCommand)}
   */
  public List<EventEnvelope<E>> handleAll(final List<? extends C> commands) {
    final List<EventEnvelope<E>> result = new ArrayList<>();
    for (C command : throwIllegalArgumentIfNull(commands, "Commands")) {
      result.addAll(handle(command));
    }
    return result;
  }

  /**
   * Handles the command within the given context, without opening a transaction.
   *
   * <p>Used by {@link SagaManager} to join the transaction of the event stream.
   *
   * @param trx transactional context
   * @param command to handle
   * @return every event appended by the command and the commands it caused, in append order
   */
  public List<EventEnvelope<E>> handle(final DSLContext trx, final C command) {
    final DSLContext nonNullTrx = throwIllegalArgumentIfNull(trx, "Transactional DSL");
    final C nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final String aggregateType =
        throwIllegalStateIfNull(nonNullCommand.aggregateType(), "Command's aggregate type");
    final String aggregateId =
        throwIllegalStateIfNull(nonNullCommand.aggregateId(), "Command's aggregate ID");

    final List<EventEnvelope<E>> history =
        eventRepository.fetch(nonNullTrx, aggregateType, aggregateId);
    final S state = decider.fold(history.stream().map(EventEnvelope::event).toList());

    final Map<ChainKey, UUID> versions = new HashMap<>();
    versions.put(
        new ChainKey(aggregateType, aggregateId),
        history.isEmpty() ? null : history.get(history.size() - 1).eventId());

    final List<E> newEvents =
        throwIllegalStateIfNull(decider.decide(nonNullCommand, state), "Decided events");
    LOGGER.debug(
        "Command {} on aggregate {} resulted in {} event(s)",
        nonNullCommand.getClass().getSimpleName(),
        aggregateId,
        newEvents.size());

    final UUID commandId = UUID.randomUUID();
    final List<EventEnvelope<E>> appended = new ArrayList<>(newEvents.size());
    for (E event : newEvents) {
      final ChainKey chain = new ChainKey(event.aggregateType(), event.aggregateId());
      final UUID previousId =
          versions.containsKey(chain)
              ? versions.get(chain)
              : eventRepository
                  .getLastEventId(nonNullTrx, chain.aggregateType(), chain.aggregateId())
                  .orElse(null);

      final EventEnvelope<E> stored =
          eventRepository.append(nonNullTrx, EventEnvelope.of(event, commandId, previousId));
      versions.put(chain, stored.eventId());
      appended.add(stored);
    }

    final List<EventEnvelope<E>> result = new ArrayList<>(appended);
    for (EventEnvelope<E> envelope : appended) {
      for (C reaction : throwIllegalStateIfNull(saga.react(envelope.event()), "Saga reactions")) {
        LOGGER.debug(
            "Event {} caused command {}",
            envelope.eventType(),
            reaction.getClass().getSimpleName());
        result.addAll(handle(nonNullTrx, reaction));
      }
    }

    return result;
  }

  /** Aggregate identifiers are only unique within their type. */
  private record ChainKey(String aggregateType, String aggregateId) {}
}
