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
import io.github.suppierk.eventsourcing.decider.Saga;
import io.github.suppierk.eventsourcing.support.Suspicious;
import java.util.List;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stream side process manager: turns streamed events into commands and publishes them to the
 * {@link Aggregate} in the transaction of the stream.
 *
 * <p>An {@link Aggregate} which already runs the same saga inline must not be combined with this
 * class, otherwise every reaction would be issued twice.
 *
 * @param <E> event type
 * @param <C> command type
 */
public final class SagaManager<E extends AggregateEvent, C extends AggregateCommand>
    extends Suspicious implements EventHandler<E> {
  private static final Logger LOGGER = LoggerFactory.getLogger(SagaManager.class);

  private final Saga<E, C> saga;
  private final Aggregate<C, ?, E> aggregate;

  public SagaManager(final Saga<E, C> saga, final Aggregate<C, ?, E> aggregate) {
    this.saga = throwIllegalArgumentIfNull(saga, "Saga");
    this.aggregate = throwIllegalArgumentIfNull(aggregate, "Aggregate");
  }

  @Override
  public void handle(final DSLContext trx, final E event) {
    final E nonNullEvent = throwIllegalArgumentIfNull(event, "Event");
    final List<C> commands = throwIllegalStateIfNull(saga.react(nonNullEvent), "Saga reactions");

    for (C command : commands) {
      LOGGER.debug(
          "Publishing {} caused by {}",
          command.getClass().getSimpleName(),
          nonNullEvent.eventType());
      aggregate.handle(trx, command);
    }
  }
}
