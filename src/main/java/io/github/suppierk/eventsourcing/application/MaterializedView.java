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

import io.github.suppierk.eventsourcing.decider.Projection;
import io.github.suppierk.eventsourcing.support.Suspicious;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Query side counterpart of the {@link Aggregate}: folds every event into the stored snapshot of
 * its aggregate.
 *
 * <p>Reading, evolving and saving happen in one transaction.
 *
 * @param <S> snapshot type
 * @param <E> event type
 */
public final class MaterializedView<S, E> extends Suspicious implements EventHandler<E> {
  private static final Logger LOGGER = LoggerFactory.getLogger(MaterializedView.class);

  private final DSLContext dsl;
  private final Projection<S, E> projection;
  private final MaterializedViewStateRepository<S, E> stateRepository;

  public MaterializedView(
      final DSLContext dsl,
      final Projection<S, E> projection,
      final MaterializedViewStateRepository<S, E> stateRepository) {
    this.dsl = throwIllegalArgumentIfNull(dsl, "DSL");
    this.projection = throwIllegalArgumentIfNull(projection, "Projection");
    this.stateRepository = throwIllegalArgumentIfNull(stateRepository, "View state repository");
  }

  /**
   * Projects the event in its own transaction.
   *
   * @param event to project
   * @return the stored snapshot
   */
  public S handle(final E event) {
    final E nonNullEvent = throwIllegalArgumentIfNull(event, "Event");
    return dsl.transactionResult((final Configuration trx) -> project(trx.dsl(), nonNullEvent));
  }

  @Override
  public void handle(final DSLContext trx, final E event) {
    project(
        throwIllegalArgumentIfNull(trx, "Transactional DSL"),
        throwIllegalArgumentIfNull(event, "Event"));
  }

  private S project(final DSLContext trx, final E event) {
    final S current = stateRepository.fetchState(trx, event);
    final S next =
        projection.evolve(current == null ? projection.initialState() : current, event);
    LOGGER.debug("Projected {}", event.getClass().getSimpleName());
    return stateRepository.save(trx, next);
  }
}
