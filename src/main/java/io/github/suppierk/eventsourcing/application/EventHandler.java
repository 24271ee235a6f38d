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

import org.jooq.DSLContext;

/**
 * Consumer of streamed events.
 *
 * <p>Handlers are invoked inside the transaction which also acknowledges the event, so all their
 * database work must go through the given {@link DSLContext}. Delivery is at-least-once, handlers
 * must tolerate seeing the same event again after a failure.
 *
 * @param <E> event type
 */
@FunctionalInterface
public interface EventHandler<E> {
  /**
   * @param dsl transactional context to use
   * @param event to handle
   */
  void handle(DSLContext dsl, E event);
}
