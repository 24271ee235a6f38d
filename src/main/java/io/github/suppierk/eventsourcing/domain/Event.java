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

package io.github.suppierk.eventsourcing.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.github.suppierk.eventsourcing.decider.AggregateEvent;

/**
 * Root of every fact the restaurant ordering domain records.
 *
 * <p>Events are persisted as JSON, the {@code type} property carries the simple name of the event
 * so that the payload can be read back without knowing its class upfront.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(
      value = RestaurantEvent.RestaurantCreatedEvent.class,
      name = "RestaurantCreatedEvent"),
  @JsonSubTypes.Type(
      value = RestaurantEvent.RestaurantMenuChangedEvent.class,
      name = "RestaurantMenuChangedEvent"),
  @JsonSubTypes.Type(
      value = RestaurantEvent.OrderPlacedAtRestaurantEvent.class,
      name = "OrderPlacedAtRestaurantEvent"),
  @JsonSubTypes.Type(value = OrderEvent.OrderCreatedEvent.class, name = "OrderCreatedEvent"),
  @JsonSubTypes.Type(value = OrderEvent.OrderPreparedEvent.class, name = "OrderPreparedEvent")
})
public sealed interface Event extends AggregateEvent permits RestaurantEvent, OrderEvent {}
