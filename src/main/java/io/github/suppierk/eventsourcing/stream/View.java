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

import java.time.OffsetDateTime;

/**
 * Named consumer group: every view keeps its own progress through the event stream.
 *
 * @param name unique name of the view
 * @param pollingDelayMs how long consumers of the view wait when there is nothing to process
 * @param startAt events created before this moment are never delivered to the view
 * @param createdAt when the view was registered for the first time
 * @param updatedAt when the view was registered for the last time
 */
public record View(
    String name,
    long pollingDelayMs,
    OffsetDateTime startAt,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt) {}
