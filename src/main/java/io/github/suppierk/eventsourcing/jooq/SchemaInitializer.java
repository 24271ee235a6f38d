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

import io.github.suppierk.eventsourcing.support.Suspicious;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the tables used by this library from the classpath scripts. Every statement is
 * idempotent, so running it on an existing schema is safe.
 */
public final class SchemaInitializer extends Suspicious {
  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaInitializer.class);

  public static final String EVENT_SOURCING = "/sql/event_sourcing.sql";
  public static final String EVENT_STREAMING = "/sql/event_streaming.sql";
  public static final String PROJECTIONS = "/sql/projections.sql";

  private final List<String> scripts;

  /** Initializer for every script shipped with the library. */
  public SchemaInitializer() {
    this(List.of(EVENT_SOURCING, EVENT_STREAMING, PROJECTIONS));
  }

  /**
   * @param scripts classpath locations to run in the given order
   */
  public SchemaInitializer(final List<String> scripts) {
    this.scripts = List.copyOf(throwIllegalArgumentIfNull(scripts, "Scripts"));
  }

  /**
   * @param dsl to run the scripts with
   */
  public void initialize(final DSLContext dsl) {
    final DSLContext nonNullDsl = throwIllegalArgumentIfNull(dsl, "DSL");

    for (String script : scripts) {
      final List<String> statements = statements(read(script));
      statements.forEach(nonNullDsl::execute);
      LOGGER.info("Executed {} statement(s) from {}", statements.size(), script);
    }
  }

  static List<String> statements(final String script) {
    final String withoutComments =
        script
            .lines()
            .filter(line -> !line.trim().startsWith("--"))
            .collect(Collectors.joining("\n"));

    return Arrays.stream(withoutComments.split(";"))
        .map(String::trim)
        .filter(statement -> !statement.isEmpty())
        .toList();
  }

  private static String read(final String script) {
    try (InputStream is = SchemaInitializer.class.getResourceAsStream(script)) {
      if (is == null) {
        throw new IllegalStateException("Script %s is not on the classpath".formatted(script));
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read %s".formatted(script), e);
    }
  }
}
