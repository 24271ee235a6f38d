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

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tuning of the {@link EventStreamProcessor} and the lease protocol.
 *
 * <p>{@link #load()} starts from the defaults and overrides them, in this order, with:
 *
 * <ol>
 *   <li>{@code event-stream.properties} from the classpath
 *   <li>environment variables starting with {@code EVENT_STREAM_}, e.g. {@code
 *       EVENT_STREAM_LEASE_DURATION_MS} for {@code event-stream.lease-duration-ms}
 *   <li>system properties starting with {@code event-stream.}
 * </ol>
 *
 * @param leaseDuration how long an acquired partition stays leased
 * @param nackDelay how long a partition is backed off after a handler failure
 * @param maxRetries consecutive infrastructure failures tolerated per view
 * @param queueCapacity of the buffer between polling and handling
 * @param pollingDelay default wait of a view when there is nothing to process
 * @param maxConcurrentDbOperations database operations the consumers may run at once
 */
public record EventStreamSettings(
    Duration leaseDuration,
    Duration nackDelay,
    int maxRetries,
    int queueCapacity,
    Duration pollingDelay,
    int maxConcurrentDbOperations) {
  private static final Logger LOGGER = LoggerFactory.getLogger(EventStreamSettings.class);

  static final String RESOURCE = "/event-stream.properties";
  static final String PREFIX = "event-stream.";
  static final String ENV_PREFIX = "EVENT_STREAM_";

  static final String LEASE_DURATION_MS = PREFIX + "lease-duration-ms";
  static final String NACK_DELAY_MS = PREFIX + "nack-delay-ms";
  static final String MAX_RETRIES = PREFIX + "max-retries";
  static final String QUEUE_CAPACITY = PREFIX + "queue-capacity";
  static final String POLLING_DELAY_MS = PREFIX + "polling-delay-ms";
  static final String MAX_CONCURRENT_DB_OPERATIONS = PREFIX + "max-concurrent-db-operations";

  public EventStreamSettings {
    if (leaseDuration == null || leaseDuration.isNegative() || leaseDuration.isZero()) {
      throw new IllegalArgumentException("Lease duration must be positive");
    }

    if (nackDelay == null || nackDelay.isNegative()) {
      throw new IllegalArgumentException("Nack delay cannot be negative");
    }

    if (maxRetries < 0) {
      throw new IllegalArgumentException("Max retries cannot be negative");
    }

    if (queueCapacity < 1) {
      throw new IllegalArgumentException("Queue capacity must be at least 1");
    }

    if (pollingDelay == null || pollingDelay.isNegative()) {
      throw new IllegalArgumentException("Polling delay cannot be negative");
    }

    if (maxConcurrentDbOperations < 1) {
      throw new IllegalArgumentException("Max concurrent database operations must be at least 1");
    }
  }

  /**
   * @return settings without any overrides
   */
  public static EventStreamSettings defaults() {
    return new EventStreamSettings(
        Duration.ofSeconds(5), Duration.ofSeconds(10), 5, 8, Duration.ofMillis(500), 10);
  }

  /**
   * @return defaults overridden by the classpath resource, environment and system properties
   */
  public static EventStreamSettings load() {
    final Properties properties = new Properties();
    loadResource(properties);
    return from(properties, System.getenv(), System.getProperties());
  }

  static EventStreamSettings from(
      final Properties resource, final Map<String, String> environment, final Properties system) {
    final Properties merged = new Properties();
    merged.putAll(resource);

    environment.forEach(
        (key, value) -> {
          if (key.startsWith(ENV_PREFIX)) {
            final String suffix = key.substring(ENV_PREFIX.length());
            merged.setProperty(PREFIX + suffix.toLowerCase(Locale.ROOT).replace('_', '-'), value);
          }
        });

    system.forEach(
        (key, value) -> {
          final String keyStr = key.toString();
          if (keyStr.startsWith(PREFIX)) {
            merged.setProperty(keyStr, value.toString());
          }
        });

    final EventStreamSettings defaults = defaults();
    final EventStreamSettings settings =
        new EventStreamSettings(
            Duration.ofMillis(
                getLong(merged, LEASE_DURATION_MS, defaults.leaseDuration().toMillis())),
            Duration.ofMillis(getLong(merged, NACK_DELAY_MS, defaults.nackDelay().toMillis())),
            getInt(merged, MAX_RETRIES, defaults.maxRetries()),
            getInt(merged, QUEUE_CAPACITY, defaults.queueCapacity()),
            Duration.ofMillis(
                getLong(merged, POLLING_DELAY_MS, defaults.pollingDelay().toMillis())),
            getInt(merged, MAX_CONCURRENT_DB_OPERATIONS, defaults.maxConcurrentDbOperations()));

    LOGGER.info("Loaded event stream settings: {}", settings);
    return settings;
  }

  /**
   * @param leaseDuration to use
   * @return a copy with another lease duration
   */
  public EventStreamSettings withLeaseDuration(final Duration leaseDuration) {
    return new EventStreamSettings(
        leaseDuration,
        nackDelay,
        maxRetries,
        queueCapacity,
        pollingDelay,
        maxConcurrentDbOperations);
  }

  /**
   * @param nackDelay to use
   * @return a copy with another nack delay
   */
  public EventStreamSettings withNackDelay(final Duration nackDelay) {
    return new EventStreamSettings(
        leaseDuration,
        nackDelay,
        maxRetries,
        queueCapacity,
        pollingDelay,
        maxConcurrentDbOperations);
  }

  /**
   * @param maxRetries to use
   * @return a copy with another retry limit
   */
  public EventStreamSettings withMaxRetries(final int maxRetries) {
    return new EventStreamSettings(
        leaseDuration,
        nackDelay,
        maxRetries,
        queueCapacity,
        pollingDelay,
        maxConcurrentDbOperations);
  }

  /**
   * @param pollingDelay to use
   * @return a copy with another default polling delay
   */
  public EventStreamSettings withPollingDelay(final Duration pollingDelay) {
    return new EventStreamSettings(
        leaseDuration,
        nackDelay,
        maxRetries,
        queueCapacity,
        pollingDelay,
        maxConcurrentDbOperations);
  }

  private static void loadResource(final Properties properties) {
    try (InputStream is = EventStreamSettings.class.getResourceAsStream(RESOURCE)) {
      if (is != null) {
        properties.load(is);
        LOGGER.debug("Loaded properties from: {}", RESOURCE);
      } else {
        LOGGER.debug("Properties file not found: {}", RESOURCE);
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to load properties from: {}", RESOURCE, e);
    }
  }

  private static int getInt(final Properties properties, final String key, final int fallback) {
    final String value = properties.getProperty(key);
    if (value == null) {
      return fallback;
    }

    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      LOGGER.warn("Invalid integer value for {}: {}, using default: {}", key, value, fallback);
      return fallback;
    }
  }

  private static long getLong(final Properties properties, final String key, final long fallback) {
    final String value = properties.getProperty(key);
    if (value == null) {
      return fallback;
    }

    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      LOGGER.warn("Invalid long value for {}: {}, using default: {}", key, value, fallback);
      return fallback;
    }
  }
}
