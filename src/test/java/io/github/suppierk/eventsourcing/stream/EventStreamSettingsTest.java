package io.github.suppierk.eventsourcing.stream;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EventStreamSettingsTest {
  static Properties properties(final String... keysAndValues) {
    final Properties properties = new Properties();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      properties.setProperty(keysAndValues[i], keysAndValues[i + 1]);
    }
    return properties;
  }

  @Nested
  class Loading {
    @Test
    void nothing_configured_means_defaults() {
      assertEquals(
          EventStreamSettings.defaults(),
          EventStreamSettings.from(new Properties(), Map.of(), new Properties()));
    }

    @Test
    void defaults_match_shipped_resource() {
      final EventStreamSettings defaults = EventStreamSettings.defaults();

      assertEquals(Duration.ofSeconds(5), defaults.leaseDuration());
      assertEquals(Duration.ofSeconds(10), defaults.nackDelay());
      assertEquals(5, defaults.maxRetries());
      assertEquals(8, defaults.queueCapacity());
      assertEquals(Duration.ofMillis(500), defaults.pollingDelay());
      assertEquals(10, defaults.maxConcurrentDbOperations());
      assertEquals(defaults, EventStreamSettings.load());
    }

    @Test
    void environment_overrides_resource_and_system_overrides_environment() {
      final Properties resource =
          properties(
              EventStreamSettings.LEASE_DURATION_MS, "1000",
              EventStreamSettings.NACK_DELAY_MS, "2000",
              EventStreamSettings.MAX_RETRIES, "3");
      final Map<String, String> environment =
          Map.of(
              "EVENT_STREAM_NACK_DELAY_MS", "3000",
              "EVENT_STREAM_MAX_RETRIES", "4",
              "UNRELATED", "ignored");
      final Properties system = properties(EventStreamSettings.MAX_RETRIES, "7", "other", "x");

      final EventStreamSettings settings = EventStreamSettings.from(resource, environment, system);

      assertEquals(Duration.ofSeconds(1), settings.leaseDuration());
      assertEquals(Duration.ofSeconds(3), settings.nackDelay());
      assertEquals(7, settings.maxRetries());
      assertEquals(8, settings.queueCapacity());
    }

    @Test
    void invalid_number_falls_back_to_default() {
      final EventStreamSettings settings =
          EventStreamSettings.from(
              properties(
                  EventStreamSettings.QUEUE_CAPACITY, "many",
                  EventStreamSettings.POLLING_DELAY_MS, " 250 "),
              Map.of(),
              new Properties());

      assertEquals(8, settings.queueCapacity());
      assertEquals(Duration.ofMillis(250), settings.pollingDelay());
    }

    @Test
    void invalid_value_is_rejected() {
      final Properties system = properties(EventStreamSettings.MAX_CONCURRENT_DB_OPERATIONS, "0");

      assertThrows(
          IllegalArgumentException.class,
          () -> EventStreamSettings.from(new Properties(), Map.of(), system));
    }
  }

  @Nested
  class Validation {
    @Test
    void lease_duration_must_be_positive() {
      final EventStreamSettings defaults = EventStreamSettings.defaults();

      assertThrows(IllegalArgumentException.class, () -> defaults.withLeaseDuration(Duration.ZERO));
      assertThrows(IllegalArgumentException.class, () -> defaults.withLeaseDuration(null));
    }

    @Test
    void delays_and_retries_cannot_be_negative() {
      final EventStreamSettings defaults = EventStreamSettings.defaults();

      assertThrows(
          IllegalArgumentException.class, () -> defaults.withNackDelay(Duration.ofMillis(-1)));
      assertThrows(
          IllegalArgumentException.class, () -> defaults.withPollingDelay(Duration.ofMillis(-1)));
      assertThrows(IllegalArgumentException.class, () -> defaults.withMaxRetries(-1));
    }

    @Test
    void zero_delays_are_allowed() {
      final EventStreamSettings settings =
          EventStreamSettings.defaults()
              .withNackDelay(Duration.ZERO)
              .withPollingDelay(Duration.ZERO)
              .withMaxRetries(0);

      assertEquals(Duration.ZERO, settings.nackDelay());
      assertEquals(0, settings.maxRetries());
    }
  }
}
