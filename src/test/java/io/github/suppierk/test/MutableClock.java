package io.github.suppierk.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/** Clock which only moves when told to. */
public final class MutableClock extends Clock {
  private final AtomicReference<Instant> instant;
  private final ZoneId zone;

  public MutableClock(final Instant instant) {
    this(new AtomicReference<>(instant), ZoneOffset.UTC);
  }

  private MutableClock(final AtomicReference<Instant> instant, final ZoneId zone) {
    this.instant = instant;
    this.zone = zone;
  }

  public void advance(final Duration duration) {
    instant.updateAndGet(current -> current.plus(duration));
  }

  public void set(final Instant newInstant) {
    instant.set(newInstant);
  }

  @Override
  public ZoneId getZone() {
    return zone;
  }

  @Override
  public Clock withZone(final ZoneId zone) {
    return new MutableClock(instant, zone);
  }

  @Override
  public Instant instant() {
    return instant.get();
  }
}
