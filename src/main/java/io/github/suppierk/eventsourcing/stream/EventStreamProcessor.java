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

import io.github.suppierk.eventsourcing.application.EventEnvelope;
import io.github.suppierk.eventsourcing.application.EventHandler;
import io.github.suppierk.eventsourcing.decider.AggregateEvent;
import io.github.suppierk.eventsourcing.json.EventSerializationException;
import io.github.suppierk.eventsourcing.stream.LockAction.Ack;
import io.github.suppierk.eventsourcing.stream.LockAction.ScheduleNack;
import io.github.suppierk.eventsourcing.support.Suspicious;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.exception.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives registered {@link EventHandler}s with events leased from the {@link LockRepository}.
 *
 * <p>Every view gets a pair of tasks: the poll task leases events and puts them into a bounded
 * queue, the handle task takes them out and runs the handler together with the {@link Ack} in one
 * transaction. A failing handler causes a {@link ScheduleNack}, so the same event is retried after
 * {@link EventStreamSettings#nackDelay()}. Infrastructure failures are retried until {@link
 * EventStreamSettings#maxRetries()} consecutive ones happened, then the view is {@link
 * ViewStatus#FAILED} while other views keep going.
 *
 * <p>Any number of processors may run against the same database, the leases make sure that a
 * partition is processed by one of them at a time.
 *
 * @param <E> event type
 */
public final class EventStreamProcessor<E extends AggregateEvent> extends Suspicious {
  private static final Logger LOGGER = LoggerFactory.getLogger(EventStreamProcessor.class);

  private final DSLContext dsl;
  private final LockRepository<E> lockRepository;
  private final ViewRepository viewRepository;
  private final EventStreamSettings settings;
  private final Semaphore dbPermits;
  private final Map<String, ViewConsumer> consumers = new LinkedHashMap<>();

  private ExecutorService executor;

  public EventStreamProcessor(
      final DSLContext dsl,
      final LockRepository<E> lockRepository,
      final ViewRepository viewRepository,
      final EventStreamSettings settings) {
    this.dsl = throwIllegalArgumentIfNull(dsl, "DSL");
    this.lockRepository = throwIllegalArgumentIfNull(lockRepository, "Lock repository");
    this.viewRepository = throwIllegalArgumentIfNull(viewRepository, "View repository");
    this.settings = throwIllegalArgumentIfNull(settings, "Settings");
    this.dbPermits = new Semaphore(settings.maxConcurrentDbOperations(), true);
  }

  /**
   * Registers the view with the default polling delay, receiving the whole history.
   *
   * @param view name of the view
   * @param handler to drive
   * @return registered view
   * @see #register(String, long, OffsetDateTime, EventHandler)
   */
  public View register(final String view, final EventHandler<E> handler) {
    return register(
        view,
        settings.pollingDelay().toMillis(),
        OffsetDateTime.ofInstant(Instant.EPOCH, ZoneOffset.UTC),
        handler);
  }

  /**
   * Registers the view in the database and binds the handler to it.
   *
   * <p>Views registered while the processor runs are started immediately.
   *
   * @param view name of the view
   * @param pollingDelayMs how long to wait when there is nothing to process
   * @param startAt earliest creation time of delivered events
   * @param handler to drive
   * @return registered view
   * @throws IllegalStateException if a handler is already bound to the view
   */
  public synchronized View register(
      final String view,
      final long pollingDelayMs,
      final OffsetDateTime startAt,
      final EventHandler<E> handler) {
    final String nonBlankView = throwIllegalArgumentIfBlank(view, "View");
    final OffsetDateTime nonNullStartAt = throwIllegalArgumentIfNull(startAt, "Start at");
    final EventHandler<E> nonNullHandler = throwIllegalArgumentIfNull(handler, "Handler");

    if (consumers.containsKey(nonBlankView)) {
      throw new IllegalStateException(
          "Handler for view '%s' is already registered".formatted(nonBlankView));
    }

    final View registered =
        dsl.transactionResult(
            (final Configuration trx) ->
                viewRepository.registerView(
                    trx.dsl(), nonBlankView, pollingDelayMs, nonNullStartAt));

    final ViewConsumer consumer = new ViewConsumer(registered, nonNullHandler);
    consumers.put(nonBlankView, consumer);
    LOGGER.info("Registered view '{}'", nonBlankView);

    if (executor != null) {
      consumer.start(executor);
    }

    return registered;
  }

  /** Starts consuming for every registered view. Does nothing if already started. */
  public synchronized void start() {
    if (executor != null) {
      return;
    }

    executor = Executors.newCachedThreadPool(new ConsumerThreadFactory());
    consumers.values().forEach(consumer -> consumer.start(executor));
    LOGGER.info("Event stream processor started with {} view(s)", consumers.size());
  }

  /**
   * Stops every consumer and waits for them to finish.
   *
   * <p>Leases held at this moment are not released, they expire on their own.
   */
  public synchronized void stop() {
    if (executor == null) {
      return;
    }

    consumers.values().forEach(ViewConsumer::stop);
    executor.shutdownNow();

    try {
      if (!executor.awaitTermination(settings.leaseDuration().toMillis(), TimeUnit.MILLISECONDS)) {
        LOGGER.warn("Event stream consumers did not terminate in time");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while waiting for event stream consumers to terminate");
    } finally {
      executor = null;
    }

    LOGGER.info("Event stream processor stopped");
  }

  /**
   * @param view name of the view
   * @return current status of the view consumers
   * @throws IllegalArgumentException if no handler is registered for the view
   */
  public synchronized ViewStatus status(final String view) {
    final ViewConsumer consumer = consumers.get(throwIllegalArgumentIfBlank(view, "View"));
    if (consumer == null) {
      throw new IllegalArgumentException("View '%s' is not registered".formatted(view));
    }
    return consumer.status.get();
  }

  private <T> T withDbPermit(final Supplier<T> operation) throws InterruptedException {
    dbPermits.acquire();
    try {
      return operation.get();
    } finally {
      dbPermits.release();
    }
  }

  /** Poll and handle tasks of one view. */
  private final class ViewConsumer {
    private final View view;
    private final EventHandler<E> handler;
    private final BlockingQueue<EventEnvelope<E>> queue;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicReference<ViewStatus> status = new AtomicReference<>(ViewStatus.STOPPED);
    private final List<Future<?>> tasks = new ArrayList<>(2);

    private ViewConsumer(final View view, final EventHandler<E> handler) {
      this.view = view;
      this.handler = handler;
      this.queue = new ArrayBlockingQueue<>(settings.queueCapacity());
    }

    private synchronized void start(final ExecutorService executorService) {
      if (status.get() == ViewStatus.FAILED) {
        LOGGER.warn("View '{}' has failed before and will not be restarted", view.name());
        return;
      }

      queue.clear();
      consecutiveFailures.set(0);
      status.set(ViewStatus.RUNNING);
      tasks.add(executorService.submit(this::poll));
      tasks.add(executorService.submit(this::handle));
      LOGGER.info("Started consuming view '{}'", view.name());
    }

    private synchronized void stop() {
      tasks.forEach(task -> task.cancel(true));
      tasks.clear();
      status.compareAndSet(ViewStatus.RUNNING, ViewStatus.STOPPED);
    }

    private boolean isRunning() {
      return status.get() == ViewStatus.RUNNING && !Thread.currentThread().isInterrupted();
    }

    private void poll() {
      try {
        while (isRunning()) {
          final Optional<EventEnvelope<E>> next = acquireNext();

          if (next.isPresent()) {
            queue.put(next.get());
          } else {
            TimeUnit.MILLISECONDS.sleep(view.pollingDelayMs());
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOGGER.debug("Polling of view '{}' interrupted", view.name());
      }
    }

    private Optional<EventEnvelope<E>> acquireNext() throws InterruptedException {
      try {
        final Optional<EventEnvelope<E>> next =
            withDbPermit(() -> lockRepository.acquireNext(dsl, view.name()));
        consecutiveFailures.set(0);
        return next;
      } catch (EventSerializationException e) {
        // Partition stays leased and is retried once the lease expires
        LOGGER.error("View '{}' leased an event which cannot be read", view.name(), e);
        return Optional.empty();
      } catch (DataAccessException e) {
        onInfrastructureFailure(e);
        return Optional.empty();
      }
    }

    private void handle() {
      try {
        while (isRunning()) {
          final EventEnvelope<E> envelope = queue.take();
          final boolean handled = handleInTransaction(envelope);

          if (!handled) {
            scheduleNack(envelope);
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOGGER.debug("Handling of view '{}' interrupted", view.name());
      }
    }

    private boolean handleInTransaction(final EventEnvelope<E> envelope)
        throws InterruptedException {
      try {
        withDbPermit(
            () -> {
              dsl.transaction(
                  (final Configuration trx) -> {
                    handler.handle(trx.dsl(), envelope.event());
                    lockRepository.executeAction(
                        trx.dsl(),
                        view.name(),
                        new Ack(envelope.offset(), envelope.aggregateId()));
                  });
              return null;
            });

        LOGGER.debug(
            "View '{}' processed {} #{} of aggregate {}",
            view.name(),
            envelope.eventType(),
            envelope.offset(),
            envelope.aggregateId());
        return true;
      } catch (RuntimeException e) {
        LOGGER.warn(
            "View '{}' failed to process {} #{} of aggregate {}, retrying in {}",
            view.name(),
            envelope.eventType(),
            envelope.offset(),
            envelope.aggregateId(),
            settings.nackDelay(),
            e);
        return false;
      }
    }

    private void scheduleNack(final EventEnvelope<E> envelope) throws InterruptedException {
      try {
        withDbPermit(
            () ->
                lockRepository.executeAction(
                    dsl,
                    view.name(),
                    new ScheduleNack(envelope.aggregateId(), settings.nackDelay().toMillis())));
        consecutiveFailures.set(0);
      } catch (DataAccessException e) {
        onInfrastructureFailure(e);
      }
    }

    private void onInfrastructureFailure(final DataAccessException e) throws InterruptedException {
      final int failures = consecutiveFailures.incrementAndGet();

      if (failures > settings.maxRetries()) {
        LOGGER.error(
            "View '{}' failed after {} consecutive infrastructure failures",
            view.name(),
            failures,
            e);
        fail();
        return;
      }

      LOGGER.warn(
          "View '{}' infrastructure failure {} of {} tolerated, retrying",
          view.name(),
          failures,
          settings.maxRetries(),
          e);
      TimeUnit.MILLISECONDS.sleep(view.pollingDelayMs());
    }

    private synchronized void fail() {
      status.set(ViewStatus.FAILED);
      tasks.forEach(task -> task.cancel(true));
      tasks.clear();
    }
  }

  private static final class ConsumerThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(final Runnable runnable) {
      final Thread thread =
          new Thread(runnable, "event-stream-consumer-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
