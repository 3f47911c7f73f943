package eventreactor.poller;

import eventreactor.Event;
import eventreactor.Reactor;
import eventreactor.spi.EventSource;
import eventreactor.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled loop that feeds one {@link Reactor} the events recorded after its tracked position.
 *
 * <p>Each cycle reads up to {@code batchSize} events of the types the reactor processes,
 * calls {@link Reactor#process(Event)} for each in order, and advances the tracker after
 * every processed event. If processing fails, the failure is logged, the cycle stops, and
 * the failed event is read again on the next cycle. There is no backoff.
 *
 * <p>Delivery is at least once. An event whose handler emitted and then failed is
 * processed again, and emits again, unless a {@linkplain Builder#transactionRunner
 * transaction runner} makes each event's processing and tracker advance one atomic unit
 * that rolls back on failure.
 *
 * <p>All cycles run on a single daemon thread, so the reactor never sees concurrent
 * {@code process} calls.
 *
 * <pre>{@code
 * try (ReactorPoller poller = ReactorPoller.builder()
 *     .reactor(reactor)
 *     .eventSource(store)
 *     .intervalMs(500)
 *     .build()) {
 *   poller.start();
 *   ...
 * }
 * }</pre>
 *
 * @see ReactorPoller.Builder
 */
public final class ReactorPoller implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ReactorPoller.class.getName());

  private final Reactor<?> reactor;
  private final EventSource eventSource;
  private final int batchSize;
  private final long intervalMs;
  private final Consumer<Runnable> transactionRunner;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private ReactorPoller(Builder builder) {
    this.reactor = Objects.requireNonNull(builder.reactor, "reactor");
    EventSource source = builder.eventSource != null ? builder.eventSource : reactor.eventSource();
    this.eventSource = Objects.requireNonNull(source, "eventSource");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
    this.transactionRunner = Objects.requireNonNull(builder.transactionRunner, "transactionRunner");
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Sets up the reactor's tracker entry and starts the scheduled loop. Subsequent calls
   * are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ReactorPoller has been closed");
    }
    if (pollTask != null) {
      return;
    }
    reactor.setup();
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("reactor-poller-" + reactor.processorName() + "-"));
    pollTask = scheduler.scheduleWithFixedDelay(this::poll, 0L, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single poll cycle. Called by the scheduler; may also be invoked directly
   * when no scheduler has been started.
   *
   * @return number of events processed in this cycle
   */
  public int poll() {
    if (closed) {
      return 0;
    }
    int processed = 0;
    try {
      List<Event> events = eventSource.getNextFrom(
          reactor.lastProcessedEventId(), batchSize, reactor.definition().processedTypes());
      for (Event event : events) {
        transactionRunner.accept(() -> {
          reactor.process(event);
          reactor.tracker().processed(reactor.processorName(), event.id());
        });
        processed++;
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Reactor " + reactor.processorName() + " poll cycle failed after "
          + processed + " event(s)", e);
    }
    return processed;
  }

  /**
   * Processes batches until the reactor has caught up with the source.
   *
   * @return total number of events processed
   */
  public int drain() {
    int total = 0;
    int processed;
    do {
      processed = poll();
      total += processed;
    } while (processed == batchSize);
    return total;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
    }
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
          scheduler.shutdownNow();
        }
      } catch (InterruptedException e) {
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link ReactorPoller}.
   */
  public static final class Builder {
    private Reactor<?> reactor;
    private EventSource eventSource;
    private int batchSize = 100;
    private long intervalMs = 1000L;
    private Consumer<Runnable> transactionRunner = Runnable::run;

    private Builder() {
    }

    public Builder reactor(Reactor<?> reactor) {
      this.reactor = reactor;
      return this;
    }

    /**
     * Sets the source to read from. Optional; defaults to the reactor's own source.
     *
     * @param eventSource the event source
     * @return this builder
     */
    public Builder eventSource(EventSource eventSource) {
      this.eventSource = eventSource;
      return this;
    }

    /**
     * Maximum events read per cycle. Default {@code 100}.
     *
     * @param batchSize events per cycle
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Delay between cycles in milliseconds. Default {@code 1000}.
     *
     * @param intervalMs delay between cycles
     * @return this builder
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Wraps the processing of each event and its tracker advance. The runner must run the
     * work once, commit if it returns and roll back and rethrow if it throws. The reactor's
     * sink and tracker have to join the runner's transaction for the unit to be atomic.
     * Default runs the work directly.
     *
     * @param transactionRunner the per-event unit of work
     * @return this builder
     */
    public Builder transactionRunner(Consumer<Runnable> transactionRunner) {
      this.transactionRunner = transactionRunner;
      return this;
    }

    public ReactorPoller build() {
      return new ReactorPoller(this);
    }
  }
}
