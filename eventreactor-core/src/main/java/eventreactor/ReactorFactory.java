package eventreactor;

import eventreactor.spi.EventSink;
import eventreactor.spi.EventSource;
import eventreactor.spi.Tracker;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Composition root for {@link Reactor} instances.
 *
 * <p>Dependencies passed explicitly win; missing ones come from the factory's
 * {@link ReactorConfig}. The resulting reactor is validated by the {@link Reactor}
 * constructor, so an emitting reactor still fails when neither the caller nor the
 * config supplies a source and sink.
 *
 * <pre>{@code
 * ReactorFactory factory = new ReactorFactory(config);
 * Reactor<Map<String, Object>> reactor = factory.create(definition);
 *
 * // override a single dependency
 * Reactor<Map<String, Object>> isolated = factory.create(definition, new InMemoryTracker(), null, null);
 * }</pre>
 *
 * @see ReactorDefaults#factory()
 */
public final class ReactorFactory {
  private final ReactorConfig config;

  public ReactorFactory(ReactorConfig config) {
    this.config = Objects.requireNonNull(config, "config").copy();
  }

  /**
   * Creates a reactor using only configured defaults.
   *
   * @param definition the reactor definition
   * @param <S>        state type
   * @return the reactor
   * @throws IllegalStateException    if no tracker is configured
   * @throws IllegalArgumentException if an emitting reactor lacks a source or sink
   */
  public <S> Reactor<S> create(ReactorDefinition<S> definition) {
    return create(definition, null, null, null);
  }

  /**
   * Creates a reactor, filling {@code null} arguments from the configured defaults.
   *
   * @param definition  the reactor definition
   * @param tracker     tracker, or {@code null} for the configured default
   * @param eventSource source, or {@code null} for the configured default
   * @param eventSink   sink, or {@code null} for the configured default
   * @param <S>         state type
   * @return the reactor
   */
  public <S> Reactor<S> create(
      ReactorDefinition<S> definition,
      Tracker tracker,
      EventSource eventSource,
      EventSink eventSink
  ) {
    return new Reactor<>(
        definition,
        tracker != null ? tracker : defaultTracker(),
        eventSource != null ? eventSource : config.getEventSource(),
        eventSink != null ? eventSink : config.getEventSink());
  }

  public ReactorConfig config() {
    return config.copy();
  }

  private Tracker defaultTracker() {
    Supplier<? extends Tracker> supplier = config.getTrackerSupplier();
    if (supplier == null) {
      throw new IllegalStateException("No tracker given and no default tracker configured");
    }
    return Objects.requireNonNull(supplier.get(), "trackerSupplier returned null");
  }
}
