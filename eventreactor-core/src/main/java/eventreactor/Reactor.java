package eventreactor;

import eventreactor.spi.EventSink;
import eventreactor.spi.EventSource;
import eventreactor.spi.Tracker;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A reactor instance: binds a {@link ReactorDefinition} to a {@link Tracker}, an
 * {@link EventSource} and an {@link EventSink}.
 *
 * <p>Reactors that declare emittable types need both a source and a sink; construction
 * fails otherwise. Reactors that emit nothing only need a tracker.
 *
 * <p>{@link #process(Event)} must be called sequentially, once per event, by a single
 * dispatch loop. State written by handlers is visible through {@link #state()} as soon as
 * {@code process} returns.
 *
 * @param <S> type of the instance state handed to handlers
 * @see ReactorFactory
 * @see eventreactor.poller.ReactorPoller
 */
public final class Reactor<S> {
  private static final Logger logger = Logger.getLogger(Reactor.class.getName());

  private final ReactorDefinition<S> definition;
  private final Tracker tracker;
  private final EventSource eventSource;
  private final EventSink eventSink;
  private final S state;

  /**
   * Creates a reactor that emits nothing and reads no events itself.
   *
   * @param definition the reactor definition
   * @param tracker    position tracker
   * @throws IllegalArgumentException if the definition declares emittable types
   */
  public Reactor(ReactorDefinition<S> definition, Tracker tracker) {
    this(definition, tracker, null, null);
  }

  /**
   * Creates a reactor.
   *
   * @param definition  the reactor definition
   * @param tracker     position tracker
   * @param eventSource event source; required if the definition declares emittable types
   * @param eventSink   event sink; required if the definition declares emittable types
   * @throws IllegalArgumentException if the definition declares emittable types and
   *                                  the source or sink is missing
   */
  public Reactor(ReactorDefinition<S> definition, Tracker tracker, EventSource eventSource, EventSink eventSink) {
    this.definition = Objects.requireNonNull(definition, "definition");
    this.tracker = Objects.requireNonNull(tracker, "tracker");
    if (definition.emitsEvents()) {
      if (eventSource == null) {
        throw new IllegalArgumentException(
            "Reactor '" + definition.processorName() + "' emits events and requires an event source");
      }
      if (eventSink == null) {
        throw new IllegalArgumentException(
            "Reactor '" + definition.processorName() + "' emits events and requires an event sink");
      }
    }
    this.eventSource = eventSource;
    this.eventSink = eventSink;
    this.state = definition.newState();
  }

  /**
   * Ensures the tracker holds a position record for this reactor. Idempotent.
   */
  public void setup() {
    tracker.setup(processorName());
  }

  /**
   * Sets this reactor's tracked position back to {@code 0}. Previously emitted
   * events are kept.
   */
  public void reset() {
    tracker.reset(processorName());
  }

  /**
   * Processes one event.
   *
   * <p>Events of types without a registered handler are ignored. Otherwise the handler
   * runs with an {@link Emitter} bound to {@code event}; anything it throws propagates
   * unchanged.
   *
   * @param event the event to process
   */
  public void process(Event event) {
    Objects.requireNonNull(event, "event");
    Optional<ReactorHandler<S>> handler = definition.handlerFor(event.type());
    if (handler.isEmpty()) {
      return;
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Reactor " + processorName() + " processing " + event);
    }
    Emission emission = new Emission(definition.processorName(), definition.emittableTypes(), eventSink, event);
    try {
      handler.get().handle(event, emission, state);
    } finally {
      emission.close();
    }
  }

  public String processorName() {
    return definition.processorName();
  }

  /**
   * Returns the last event id recorded for this reactor by its tracker.
   *
   * @return the tracked position
   */
  public long lastProcessedEventId() {
    return tracker.lastProcessedEventId(processorName());
  }

  public ReactorDefinition<S> definition() {
    return definition;
  }

  /**
   * Returns the mutable state shared by this instance's handlers.
   *
   * @return the instance state
   */
  public S state() {
    return state;
  }

  public Tracker tracker() {
    return tracker;
  }

  /**
   * Returns the event source, or {@code null} for reactors created without one.
   *
   * @return the event source
   */
  public EventSource eventSource() {
    return eventSource;
  }

  /**
   * Returns the event sink, or {@code null} for reactors created without one.
   *
   * @return the event sink
   */
  public EventSink eventSink() {
    return eventSink;
  }

  @Override
  public String toString() {
    return "Reactor{" + processorName() + '}';
  }
}
