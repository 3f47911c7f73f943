package eventreactor;

import eventreactor.spi.EventSink;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link Emitter} bound to a single {@link Reactor#process(Event)} invocation.
 */
final class Emission implements Emitter {

  private final String processorName;
  private final Set<String> emittableTypes;
  private final EventSink eventSink;
  private final Event sourceEvent;
  private boolean closed;

  Emission(String processorName, Set<String> emittableTypes, EventSink eventSink, Event sourceEvent) {
    this.processorName = processorName;
    this.emittableTypes = emittableTypes;
    this.eventSink = eventSink;
    this.sourceEvent = sourceEvent;
  }

  @Override
  public Event emit(Event event, BodyMutator mutator, Runnable action) {
    Objects.requireNonNull(event, "event");
    if (closed) {
      throw new IllegalStateException(
          "Emitter for " + sourceEvent + " used after its handler returned");
    }
    if (!emittableTypes.contains(event.type())) {
      throw EventProcessingException.undeclaredEmission(processorName, event.type());
    }

    Event.Builder stamped = event.toBuilder()
        .id(null)
        .causationId(sourceEvent.uuid())
        .correlationId(sourceEvent.correlationId() != null
            ? sourceEvent.correlationId()
            : sourceEvent.uuid());

    if (mutator != null) {
      Map<String, Object> body = new LinkedHashMap<>(event.body());
      mutator.mutate(body);
      stamped.body(body);
    }

    // emittableTypes is non-empty here, so the reactor was constructed with a sink
    Event stored = eventSink.append(stamped.build());

    if (action != null) {
      eventSink.afterAppend(action);
    }
    return stored;
  }

  @Override
  public Event sourceEvent() {
    return sourceEvent;
  }

  void close() {
    closed = true;
  }
}
