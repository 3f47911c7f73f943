package eventreactor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Immutable description of a reactor type: its processor name, the handler for each
 * event type it processes, and the closed set of event types it may emit.
 *
 * <p>A definition is built once and shared by every {@link Reactor} instance of that type.
 * All type names are held in canonical form (see {@link EventTypes}), so queries accept
 * any spelling of a name.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ReactorDefinition<Map<String, Object>> terms = ReactorDefinition.builder("terms_email_reactor")
 *     .emitsEvents("TermsConfirmationEmailSent")
 *     .process("TermsAccepted", (event, emitter, state) ->
 *         emitter.emit(Event.builder("TermsConfirmationEmailSent")
 *                 .aggregateId(event.aggregateId())
 *                 .build(),
 *             () -> mailer.sendConfirmation(event.aggregateId())))
 *     .build();
 * }</pre>
 *
 * @param <S> type of the per-instance state handed to handlers
 * @see Reactor
 */
public final class ReactorDefinition<S> {

  private final String processorName;
  private final Map<String, ReactorHandler<S>> handlers;
  private final Set<String> emittableTypes;
  private final Supplier<? extends S> stateFactory;

  private ReactorDefinition(Builder<S> builder) {
    this.processorName = builder.processorName;
    this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.handlers));
    this.emittableTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.emittableTypes));
    this.stateFactory = builder.stateFactory;
  }

  /**
   * Creates a builder whose instances keep their state in a mutable map.
   *
   * @param processorName the tracking key; canonicalized
   * @return a new builder
   */
  public static Builder<Map<String, Object>> builder(String processorName) {
    return new Builder<>(processorName, LinkedHashMap::new);
  }

  /**
   * Creates a builder whose instances get their state from {@code stateFactory}.
   *
   * @param processorName the tracking key; canonicalized
   * @param stateFactory  creates the state of each new instance
   * @param <S>           state type
   * @return a new builder
   */
  public static <S> Builder<S> builder(String processorName, Supplier<? extends S> stateFactory) {
    return new Builder<>(processorName, stateFactory);
  }

  /**
   * Creates a builder whose processor name is derived from {@code reactorType}'s simple name,
   * e.g. {@code TermsEmailReactor} becomes {@code terms_email_reactor}.
   *
   * @param reactorType  class naming the reactor
   * @param stateFactory creates the state of each new instance
   * @param <S>          state type
   * @return a new builder
   */
  public static <S> Builder<S> builder(Class<?> reactorType, Supplier<? extends S> stateFactory) {
    return new Builder<>(EventTypes.canonicalize(reactorType), stateFactory);
  }

  public String processorName() {
    return processorName;
  }

  /**
   * Returns {@code true} if a handler is registered for the given type name. Names that
   * have no canonical form, such as {@code null} or blank ones, are never processed.
   *
   * @param eventType type name in any spelling
   * @return whether this reactor processes the type
   */
  public boolean processes(String eventType) {
    return EventTypes.isValidName(eventType) && handlers.containsKey(EventTypes.canonicalize(eventType));
  }

  public boolean processes(EventType eventType) {
    return eventType != null && processes(eventType.name());
  }

  /**
   * Returns {@code true} if the type is in the emit whitelist. Always {@code false}
   * for reactors that declare no emissions.
   *
   * @param eventType type name in any spelling
   * @return whether this reactor may emit the type
   */
  public boolean emitsEvent(String eventType) {
    return EventTypes.isValidName(eventType) && emittableTypes.contains(EventTypes.canonicalize(eventType));
  }

  public boolean emitsEvent(EventType eventType) {
    return eventType != null && emitsEvent(eventType.name());
  }

  /**
   * Returns {@code true} if this reactor declares at least one emittable type and therefore
   * needs an event source and sink.
   *
   * @return whether the reactor emits events
   */
  public boolean emitsEvents() {
    return !emittableTypes.isEmpty();
  }

  /**
   * Returns the handler registered for the given type, if any.
   *
   * @param eventType type name in any spelling
   * @return the handler, or empty
   */
  public Optional<ReactorHandler<S>> handlerFor(String eventType) {
    if (!EventTypes.isValidName(eventType)) {
      return Optional.empty();
    }
    return Optional.ofNullable(handlers.get(EventTypes.canonicalize(eventType)));
  }

  /** Canonical names of all processed types, in registration order. */
  public Set<String> processedTypes() {
    return handlers.keySet();
  }

  /** Canonical names of all emittable types, in declaration order. */
  public Set<String> emittableTypes() {
    return emittableTypes;
  }

  S newState() {
    return stateFactory.get();
  }

  @Override
  public String toString() {
    return "ReactorDefinition{processorName=" + processorName
        + ", processes=" + handlers.keySet()
        + ", emits=" + emittableTypes + '}';
  }

  /**
   * Builder for {@link ReactorDefinition}.
   *
   * <p>Registering a second handler for the same canonical type is rejected.
   * {@link #emitsEvents} calls accumulate.
   *
   * @param <S> state type
   */
  public static final class Builder<S> {
    private final String processorName;
    private final Supplier<? extends S> stateFactory;
    private final Map<String, ReactorHandler<S>> handlers = new LinkedHashMap<>();
    private final Set<String> emittableTypes = new LinkedHashSet<>();

    private Builder(String processorName, Supplier<? extends S> stateFactory) {
      this.processorName = EventTypes.canonicalize(Objects.requireNonNull(processorName, "processorName"));
      this.stateFactory = Objects.requireNonNull(stateFactory, "stateFactory");
    }

    /**
     * Registers the handler for an event type.
     *
     * @param eventType type name in any spelling
     * @param handler   the handler
     * @return this builder
     * @throws IllegalArgumentException if a handler is already registered for the type
     */
    public Builder<S> process(String eventType, ReactorHandler<S> handler) {
      Objects.requireNonNull(handler, "handler");
      String type = EventTypes.canonicalize(Objects.requireNonNull(eventType, "eventType"));
      if (handlers.containsKey(type)) {
        throw new IllegalArgumentException(
            "Reactor '" + processorName + "' already has a handler for '" + type + "'");
      }
      handlers.put(type, handler);
      return this;
    }

    public Builder<S> process(EventType eventType, ReactorHandler<S> handler) {
      Objects.requireNonNull(eventType, "eventType");
      return process(eventType.name(), handler);
    }

    /**
     * Registers one handler for several event types.
     *
     * @param handler    the handler
     * @param eventTypes type names in any spelling
     * @return this builder
     */
    public Builder<S> process(ReactorHandler<S> handler, String... eventTypes) {
      if (eventTypes.length == 0) {
        throw new IllegalArgumentException("At least one event type is required");
      }
      for (String eventType : eventTypes) {
        process(eventType, handler);
      }
      return this;
    }

    /**
     * Adds event types to the emit whitelist. Repeated calls accumulate.
     *
     * @param eventTypes type names in any spelling
     * @return this builder
     */
    public Builder<S> emitsEvents(String... eventTypes) {
      for (String eventType : eventTypes) {
        emittableTypes.add(EventTypes.canonicalize(Objects.requireNonNull(eventType, "eventType")));
      }
      return this;
    }

    public Builder<S> emitsEvents(EventType... eventTypes) {
      for (EventType eventType : eventTypes) {
        Objects.requireNonNull(eventType, "eventType");
        emittableTypes.add(eventType.canonicalName());
      }
      return this;
    }

    public ReactorDefinition<S> build() {
      return new ReactorDefinition<>(this);
    }
  }
}
