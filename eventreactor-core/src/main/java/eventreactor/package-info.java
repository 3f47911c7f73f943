/**
 * Root API for event-sourcing reactors: consumers of an ordered event stream that react to
 * the event types they register for and may emit derived events back into the stream.
 *
 * <h2>Core Design</h2>
 * <p>A {@link eventreactor.ReactorDefinition} is built once per reactor type. It maps each
 * processed event type to a {@link eventreactor.ReactorHandler} and declares the closed set
 * of types the reactor may emit. A {@link eventreactor.Reactor} binds a definition to a
 * {@linkplain eventreactor.spi.Tracker tracker}, an
 * {@linkplain eventreactor.spi.EventSource event source} and an
 * {@linkplain eventreactor.spi.EventSink event sink}.
 *
 * <p>Handlers emit through an {@link eventreactor.Emitter}. Every emitted event is checked
 * against the whitelist, stamped with the processed event's uuid as causation id and its
 * correlation id, appended, and only then is the caller's action run.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>eventreactor-core</b>: definitions, reactors, in-memory store and tracker, poller</li>
 *   <li><b>eventreactor-jdbc</b>: JDBC event store and tracker (H2, MySQL, PostgreSQL)</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var store   = new InMemoryEventStore();
 * var tracker = new InMemoryTracker();
 *
 * ReactorDefinition<Map<String, Object>> definition = ReactorDefinition.builder("terms_email_reactor")
 *     .emitsEvents("TermsConfirmationEmailSent")
 *     .process("TermsAccepted", (event, emitter, state) -> {
 *       emitter.emit(Event.builder("TermsConfirmationEmailSent")
 *               .aggregateId(event.aggregateId())
 *               .build(),
 *           () -> mailer.send(event.aggregateId()));
 *       state.put("last", event.uuid());
 *     })
 *     .build();
 *
 * var reactor = new Reactor<>(definition, tracker, store, store);
 * reactor.setup();
 *
 * try (var poller = ReactorPoller.builder().reactor(reactor).build()) {
 *   poller.start();
 * }
 * }</pre>
 */
package eventreactor;
