package eventreactor.spi;

/**
 * An event stream that can be both read and appended to.
 *
 * <p>Implementations: {@link eventreactor.memory.InMemoryEventStore} and the JDBC stores in
 * the {@code eventreactor-jdbc} module.
 */
public interface EventStore extends EventSource, EventSink {
}
