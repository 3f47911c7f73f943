/**
 * Collaborator contracts consumed by reactors.
 *
 * <p>{@link eventreactor.spi.EventSource} and {@link eventreactor.spi.EventSink} are the read
 * and write sides of the event stream, {@link eventreactor.spi.Tracker} records each
 * reactor's position in it.
 *
 * @see eventreactor.spi.EventStore
 */
package eventreactor.spi;
