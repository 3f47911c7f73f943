package eventreactor.spi;

import eventreactor.Event;

/**
 * Write side of an event stream.
 *
 * @see EventStore
 */
public interface EventSink {

  /**
   * Durably appends an event.
   *
   * <p>The call blocks until the event is committed or the append fails.
   *
   * @param event the event to append; its {@code id} is ignored
   * @return the stored event carrying the store-assigned id
   * @throws RuntimeException if the event cannot be durably recorded
   */
  Event append(Event event);

  /**
   * Runs {@code action} once the events appended so far are durable.
   *
   * <p>Sinks that append inside a caller's transaction defer the action until that
   * transaction commits and drop it on rollback. The default runs it immediately, which
   * is correct for sinks whose appends are durable when {@link #append(Event)} returns.
   *
   * @param action side effect that must not run without a recorded event
   */
  default void afterAppend(Runnable action) {
    action.run();
  }
}
