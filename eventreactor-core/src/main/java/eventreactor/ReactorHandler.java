package eventreactor;

/**
 * Handler registered for one or more event types of a reactor.
 *
 * <p>Everything a handler may read or write is explicit: the event being processed,
 * the {@link Emitter} for derived events, and the reactor instance's mutable state.
 *
 * <p>Exceptions propagate unchanged through {@link Reactor#process(Event)}; the
 * dispatch loop decides whether to retry or stop.
 *
 * @param <S> type of the reactor instance state
 */
@FunctionalInterface
public interface ReactorHandler<S> {

  /**
   * Handles an event.
   *
   * @param event   the event being processed
   * @param emitter emission capability bound to {@code event}
   * @param state   the reactor instance's mutable state
   */
  void handle(Event event, Emitter emitter, S state);
}
