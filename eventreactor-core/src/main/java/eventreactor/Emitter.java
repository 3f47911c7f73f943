package eventreactor;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Emission capability handed to a {@link ReactorHandler} while it processes an event.
 *
 * <p>Each emission runs the same pipeline:
 * <ol>
 *   <li>The event type must be declared via
 *       {@link ReactorDefinition.Builder#emitsEvents(String...)}; otherwise an
 *       {@link EventProcessingException} is thrown and nothing is appended.</li>
 *   <li>The causation id is set to the uuid of the event being processed; the correlation
 *       id is inherited from it, or set to its uuid when it has none. Values set by the
 *       caller are replaced.</li>
 *   <li>The optional {@link BodyMutator} runs on a mutable copy of the body.</li>
 *   <li>The event is appended to the reactor's event sink.</li>
 *   <li>The optional action runs, only after the append succeeded. A sink that joined a
 *       caller's transaction runs it after that transaction commits instead.</li>
 * </ol>
 *
 * <p>Side effects with external consequences (sending an email, calling an API) belong
 * in the action, so they never run without a recorded event.
 *
 * <p>An emitter is bound to one {@link Reactor#process(Event)} call and is unusable once
 * the handler has returned.
 */
public interface Emitter {

  /**
   * Emits an event.
   *
   * @param event the event to emit; type, aggregate id and body are taken from it
   * @return the stored event with its assigned id
   * @throws EventProcessingException if the type is not declared
   * @throws IllegalStateException    if the handler invocation has completed
   */
  default Event emit(Event event) {
    return emit(event, null, null);
  }

  /**
   * Emits an event, letting {@code mutator} enrich the body before the append.
   *
   * @param event   the event to emit
   * @param mutator body mutation hook
   * @return the stored event
   */
  default Event emit(Event event, BodyMutator mutator) {
    return emit(event, mutator, null);
  }

  /**
   * Emits an event and runs {@code action} once the append succeeded.
   *
   * @param event  the event to emit
   * @param action post-append side effect
   * @return the stored event
   */
  default Event emit(Event event, Runnable action) {
    return emit(event, null, action);
  }

  /**
   * Emits an event with both a body mutation hook and a post-append action.
   *
   * @param event   the event to emit
   * @param mutator body mutation hook, may be {@code null}
   * @param action  post-append side effect, may be {@code null}
   * @return the stored event
   */
  Event emit(Event event, BodyMutator mutator, Runnable action);

  /**
   * Emits an event and hands the source event to {@code action} once the append succeeded.
   *
   * <pre>{@code
   * emitter.emitThen(EmailSent.forUser(userId),
   *     source -> mailer.send(userId, "terms-" + source.uuid()));
   * }</pre>
   *
   * @param event  the event to emit
   * @param action post-append side effect receiving {@link #sourceEvent()}
   * @return the stored event
   */
  default Event emitThen(Event event, Consumer<? super Event> action) {
    Objects.requireNonNull(action, "action");
    Event source = sourceEvent();
    return emit(event, null, () -> action.accept(source));
  }

  /**
   * Returns the event whose processing this emitter is bound to.
   *
   * @return the source event
   */
  Event sourceEvent();
}
