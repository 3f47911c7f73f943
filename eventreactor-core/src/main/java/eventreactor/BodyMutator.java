package eventreactor;

import java.util.Map;

/**
 * Callback that enriches an event body right before it is appended.
 *
 * <p>Receives a mutable copy of the body. Entries put into the map end up in the
 * stored event.
 *
 * <pre>{@code
 * emitter.emit(Event.builder("TermsConfirmationEmailSent").build(),
 *     body -> body.put("token", tokens.next()));
 * }</pre>
 *
 * @see Emitter
 */
@FunctionalInterface
public interface BodyMutator {

  /**
   * Mutates the body in place.
   *
   * @param body mutable copy of the body about to be appended
   */
  void mutate(Map<String, Object> body);
}
