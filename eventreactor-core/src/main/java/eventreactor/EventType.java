package eventreactor;

/**
 * Represents an event type identifier.
 *
 * <p>Implementations can be enums for compile-time safety:
 * <pre>{@code
 * public enum TermsEvents implements EventType {
 *   TERMS_ACCEPTED,
 *   TERMS_CONFIRMATION_EMAIL_SENT
 * }
 * }</pre>
 *
 * <p>Or use {@link StringEventType} for dynamic event types:
 * <pre>{@code
 * EventType type = StringEventType.of("TermsAccepted");
 * }</pre>
 *
 * <p>Names are compared in canonical form, so {@code TERMS_ACCEPTED},
 * {@code TermsAccepted} and {@code terms_accepted} denote the same type.
 *
 * @see EventTypes#canonicalize(String)
 */
public interface EventType {

  /**
   * Returns the name of this event type. The canonical form of this value is
   * persisted with the event and used for dispatch.
   *
   * @return the event type name, never null
   */
  String name();

  /**
   * Returns the canonical form of {@link #name()}.
   *
   * @return the canonical type name
   */
  default String canonicalName() {
    return EventTypes.canonicalize(name());
  }
}
