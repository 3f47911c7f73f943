package eventreactor;

import java.util.Objects;

/**
 * A simple string-based event type for dynamic scenarios.
 *
 * <pre>{@code
 * EventType type = StringEventType.of("TermsAccepted");
 * Event event = Event.builder(type)
 *     .aggregateId("user-1")
 *     .build();
 * }</pre>
 */
public final class StringEventType implements EventType {

  private final String name;

  private StringEventType(String name) {
    this.name = EventTypes.canonicalize(Objects.requireNonNull(name, "name"));
  }

  /**
   * Creates an event type from a string. The name is held in canonical form.
   *
   * @param name the event type name
   * @return the event type
   * @throws NullPointerException if name is null
   * @throws IllegalArgumentException if name is blank
   */
  public static StringEventType of(String name) {
    return new StringEventType(name);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof StringEventType)) return false;
    StringEventType that = (StringEventType) o;
    return name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
