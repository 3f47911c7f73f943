package eventreactor;

/**
 * Thrown when a reactor violates its emission contract while processing an event,
 * for example by emitting an event type it did not declare.
 *
 * <p>Raised from within {@link Reactor#process(Event)}. Nothing is appended to the
 * event sink when this exception is thrown.
 */
public class EventProcessingException extends RuntimeException {

  private final String processorName;
  private final String eventType;

  /**
   * Creates a new instance.
   *
   * @param processorName the reactor that was processing
   * @param eventType     the offending event type
   * @param message       detail message
   */
  public EventProcessingException(String processorName, String eventType, String message) {
    super(message);
    this.processorName = processorName;
    this.eventType = eventType;
  }

  /**
   * Creates an exception for an emission of a type missing from the reactor's emit whitelist.
   *
   * @param processorName the reactor that attempted the emission
   * @param eventType     the undeclared event type
   * @return the exception
   */
  public static EventProcessingException undeclaredEmission(String processorName, String eventType) {
    return new EventProcessingException(processorName, eventType,
        "Reactor '" + processorName + "' emitted undeclared event type '" + eventType + "'");
  }

  public String processorName() {
    return processorName;
  }

  public String eventType() {
    return eventType;
  }
}
