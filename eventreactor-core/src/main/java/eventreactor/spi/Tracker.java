package eventreactor.spi;

import java.util.List;

/**
 * Durable record of the last event each reactor has processed.
 *
 * <p>Positions are keyed by processor name and default to {@code 0}. Implementations
 * must tolerate concurrent callers across processor names; {@link #compareAndSet}
 * must be atomic per name.
 *
 * @see eventreactor.memory.InMemoryTracker
 */
public interface Tracker {

  /**
   * Ensures a position record exists for the processor, creating it at {@code 0}.
   * Calling it for an existing record leaves the record untouched.
   *
   * @param processorName the processor name
   */
  void setup(String processorName);

  /**
   * Records that the processor has processed every event up to {@code eventId}.
   *
   * @param processorName the processor name
   * @param eventId       id of the last processed event
   */
  void processed(String processorName, long eventId);

  /**
   * Atomically moves the position from {@code expected} to {@code eventId}.
   *
   * @param processorName the processor name
   * @param expected      the position the caller last observed
   * @param eventId       the new position
   * @return {@code true} if the position was {@code expected} and has been updated
   */
  boolean compareAndSet(String processorName, long expected, long eventId);

  /**
   * Sets the processor's position back to {@code 0}.
   *
   * @param processorName the processor name
   */
  void reset(String processorName);

  /**
   * Returns the last processed event id, or {@code 0} if none was recorded.
   *
   * @param processorName the processor name
   * @return the last processed event id
   */
  long lastProcessedEventId(String processorName);

  /**
   * Returns the names of all processors with a position record.
   *
   * @return processor names, sorted
   */
  List<String> trackedProcessors();
}
