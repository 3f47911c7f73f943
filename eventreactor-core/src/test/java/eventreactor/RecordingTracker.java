package eventreactor;

import eventreactor.memory.InMemoryTracker;
import eventreactor.spi.Tracker;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tracker stub that delegates to an in-memory tracker and records calls.
 */
class RecordingTracker implements Tracker {
  final List<String> calls = new CopyOnWriteArrayList<>();
  private final InMemoryTracker delegate = new InMemoryTracker();

  @Override
  public void setup(String processorName) {
    calls.add("setup:" + processorName);
    delegate.setup(processorName);
  }

  @Override
  public void processed(String processorName, long eventId) {
    calls.add("processed:" + processorName + ":" + eventId);
    delegate.processed(processorName, eventId);
  }

  @Override
  public boolean compareAndSet(String processorName, long expected, long eventId) {
    calls.add("compareAndSet:" + processorName);
    return delegate.compareAndSet(processorName, expected, eventId);
  }

  @Override
  public void reset(String processorName) {
    calls.add("reset:" + processorName);
    delegate.reset(processorName);
  }

  @Override
  public long lastProcessedEventId(String processorName) {
    return delegate.lastProcessedEventId(processorName);
  }

  @Override
  public List<String> trackedProcessors() {
    return delegate.trackedProcessors();
  }
}
