package eventreactor.memory;

import eventreactor.spi.Tracker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link Tracker} kept in a {@link ConcurrentHashMap}. Positions are lost on restart.
 */
public final class InMemoryTracker implements Tracker {
  private final Map<String, Long> positions = new ConcurrentHashMap<>();

  @Override
  public void setup(String processorName) {
    positions.putIfAbsent(processorName, 0L);
  }

  @Override
  public void processed(String processorName, long eventId) {
    positions.put(processorName, eventId);
  }

  @Override
  public boolean compareAndSet(String processorName, long expected, long eventId) {
    if (expected == 0L && positions.putIfAbsent(processorName, eventId) == null) {
      return true;
    }
    return positions.replace(processorName, expected, eventId);
  }

  @Override
  public void reset(String processorName) {
    positions.put(processorName, 0L);
  }

  @Override
  public long lastProcessedEventId(String processorName) {
    return positions.getOrDefault(processorName, 0L);
  }

  @Override
  public List<String> trackedProcessors() {
    List<String> names = new ArrayList<>(positions.keySet());
    Collections.sort(names);
    return names;
  }
}
