package eventreactor.memory;

import eventreactor.Event;
import eventreactor.EventTypes;
import eventreactor.spi.EventStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Thread-safe {@link EventStore} kept in memory. Intended for tests and single-process use.
 *
 * <p>Appends are serialized and assign consecutive ids starting at {@code 1}. Events
 * given to the constructor keep their ids when they have one.
 */
public final class InMemoryEventStore implements EventStore {
  private final List<Event> events = new ArrayList<>();

  public InMemoryEventStore() {
  }

  /**
   * Creates a store pre-populated with {@code initial} events, in order.
   *
   * @param initial existing events
   */
  public InMemoryEventStore(Collection<Event> initial) {
    for (Event event : initial) {
      if (event.isStored()) {
        if (event.id() <= latestEventId()) {
          throw new IllegalArgumentException("Event ids must ascend: " + event);
        }
        events.add(event);
      } else {
        append(event);
      }
    }
  }

  @Override
  public synchronized Event append(Event event) {
    Objects.requireNonNull(event, "event");
    Event stored = event.withId(latestEventId() + 1);
    events.add(stored);
    return stored;
  }

  @Override
  public synchronized List<Event> getNextFrom(long afterId, int limit) {
    return events.stream()
        .filter(event -> event.id() > afterId)
        .limit(limit)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized List<Event> getNextFrom(long afterId, int limit, Collection<String> eventTypes) {
    if (eventTypes == null || eventTypes.isEmpty()) {
      return getNextFrom(afterId, limit);
    }
    Set<String> wanted = eventTypes.stream().map(EventTypes::canonicalize).collect(Collectors.toSet());
    return events.stream()
        .filter(event -> event.id() > afterId && wanted.contains(event.type()))
        .limit(limit)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized long latestEventId() {
    return events.isEmpty() ? 0L : events.get(events.size() - 1).id();
  }

  @Override
  public synchronized List<Event> getEventsForAggregateId(String aggregateId) {
    return events.stream()
        .filter(event -> Objects.equals(aggregateId, event.aggregateId()))
        .collect(Collectors.toList());
  }

  /**
   * Returns the number of stored events.
   *
   * @return the event count
   */
  public synchronized int size() {
    return events.size();
  }
}
