package eventreactor.spi;

import eventreactor.Event;
import eventreactor.EventTypes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read side of an event stream.
 *
 * <p>Results are ordered ascending by {@link Event#id()} and reading is restartable
 * from any position.
 *
 * @see EventStore
 */
public interface EventSource {

  /**
   * Returns up to {@code limit} events with an id greater than {@code afterId}.
   *
   * @param afterId exclusive lower bound; {@code 0} reads from the beginning
   * @param limit   maximum number of events to return
   * @return events ordered by id, possibly empty
   */
  List<Event> getNextFrom(long afterId, int limit);

  /**
   * Returns up to {@code limit} events of the given types with an id greater than {@code afterId}.
   *
   * <p>Default filters the unfiltered read in memory and keeps reading until {@code limit}
   * matches are found or the stream is exhausted. Stores should override with a filtered query.
   *
   * @param afterId    exclusive lower bound
   * @param limit      maximum number of events to return
   * @param eventTypes types to include in any spelling; empty means all types
   * @return matching events ordered by id
   */
  default List<Event> getNextFrom(long afterId, int limit, Collection<String> eventTypes) {
    if (eventTypes == null || eventTypes.isEmpty()) {
      return getNextFrom(afterId, limit);
    }
    Set<String> wanted = eventTypes.stream().map(EventTypes::canonicalize).collect(Collectors.toSet());
    List<Event> result = new ArrayList<>();
    long position = afterId;
    while (result.size() < limit) {
      List<Event> page = getNextFrom(position, limit);
      if (page.isEmpty()) {
        break;
      }
      for (Event event : page) {
        if (wanted.contains(event.type())) {
          result.add(event);
          if (result.size() == limit) {
            break;
          }
        }
      }
      position = page.get(page.size() - 1).id();
    }
    return result;
  }

  /**
   * Returns the id of the most recently appended event, or {@code 0} for an empty stream.
   *
   * @return the latest event id
   */
  long latestEventId();

  /**
   * Returns every event of one aggregate, ordered by id.
   *
   * @param aggregateId the aggregate identifier
   * @return the aggregate's events
   */
  List<Event> getEventsForAggregateId(String aggregateId);
}
