package eventreactor;

import eventreactor.spi.EventSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * EventSink stub that records appends, can be told to fail and can hold back actions.
 */
class RecordingEventSink implements EventSink {
  final AtomicInteger appendCount = new AtomicInteger();
  final List<Event> appended = new CopyOnWriteArrayList<>();
  final List<Runnable> deferred = new CopyOnWriteArrayList<>();
  volatile RuntimeException failure;
  volatile boolean deferActions;

  @Override
  public Event append(Event event) {
    appendCount.incrementAndGet();
    if (failure != null) {
      throw failure;
    }
    Event stored = event.withId(appended.size() + 1L);
    appended.add(stored);
    return stored;
  }

  @Override
  public void afterAppend(Runnable action) {
    if (deferActions) {
      deferred.add(action);
    } else {
      action.run();
    }
  }
}
