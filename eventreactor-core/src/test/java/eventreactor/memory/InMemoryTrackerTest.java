package eventreactor.memory;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryTrackerTest {
  private final InMemoryTracker tracker = new InMemoryTracker();

  @Test
  void unknownProcessorIsAtZero() {
    assertEquals(0L, tracker.lastProcessedEventId("unknown"));
    assertTrue(tracker.trackedProcessors().isEmpty());
  }

  @Test
  void setupIsIdempotent() {
    tracker.setup("reactor");
    tracker.processed("reactor", 5L);
    tracker.setup("reactor");

    assertEquals(5L, tracker.lastProcessedEventId("reactor"));
  }

  @Test
  void resetReturnsToZero() {
    tracker.processed("reactor", 9L);
    tracker.reset("reactor");
    assertEquals(0L, tracker.lastProcessedEventId("reactor"));
  }

  @Test
  void compareAndSetRejectsStalePosition() {
    tracker.setup("reactor");

    assertTrue(tracker.compareAndSet("reactor", 0L, 3L));
    assertFalse(tracker.compareAndSet("reactor", 0L, 4L));
    assertEquals(3L, tracker.lastProcessedEventId("reactor"));
  }

  @Test
  void compareAndSetFromZeroCreatesMissingRecord() {
    assertTrue(tracker.compareAndSet("fresh", 0L, 2L));
    assertEquals(2L, tracker.lastProcessedEventId("fresh"));
  }

  @Test
  void trackedProcessorsAreSorted() {
    tracker.setup("zeta");
    tracker.setup("alpha");
    tracker.processed("mid", 1L);

    assertEquals(List.of("alpha", "mid", "zeta"), tracker.trackedProcessors());
  }
}
