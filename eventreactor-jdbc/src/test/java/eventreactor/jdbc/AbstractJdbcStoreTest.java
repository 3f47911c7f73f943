package eventreactor.jdbc;

import eventreactor.Event;
import eventreactor.jdbc.tx.JdbcTransactionManager;
import eventreactor.jdbc.tx.ThreadLocalTxContext;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Store and tracker behaviour shared by every database.
 */
abstract class AbstractJdbcStoreTest {

  protected ThreadLocalTxContext txContext;
  protected JdbcEventStore store;
  protected JdbcTracker tracker;

  abstract DataSource dataSource();

  /** Called before each test; leaves the schema in place with empty tables. */
  abstract void prepareDatabase() throws Exception;

  @BeforeEach
  void createComponents() throws Exception {
    prepareDatabase();
    txContext = new ThreadLocalTxContext();
    store = JdbcEventStore.builder().dataSource(dataSource()).txContext(txContext).build();
    tracker = JdbcTracker.builder().dataSource(dataSource()).txContext(txContext).build();
  }

  @Test
  void appendAssignsAscendingIds() {
    Event first = store.append(Event.builder("ItemAdded").build());
    Event second = store.append(Event.builder("ItemAdded").build());

    assertTrue(first.id() > 0L);
    assertTrue(second.id() > first.id());
    assertEquals(second.id(), store.latestEventId());
  }

  @Test
  void emptyStoreHasNoLatestEvent() {
    assertEquals(0L, store.latestEventId());
    assertTrue(store.getNextFrom(0L, 10).isEmpty());
  }

  @Test
  void appendedEventReadsBackUnchanged() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("email", "alice@example.com");
    body.put("quantity", 2);
    body.put("tags", List.of("new", "vip"));
    body.put("address", Map.of("city", "Berlin"));
    UUID correlationId = UUID.randomUUID();
    UUID causationId = UUID.randomUUID();
    Instant createdAt = Instant.parse("2024-03-01T12:30:45.123Z");
    Event stored = store.append(Event.builder("TermsAccepted")
        .aggregateId("user-1")
        .body(body)
        .correlationId(correlationId)
        .causationId(causationId)
        .createdAt(createdAt)
        .build());

    Event read = store.getNextFrom(0L, 10).get(0);

    assertEquals(stored, read);
    assertEquals("terms_accepted", read.type());
    assertEquals(body, read.body());
    assertEquals(correlationId, read.correlationId());
    assertEquals(causationId, read.causationId());
    assertEquals(createdAt, read.createdAt());
  }

  @Test
  void rootEventsHaveNoCausalMetadata() {
    store.append(Event.builder("ItemAdded").build());

    Event read = store.getNextFrom(0L, 1).get(0);

    assertNull(read.causationId());
    assertNull(read.correlationId());
    assertTrue(read.body().isEmpty());
  }

  @Test
  void getNextFromHonorsPositionLimitAndTypes() {
    List<Long> ids = appendAll("ItemAdded", "ItemViewed", "ItemAdded", "ItemRemoved", "ItemAdded");

    assertEquals(ids.subList(2, 4), ids(store.getNextFrom(ids.get(1), 2)));
    assertEquals(List.of(ids.get(0), ids.get(2)), ids(store.getNextFrom(0L, 2, List.of("ItemAdded"))));
    assertEquals(List.of(ids.get(1), ids.get(3)),
        ids(store.getNextFrom(0L, 10, List.of("item_viewed", "ITEM_REMOVED"))));
    assertTrue(store.getNextFrom(ids.get(4), 10).isEmpty());
  }

  @Test
  void getEventsForAggregateIdReturnsOnlyThatAggregate() {
    store.append(Event.builder("ItemAdded").aggregateId("cart-1").build());
    store.append(Event.builder("ItemAdded").aggregateId("cart-2").build());
    store.append(Event.builder("ItemRemoved").aggregateId("cart-1").build());

    List<Event> events = store.getEventsForAggregateId("cart-1");

    assertEquals(List.of("item_added", "item_removed"),
        events.stream().map(Event::type).collect(Collectors.toList()));
  }

  @Test
  void appendInRolledBackTransactionIsNotVisible() throws Exception {
    JdbcTransactionManager txManager = new JdbcTransactionManager(
        dataSource()::getConnection, txContext);

    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      store.append(Event.builder("ItemAdded").build());
      assertEquals(1, store.getNextFrom(0L, 10).size());
      tx.rollback();
    }

    assertTrue(store.getNextFrom(0L, 10).isEmpty());
  }

  @Test
  void appendInCommittedTransactionIsVisible() throws Exception {
    JdbcTransactionManager txManager = new JdbcTransactionManager(
        dataSource()::getConnection, txContext);

    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      Event stored = store.append(Event.builder("ItemAdded").build());
      tracker.processed("projector", stored.id());
      tx.commit();
    }

    assertEquals(1, store.getNextFrom(0L, 10).size());
    assertEquals(store.latestEventId(), tracker.lastProcessedEventId("projector"));
  }

  @Test
  void trackerSetupIsIdempotent() {
    tracker.setup("reactor");
    tracker.processed("reactor", 5L);
    tracker.setup("reactor");

    assertEquals(5L, tracker.lastProcessedEventId("reactor"));
    assertEquals(List.of("reactor"), tracker.trackedProcessors());
  }

  @Test
  void trackerDefaultsToZero() {
    assertEquals(0L, tracker.lastProcessedEventId("unknown"));
    assertTrue(tracker.trackedProcessors().isEmpty());
  }

  @Test
  void trackerResetReturnsToZero() {
    tracker.setup("reactor");
    tracker.processed("reactor", 9L);
    tracker.reset("reactor");

    assertEquals(0L, tracker.lastProcessedEventId("reactor"));
  }

  @Test
  void processedCreatesMissingEntry() {
    tracker.processed("late", 3L);
    assertEquals(3L, tracker.lastProcessedEventId("late"));
  }

  @Test
  void compareAndSetFailsOnStaleExpectation() {
    tracker.setup("reactor");

    assertTrue(tracker.compareAndSet("reactor", 0L, 4L));
    assertFalse(tracker.compareAndSet("reactor", 0L, 6L));
    assertTrue(tracker.compareAndSet("reactor", 4L, 6L));
    assertEquals(6L, tracker.lastProcessedEventId("reactor"));
  }

  @Test
  void compareAndSetFromZeroCreatesMissingEntry() {
    assertTrue(tracker.compareAndSet("fresh", 0L, 2L));
    assertFalse(tracker.compareAndSet("other", 1L, 2L));
    assertEquals(List.of("fresh"), tracker.trackedProcessors());
  }

  @Test
  void rejectsInvalidTableNames() {
    assertThrows(IllegalArgumentException.class,
        () -> JdbcEventStore.builder().dataSource(dataSource()).tableName("events; DROP").build());
  }

  private List<Long> appendAll(String... types) {
    return Arrays.stream(types)
        .map(type -> store.append(Event.builder(type).build()).id())
        .collect(Collectors.toList());
  }

  private static List<Long> ids(List<Event> events) {
    return events.stream().map(Event::id).collect(Collectors.toList());
  }
}
