package eventreactor.jdbc;

import eventreactor.Event;
import eventreactor.EventTypes;
import eventreactor.jdbc.spi.ConnectionProvider;
import eventreactor.jdbc.spi.Dialect;
import eventreactor.jdbc.spi.TxContext;
import eventreactor.spi.EventStore;
import eventreactor.util.JsonCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventStore} backed by a relational {@code events} table.
 *
 * <p>Ids come from the table's identity column. When a {@link TxContext} is configured and a
 * transaction is active on the calling thread, appends and reads run on that transaction's
 * connection and become visible only on commit. Otherwise each call uses its own
 * auto-commit connection.
 *
 * <pre>{@code
 * JdbcEventStore store = JdbcEventStore.builder()
 *     .dataSource(dataSource)          // dialect detected from the JDBC URL
 *     .txContext(txContext)
 *     .build();
 * }</pre>
 *
 * @see JdbcTracker
 */
public final class JdbcEventStore implements EventStore {
  private static final Logger logger = Logger.getLogger(JdbcEventStore.class.getName());

  private final TxAwareConnections connections;
  private final Dialect dialect;
  private final JsonCodec jsonCodec;
  private final String tableName;

  private final JdbcTemplate.RowMapper<Event> rowMapper;

  private JdbcEventStore(Builder builder) {
    this.connections = new TxAwareConnections(builder.connectionProvider, builder.txContext);
    this.dialect = builder.dialect;
    this.jsonCodec = builder.jsonCodec;
    this.tableName = TableNames.events(builder.tableName);
    this.rowMapper = rs -> Event.builder(rs.getString("type"))
        .id(rs.getLong("id"))
        .uuid(UUID.fromString(rs.getString("uuid")))
        .aggregateId(rs.getString("aggregate_id"))
        .body(jsonCodec.parseObject(rs.getString("body")))
        .correlationId(toUuid(rs.getString("correlation_id")))
        .causationId(toUuid(rs.getString("causation_id")))
        .createdAt(rs.getTimestamp("created_at").toInstant())
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Event append(Event event) {
    Objects.requireNonNull(event, "event");
    String json = jsonCodec.toJson(event.body());
    long id = connections.execute(conn -> JdbcTemplate.insertReturningKey(conn,
        dialect.insertEventSql(tableName),
        event.uuid().toString(),
        event.aggregateId(),
        event.type(),
        json,
        toText(event.correlationId()),
        toText(event.causationId()),
        Timestamp.from(event.createdAt())));
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Appended " + event.type() + " as event " + id);
    }
    return event.withId(id);
  }

  /**
   * Defers {@code action} until the caller's transaction commits when an append joined one;
   * otherwise the append is already committed and the action runs now.
   */
  @Override
  public void afterAppend(Runnable action) {
    connections.afterCommit(action);
  }

  @Override
  public List<Event> getNextFrom(long afterId, int limit) {
    return getNextFrom(afterId, limit, List.of());
  }

  @Override
  public List<Event> getNextFrom(long afterId, int limit, Collection<String> eventTypes) {
    Set<String> types = new LinkedHashSet<>();
    if (eventTypes != null) {
      for (String eventType : eventTypes) {
        types.add(EventTypes.canonicalize(eventType));
      }
    }
    List<Object> params = new ArrayList<>(types.size() + 2);
    params.add(afterId);
    params.addAll(types);
    params.add(limit);
    String sql = dialect.selectEventsAfterSql(tableName, types.size());
    return connections.execute(conn -> JdbcTemplate.query(conn, sql, rowMapper, params.toArray()));
  }

  @Override
  public long latestEventId() {
    List<Long> ids = connections.execute(conn ->
        JdbcTemplate.query(conn, dialect.latestEventIdSql(tableName), rs -> rs.getLong(1)));
    return ids.isEmpty() ? 0L : ids.get(0);
  }

  @Override
  public List<Event> getEventsForAggregateId(String aggregateId) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    return connections.execute(conn -> JdbcTemplate.query(conn,
        dialect.selectEventsForAggregateSql(tableName), rowMapper, aggregateId));
  }

  public Dialect dialect() {
    return dialect;
  }

  public String tableName() {
    return tableName;
  }

  private static String toText(UUID uuid) {
    return uuid == null ? null : uuid.toString();
  }

  private static UUID toUuid(String text) {
    return text == null ? null : UUID.fromString(text);
  }

  /**
   * Builder for {@link JdbcEventStore}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private Dialect dialect;
    private TxContext txContext;
    private JsonCodec jsonCodec = JsonCodec.getDefault();
    private String tableName = TableNames.EVENTS;

    private Builder() {
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder dataSource(DataSource dataSource) {
      this.connectionProvider = Objects.requireNonNull(dataSource, "dataSource")::getConnection;
      return this;
    }

    /**
     * Sets the SQL dialect. When unset, {@link #build()} picks the registered dialect whose
     * URL prefix matches the database the connections point at.
     *
     * @param dialect the dialect
     * @return this builder
     */
    public Builder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    /**
     * Sets the context whose active transaction appends and reads join. Optional.
     *
     * @param txContext the transaction context
     * @return this builder
     */
    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    /**
     * Sets the body codec. Default {@link JsonCodec#getDefault()}.
     *
     * @param jsonCodec the codec
     * @return this builder
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    public JdbcEventStore build() {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(jsonCodec, "jsonCodec");
      if (dialect == null) {
        dialect = dialectFor(connectionProvider);
      }
      return new JdbcEventStore(this);
    }
  }

  /**
   * Matches the connection's JDBC URL against the dialects registered in
   * {@code META-INF/services/eventreactor.jdbc.spi.Dialect}.
   */
  static Dialect dialectFor(ConnectionProvider connectionProvider) {
    String url;
    try (Connection conn = connectionProvider.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new ReactorStoreException("Failed to read the JDBC URL for dialect detection", e);
    }
    List<String> prefixes = new ArrayList<>();
    for (Dialect candidate : ServiceLoader.load(Dialect.class)) {
      for (String prefix : candidate.jdbcUrlPrefixes()) {
        if (url != null && url.startsWith(prefix)) {
          if (logger.isLoggable(Level.FINE)) {
            logger.fine("Using " + candidate.name() + " dialect for " + url);
          }
          return candidate;
        }
        prefixes.add(prefix);
      }
    }
    throw new IllegalStateException("No registered dialect for " + url
        + " (known prefixes " + prefixes + "); set one with dialect(...)");
  }
}
