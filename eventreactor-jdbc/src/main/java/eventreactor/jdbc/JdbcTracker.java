package eventreactor.jdbc;

import eventreactor.jdbc.spi.ConnectionProvider;
import eventreactor.jdbc.spi.Dialect;
import eventreactor.jdbc.spi.TxContext;
import eventreactor.spi.Tracker;

import javax.sql.DataSource;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link Tracker} backed by a {@code tracker} table with one row per processor.
 *
 * <p>Like {@link JdbcEventStore}, it joins the active transaction of its {@link TxContext}
 * when there is one, so a reactor can commit its position together with the writes made
 * while processing.
 *
 * <pre>{@code
 * ReactorDefaults.configure(config -> config
 *     .setTrackerSupplier(() -> JdbcTracker.builder().dataSource(projections).build()));
 * }</pre>
 */
public final class JdbcTracker implements Tracker {
  private static final Logger logger = Logger.getLogger(JdbcTracker.class.getName());

  private final TxAwareConnections connections;
  private final Dialect dialect;
  private final String tableName;

  private JdbcTracker(Builder builder) {
    this.connections = new TxAwareConnections(builder.connectionProvider, builder.txContext);
    this.dialect = builder.dialect;
    this.tableName = TableNames.tracker(builder.tableName);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void setup(String processorName) {
    Objects.requireNonNull(processorName, "processorName");
    int inserted = connections.execute(conn -> dialect.insertTrackerIfAbsent(conn, tableName, processorName));
    if (inserted > 0) {
      logger.info("Created tracker entry for " + processorName);
    }
  }

  @Override
  public void processed(String processorName, long eventId) {
    Objects.requireNonNull(processorName, "processorName");
    connections.execute(conn -> {
      String sql = "UPDATE " + tableName + " SET last_processed_event_id = ? WHERE name = ?";
      if (JdbcTemplate.update(conn, sql, eventId, processorName) == 0) {
        dialect.insertTrackerIfAbsent(conn, tableName, processorName);
        JdbcTemplate.update(conn, sql, eventId, processorName);
      }
      return null;
    });
  }

  @Override
  public boolean compareAndSet(String processorName, long expected, long eventId) {
    Objects.requireNonNull(processorName, "processorName");
    String sql = "UPDATE " + tableName + " SET last_processed_event_id = ?" +
        " WHERE name = ? AND last_processed_event_id = ?";
    return connections.execute(conn -> {
      if (JdbcTemplate.update(conn, sql, eventId, processorName, expected) == 1) {
        return true;
      }
      if (expected != 0L || dialect.insertTrackerIfAbsent(conn, tableName, processorName) == 0) {
        return false;
      }
      return JdbcTemplate.update(conn, sql, eventId, processorName, expected) == 1;
    });
  }

  @Override
  public void reset(String processorName) {
    processed(processorName, 0L);
    logger.info("Reset tracker entry for " + processorName);
  }

  @Override
  public long lastProcessedEventId(String processorName) {
    Objects.requireNonNull(processorName, "processorName");
    List<Long> ids = connections.execute(conn -> JdbcTemplate.query(conn,
        "SELECT last_processed_event_id FROM " + tableName + " WHERE name = ?",
        rs -> rs.getLong(1), processorName));
    return ids.isEmpty() ? 0L : ids.get(0);
  }

  @Override
  public List<String> trackedProcessors() {
    return connections.execute(conn -> JdbcTemplate.query(conn,
        "SELECT name FROM " + tableName + " ORDER BY name", rs -> rs.getString(1)));
  }

  /**
   * Builder for {@link JdbcTracker}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private Dialect dialect;
    private TxContext txContext;
    private String tableName = TableNames.TRACKER;

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

    public Builder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    public JdbcTracker build() {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      if (dialect == null) {
        dialect = JdbcEventStore.dialectFor(connectionProvider);
      }
      return new JdbcTracker(this);
    }
  }
}
