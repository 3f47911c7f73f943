package eventreactor.jdbc.dialect;

import eventreactor.jdbc.JdbcTemplate;
import eventreactor.jdbc.spi.Dialect;

import java.sql.Connection;
import java.util.Collections;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses override the placeholder and limit hooks, or whole statements, to provide
 * database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {

  protected static final String EVENT_COLUMNS =
      "id, uuid, aggregate_id, type, body, correlation_id, causation_id, created_at";

  @Override
  public String insertEventSql(String table) {
    return "INSERT INTO " + table +
        " (uuid, aggregate_id, type, body, correlation_id, causation_id, created_at) VALUES (" +
        uuidPlaceholder() + ", ?, ?, " + jsonPlaceholder() + ", " +
        uuidPlaceholder() + ", " + uuidPlaceholder() + ", ?)";
  }

  @Override
  public String selectEventsAfterSql(String table, int typeCount) {
    StringBuilder sql = new StringBuilder("SELECT ").append(EVENT_COLUMNS)
        .append(" FROM ").append(table)
        .append(" WHERE id > ?");
    if (typeCount > 0) {
      sql.append(" AND type IN (")
          .append(String.join(",", Collections.nCopies(typeCount, "?")))
          .append(')');
    }
    return sql.append(" ORDER BY id ").append(limitClause()).toString();
  }

  @Override
  public String selectEventsForAggregateSql(String table) {
    return "SELECT " + EVENT_COLUMNS + " FROM " + table + " WHERE aggregate_id = ? ORDER BY id";
  }

  @Override
  public String latestEventIdSql(String table) {
    return "SELECT MAX(id) FROM " + table;
  }

  @Override
  public int insertTrackerIfAbsent(Connection conn, String table, String name) {
    String sql = "INSERT INTO " + table + " (name, last_processed_event_id) " +
        "SELECT CAST(? AS VARCHAR(255)), 0 WHERE NOT EXISTS (SELECT 1 FROM " + table + " WHERE name = ?)";
    return JdbcTemplate.update(conn, sql, name, name);
  }

  /** Placeholder for a UUID bound as a string. */
  protected String uuidPlaceholder() {
    return "?";
  }

  /** Placeholder for a JSON document bound as a string. */
  protected String jsonPlaceholder() {
    return "?";
  }

  /** Row limit clause taking a single int parameter. */
  protected String limitClause() {
    return "LIMIT ?";
  }
}
