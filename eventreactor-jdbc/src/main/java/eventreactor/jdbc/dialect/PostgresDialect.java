package eventreactor.jdbc.dialect;

import eventreactor.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL dialect. UUIDs and bodies use the native {@code uuid} and {@code jsonb} types.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public int insertTrackerIfAbsent(Connection conn, String table, String name) {
    String sql = "INSERT INTO " + table + " (name, last_processed_event_id) VALUES (?, 0)" +
        " ON CONFLICT (name) DO NOTHING";
    return JdbcTemplate.update(conn, sql, name);
  }

  @Override
  protected String uuidPlaceholder() {
    return "CAST(? AS uuid)";
  }

  @Override
  protected String jsonPlaceholder() {
    return "CAST(? AS jsonb)";
  }
}
