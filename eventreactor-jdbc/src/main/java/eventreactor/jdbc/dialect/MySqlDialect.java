package eventreactor.jdbc.dialect;

import eventreactor.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.util.List;

/**
 * MySQL dialect. Also handles MariaDB URLs.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  public int insertTrackerIfAbsent(Connection conn, String table, String name) {
    String sql = "INSERT IGNORE INTO " + table + " (name, last_processed_event_id) VALUES (?, 0)";
    return JdbcTemplate.update(conn, sql, name);
  }
}
