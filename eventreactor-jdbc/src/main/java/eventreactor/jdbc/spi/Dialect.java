package eventreactor.jdbc.spi;

import java.sql.Connection;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide database-specific SQL for the events and tracker tables.
 * Register custom dialects via {@code META-INF/services/eventreactor.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: H2, PostgreSQL, MySQL.
 *
 * @see eventreactor.jdbc.JdbcEventStore.Builder#dialect(Dialect)
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * SQL for appending an event. The {@code id} column is generated.
   *
   * <p>Parameters (in order):
   * <ol>
   *   <li>uuid (String)</li>
   *   <li>aggregate_id (String)</li>
   *   <li>type (String)</li>
   *   <li>body (String/JSON)</li>
   *   <li>correlation_id (String)</li>
   *   <li>causation_id (String)</li>
   *   <li>created_at (Timestamp)</li>
   * </ol>
   */
  String insertEventSql(String table);

  /**
   * SQL for reading events after a position, ordered by id.
   *
   * <p>Parameters: id (long), then {@code typeCount} type names, then limit (int).
   *
   * <p>Returns columns: id, uuid, aggregate_id, type, body, correlation_id,
   * causation_id, created_at
   *
   * @param typeCount number of type names to filter on; {@code 0} reads every type
   */
  String selectEventsAfterSql(String table, int typeCount);

  /**
   * SQL for reading all events of one aggregate, ordered by id.
   *
   * <p>Parameters: aggregate_id (String)
   */
  String selectEventsForAggregateSql(String table);

  /**
   * SQL returning the highest event id as a single column, {@code NULL} for an empty table.
   */
  String latestEventIdSql(String table);

  /**
   * Inserts a tracker row at position {@code 0} unless one exists for {@code name}.
   *
   * @param conn  JDBC connection
   * @param table tracker table name
   * @param name  processor name
   * @return rows inserted, {@code 0} if the row already existed
   */
  int insertTrackerIfAbsent(Connection conn, String table, String name);
}
