package eventreactor.jdbc.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for store and tracker operations that run outside a
 * caller's transaction.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * <p>A {@code DataSource} adapts as {@code dataSource::getConnection}.
 */
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
