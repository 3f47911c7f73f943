package eventreactor.jdbc;

import eventreactor.jdbc.spi.ConnectionProvider;
import eventreactor.jdbc.spi.TxContext;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Runs work on the caller's transactional connection when one is active, otherwise on a
 * fresh auto-commit connection that is closed afterwards.
 */
final class TxAwareConnections {
  private final ConnectionProvider connectionProvider;
  private final TxContext txContext;

  TxAwareConnections(ConnectionProvider connectionProvider, TxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = txContext;
  }

  <T> T execute(Function<Connection, T> work) {
    if (txContext != null && txContext.isTransactionActive()) {
      return work.apply(txContext.currentConnection());
    }
    try (Connection conn = connectionProvider.getConnection()) {
      return work.apply(conn);
    } catch (SQLException e) {
      throw new ReactorStoreException("Failed to obtain connection", e);
    }
  }

  void afterCommit(Runnable action) {
    if (txContext != null && txContext.isTransactionActive()) {
      txContext.afterCommit(action);
    } else {
      action.run();
    }
  }
}
