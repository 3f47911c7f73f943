package eventreactor.jdbc.tx;

import eventreactor.jdbc.ReactorStoreException;
import eventreactor.jdbc.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight transaction manager for manual JDBC usage. Obtains a connection,
 * disables auto-commit, and binds it to a {@link ThreadLocalTxContext}.
 *
 * <p>Stores and trackers created with the same context join the transaction, so a
 * projection update, the events it emits and the tracker position commit together:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     reactor.process(event);
 *     tracker.processed(reactor.processorName(), event.id());
 *     tx.commit();
 * }
 * }</pre>
 *
 * <p>{@link #transactionRunner()} packages the same pattern for
 * {@code ReactorPoller.Builder#transactionRunner}.
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  /**
   * Begins a new transaction by obtaining a connection and binding it to the thread context.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      connection.close();
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  /**
   * Returns a runner that executes each unit of work in its own transaction, committing when
   * it returns and rolling back when it throws. The work's exception is rethrown unchanged;
   * JDBC failures to begin or commit surface as {@link ReactorStoreException}.
   *
   * @return the per-unit transaction runner
   */
  public Consumer<Runnable> transactionRunner() {
    return work -> {
      try (Transaction tx = begin()) {
        work.run();
        tx.commit();
      } catch (SQLException e) {
        throw new ReactorStoreException("Transaction failed", e);
      }
    };
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
    }

    /**
     * Commits, then runs the callbacks registered through {@link ThreadLocalTxContext#afterCommit}.
     * If a callback fails the remaining ones still run and the first failure is rethrown.
     */
    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      List<Runnable> callbacks;
      try {
        connection.commit();
      } catch (SQLException e) {
        safeRollback();
        throw e;
      } finally {
        callbacks = finish();
      }
      runAfterCommit(callbacks);
    }

    /**
     * Rolls back and discards the after-commit callbacks.
     */
    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        List<Runnable> discarded = finish();
        if (!discarded.isEmpty() && logger.isLoggable(Level.FINE)) {
          logger.fine("Rolled back; discarded " + discarded.size() + " after-commit callback(s)");
        }
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private List<Runnable> finish() throws SQLException {
      completed = true;
      List<Runnable> callbacks = txContext.clear();
      try {
        connection.setAutoCommit(true);
      } finally {
        connection.close();
      }
      return callbacks;
    }

    private static void runAfterCommit(List<Runnable> callbacks) {
      RuntimeException first = null;
      for (Runnable callback : callbacks) {
        try {
          callback.run();
        } catch (RuntimeException e) {
          if (first == null) {
            first = e;
          } else {
            first.addSuppressed(e);
          }
        }
      }
      if (first != null) {
        throw first;
      }
    }

    private void safeRollback() {
      try {
        connection.rollback();
      } catch (SQLException e) {
        logger.log(Level.WARNING, "Rollback after failed commit failed", e);
      }
    }
  }
}
