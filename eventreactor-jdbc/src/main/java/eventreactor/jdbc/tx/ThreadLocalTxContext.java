package eventreactor.jdbc.tx;

import eventreactor.jdbc.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link TxContext} implementation that keeps the transaction's connection and its
 * after-commit callbacks in a {@link ThreadLocal}.
 *
 * <p>Bound and cleared by {@link JdbcTransactionManager}.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext implements TxContext {
  private final ThreadLocal<BoundTransaction> current = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return current.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return active().connection;
  }

  @Override
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    active().afterCommit.add(callback);
  }

  void bind(Connection connection) {
    if (current.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    current.set(new BoundTransaction(connection));
  }

  /**
   * Unbinds the transaction and hands back its after-commit callbacks in registration order.
   */
  List<Runnable> clear() {
    BoundTransaction bound = current.get();
    current.remove();
    return bound == null ? List.of() : bound.afterCommit;
  }

  private BoundTransaction active() {
    BoundTransaction bound = current.get();
    if (bound == null) {
      throw new IllegalStateException("No active transaction");
    }
    return bound;
  }

  private static final class BoundTransaction {
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();

    private BoundTransaction(Connection connection) {
      this.connection = connection;
    }
  }
}
