package eventreactor.jdbc.spi;

import java.sql.Connection;

/**
 * Exposes the caller's current transaction so appends and tracker updates can join it.
 *
 * @see eventreactor.jdbc.tx.ThreadLocalTxContext
 */
public interface TxContext {

  /**
   * Returns {@code true} if a transaction is currently active on this thread.
   */
  boolean isTransactionActive();

  /**
   * Returns the JDBC connection bound to the current transaction.
   *
   * @throws IllegalStateException if no transaction is active
   */
  Connection currentConnection();

  /**
   * Registers a callback to run after the current transaction commits. Callbacks are
   * discarded if the transaction rolls back.
   *
   * @param callback the callback
   * @throws IllegalStateException if no transaction is active
   */
  void afterCommit(Runnable callback);
}
