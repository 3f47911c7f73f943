package eventreactor.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link JdbcEventStore},
 * {@link JdbcTracker} and {@link JdbcTemplate}.
 */
public final class ReactorStoreException extends RuntimeException {
  public ReactorStoreException(String message) {
    super(message);
  }

  public ReactorStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
