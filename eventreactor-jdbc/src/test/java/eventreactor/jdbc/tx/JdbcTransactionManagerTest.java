package eventreactor.jdbc.tx;

import eventreactor.jdbc.ReactorStoreException;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcTransactionManagerTest {

  private JdbcDataSource dataSource;
  private ThreadLocalTxContext txContext;
  private JdbcTransactionManager txManager;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("CREATE TABLE items (id INT PRIMARY KEY)");
    }
    txContext = new ThreadLocalTxContext();
    txManager = new JdbcTransactionManager(dataSource::getConnection, txContext);
  }

  @Test
  void noTransactionIsActiveByDefault() {
    assertFalse(txContext.isTransactionActive());
    assertThrows(IllegalStateException.class, () -> txContext.currentConnection());
  }

  @Test
  void commitPersistsAndUnbinds() throws SQLException {
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      assertTrue(txContext.isTransactionActive());
      insert(txContext.currentConnection(), 1);
      tx.commit();
    }

    assertFalse(txContext.isTransactionActive());
    assertEquals(1, count());
  }

  @Test
  void closeWithoutCommitRollsBack() throws SQLException {
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      insert(txContext.currentConnection(), 1);
    }

    assertFalse(txContext.isTransactionActive());
    assertEquals(0, count());
  }

  @Test
  void afterCommitCallbacksRunOnceCommitted() throws SQLException {
    List<Integer> seenCounts = new ArrayList<>();
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      insert(txContext.currentConnection(), 1);
      txContext.afterCommit(() -> seenCounts.add(countQuietly()));
      assertTrue(seenCounts.isEmpty());
      tx.commit();
    }

    assertEquals(List.of(1), seenCounts);
  }

  @Test
  void afterCommitCallbacksAreDiscardedOnRollback() throws SQLException {
    List<String> ran = new ArrayList<>();
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      txContext.afterCommit(() -> ran.add("notify"));
    }
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      tx.commit();
    }

    assertTrue(ran.isEmpty());
  }

  @Test
  void failingCallbackDoesNotStopTheOthers() throws SQLException {
    List<String> ran = new ArrayList<>();
    JdbcTransactionManager.Transaction tx = txManager.begin();
    txContext.afterCommit(() -> {
      throw new IllegalStateException("first");
    });
    txContext.afterCommit(() -> ran.add("second"));

    IllegalStateException ex = assertThrows(IllegalStateException.class, tx::commit);

    assertEquals("first", ex.getMessage());
    assertEquals(List.of("second"), ran);
    assertFalse(txContext.isTransactionActive());
  }

  @Test
  void afterCommitRequiresActiveTransaction() {
    assertThrows(IllegalStateException.class, () -> txContext.afterCommit(() -> { }));
  }

  @Test
  void transactionRunnerCommitsOrRollsBack() throws SQLException {
    txManager.transactionRunner().accept(() -> insertQuietly(1));
    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> txManager.transactionRunner().accept(() -> {
          insertQuietly(2);
          throw new IllegalStateException("handler failed");
        }));

    assertEquals("handler failed", ex.getMessage());
    assertEquals(1, count());
    assertFalse(txContext.isTransactionActive());
  }

  @Test
  void transactionRunnerWrapsConnectionFailures() {
    JdbcTransactionManager unreachable = new JdbcTransactionManager(() -> {
      throw new SQLException("connection refused");
    }, txContext);

    assertThrows(ReactorStoreException.class, () -> unreachable.transactionRunner().accept(() -> { }));
  }

  @Test
  void nestedBeginIsRejected() throws SQLException {
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      assertThrows(IllegalStateException.class, () -> txManager.begin());
      tx.rollback();
    }
  }

  private static void insert(Connection conn, int id) throws SQLException {
    try (Statement stmt = conn.createStatement()) {
      stmt.execute("INSERT INTO items (id) VALUES (" + id + ")");
    }
  }

  private void insertQuietly(int id) {
    try {
      insert(txContext.currentConnection(), id);
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }

  private int countQuietly() {
    try {
      return count();
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }

  private int count() throws SQLException {
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM items")) {
      rs.next();
      return rs.getInt(1);
    }
  }
}
