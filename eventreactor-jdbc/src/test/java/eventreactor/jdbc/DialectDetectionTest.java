package eventreactor.jdbc;

import eventreactor.jdbc.dialect.H2Dialect;
import eventreactor.jdbc.dialect.MySqlDialect;
import eventreactor.jdbc.dialect.PostgresDialect;
import eventreactor.jdbc.spi.ConnectionProvider;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DialectDetectionTest {

  private JdbcDataSource dataSource;

  @BeforeEach
  void setUp() {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
  }

  @Test
  void buildersDetectDialectFromDataSource() {
    assertInstanceOf(H2Dialect.class, JdbcEventStore.builder().dataSource(dataSource).build().dialect());
    assertInstanceOf(H2Dialect.class, JdbcEventStore.dialectFor(dataSource::getConnection));
  }

  @Test
  void customConnectionProvidersAreDetectedToo() {
    ConnectionProvider provider = () -> dataSource.getConnection();

    assertInstanceOf(H2Dialect.class, JdbcEventStore.builder().connectionProvider(provider).build().dialect());
  }

  @Test
  void explicitDialectSkipsDetection() {
    MySqlDialect mysql = new MySqlDialect();
    ConnectionProvider unreachable = () -> {
      throw new SQLException("connection refused");
    };

    assertSame(mysql, JdbcEventStore.builder().connectionProvider(unreachable).dialect(mysql).build().dialect());
  }

  @Test
  void unreachableDatabaseFailsDetection() {
    ConnectionProvider unreachable = () -> {
      throw new SQLException("connection refused");
    };

    assertThrows(ReactorStoreException.class,
        () -> JdbcTracker.builder().connectionProvider(unreachable).build());
  }

  @Test
  void registeredDialectsAreMatchedByUrlPrefix() {
    assertInstanceOf(PostgresDialect.class,
        JdbcEventStore.dialectFor(connectionsTo("jdbc:postgresql://localhost/events")));
    assertInstanceOf(MySqlDialect.class,
        JdbcEventStore.dialectFor(connectionsTo("jdbc:mariadb://localhost/events")));
  }

  @Test
  void unknownDatabaseIsRejected() {
    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> JdbcEventStore.dialectFor(connectionsTo("jdbc:oracle:thin:@localhost")));

    assertTrue(ex.getMessage().contains("jdbc:oracle:thin:@localhost"), ex.getMessage());
    assertTrue(ex.getMessage().contains("jdbc:h2:"), ex.getMessage());
  }

  /** Connections that only answer {@code getMetaData().getURL()}. */
  private static ConnectionProvider connectionsTo(String url) {
    ClassLoader loader = DialectDetectionTest.class.getClassLoader();
    DatabaseMetaData metaData = (DatabaseMetaData) Proxy.newProxyInstance(loader,
        new Class<?>[] {DatabaseMetaData.class},
        (proxy, method, args) -> "getURL".equals(method.getName()) ? url : null);
    Connection connection = (Connection) Proxy.newProxyInstance(loader,
        new Class<?>[] {Connection.class},
        (proxy, method, args) -> "getMetaData".equals(method.getName()) ? metaData : null);
    return () -> connection;
  }
}
