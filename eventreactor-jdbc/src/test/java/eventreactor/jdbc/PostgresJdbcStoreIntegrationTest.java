package eventreactor.jdbc;

import org.junit.jupiter.api.BeforeAll;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class PostgresJdbcStoreIntegrationTest extends AbstractJdbcStoreTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("events_test");

  private static PGSimpleDataSource dataSource;

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = new PGSimpleDataSource();
    dataSource.setUrl(postgres.getJdbcUrl());
    dataSource.setUser(postgres.getUsername());
    dataSource.setPassword(postgres.getPassword());
    Schemas.apply(dataSource, "postgresql");
  }

  @Override
  void prepareDatabase() throws Exception {
    Schemas.truncate(dataSource);
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }
}
