package eventreactor.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.UUID;

class H2JdbcStoreTest extends AbstractJdbcStoreTest {
  private JdbcDataSource dataSource;

  @Override
  void prepareDatabase() throws SQLException {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:events_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    Schemas.apply(dataSource, "h2");
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }
}
