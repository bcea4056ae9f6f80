package io.b2mash.imagehost.catalog;

import io.b2mash.imagehost.config.StoreTablesProperties;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Stream;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.stereotype.Component;

/**
 * Runs search queries as database cursors. Each stream owns a pooled connection in a read-only
 * transaction with a bounded fetch size, so rows are fetched in batches while the stream is
 * consumed instead of being loaded up front. Closing the stream ends the transaction and returns
 * the connection.
 */
@Component
public class CatalogCursors {

  private static final Logger log = LoggerFactory.getLogger(CatalogCursors.class);

  private final DataSource dataSource;
  private final int fetchSize;

  public CatalogCursors(DataSource dataSource, StoreTablesProperties properties) {
    this.dataSource = dataSource;
    this.fetchSize = Math.max(1, properties.searchFetchSize());
  }

  public <T> Stream<T> stream(String sql, List<Object> params, RowMapper<T> rowMapper) {
    Connection con;
    try {
      con = dataSource.getConnection();
    } catch (SQLException e) {
      throw new CannotGetJdbcConnectionException("Failed to obtain JDBC Connection", e);
    }
    try {
      // drivers such as PostgreSQL only honour the fetch size outside auto-commit
      con.setAutoCommit(false);
      con.setReadOnly(true);
      var cursorTemplate = new JdbcTemplate(new SingleConnectionDataSource(con, true));
      cursorTemplate.setFetchSize(fetchSize);
      return cursorTemplate
          .queryForStream(sql, rowMapper, params.toArray())
          .onClose(() -> release(con));
    } catch (SQLException e) {
      release(con);
      throw new CannotGetJdbcConnectionException("Could not open a read-only cursor", e);
    } catch (RuntimeException e) {
      release(con);
      throw e;
    }
  }

  private static void release(Connection con) {
    try {
      con.rollback();
      con.setReadOnly(false);
      con.setAutoCommit(true);
    } catch (SQLException e) {
      log.warn("Could not reset search connection: {}", e.getMessage());
    } finally {
      JdbcUtils.closeConnection(con);
    }
  }
}
