package io.b2mash.imagehost.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.imagehost.config.StoreTablesProperties;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessException;

@ExtendWith(MockitoExtension.class)
class CatalogCursorsTest {

  @Mock private DataSource dataSource;
  @Mock private Connection connection;
  @Mock private PreparedStatement statement;
  @Mock private ResultSet resultSet;

  private CatalogCursors cursors;

  @BeforeEach
  void setUp() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    cursors =
        new CatalogCursors(
            dataSource, new StoreTablesProperties(true, Duration.ofSeconds(30), 1000, 2));
  }

  @Test
  void stream_readsInBatchesInsideReadOnlyTransaction() throws SQLException {
    when(connection.prepareStatement(anyString())).thenReturn(statement);
    when(statement.executeQuery()).thenReturn(resultSet);
    when(resultSet.next()).thenReturn(true, true, false);

    try (var rows = cursors.stream("SELECT name FROM t", List.of(), (rs, n) -> "row" + n)) {
      assertThat(rows).containsExactly("row0", "row1");
      verify(connection, never()).close();
    }

    var order = inOrder(connection, statement);
    order.verify(connection).setAutoCommit(false);
    order.verify(connection).setReadOnly(true);
    order.verify(statement).setFetchSize(2);
    order.verify(connection).rollback();
    order.verify(connection).close();
  }

  @Test
  void stream_failingQueryReleasesConnection() throws SQLException {
    when(connection.prepareStatement(anyString()))
        .thenThrow(new SQLException("relation does not exist", "42P01"));

    assertThatThrownBy(() -> cursors.stream("SELECT name FROM t", List.of(), (rs, n) -> "row"))
        .isInstanceOf(DataAccessException.class);

    verify(connection).rollback();
    verify(connection).close();
  }
}
