package io.b2mash.imagehost.multitenancy;

import io.b2mash.imagehost.exception.ResourceNotFoundException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/**
 * The global {@code stores} table (Flyway-managed, see {@code db/migration/global}). A row here is
 * what makes a store visible to catalog operations.
 */
@Repository
public class StoreRegistryRepository {

  private final JdbcClient jdbc;

  public StoreRegistryRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  /**
   * Returns {@code false} when the store was already registered. Two concurrent callers can both
   * pass the check; the loser gets a {@link org.springframework.dao.DuplicateKeyException}.
   */
  public boolean insertIfAbsent(StoreId storeId, String name) {
    if (exists(storeId)) {
      return false;
    }
    var now = Timestamp.from(Instant.now());
    jdbc.sql(
            """
            INSERT INTO stores (store_key, name, created_at, updated_at)
            VALUES (?, ?, ?, ?)
            """)
        .params(storeId.value(), name, now, now)
        .update();
    return true;
  }

  public Optional<Store> findById(StoreId storeId) {
    return jdbc.sql(
            "SELECT store_key, name, created_at, updated_at FROM stores WHERE store_key = ?")
        .param(storeId.value())
        .query(StoreRegistryRepository::mapRow)
        .optional();
  }

  public List<Store> findAll() {
    return jdbc.sql(
            "SELECT store_key, name, created_at, updated_at FROM stores ORDER BY created_at,"
                + " store_key")
        .query(StoreRegistryRepository::mapRow)
        .list();
  }

  public boolean exists(StoreId storeId) {
    return jdbc.sql("SELECT COUNT(*) FROM stores WHERE store_key = ?")
            .param(storeId.value())
            .query(Long.class)
            .single()
        > 0;
  }

  public void requireRegistered(StoreId storeId) {
    if (!exists(storeId)) {
      throw new ResourceNotFoundException("Store", storeId.value());
    }
  }

  /**
   * Takes a row lock on the store's registry entry until the surrounding transaction ends. Used
   * to serialize image code reservations of one store inside the database engine.
   */
  public void lockForUpdate(StoreId storeId) {
    var locked =
        jdbc.sql("SELECT store_key FROM stores WHERE store_key = ? FOR UPDATE")
            .param(storeId.value())
            .query(String.class)
            .optional();
    if (locked.isEmpty()) {
      throw new ResourceNotFoundException("Store", storeId.value());
    }
  }

  public int rename(StoreId storeId, String name) {
    return jdbc.sql("UPDATE stores SET name = ?, updated_at = ? WHERE store_key = ?")
        .params(name, Timestamp.from(Instant.now()), storeId.value())
        .update();
  }

  public int delete(StoreId storeId) {
    return jdbc.sql("DELETE FROM stores WHERE store_key = ?").param(storeId.value()).update();
  }

  private static Store mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Store(
        StoreId.of(rs.getString("store_key")),
        rs.getString("name"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }
}
