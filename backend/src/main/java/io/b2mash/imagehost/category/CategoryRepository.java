package io.b2mash.imagehost.category;

import io.b2mash.imagehost.catalog.CatalogCursors;
import io.b2mash.imagehost.catalog.CatalogQuery;
import io.b2mash.imagehost.catalog.CatalogSql;
import io.b2mash.imagehost.multitenancy.StoreTables;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;

@Repository
public class CategoryRepository {

  private static final String COLUMNS = "id, name, created_at, updated_at";

  private final JdbcClient jdbc;
  private final CatalogCursors cursors;

  public CategoryRepository(JdbcClient jdbc, CatalogCursors cursors) {
    this.jdbc = jdbc;
    this.cursors = cursors;
  }

  public Category insert(StoreTables tables, String name) {
    var now = CatalogSql.now();
    var keyHolder = new GeneratedKeyHolder();
    jdbc.sql(
            "INSERT INTO "
                + tables.categories()
                + " (name, created_at, updated_at) VALUES (?, ?, ?)")
        .params(name, now, now)
        .update(keyHolder, "id");
    return findById(tables, CatalogSql.generatedId(keyHolder)).orElseThrow();
  }

  public Optional<Category> findById(StoreTables tables, long id) {
    return jdbc.sql("SELECT " + COLUMNS + " FROM " + tables.categories() + " WHERE id = ?")
        .param(id)
        .query(CategoryRepository::mapRow)
        .optional();
  }

  /** Locks the row until the surrounding transaction ends. */
  public Optional<Category> findByIdForUpdate(StoreTables tables, long id) {
    return jdbc.sql(
            "SELECT " + COLUMNS + " FROM " + tables.categories() + " WHERE id = ? FOR UPDATE")
        .param(id)
        .query(CategoryRepository::mapRow)
        .optional();
  }

  public List<Category> findAll(StoreTables tables) {
    return jdbc.sql("SELECT " + COLUMNS + " FROM " + tables.categories() + " ORDER BY id")
        .query(CategoryRepository::mapRow)
        .list();
  }

  /** Streamed from a cursor; the caller must close the stream to release the connection. */
  public Stream<Category> search(StoreTables tables, CatalogQuery query) {
    var sql =
        new StringBuilder("SELECT ")
            .append(COLUMNS)
            .append(" FROM ")
            .append(tables.categories())
            .append(" WHERE 1 = 1");
    var params = new ArrayList<Object>();
    CatalogSql.appendNameFilter(sql, params, query);
    sql.append(CatalogSql.orderBy(query));
    return cursors.stream(sql.toString(), params, CategoryRepository::mapRow);
  }

  public int rename(StoreTables tables, long id, String name) {
    return jdbc.sql(
            "UPDATE " + tables.categories() + " SET name = ?, updated_at = ? WHERE id = ?")
        .params(name, CatalogSql.now(), id)
        .update();
  }

  public int delete(StoreTables tables, long id) {
    return jdbc.sql("DELETE FROM " + tables.categories() + " WHERE id = ?").param(id).update();
  }

  private static Category mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Category(
        rs.getLong("id"),
        rs.getString("name"),
        CatalogSql.instant(rs, "created_at"),
        CatalogSql.instant(rs, "updated_at"));
  }
}
