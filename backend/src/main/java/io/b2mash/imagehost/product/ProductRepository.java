package io.b2mash.imagehost.product;

import io.b2mash.imagehost.catalog.CatalogCursors;
import io.b2mash.imagehost.catalog.CatalogQuery;
import io.b2mash.imagehost.catalog.CatalogSql;
import io.b2mash.imagehost.multitenancy.StoreTables;
import io.b2mash.imagehost.product.dto.ProductRequest;
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
public class ProductRepository {

  private static final String COLUMNS =
      "id, category_id, name, marked_price, min_discounted_price, description, created_at,"
          + " updated_at";

  private final JdbcClient jdbc;
  private final CatalogCursors cursors;

  public ProductRepository(JdbcClient jdbc, CatalogCursors cursors) {
    this.jdbc = jdbc;
    this.cursors = cursors;
  }

  public Product insert(StoreTables tables, ProductRequest request) {
    var now = CatalogSql.now();
    var keyHolder = new GeneratedKeyHolder();
    jdbc.sql(
            "INSERT INTO "
                + tables.products()
                + " (category_id, name, marked_price, min_discounted_price, description,"
                + " created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?)")
        .params(
            request.categoryId(),
            request.name(),
            request.markedPrice(),
            request.minDiscountedPrice(),
            request.description(),
            now,
            now)
        .update(keyHolder, "id");
    return findById(tables, CatalogSql.generatedId(keyHolder)).orElseThrow();
  }

  public Optional<Product> findById(StoreTables tables, long id) {
    return jdbc.sql("SELECT " + COLUMNS + " FROM " + tables.products() + " WHERE id = ?")
        .param(id)
        .query(ProductRepository::mapRow)
        .optional();
  }

  public List<Product> findAll(StoreTables tables) {
    return jdbc.sql("SELECT " + COLUMNS + " FROM " + tables.products() + " ORDER BY id")
        .query(ProductRepository::mapRow)
        .list();
  }

  public List<Product> findByCategoryId(StoreTables tables, long categoryId) {
    return jdbc.sql(
            "SELECT "
                + COLUMNS
                + " FROM "
                + tables.products()
                + " WHERE category_id = ? ORDER BY id")
        .param(categoryId)
        .query(ProductRepository::mapRow)
        .list();
  }

  public List<Long> findIdsByCategoryId(StoreTables tables, long categoryId) {
    return jdbc.sql("SELECT id FROM " + tables.products() + " WHERE category_id = ? ORDER BY id")
        .param(categoryId)
        .query(Long.class)
        .list();
  }

  /** Streamed from a cursor; the caller must close the stream to release the connection. */
  public Stream<Product> search(StoreTables tables, Long categoryId, CatalogQuery query) {
    var sql =
        new StringBuilder("SELECT ")
            .append(COLUMNS)
            .append(" FROM ")
            .append(tables.products())
            .append(" WHERE 1 = 1");
    var params = new ArrayList<Object>();
    if (categoryId != null) {
      sql.append(" AND category_id = ?");
      params.add(categoryId);
    }
    CatalogSql.appendNameFilter(sql, params, query);
    sql.append(CatalogSql.orderBy(query));
    return cursors.stream(sql.toString(), params, ProductRepository::mapRow);
  }

  public int update(StoreTables tables, long id, ProductRequest request) {
    return jdbc.sql(
            "UPDATE "
                + tables.products()
                + " SET category_id = ?, name = ?, marked_price = ?, min_discounted_price = ?,"
                + " description = ?, updated_at = ? WHERE id = ?")
        .params(
            request.categoryId(),
            request.name(),
            request.markedPrice(),
            request.minDiscountedPrice(),
            request.description(),
            CatalogSql.now(),
            id)
        .update();
  }

  public int delete(StoreTables tables, long id) {
    return jdbc.sql("DELETE FROM " + tables.products() + " WHERE id = ?").param(id).update();
  }

  public int deleteByCategoryId(StoreTables tables, long categoryId) {
    return jdbc.sql("DELETE FROM " + tables.products() + " WHERE category_id = ?")
        .param(categoryId)
        .update();
  }

  private static Product mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Product(
        rs.getLong("id"),
        rs.getLong("category_id"),
        rs.getString("name"),
        rs.getBigDecimal("marked_price"),
        rs.getBigDecimal("min_discounted_price"),
        rs.getString("description"),
        CatalogSql.instant(rs, "created_at"),
        CatalogSql.instant(rs, "updated_at"));
  }
}
