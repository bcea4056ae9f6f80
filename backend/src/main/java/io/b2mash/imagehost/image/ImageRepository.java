package io.b2mash.imagehost.image;

import io.b2mash.imagehost.catalog.CatalogCursors;
import io.b2mash.imagehost.catalog.CatalogQuery;
import io.b2mash.imagehost.catalog.CatalogSql;
import io.b2mash.imagehost.exception.DuplicateCodeException;
import io.b2mash.imagehost.image.dto.UpdateImageRequest;
import io.b2mash.imagehost.multitenancy.StoreTables;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;

@Repository
public class ImageRepository {

  private static final String COLUMNS =
      "id, product_id, name, code, file_path, url, created_at, updated_at";

  private final JdbcClient jdbc;
  private final CatalogCursors cursors;

  public ImageRepository(JdbcClient jdbc, CatalogCursors cursors) {
    this.jdbc = jdbc;
    this.cursors = cursors;
  }

  /**
   * Inserts an image whose code has already been reserved. The unique constraint on {@code code}
   * still has the last word; a violation of it surfaces as {@link DuplicateCodeException}.
   */
  public Image insert(
      StoreTables tables, long productId, String name, String code, String filePath, String url) {
    var now = CatalogSql.now();
    var keyHolder = new GeneratedKeyHolder();
    try {
      jdbc.sql(
              "INSERT INTO "
                  + tables.images()
                  + " (product_id, name, code, file_path, url, created_at, updated_at)"
                  + " VALUES (?, ?, ?, ?, ?, ?, ?)")
          .params(productId, name, code, filePath, url, now, now)
          .update(keyHolder, "id");
    } catch (DuplicateKeyException e) {
      throw new DuplicateCodeException(tables.storeId(), code, e);
    }
    return findById(tables, CatalogSql.generatedId(keyHolder)).orElseThrow();
  }

  public Optional<Image> findById(StoreTables tables, long id) {
    return jdbc.sql("SELECT " + COLUMNS + " FROM " + tables.images() + " WHERE id = ?")
        .param(id)
        .query(ImageRepository::mapRow)
        .optional();
  }

  public Optional<Image> findByCode(StoreTables tables, String code) {
    return jdbc.sql("SELECT " + COLUMNS + " FROM " + tables.images() + " WHERE code = ?")
        .param(code)
        .query(ImageRepository::mapRow)
        .optional();
  }

  public List<Image> findAll(StoreTables tables) {
    return jdbc.sql("SELECT " + COLUMNS + " FROM " + tables.images() + " ORDER BY id")
        .query(ImageRepository::mapRow)
        .list();
  }

  public List<Image> findByProductId(StoreTables tables, long productId) {
    return jdbc.sql(
            "SELECT " + COLUMNS + " FROM " + tables.images() + " WHERE product_id = ? ORDER BY id")
        .param(productId)
        .query(ImageRepository::mapRow)
        .list();
  }

  /** Streamed from a cursor; the caller must close the stream to release the connection. */
  public Stream<Image> search(StoreTables tables, Long productId, CatalogQuery query) {
    var sql =
        new StringBuilder("SELECT ")
            .append(COLUMNS)
            .append(" FROM ")
            .append(tables.images())
            .append(" WHERE 1 = 1");
    var params = new ArrayList<Object>();
    if (productId != null) {
      sql.append(" AND product_id = ?");
      params.add(productId);
    }
    CatalogSql.appendNameFilter(sql, params, query);
    sql.append(CatalogSql.orderBy(query));
    return cursors.stream(sql.toString(), params, ImageRepository::mapRow);
  }

  /** Whether {@code code} is used by any image other than {@code exceptId}. */
  public boolean codeExists(StoreTables tables, String code, Long exceptId) {
    if (exceptId == null) {
      return jdbc.sql("SELECT COUNT(*) FROM " + tables.images() + " WHERE code = ?")
              .param(code)
              .query(Long.class)
              .single()
          > 0;
    }
    return jdbc.sql("SELECT COUNT(*) FROM " + tables.images() + " WHERE code = ? AND id <> ?")
            .params(code, exceptId)
            .query(Long.class)
            .single()
        > 0;
  }

  public Optional<ImageLocation> findLocationByCode(StoreTables tables, String code) {
    return jdbc.sql(
            "SELECT i.id, i.product_id, i.name, i.code, i.file_path, i.url, i.created_at,"
                + " i.updated_at, p.name AS product_name, c.name AS category_name FROM "
                + tables.images()
                + " i JOIN "
                + tables.products()
                + " p ON p.id = i.product_id JOIN "
                + tables.categories()
                + " c ON c.id = p.category_id WHERE i.code = ?")
        .param(code)
        .query(
            (rs, rowNum) ->
                new ImageLocation(
                    mapRow(rs, rowNum),
                    rs.getString("product_name"),
                    rs.getString("category_name")))
        .optional();
  }

  public int update(StoreTables tables, long id, UpdateImageRequest request) {
    return jdbc.sql(
            "UPDATE "
                + tables.images()
                + " SET product_id = ?, name = ?, file_path = ?, url = ?, updated_at = ?"
                + " WHERE id = ?")
        .params(
            request.productId(),
            request.name(),
            request.filePath(),
            request.url(),
            CatalogSql.now(),
            id)
        .update();
  }

  public int updateCode(StoreTables tables, long id, String code) {
    try {
      return jdbc.sql(
              "UPDATE " + tables.images() + " SET code = ?, updated_at = ? WHERE id = ?")
          .params(code, CatalogSql.now(), id)
          .update();
    } catch (DuplicateKeyException e) {
      throw new DuplicateCodeException(tables.storeId(), code, e);
    }
  }

  public int delete(StoreTables tables, long id) {
    return jdbc.sql("DELETE FROM " + tables.images() + " WHERE id = ?").param(id).update();
  }

  public int deleteByProductId(StoreTables tables, long productId) {
    return jdbc.sql("DELETE FROM " + tables.images() + " WHERE product_id = ?")
        .param(productId)
        .update();
  }

  private static Image mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Image(
        rs.getLong("id"),
        rs.getLong("product_id"),
        rs.getString("name"),
        rs.getString("code"),
        rs.getString("file_path"),
        rs.getString("url"),
        CatalogSql.instant(rs, "created_at"),
        CatalogSql.instant(rs, "updated_at"));
  }
}
