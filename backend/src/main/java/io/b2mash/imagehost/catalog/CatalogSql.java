package io.b2mash.imagehost.catalog;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.jdbc.support.KeyHolder;

/** SQL fragments shared by the store table repositories. None of them carries data values. */
public final class CatalogSql {

  private CatalogSql() {}

  /** Appends a bound, case-insensitive name filter when the query has one. */
  public static void appendNameFilter(StringBuilder sql, List<Object> params, CatalogQuery query) {
    if (query.nameContains() != null) {
      sql.append(" AND LOWER(name) LIKE ? ESCAPE '\\'");
      params.add(likePattern(query.nameContains()));
    }
  }

  public static String likePattern(String fragment) {
    String escaped =
        fragment
            .toLowerCase(Locale.ROOT)
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
    return "%" + escaped + "%";
  }

  public static String orderBy(CatalogQuery query) {
    String direction = query.descending() ? " DESC" : " ASC";
    if (query.sort() == CatalogSort.INSERTION) {
      return " ORDER BY id" + direction;
    }
    return " ORDER BY " + query.sort().column() + direction + ", id" + direction;
  }

  /**
   * Reads the generated {@code id} after an insert. Drivers differ in what they hand back (only
   * the identity column, or the whole row) and in the case of the column label.
   */
  public static long generatedId(KeyHolder keyHolder) {
    Map<String, Object> keys = keyHolder.getKeys();
    if (keys != null) {
      for (var entry : keys.entrySet()) {
        if ("id".equalsIgnoreCase(entry.getKey()) && entry.getValue() instanceof Number id) {
          return id.longValue();
        }
      }
    }
    throw new IllegalStateException("Insert did not return a generated id");
  }

  public static Timestamp now() {
    return Timestamp.from(Instant.now());
  }

  public static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp value = rs.getTimestamp(column);
    return value != null ? value.toInstant() : null;
  }
}
