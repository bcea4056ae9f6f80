package io.b2mash.imagehost.provisioning;

import io.b2mash.imagehost.multitenancy.StoreTables;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Reads the database catalog through {@link DatabaseMetaData} on the connection of the current
 * transaction, so it sees tables created earlier in that transaction.
 */
@Component
public class StoreTableInspector {

  private final JdbcTemplate jdbcTemplate;

  public StoreTableInspector(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  /** The subset of the store's tables that currently exist, in creation order. */
  public Set<String> existingTables(StoreTables tables) {
    return jdbcTemplate.execute(
        (ConnectionCallback<Set<String>>)
            con -> {
              var existing = new LinkedHashSet<String>();
              for (String table : tables.creationOrder()) {
                if (tableExists(con, table)) {
                  existing.add(table);
                }
              }
              return existing;
            });
  }

  /**
   * Foreign keys declared by tables outside the store's own set that point into it. A store with
   * such references cannot be dropped without breaking another table.
   */
  public List<ForeignReference> externalReferences(StoreTables tables) {
    return jdbcTemplate.execute(
        (ConnectionCallback<List<ForeignReference>>)
            con -> {
              var meta = con.getMetaData();
              var references = new ArrayList<ForeignReference>();
              for (String table : tables.creationOrder()) {
                if (!tableExists(con, table)) {
                  continue;
                }
                try (var rs =
                    meta.getExportedKeys(con.getCatalog(), con.getSchema(), storedCase(meta, table))) {
                  while (rs.next()) {
                    String referencing = rs.getString("FKTABLE_NAME");
                    if (!tables.contains(referencing)) {
                      references.add(
                          new ForeignReference(
                              referencing.toLowerCase(Locale.ROOT),
                              rs.getString("FK_NAME"),
                              table));
                    }
                  }
                }
              }
              return references;
            });
  }

  /**
   * Whether DDL commits the surrounding transaction on this engine. Where it does, a rolled back
   * provisioning attempt leaves its tables behind and they have to be dropped explicitly.
   */
  public boolean ddlCommitsTransaction() {
    Boolean commits =
        jdbcTemplate.execute(
            (ConnectionCallback<Boolean>)
                con -> {
                  var meta = con.getMetaData();
                  return meta.dataDefinitionCausesTransactionCommit()
                      || !meta.supportsDataDefinitionAndDataManipulationTransactions();
                });
    return Boolean.TRUE.equals(commits);
  }

  private boolean tableExists(Connection con, String table) throws SQLException {
    var meta = con.getMetaData();
    String pattern = escapeLikePattern(meta, storedCase(meta, table));
    try (var rs = meta.getTables(con.getCatalog(), con.getSchema(), pattern, null)) {
      while (rs.next()) {
        String type = rs.getString("TABLE_TYPE");
        if (("TABLE".equals(type) || "BASE TABLE".equals(type))
            && table.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
          return true;
        }
      }
    }
    return false;
  }

  private static String storedCase(DatabaseMetaData meta, String identifier) throws SQLException {
    if (meta.storesUpperCaseIdentifiers()) {
      return identifier.toUpperCase(Locale.ROOT);
    }
    if (meta.storesLowerCaseIdentifiers()) {
      return identifier.toLowerCase(Locale.ROOT);
    }
    return identifier;
  }

  // '_' is a single-character wildcard in catalog patterns and store tables are full of them
  private static String escapeLikePattern(DatabaseMetaData meta, String name) throws SQLException {
    String escape = meta.getSearchStringEscape();
    if (escape == null || escape.isEmpty()) {
      return name;
    }
    return name.replace(escape, escape + escape)
        .replace("_", escape + "_")
        .replace("%", escape + "%");
  }

  /** A foreign key {@code constraintName} on {@code referencingTable} targeting {@code target}. */
  public record ForeignReference(String referencingTable, String constraintName, String target) {}
}
