package io.b2mash.imagehost.provisioning;

import io.b2mash.imagehost.config.StoreTablesProperties;
import io.b2mash.imagehost.exception.ProvisioningException;
import io.b2mash.imagehost.multitenancy.StoreId;
import io.b2mash.imagehost.multitenancy.StoreTables;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Creates and drops the three tables of a store. Table and constraint names come from {@link
 * StoreTables}; no other input reaches the DDL text.
 *
 * <p>Provisioning runs in one transaction. Engines with transactional DDL roll a failed attempt
 * back on their own; for engines that commit DDL implicitly, the tables this attempt created are
 * dropped again before the error is rethrown. Tables created by anyone else are never touched, and
 * an attempt that lost a race against a concurrent call for the same store reports the store as
 * already provisioned.
 */
@Component
public class StoreTableProvisioner {

  private static final Logger log = LoggerFactory.getLogger(StoreTableProvisioner.class);

  private final JdbcTemplate jdbcTemplate;
  private final StoreTableInspector inspector;
  private final TransactionTemplate transactionTemplate;
  private final StoreTablesProperties properties;

  public StoreTableProvisioner(
      JdbcTemplate jdbcTemplate,
      StoreTableInspector inspector,
      @Qualifier("storeTransactionTemplate") TransactionTemplate transactionTemplate,
      StoreTablesProperties properties) {
    this.jdbcTemplate = jdbcTemplate;
    this.inspector = inspector;
    this.transactionTemplate = transactionTemplate;
    this.properties = properties;
  }

  public ProvisioningResult provision(StoreId storeId) {
    var tables = StoreTables.of(storeId);
    Set<String> existingBefore;
    try {
      existingBefore = inspector.existingTables(tables);
    } catch (RuntimeException e) {
      throw new ProvisioningException("Could not inspect tables of store " + storeId.value(), e);
    }
    if (existingBefore.size() == tables.creationOrder().size()) {
      log.info("Tables of store {} already provisioned", storeId.value());
      return ProvisioningResult.alreadyProvisioned(storeId);
    }

    log.info(
        "Provisioning tables of store {} (declarative cascade: {})",
        storeId.value(),
        properties.declarativeCascade());
    // tables this attempt created itself, in creation order
    var created = new ArrayList<String>();
    try {
      transactionTemplate.executeWithoutResult(
          status -> {
            var present = inspector.existingTables(tables);
            for (var table : createTableStatements(tables).entrySet()) {
              if (!present.contains(table.getKey())) {
                jdbcTemplate.execute(table.getValue());
                created.add(table.getKey());
              }
            }
            for (String statement : createIndexStatements(tables)) {
              jdbcTemplate.execute(statement);
            }
          });
    } catch (RuntimeException e) {
      log.error(
          "Failed to provision tables of store {}: {}",
          storeId.value(),
          NestedExceptionUtils.getMostSpecificCause(e).getMessage());
      var failure = new ProvisioningException("Provisioning failed for store " + storeId.value(), e);
      if (completedConcurrently(tables, created, failure)) {
        log.warn("Tables of store {} were provisioned by a concurrent call", storeId.value());
        return ProvisioningResult.alreadyProvisioned(storeId);
      }
      dropTablesCreatedBy(created, failure);
      throw failure;
    }

    log.info("Provisioned tables of store {}", storeId.value());
    return ProvisioningResult.created(storeId);
  }

  /**
   * Drops the store's tables, children first. Refuses when a table outside the store's own set
   * holds a foreign key into it; nothing is dropped in that case.
   */
  public void deprovision(StoreId storeId) {
    var tables = StoreTables.of(storeId);
    try {
      transactionTemplate.executeWithoutResult(
          status -> {
            var references = inspector.externalReferences(tables);
            if (!references.isEmpty()) {
              throw new ProvisioningException(
                  "Tables of store "
                      + storeId.value()
                      + " are referenced from outside the store: "
                      + references);
            }
            for (String statement : dropStatements(tables)) {
              jdbcTemplate.execute(statement);
            }
          });
    } catch (ProvisioningException e) {
      log.error("Refusing to drop tables of store {}: {}", storeId.value(), e.getBody().getDetail());
      throw e;
    } catch (RuntimeException e) {
      log.error(
          "Failed to drop tables of store {}: {}",
          storeId.value(),
          NestedExceptionUtils.getMostSpecificCause(e).getMessage());
      throw new ProvisioningException("Deprovisioning failed for store " + storeId.value(), e);
    }
    log.info("Dropped tables of store {}", storeId.value());
  }

  /** Table DDL followed by index DDL. */
  List<String> createStatements(StoreTables tables) {
    var statements = new ArrayList<String>(createTableStatements(tables).values());
    statements.addAll(createIndexStatements(tables));
    return statements;
  }

  /** {@code CREATE TABLE} per table name, parents first. */
  Map<String, String> createTableStatements(StoreTables tables) {
    String categories = tables.categories();
    String products = tables.products();
    String images = tables.images();
    String onDelete = properties.declarativeCascade() ? " ON DELETE CASCADE" : "";

    var statements = new LinkedHashMap<String, String>();
    statements.put(
        categories,
        "CREATE TABLE IF NOT EXISTS "
            + categories
            + " ("
            + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
            + " name VARCHAR(200) NOT NULL,"
            + " created_at TIMESTAMP WITH TIME ZONE NOT NULL,"
            + " updated_at TIMESTAMP WITH TIME ZONE NOT NULL"
            + ")");
    statements.put(
        products,
        "CREATE TABLE IF NOT EXISTS "
            + products
            + " ("
            + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
            + " category_id BIGINT NOT NULL,"
            + " name VARCHAR(200) NOT NULL,"
            + " marked_price NUMERIC(10, 2),"
            + " min_discounted_price NUMERIC(10, 2),"
            + " description VARCHAR(2000),"
            + " created_at TIMESTAMP WITH TIME ZONE NOT NULL,"
            + " updated_at TIMESTAMP WITH TIME ZONE NOT NULL,"
            + " CONSTRAINT "
            + tables.objectName(products, "_category_fk")
            + " FOREIGN KEY (category_id) REFERENCES "
            + categories
            + " (id)"
            + onDelete
            + ")");
    statements.put(
        images,
        "CREATE TABLE IF NOT EXISTS "
            + images
            + " ("
            + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
            + " product_id BIGINT NOT NULL,"
            + " name VARCHAR(200) NOT NULL,"
            + " code VARCHAR(200) NOT NULL,"
            + " file_path VARCHAR(500),"
            + " url VARCHAR(500),"
            + " created_at TIMESTAMP WITH TIME ZONE NOT NULL,"
            + " updated_at TIMESTAMP WITH TIME ZONE NOT NULL,"
            + " CONSTRAINT "
            + tables.objectName(images, "_code_key")
            + " UNIQUE (code),"
            + " CONSTRAINT "
            + tables.objectName(images, "_product_fk")
            + " FOREIGN KEY (product_id) REFERENCES "
            + products
            + " (id)"
            + onDelete
            + ")");
    return statements;
  }

  List<String> createIndexStatements(StoreTables tables) {
    return List.of(
        createIndex(tables, tables.categories(), "_name_idx", "name"),
        createIndex(tables, tables.products(), "_category_idx", "category_id"),
        createIndex(tables, tables.products(), "_name_idx", "name"),
        createIndex(tables, tables.images(), "_product_idx", "product_id"));
  }

  List<String> dropStatements(StoreTables tables) {
    return tables.dropOrder().stream().map(table -> "DROP TABLE IF EXISTS " + table).toList();
  }

  private static String createIndex(
      StoreTables tables, String table, String suffix, String column) {
    return "CREATE INDEX IF NOT EXISTS "
        + tables.objectName(table, suffix)
        + " ON "
        + table
        + " ("
        + column
        + ")";
  }

  /**
   * After a failed attempt, checks whether another caller has meanwhile provisioned the complete
   * set. That only counts when none of the tables is this attempt's own leftover, which can only
   * happen on engines where DDL commits.
   */
  private boolean completedConcurrently(
      StoreTables tables, List<String> created, ProvisioningException failure) {
    try {
      if (inspector.existingTables(tables).size() != tables.creationOrder().size()) {
        return false;
      }
      return created.isEmpty() || !inspector.ddlCommitsTransaction();
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
      return false;
    }
  }

  /**
   * Drops the tables this attempt created, children first. Only needed where DDL commits on its
   * own; with transactional DDL the rollback already removed them, and a table of that name now
   * belongs to someone else.
   */
  private void dropTablesCreatedBy(List<String> created, ProvisioningException failure) {
    if (created.isEmpty()) {
      return;
    }
    try {
      if (!inspector.ddlCommitsTransaction()) {
        return;
      }
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
      return;
    }
    for (int i = created.size() - 1; i >= 0; i--) {
      String table = created.get(i);
      try {
        jdbcTemplate.execute("DROP TABLE IF EXISTS " + table);
        log.warn("Dropped partially provisioned table {}", table);
      } catch (RuntimeException e) {
        failure.addSuppressed(e);
      }
    }
  }
}
