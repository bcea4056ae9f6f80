package io.b2mash.imagehost.multitenancy;

import io.b2mash.imagehost.exception.DataAccessTranslator;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs one store operation: resolves the store's tables from its validated id, checks that the
 * store is registered, and executes the work in a single transaction. Engine failures are
 * translated after the transaction has rolled back, so callers never observe a partial write.
 */
@Component
public class StoreScope {

  private static final Logger log = LoggerFactory.getLogger(StoreScope.class);

  private final StoreRegistryRepository registry;
  private final TransactionTemplate transactionTemplate;
  private final DataAccessTranslator translator;

  public StoreScope(
      StoreRegistryRepository registry,
      @Qualifier("storeTransactionTemplate") TransactionTemplate transactionTemplate,
      DataAccessTranslator translator) {
    this.registry = registry;
    this.transactionTemplate = transactionTemplate;
    this.translator = translator;
  }

  public <T> T inTransaction(StoreId storeId, String operation, Function<StoreTables, T> work) {
    return StoreLogContext.call(
        storeId,
        operation,
        () -> {
          log.debug("Starting {} in store {}", operation, storeId.value());
          try {
            return transactionTemplate.execute(
                status -> {
                  registry.requireRegistered(storeId);
                  return work.apply(StoreTables.of(storeId));
                });
          } catch (DataAccessException ex) {
            throw translator.translate(storeId, operation, ex);
          }
        });
  }

  /**
   * Resolves the tables of a registered store for work that manages its own connection, such as
   * streaming queries that must outlive a transaction callback.
   */
  public <T> T outsideTransaction(
      StoreId storeId, String operation, Function<StoreTables, T> work) {
    return StoreLogContext.call(
        storeId,
        operation,
        () -> {
          try {
            registry.requireRegistered(storeId);
            return work.apply(StoreTables.of(storeId));
          } catch (DataAccessException ex) {
            throw translator.translate(storeId, operation, ex);
          }
        });
  }
}
