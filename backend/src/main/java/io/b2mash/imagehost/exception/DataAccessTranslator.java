package io.b2mash.imagehost.exception;

import io.b2mash.imagehost.multitenancy.StoreId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.stereotype.Component;

/**
 * Maps Spring's engine-neutral {@link DataAccessException}s raised by store table SQL onto the
 * store error taxonomy. Messages name the store and the operation only; the statement text that
 * Spring embeds in its own messages is never copied into the translated exception or the logs.
 */
@Component
public class DataAccessTranslator {

  private static final Logger log = LoggerFactory.getLogger(DataAccessTranslator.class);

  public RuntimeException translate(StoreId storeId, String operation, DataAccessException ex) {
    if (ex instanceof DataIntegrityViolationException) {
      // DuplicateKeyException is a DataIntegrityViolationException as well
      log.warn(
          "Constraint violation in store {} during {}: {}",
          storeId.value(),
          operation,
          ex.getClass().getSimpleName());
      return new IntegrityViolationException(
          "Constraint violation",
          "Operation " + operation + " violated a constraint in store " + storeId.value(),
          ex);
    }
    if (ex instanceof BadSqlGrammarException) {
      log.error(
          "Store {} tables are not usable during {}: {}",
          storeId.value(),
          operation,
          ex.getMostSpecificCause().getMessage());
      return new ProvisioningException(
          "Tables of store " + storeId.value() + " are missing or malformed", ex);
    }
    log.error(
        "Data access failure in store {} during {}: {}",
        storeId.value(),
        operation,
        ex.getMostSpecificCause().getMessage());
    return ex;
  }
}
