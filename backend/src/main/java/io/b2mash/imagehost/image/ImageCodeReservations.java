package io.b2mash.imagehost.image;

import io.b2mash.imagehost.config.StoreTablesProperties;
import io.b2mash.imagehost.exception.DuplicateCodeException;
import io.b2mash.imagehost.multitenancy.StoreRegistryRepository;
import io.b2mash.imagehost.multitenancy.StoreTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Checks image codes for availability inside the transaction that will write them. The first
 * reservation in a transaction locks the store's registry row, so two writers of the same store
 * never interleave between check and insert. The unique constraint on the images table remains
 * the final guard.
 */
@Component
public class ImageCodeReservations {

  private static final Logger log = LoggerFactory.getLogger(ImageCodeReservations.class);

  private final StoreRegistryRepository registry;
  private final ImageRepository imageRepository;
  private final StoreTablesProperties properties;

  public ImageCodeReservations(
      StoreRegistryRepository registry,
      ImageRepository imageRepository,
      StoreTablesProperties properties) {
    this.registry = registry;
    this.imageRepository = imageRepository;
    this.properties = properties;
  }

  /**
   * Returns {@code true} when {@code code} is free for the image {@code exceptId} (or for a new
   * image when it is {@code null}). The lock taken here holds until the transaction ends.
   */
  public boolean reserveCode(StoreTables tables, String code, Long exceptId) {
    requireTransaction();
    registry.lockForUpdate(tables.storeId());
    return !imageRepository.codeExists(tables, code, exceptId);
  }

  /** Like {@link #reserveCode} but throws {@link DuplicateCodeException} when the code is taken. */
  public String requireCode(StoreTables tables, String code, Long exceptId) {
    if (!reserveCode(tables, code, exceptId)) {
      throw new DuplicateCodeException(tables.storeId(), code);
    }
    return code;
  }

  /**
   * Reserves {@code base} or the first free {@code base_1}, {@code base_2}, ... within the
   * configured suffix limit.
   */
  public String allocateCode(StoreTables tables, String base) {
    if (reserveCode(tables, base, null)) {
      return base;
    }
    for (int suffix = 1; suffix <= properties.codeSuffixLimit(); suffix++) {
      String candidate = ImageCodes.withSuffix(base, suffix);
      if (!imageRepository.codeExists(tables, candidate, null)) {
        log.debug("Code {} is taken in store {}, using {}", base, tables.storeId(), candidate);
        return candidate;
      }
    }
    throw new DuplicateCodeException(tables.storeId(), base);
  }

  private static void requireTransaction() {
    if (!TransactionSynchronizationManager.isActualTransactionActive()) {
      throw new IllegalStateException("Image codes can only be reserved inside a transaction");
    }
  }
}
