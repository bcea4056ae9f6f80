package io.b2mash.imagehost.category;

import io.b2mash.imagehost.exception.ResourceNotFoundException;
import io.b2mash.imagehost.image.ImageRepository;
import io.b2mash.imagehost.multitenancy.StoreTables;
import io.b2mash.imagehost.product.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Deletes a category or product together with everything below it, children first, within the
 * caller's transaction. The walk does not rely on {@code ON DELETE CASCADE}; where the foreign
 * keys carry it, it only backs the walk up.
 */
@Service
public class CatalogCascadeService {

  private static final Logger log = LoggerFactory.getLogger(CatalogCascadeService.class);

  private final CategoryRepository categoryRepository;
  private final ProductRepository productRepository;
  private final ImageRepository imageRepository;

  public CatalogCascadeService(
      CategoryRepository categoryRepository,
      ProductRepository productRepository,
      ImageRepository imageRepository) {
    this.categoryRepository = categoryRepository;
    this.productRepository = productRepository;
    this.imageRepository = imageRepository;
  }

  public CascadeDeletionResult deleteCategoryCascade(StoreTables tables, long categoryId) {
    requireTransaction();
    // lock first so no product can be filed under the category while it is being emptied
    categoryRepository
        .findByIdForUpdate(tables, categoryId)
        .orElseThrow(
            () -> new ResourceNotFoundException(tables.storeId(), "Category", categoryId));

    var productIds = productRepository.findIdsByCategoryId(tables, categoryId);
    int imagesDeleted = 0;
    for (Long productId : productIds) {
      imagesDeleted += imageRepository.deleteByProductId(tables, productId);
    }
    int productsDeleted = productRepository.deleteByCategoryId(tables, categoryId);
    categoryRepository.delete(tables, categoryId);

    log.info(
        "Deleted category {} in store {} with {} products and {} images",
        categoryId,
        tables.storeId(),
        productsDeleted,
        imagesDeleted);
    return new CascadeDeletionResult(categoryId, productsDeleted, imagesDeleted);
  }

  public CascadeDeletionResult deleteProductCascade(StoreTables tables, long productId) {
    requireTransaction();
    productRepository
        .findById(tables, productId)
        .orElseThrow(() -> new ResourceNotFoundException(tables.storeId(), "Product", productId));

    int imagesDeleted = imageRepository.deleteByProductId(tables, productId);
    int productsDeleted = productRepository.delete(tables, productId);

    log.info(
        "Deleted product {} in store {} with {} images", productId, tables.storeId(), imagesDeleted);
    return new CascadeDeletionResult(null, productsDeleted, imagesDeleted);
  }

  private static void requireTransaction() {
    if (!TransactionSynchronizationManager.isActualTransactionActive()) {
      throw new IllegalStateException("Cascading deletes must run inside a transaction");
    }
  }
}
