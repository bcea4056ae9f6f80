package io.b2mash.imagehost.catalog;

import io.b2mash.imagehost.category.CascadeDeletionResult;
import io.b2mash.imagehost.category.CatalogCascadeService;
import io.b2mash.imagehost.category.Category;
import io.b2mash.imagehost.category.CategoryRepository;
import io.b2mash.imagehost.exception.ResourceNotFoundException;
import io.b2mash.imagehost.image.Image;
import io.b2mash.imagehost.image.ImageCodeReservations;
import io.b2mash.imagehost.image.ImageCodes;
import io.b2mash.imagehost.image.ImageLocation;
import io.b2mash.imagehost.image.ImageRepository;
import io.b2mash.imagehost.image.dto.CreateImageRequest;
import io.b2mash.imagehost.image.dto.UpdateImageRequest;
import io.b2mash.imagehost.multitenancy.StoreId;
import io.b2mash.imagehost.multitenancy.StoreScope;
import io.b2mash.imagehost.product.Product;
import io.b2mash.imagehost.product.ProductRepository;
import io.b2mash.imagehost.product.dto.ProductRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

/**
 * Catalog operations of one store. Every call names its store explicitly; table names are
 * resolved from the {@link StoreId} and every value is bound as a parameter. Writes run in one
 * transaction each.
 *
 * <p>The {@code search*} methods return a lazily fetched {@link Stream} backed by an open cursor.
 * It can be consumed once and must be closed by the caller, typically with try-with-resources.
 */
@Service
@Validated
public class StoreCatalogService {

  private static final Logger log = LoggerFactory.getLogger(StoreCatalogService.class);

  private final StoreScope storeScope;
  private final CategoryRepository categoryRepository;
  private final ProductRepository productRepository;
  private final ImageRepository imageRepository;
  private final ImageCodeReservations codeReservations;
  private final CatalogCascadeService cascadeService;

  public StoreCatalogService(
      StoreScope storeScope,
      CategoryRepository categoryRepository,
      ProductRepository productRepository,
      ImageRepository imageRepository,
      ImageCodeReservations codeReservations,
      CatalogCascadeService cascadeService) {
    this.storeScope = storeScope;
    this.categoryRepository = categoryRepository;
    this.productRepository = productRepository;
    this.imageRepository = imageRepository;
    this.codeReservations = codeReservations;
    this.cascadeService = cascadeService;
  }

  // --- Categories ---

  public Category createCategory(StoreId storeId, @NotBlank @Size(max = 200) String name) {
    return storeScope.inTransaction(
        storeId,
        "createCategory",
        tables -> {
          var category = categoryRepository.insert(tables, name);
          log.info("Created category {} in store {}", category.id(), storeId);
          return category;
        });
  }

  public Category getCategory(StoreId storeId, long categoryId) {
    return storeScope.inTransaction(
        storeId,
        "getCategory",
        tables ->
            categoryRepository
                .findById(tables, categoryId)
                .orElseThrow(
                    () -> new ResourceNotFoundException(storeId, "Category", categoryId)));
  }

  public List<Category> listCategories(StoreId storeId) {
    return storeScope.inTransaction(
        storeId, "listCategories", tables -> categoryRepository.findAll(tables));
  }

  public Stream<Category> searchCategories(StoreId storeId, @NotNull CatalogQuery query) {
    return storeScope.outsideTransaction(
        storeId, "searchCategories", tables -> categoryRepository.search(tables, query));
  }

  public Category renameCategory(
      StoreId storeId, long categoryId, @NotBlank @Size(max = 200) String name) {
    return storeScope.inTransaction(
        storeId,
        "renameCategory",
        tables -> {
          if (categoryRepository.rename(tables, categoryId, name) == 0) {
            throw new ResourceNotFoundException(storeId, "Category", categoryId);
          }
          return categoryRepository.findById(tables, categoryId).orElseThrow();
        });
  }

  /** Deletes the category with all of its products and their images. */
  public CascadeDeletionResult deleteCategory(StoreId storeId, long categoryId) {
    return storeScope.inTransaction(
        storeId,
        "deleteCategory",
        tables -> cascadeService.deleteCategoryCascade(tables, categoryId));
  }

  // --- Products ---

  public Product createProduct(StoreId storeId, @Valid @NotNull ProductRequest request) {
    return storeScope.inTransaction(
        storeId,
        "createProduct",
        tables -> {
          var product = productRepository.insert(tables, request);
          log.info(
              "Created product {} in category {} of store {}",
              product.id(),
              product.categoryId(),
              storeId);
          return product;
        });
  }

  public Product getProduct(StoreId storeId, long productId) {
    return storeScope.inTransaction(
        storeId,
        "getProduct",
        tables ->
            productRepository
                .findById(tables, productId)
                .orElseThrow(() -> new ResourceNotFoundException(storeId, "Product", productId)));
  }

  /** All products of the store, or of one category when {@code categoryId} is given. */
  public List<Product> listProducts(StoreId storeId, Long categoryId) {
    return storeScope.inTransaction(
        storeId,
        "listProducts",
        tables ->
            categoryId == null
                ? productRepository.findAll(tables)
                : productRepository.findByCategoryId(tables, categoryId));
  }

  public Stream<Product> searchProducts(
      StoreId storeId, Long categoryId, @NotNull CatalogQuery query) {
    return storeScope.outsideTransaction(
        storeId, "searchProducts", tables -> productRepository.search(tables, categoryId, query));
  }

  public Product updateProduct(
      StoreId storeId, long productId, @Valid @NotNull ProductRequest request) {
    return storeScope.inTransaction(
        storeId,
        "updateProduct",
        tables -> {
          if (productRepository.update(tables, productId, request) == 0) {
            throw new ResourceNotFoundException(storeId, "Product", productId);
          }
          return productRepository.findById(tables, productId).orElseThrow();
        });
  }

  /** Deletes the product and its images. */
  public CascadeDeletionResult deleteProduct(StoreId storeId, long productId) {
    return storeScope.inTransaction(
        storeId, "deleteProduct", tables -> cascadeService.deleteProductCascade(tables, productId));
  }

  // --- Images ---

  /**
   * Creates an image. A supplied code is normalized and must be free; without one, a code is
   * derived and numbered until it is free.
   */
  public Image createImage(StoreId storeId, @Valid @NotNull CreateImageRequest request) {
    String requestedCode =
        request.code() == null || request.code().isBlank()
            ? null
            : ImageCodes.requireValid(request.code());
    return storeScope.inTransaction(
        storeId,
        "createImage",
        tables -> {
          String code =
              requestedCode != null
                  ? codeReservations.requireCode(tables, requestedCode, null)
                  : codeReservations.allocateCode(
                      tables, ImageCodes.derive(request.filePath(), request.url(), request.name()));
          var image =
              imageRepository.insert(
                  tables,
                  request.productId(),
                  request.name(),
                  code,
                  request.filePath(),
                  request.url());
          log.info("Created image {} with code {} in store {}", image.id(), code, storeId);
          return image;
        });
  }

  public Image getImage(StoreId storeId, long imageId) {
    return storeScope.inTransaction(
        storeId,
        "getImage",
        tables ->
            imageRepository
                .findById(tables, imageId)
                .orElseThrow(() -> new ResourceNotFoundException(storeId, "Image", imageId)));
  }

  /** Looks the code up exactly as given after normalization. */
  public Image findImageByCode(StoreId storeId, @NotNull String code) {
    String normalized = ImageCodes.normalize(code);
    return storeScope.inTransaction(
        storeId,
        "findImageByCode",
        tables ->
            imageRepository
                .findByCode(tables, normalized)
                .orElseThrow(() -> new ResourceNotFoundException(storeId, "Image", code)));
  }

  /** All images of the store, or of one product when {@code productId} is given. */
  public List<Image> listImages(StoreId storeId, Long productId) {
    return storeScope.inTransaction(
        storeId,
        "listImages",
        tables ->
            productId == null
                ? imageRepository.findAll(tables)
                : imageRepository.findByProductId(tables, productId));
  }

  public Stream<Image> searchImages(StoreId storeId, Long productId, @NotNull CatalogQuery query) {
    return storeScope.outsideTransaction(
        storeId, "searchImages", tables -> imageRepository.search(tables, productId, query));
  }

  public Image updateImage(
      StoreId storeId, long imageId, @Valid @NotNull UpdateImageRequest request) {
    return storeScope.inTransaction(
        storeId,
        "updateImage",
        tables -> {
          if (imageRepository.update(tables, imageId, request) == 0) {
            throw new ResourceNotFoundException(storeId, "Image", imageId);
          }
          return imageRepository.findById(tables, imageId).orElseThrow();
        });
  }

  /** Changes the code of an image. Its current code stays available to it. */
  public Image updateImageCode(StoreId storeId, long imageId, @NotNull String code) {
    String normalized = ImageCodes.requireValid(code);
    return storeScope.inTransaction(
        storeId,
        "updateImageCode",
        tables -> {
          var current =
              imageRepository
                  .findById(tables, imageId)
                  .orElseThrow(() -> new ResourceNotFoundException(storeId, "Image", imageId));
          if (current.code().equals(normalized)) {
            return current;
          }
          codeReservations.requireCode(tables, normalized, imageId);
          imageRepository.updateCode(tables, imageId, normalized);
          log.info(
              "Changed code of image {} in store {} from {} to {}",
              imageId,
              storeId,
              current.code(),
              normalized);
          return imageRepository.findById(tables, imageId).orElseThrow();
        });
  }

  public void deleteImage(StoreId storeId, long imageId) {
    storeScope.inTransaction(
        storeId,
        "deleteImage",
        tables -> {
          if (imageRepository.delete(tables, imageId) == 0) {
            throw new ResourceNotFoundException(storeId, "Image", imageId);
          }
          log.info("Deleted image {} in store {}", imageId, storeId);
          return null;
        });
  }

  /**
   * Whether a new image could take {@code code} right now. The answer is advisory; only a write
   * holds the reservation.
   */
  public boolean isCodeAvailable(StoreId storeId, @NotNull String code) {
    String normalized = ImageCodes.normalize(code);
    if (normalized.isEmpty()) {
      return false;
    }
    return storeScope.inTransaction(
        storeId,
        "isCodeAvailable",
        tables -> !imageRepository.codeExists(tables, normalized, null));
  }

  /** Resolves a public image code to the image and the names used in its external URL. */
  public ImageLocation resolveImage(StoreId storeId, @NotNull String code) {
    String normalized = ImageCodes.normalize(code);
    return storeScope.inTransaction(
        storeId,
        "resolveImage",
        tables ->
            imageRepository
                .findLocationByCode(tables, normalized)
                .orElseThrow(() -> new ResourceNotFoundException(storeId, "Image", code)));
  }
}
