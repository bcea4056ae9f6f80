package io.b2mash.imagehost.category;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;

import io.b2mash.imagehost.TestStores;
import io.b2mash.imagehost.catalog.StoreCatalogService;
import io.b2mash.imagehost.image.Image;
import io.b2mash.imagehost.image.dto.CreateImageRequest;
import io.b2mash.imagehost.multitenancy.StoreId;
import io.b2mash.imagehost.multitenancy.StoreTables;
import io.b2mash.imagehost.product.Product;
import io.b2mash.imagehost.product.dto.ProductRequest;
import io.b2mash.imagehost.provisioning.StoreLifecycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;

@SpringBootTest
@ActiveProfiles("test")
class CatalogCascadeRollbackIntegrationTest {

  @Autowired private StoreLifecycleService lifecycle;
  @Autowired private StoreCatalogService catalog;
  @MockitoSpyBean private CategoryRepository categoryRepository;

  private StoreId store;
  private Category shoes;

  @BeforeEach
  void setUp() {
    store = TestStores.newStoreId();
    lifecycle.onTenantCreated(store);
    shoes = catalog.createCategory(store, "Shoes");
    var sneaker = catalog.createProduct(store, ProductRequest.of(shoes.id(), "Sneaker"));
    catalog.createImage(store, CreateImageRequest.of(sneaker.id(), "Front", "front"));
    catalog.createImage(store, CreateImageRequest.of(sneaker.id(), "Side", "side"));
  }

  @Test
  void failureOnLastStep_keepsCategoryProductsAndImages() {
    // images and products are already gone inside the transaction when the category delete fails
    doThrow(new DataAccessResourceFailureException("connection lost"))
        .when(categoryRepository)
        .delete(any(StoreTables.class), eq(shoes.id()));

    assertThatThrownBy(() -> catalog.deleteCategory(store, shoes.id()))
        .isInstanceOf(DataAccessResourceFailureException.class);

    assertThat(catalog.listCategories(store)).extracting(Category::id).containsExactly(shoes.id());
    assertThat(catalog.listProducts(store, shoes.id()))
        .extracting(Product::name)
        .containsExactly("Sneaker");
    assertThat(catalog.listImages(store, null))
        .extracting(Image::code)
        .containsExactly("front", "side");
  }
}
