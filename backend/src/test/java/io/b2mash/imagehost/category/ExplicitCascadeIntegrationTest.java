package io.b2mash.imagehost.category;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.imagehost.TestStores;
import io.b2mash.imagehost.catalog.StoreCatalogService;
import io.b2mash.imagehost.image.dto.CreateImageRequest;
import io.b2mash.imagehost.multitenancy.StoreId;
import io.b2mash.imagehost.multitenancy.StoreTables;
import io.b2mash.imagehost.product.dto.ProductRequest;
import io.b2mash.imagehost.provisioning.StoreLifecycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

/** Store tables provisioned with plain foreign keys, so only the explicit walk cascades. */
@SpringBootTest(properties = "imagehost.store-tables.declarative-cascade=false")
@ActiveProfiles("test")
class ExplicitCascadeIntegrationTest {

  @Autowired private StoreLifecycleService lifecycle;
  @Autowired private StoreCatalogService catalog;
  @Autowired private JdbcTemplate jdbc;

  private StoreId store;
  private Category shoes;

  @BeforeEach
  void setUp() {
    store = TestStores.newStoreId();
    lifecycle.onTenantCreated(store);
    shoes = catalog.createCategory(store, "Shoes");
    var sneaker = catalog.createProduct(store, ProductRequest.of(shoes.id(), "Sneaker"));
    catalog.createImage(store, CreateImageRequest.of(sneaker.id(), "Front", "front"));
  }

  @Test
  void foreignKeysDoNotCascadeOnTheirOwn() {
    var tables = StoreTables.of(store);

    assertThatThrownBy(
            () -> jdbc.update("DELETE FROM " + tables.categories() + " WHERE id = ?", shoes.id()))
        .isInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void deleteCategory_removesDependentsThroughTheExplicitWalk() {
    var result = catalog.deleteCategory(store, shoes.id());

    assertThat(result.productsDeleted()).isEqualTo(1);
    assertThat(result.imagesDeleted()).isEqualTo(1);
    assertThat(catalog.listCategories(store)).isEmpty();
    assertThat(catalog.listProducts(store, null)).isEmpty();
    assertThat(catalog.listImages(store, null)).isEmpty();
  }

  @Test
  void deleteProduct_removesItsImagesThroughTheExplicitWalk() {
    long productId = catalog.listProducts(store, shoes.id()).get(0).id();

    var result = catalog.deleteProduct(store, productId);

    assertThat(result.imagesDeleted()).isEqualTo(1);
    assertThat(catalog.isCodeAvailable(store, "front")).isTrue();
  }
}
