package io.b2mash.imagehost.image;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.imagehost.TestStores;
import io.b2mash.imagehost.catalog.StoreCatalogService;
import io.b2mash.imagehost.exception.DuplicateCodeException;
import io.b2mash.imagehost.image.dto.CreateImageRequest;
import io.b2mash.imagehost.multitenancy.StoreId;
import io.b2mash.imagehost.product.dto.ProductRequest;
import io.b2mash.imagehost.provisioning.StoreLifecycleService;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ImageCodeConcurrencyIntegrationTest {

  private static final int WRITERS = 4;

  @Autowired private StoreLifecycleService lifecycle;
  @Autowired private StoreCatalogService catalog;

  @Test
  void concurrentInsertsOfOneCode_exactlyOneSucceeds() throws Exception {
    StoreId store = TestStores.newStoreId();
    lifecycle.onTenantCreated(store);
    long categoryId = catalog.createCategory(store, "Shoes").id();
    long productId = catalog.createProduct(store, ProductRequest.of(categoryId, "Sneaker")).id();

    var start = new CountDownLatch(1);
    var executor = Executors.newFixedThreadPool(WRITERS);
    try {
      List<Future<Image>> futures = new ArrayList<>();
      for (int i = 0; i < WRITERS; i++) {
        String name = "Logo " + i;
        Callable<Image> writer =
            () -> {
              start.await();
              return catalog.createImage(store, CreateImageRequest.of(productId, name, "logo"));
            };
        futures.add(executor.submit(writer));
      }
      start.countDown();

      int succeeded = 0;
      int duplicates = 0;
      for (Future<Image> future : futures) {
        try {
          future.get(30, TimeUnit.SECONDS);
          succeeded++;
        } catch (ExecutionException e) {
          assertThat(e.getCause()).isInstanceOf(DuplicateCodeException.class);
          duplicates++;
        }
      }

      assertThat(succeeded).isEqualTo(1);
      assertThat(duplicates).isEqualTo(WRITERS - 1);
      assertThat(catalog.listImages(store, null)).hasSize(1);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void sameCodeInDifferentStores_doesNotConflict() {
    StoreId first = TestStores.newStoreId();
    StoreId second = TestStores.newStoreId();
    for (StoreId store : List.of(first, second)) {
      lifecycle.onTenantCreated(store);
      long categoryId = catalog.createCategory(store, "Shoes").id();
      long productId = catalog.createProduct(store, ProductRequest.of(categoryId, "Sneaker")).id();
      catalog.createImage(store, CreateImageRequest.of(productId, "Logo", "logo"));
    }

    assertThat(catalog.findImageByCode(first, "logo")).isNotNull();
    assertThat(catalog.findImageByCode(second, "logo")).isNotNull();
  }
}
