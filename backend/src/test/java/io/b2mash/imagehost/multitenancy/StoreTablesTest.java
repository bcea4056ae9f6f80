package io.b2mash.imagehost.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class StoreTablesTest {

  private final StoreTables tables = StoreTables.of(StoreId.of(2L));

  @Test
  void tableNames_derivedFromStoreId() {
    assertThat(tables.categories()).isEqualTo("store_2_categories");
    assertThat(tables.products()).isEqualTo("store_2_products");
    assertThat(tables.images()).isEqualTo("store_2_images");
  }

  @Test
  void dropOrder_isReverseOfCreationOrder() {
    assertThat(tables.creationOrder())
        .containsExactly("store_2_categories", "store_2_products", "store_2_images");
    assertThat(tables.dropOrder())
        .containsExactly("store_2_images", "store_2_products", "store_2_categories");
  }

  @Test
  void contains_ignoresCase() {
    assertThat(tables.contains("STORE_2_IMAGES")).isTrue();
    assertThat(tables.contains("store_3_images")).isFalse();
    assertThat(tables.contains(null)).isFalse();
  }

  @Test
  void differentStores_shareNoTable() {
    var other = StoreTables.of(StoreId.of(3L));
    assertThat(other.creationOrder()).doesNotContainAnyElementsOf(tables.creationOrder());
  }

  @Test
  void sameStore_yieldsEqualTables() {
    var again = StoreTables.of(StoreId.of("2"));

    assertThat(again).isEqualTo(tables).hasSameHashCodeAs(tables);
    assertThat(StoreTables.of(StoreId.of(3L))).isNotEqualTo(tables);
  }

  @Test
  void objectName_appendsSuffixToOwnTable() {
    assertThat(tables.objectName(tables.images(), "_code_key")).isEqualTo("store_2_images_code_key");
  }

  @Test
  void objectName_rejectsForeignTable() {
    assertThatThrownBy(() -> tables.objectName("store_3_images", "_code_key"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void objectName_rejectsUnsafeSuffix() {
    assertThatThrownBy(() -> tables.objectName(tables.images(), "_idx; DROP TABLE x"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
