package io.b2mash.imagehost.multitenancy;

import java.util.List;
import java.util.Locale;

/**
 * Table and constraint names of one store, derived from its {@link StoreId} and nothing else:
 * {@code store_<id>_categories}, {@code store_<id>_products}, {@code store_<id>_images}.
 * Repositories receive this type instead of raw strings, so a table name cannot reach SQL text
 * without going through {@link StoreId} validation first.
 */
public final class StoreTables {

  private static final String PREFIX = "store_";

  private final StoreId storeId;
  private final String categories;
  private final String products;
  private final String images;

  private StoreTables(StoreId storeId) {
    this.storeId = storeId;
    String base = PREFIX + storeId.value();
    this.categories = base + "_categories";
    this.products = base + "_products";
    this.images = base + "_images";
  }

  public static StoreTables of(StoreId storeId) {
    if (storeId == null) {
      throw new IllegalArgumentException("Store id must not be null");
    }
    return new StoreTables(storeId);
  }

  public StoreId storeId() {
    return storeId;
  }

  public String categories() {
    return categories;
  }

  public String products() {
    return products;
  }

  public String images() {
    return images;
  }

  /** Parent tables first; drop in reverse. */
  public List<String> creationOrder() {
    return List.of(categories, products, images);
  }

  public List<String> dropOrder() {
    return List.of(images, products, categories);
  }

  public boolean contains(String tableName) {
    return tableName != null && creationOrder().contains(tableName.toLowerCase(Locale.ROOT));
  }

  /** Name for an index or constraint on one of this store's tables, e.g. {@code _name_idx}. */
  public String objectName(String table, String suffix) {
    if (!creationOrder().contains(table)) {
      throw new IllegalArgumentException("Not a table of store " + storeId + ": " + table);
    }
    if (!suffix.matches("^_[a-z_]+$")) {
      throw new IllegalArgumentException("Invalid object name suffix: " + suffix);
    }
    return table + suffix;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof StoreTables other && storeId.equals(other.storeId));
  }

  @Override
  public int hashCode() {
    return storeId.hashCode();
  }

  @Override
  public String toString() {
    return "StoreTables[" + storeId + "]";
  }
}
