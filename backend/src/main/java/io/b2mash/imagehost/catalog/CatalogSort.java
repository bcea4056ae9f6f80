package io.b2mash.imagehost.catalog;

/** Sort keys for catalog searches. Each maps to a fixed column; ties break on insertion order. */
public enum CatalogSort {
  INSERTION("id"),
  NAME("name"),
  CREATED_AT("created_at"),
  UPDATED_AT("updated_at");

  private final String column;

  CatalogSort(String column) {
    this.column = column;
  }

  public String column() {
    return column;
  }
}
