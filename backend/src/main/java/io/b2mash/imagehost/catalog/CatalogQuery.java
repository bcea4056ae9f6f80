package io.b2mash.imagehost.catalog;

/**
 * Filter and ordering for catalog searches.
 *
 * @param nameContains case-insensitive substring of the name, or {@code null} for no filter
 * @param sort sort key, insertion order when {@code null}
 * @param descending reverse the sort order
 */
public record CatalogQuery(String nameContains, CatalogSort sort, boolean descending) {

  public CatalogQuery {
    if (sort == null) {
      sort = CatalogSort.INSERTION;
    }
    if (nameContains != null && nameContains.isBlank()) {
      nameContains = null;
    }
  }

  public static CatalogQuery all() {
    return new CatalogQuery(null, CatalogSort.INSERTION, false);
  }

  public static CatalogQuery nameContains(String fragment) {
    return new CatalogQuery(fragment, CatalogSort.INSERTION, false);
  }

  public CatalogQuery sortedBy(CatalogSort sort, boolean descending) {
    return new CatalogQuery(nameContains, sort, descending);
  }
}
