package io.b2mash.imagehost.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.support.GeneratedKeyHolder;

class CatalogSqlTest {

  @Test
  void likePattern_escapesWildcards() {
    assertThat(CatalogSql.likePattern("50%_Off")).isEqualTo("%50\\%\\_off%");
  }

  @Test
  void nameFilter_bindsValueInsteadOfSplicingIt() {
    var sql = new StringBuilder("SELECT id FROM t WHERE 1 = 1");
    var params = new ArrayList<Object>();

    CatalogSql.appendNameFilter(sql, params, CatalogQuery.nameContains("o'Brien"));

    assertThat(sql.toString()).doesNotContain("Brien").endsWith("LIKE ? ESCAPE '\\'");
    assertThat(params).containsExactly("%o'brien%");
  }

  @Test
  void nameFilter_skippedForBlankFragment() {
    var sql = new StringBuilder("x");
    var params = new ArrayList<Object>();

    CatalogSql.appendNameFilter(sql, params, CatalogQuery.nameContains("  "));

    assertThat(sql.toString()).isEqualTo("x");
    assertThat(params).isEmpty();
  }

  @Test
  void orderBy_defaultsToInsertionOrder() {
    assertThat(CatalogSql.orderBy(CatalogQuery.all())).isEqualTo(" ORDER BY id ASC");
    assertThat(CatalogSql.orderBy(new CatalogQuery(null, null, true)))
        .isEqualTo(" ORDER BY id DESC");
  }

  @Test
  void orderBy_breaksTiesOnId() {
    assertThat(CatalogSql.orderBy(CatalogQuery.all().sortedBy(CatalogSort.NAME, false)))
        .isEqualTo(" ORDER BY name ASC, id ASC");
  }

  @Test
  void generatedId_readsIdRegardlessOfLabelCase() {
    var keyHolder =
        new GeneratedKeyHolder(List.<Map<String, Object>>of(Map.of("ID", 5L, "NAME", "x")));
    assertThat(CatalogSql.generatedId(keyHolder)).isEqualTo(5L);
  }

  @Test
  void generatedId_failsWithoutId() {
    var keyHolder = new GeneratedKeyHolder();
    assertThatThrownBy(() -> CatalogSql.generatedId(keyHolder))
        .isInstanceOf(IllegalStateException.class);
  }
}
