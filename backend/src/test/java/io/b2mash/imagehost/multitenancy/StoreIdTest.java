package io.b2mash.imagehost.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.imagehost.exception.InvalidIdentifierException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class StoreIdTest {

  @Test
  void numericId_usesDecimalForm() {
    assertThat(StoreId.of(42L).value()).isEqualTo("42");
  }

  @Test
  void numericId_mustBePositive() {
    assertThatThrownBy(() -> StoreId.of(0L)).isInstanceOf(InvalidIdentifierException.class);
    assertThatThrownBy(() -> StoreId.of(-7L)).isInstanceOf(InvalidIdentifierException.class);
  }

  @ParameterizedTest
  @ValueSource(strings = {"7", "shop_1", "a", "abcdefghijklmnopqrstuvwxyz012345"})
  void token_acceptsLowercaseLettersDigitsAndUnderscore(String raw) {
    assertThat(StoreId.of(raw).value()).isEqualTo(raw);
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "",
        "Shop",
        "shop-1",
        "shop 1",
        "1; DROP TABLE stores",
        "store\"x",
        "abcdefghijklmnopqrstuvwxyz0123456",
        "007",
        "0"
      })
  void token_rejectsEverythingElse(String raw) {
    assertThatThrownBy(() -> StoreId.of(raw)).isInstanceOf(InvalidIdentifierException.class);
  }

  @Test
  void token_rejectsNull() {
    assertThatThrownBy(() -> StoreId.of((String) null))
        .isInstanceOf(InvalidIdentifierException.class);
  }

  @Test
  void numericAndTextualForms_areEqual() {
    assertThat(StoreId.of(12L)).isEqualTo(StoreId.of("12"));
    assertThat(StoreId.of(12L)).hasSameHashCodeAs(StoreId.of("12"));
  }

  @Test
  void invalidIdentifier_isBadRequest() {
    assertThatThrownBy(() -> StoreId.of("x'y"))
        .isInstanceOfSatisfying(
            InvalidIdentifierException.class,
            e -> assertThat(e.getStatusCode().value()).isEqualTo(400));
  }
}
