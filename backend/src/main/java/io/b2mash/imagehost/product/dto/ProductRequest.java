package io.b2mash.imagehost.product.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

/** Payload for creating a product, and the full replacement state when updating one. */
public record ProductRequest(
    @Positive long categoryId,
    @NotBlank @Size(max = 200) String name,
    @DecimalMin("0.00") @Digits(integer = 8, fraction = 2) BigDecimal markedPrice,
    @DecimalMin("0.00") @Digits(integer = 8, fraction = 2) BigDecimal minDiscountedPrice,
    @Size(max = 2000) String description) {

  public static ProductRequest of(long categoryId, String name) {
    return new ProductRequest(categoryId, name, null, null, null);
  }
}
