package io.b2mash.imagehost.product;

import java.math.BigDecimal;
import java.time.Instant;

public record Product(
    long id,
    long categoryId,
    String name,
    BigDecimal markedPrice,
    BigDecimal minDiscountedPrice,
    String description,
    Instant createdAt,
    Instant updatedAt) {}
