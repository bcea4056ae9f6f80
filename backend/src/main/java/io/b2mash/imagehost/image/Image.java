package io.b2mash.imagehost.image;

import java.time.Instant;

/**
 * An image row. {@code filePath} is the storage key of the uploaded file and {@code url} an
 * external location; the binary content itself never lives in the store tables.
 */
public record Image(
    long id,
    long productId,
    String name,
    String code,
    String filePath,
    String url,
    Instant createdAt,
    Instant updatedAt) {}
