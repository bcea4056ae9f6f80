package io.b2mash.imagehost.image.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Payload for a new image. When {@code code} is absent a code is derived from the file path, the
 * URL or the name, in that order.
 */
public record CreateImageRequest(
    @Positive long productId,
    @NotBlank @Size(max = 200) String name,
    @Size(max = 200) String code,
    @Size(max = 500) String filePath,
    @Size(max = 500) String url) {

  public static CreateImageRequest of(long productId, String name, String code) {
    return new CreateImageRequest(productId, name, code, null, null);
  }
}
