package io.b2mash.imagehost.image.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/** Replaces everything but the code, which has its own operation. */
public record UpdateImageRequest(
    @Positive long productId,
    @NotBlank @Size(max = 200) String name,
    @Size(max = 500) String filePath,
    @Size(max = 500) String url) {}
