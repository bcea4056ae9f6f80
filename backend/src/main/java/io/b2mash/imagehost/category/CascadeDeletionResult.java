package io.b2mash.imagehost.category;

/** What a cascading delete removed. {@code categoryId} is null when a single product was deleted. */
public record CascadeDeletionResult(Long categoryId, int productsDeleted, int imagesDeleted) {}
