package io.b2mash.imagehost.image;

/** An image together with the names of the product and category it is filed under. */
public record ImageLocation(Image image, String productName, String categoryName) {}
