package io.b2mash.imagehost.category;

import java.time.Instant;

public record Category(long id, String name, Instant createdAt, Instant updatedAt) {}
