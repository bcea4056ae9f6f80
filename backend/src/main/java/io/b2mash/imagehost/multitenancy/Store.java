package io.b2mash.imagehost.multitenancy;

import java.time.Instant;

/** A registered store. Its tables exist before this row does and are dropped after it is gone. */
public record Store(StoreId id, String name, Instant createdAt, Instant updatedAt) {}
