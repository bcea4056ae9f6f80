package io.b2mash.imagehost;

import io.b2mash.imagehost.multitenancy.StoreId;
import java.util.UUID;

/** Store ids that no other test uses, so tests sharing one database never collide. */
public final class TestStores {

  private TestStores() {}

  public static StoreId newStoreId() {
    return StoreId.of("t" + UUID.randomUUID().toString().replace("-", "").substring(0, 12));
  }
}
