package io.b2mash.imagehost.provisioning;

import io.b2mash.imagehost.multitenancy.StoreId;

public record ProvisioningResult(StoreId storeId, boolean alreadyProvisioned) {

  public static ProvisioningResult created(StoreId storeId) {
    return new ProvisioningResult(storeId, false);
  }

  public static ProvisioningResult alreadyProvisioned(StoreId storeId) {
    return new ProvisioningResult(storeId, true);
  }
}
