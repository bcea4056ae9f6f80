package io.b2mash.imagehost.provisioning;

import io.b2mash.imagehost.exception.InvalidStateException;
import io.b2mash.imagehost.exception.ResourceNotFoundException;
import io.b2mash.imagehost.multitenancy.Store;
import io.b2mash.imagehost.multitenancy.StoreId;
import io.b2mash.imagehost.multitenancy.StoreLogContext;
import io.b2mash.imagehost.multitenancy.StoreRegistryRepository;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Entry points the application calls when a store is created or deleted. Tables are provisioned
 * before the registry row is written, so catalog operations only ever resolve to a store whose
 * tables are complete; on deletion the registry row goes first.
 */
@Service
public class StoreLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(StoreLifecycleService.class);

  private final StoreRegistryRepository registry;
  private final StoreTableProvisioner provisioner;
  private final TransactionTemplate transactionTemplate;

  public StoreLifecycleService(
      StoreRegistryRepository registry,
      StoreTableProvisioner provisioner,
      @Qualifier("storeTransactionTemplate") TransactionTemplate transactionTemplate) {
    this.registry = registry;
    this.provisioner = provisioner;
    this.transactionTemplate = transactionTemplate;
  }

  /** Registers the store under a placeholder name; callers that know the name should pass it. */
  public ProvisioningResult onTenantCreated(StoreId storeId) {
    return onTenantCreated(storeId, "Store " + storeId.value());
  }

  public ProvisioningResult onTenantCreated(StoreId storeId, String name) {
    requireName(name);
    return StoreLogContext.call(
        storeId,
        "onTenantCreated",
        () -> {
          var result = provisioner.provision(storeId);
          boolean registered;
          try {
            registered =
                Boolean.TRUE.equals(
                    transactionTemplate.execute(status -> registry.insertIfAbsent(storeId, name)));
          } catch (DuplicateKeyException e) {
            // a concurrent call registered the same store between the check and the insert
            registered = false;
          }
          if (registered) {
            log.info("Registered store {}", storeId.value());
          } else {
            log.info("Store {} was already registered", storeId.value());
          }
          return result;
        });
  }

  public void onTenantDeleted(StoreId storeId) {
    StoreLogContext.call(
        storeId,
        "onTenantDeleted",
        () -> {
          int removed =
              transactionTemplate.execute(
                  status -> {
                    int rows = registry.delete(storeId);
                    provisioner.deprovision(storeId);
                    return rows;
                  });
          if (removed == 0) {
            log.info("Store {} was not registered; dropped any leftover tables", storeId.value());
          } else {
            log.info("Deleted store {}", storeId.value());
          }
          return null;
        });
  }

  public Optional<Store> findStore(StoreId storeId) {
    return registry.findById(storeId);
  }

  public List<Store> listStores() {
    return registry.findAll();
  }

  public Store renameStore(StoreId storeId, String name) {
    requireName(name);
    return transactionTemplate.execute(
        status -> {
          if (registry.rename(storeId, name) == 0) {
            throw new ResourceNotFoundException("Store", storeId.value());
          }
          log.info("Renamed store {}", storeId.value());
          return registry.findById(storeId).orElseThrow();
        });
  }

  private static void requireName(String name) {
    if (name == null || name.isBlank()) {
      throw new InvalidStateException("Invalid store name", "Store name must not be blank");
    }
    if (name.length() > 200) {
      throw new InvalidStateException(
          "Invalid store name", "Store name must be at most 200 characters");
    }
  }
}
