package io.b2mash.imagehost.multitenancy;

import java.util.function.Supplier;
import org.slf4j.MDC;

/** Puts the store id and operation name into the MDC for the duration of one store operation. */
public final class StoreLogContext {

  public static final String MDC_STORE_ID = "storeId";
  public static final String MDC_OPERATION = "storeOperation";

  private StoreLogContext() {}

  public static <T> T call(StoreId storeId, String operation, Supplier<T> work) {
    String previousStore = MDC.get(MDC_STORE_ID);
    String previousOperation = MDC.get(MDC_OPERATION);
    try {
      MDC.put(MDC_STORE_ID, storeId.value());
      MDC.put(MDC_OPERATION, operation);
      return work.get();
    } finally {
      restore(MDC_STORE_ID, previousStore);
      restore(MDC_OPERATION, previousOperation);
    }
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
