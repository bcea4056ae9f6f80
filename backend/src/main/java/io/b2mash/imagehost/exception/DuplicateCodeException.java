package io.b2mash.imagehost.exception;

import io.b2mash.imagehost.multitenancy.StoreId;

public class DuplicateCodeException extends IntegrityViolationException {

  private final String code;

  public DuplicateCodeException(StoreId storeId, String code) {
    this(storeId, code, null);
  }

  public DuplicateCodeException(StoreId storeId, String code, Throwable cause) {
    super(
        "Duplicate image code",
        "An image with code '" + code + "' already exists in store " + storeId.value(),
        cause);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
