package com.codeheadsystems.keyring.exceptions;

/**
 * The store does not implement the requested operation (for example, search).
 */
public class NotSupportedByStoreException extends KeyringException {

  private final String vendor;

  /**
   * Instantiates a new Not supported by store exception.
   *
   * @param vendor the vendor of the store, or a short description of what is unsupported
   */
  public NotSupportedByStoreException(final String vendor) {
    super("The store (" + vendor + ") does not support this operation");
    this.vendor = vendor;
  }

  public String vendor() {
    return vendor;
  }
}
