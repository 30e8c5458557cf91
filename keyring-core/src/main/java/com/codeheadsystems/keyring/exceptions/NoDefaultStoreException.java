package com.codeheadsystems.keyring.exceptions;

/**
 * An entry was created or a search was requested through the default store, but none is set.
 */
public class NoDefaultStoreException extends KeyringException {

  /**
   * Instantiates a new No default store exception.
   */
  public NoDefaultStoreException() {
    super("No default store has been set, so cannot search or create entries");
  }
}
