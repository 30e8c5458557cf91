package com.codeheadsystems.keyring.exceptions;

/**
 * The underlying storage could not be reached (locked, missing, or access was refused).
 */
public class NoStorageAccessException extends KeyringException {

  /**
   * Instantiates a new No storage access exception.
   *
   * @param cause the access failure
   */
  public NoStorageAccessException(final Throwable cause) {
    super("Couldn't access platform secure storage: " + cause.getMessage(), cause);
  }
}
