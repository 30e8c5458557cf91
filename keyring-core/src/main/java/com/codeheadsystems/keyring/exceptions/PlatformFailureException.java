package com.codeheadsystems.keyring.exceptions;

/**
 * The underlying storage failed. The cause holds the storage-specific detail.
 */
public class PlatformFailureException extends KeyringException {

  /**
   * Instantiates a new Platform failure exception.
   *
   * @param cause the storage failure
   */
  public PlatformFailureException(final Throwable cause) {
    super("Platform secure storage failure: " + cause.getMessage(), cause);
  }
}
