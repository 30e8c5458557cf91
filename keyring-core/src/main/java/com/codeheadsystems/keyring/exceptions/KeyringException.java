package com.codeheadsystems.keyring.exceptions;

/**
 * Base type of every failure raised by a credential or credential store.
 * <p>
 * All subclasses are unchecked and are always propagated to the caller: nothing in this
 * library retries an operation on its own. Callers decide whether to retry, disambiguate
 * (see {@link AmbiguousException}), or surface the failure.
 */
public abstract class KeyringException extends RuntimeException {

  /**
   * Instantiates a new Keyring exception.
   *
   * @param message the message
   */
  protected KeyringException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Keyring exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  protected KeyringException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
