package com.codeheadsystems.keyring.exceptions;

/**
 * No credential matches the entry: a specifier whose bucket is empty, or a wrapper whose
 * credential has been deleted.
 */
public class NoEntryException extends KeyringException {

  /**
   * Instantiates a new No entry exception.
   */
  public NoEntryException() {
    super("No matching entry found in secure storage");
  }
}
