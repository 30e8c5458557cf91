package com.codeheadsystems.keyring.exceptions;

/**
 * A password was requested but the stored secret is not UTF-8. The raw secret is kept so
 * the caller can still use it.
 */
public class BadEncodingException extends KeyringException {

  private final byte[] bytes;

  /**
   * Instantiates a new Bad encoding exception.
   *
   * @param bytes the undecodable secret
   */
  public BadEncodingException(final byte[] bytes) {
    super("Data is not UTF-8 encoded");
    this.bytes = bytes.clone();
  }

  public byte[] bytes() {
    return bytes.clone();
  }
}
