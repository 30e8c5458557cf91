package com.codeheadsystems.keyring.exceptions;

/**
 * Stored data could not be interpreted in the format a store expects.
 * <p>
 * Raised by stores that keep secrets in a structured encoding of their own, when a stored
 * item does not decode. The sample store reports an undecodable backing file as
 * {@link PlatformFailureException} instead.
 */
public class BadDataFormatException extends KeyringException {

  private final byte[] bytes;

  /**
   * Instantiates a new Bad data format exception.
   *
   * @param bytes the data as found in storage
   * @param cause the decoding failure
   */
  public BadDataFormatException(final byte[] bytes, final Throwable cause) {
    super("Data is not in the expected format: " + cause.getMessage(), cause);
    this.bytes = bytes.clone();
  }

  public byte[] bytes() {
    return bytes.clone();
  }
}
