package com.codeheadsystems.keyring.exceptions;

/**
 * An attribute exceeded a store's length limit.
 * <p>
 * Raised by stores backed by platform keychains that cap service, user or comment lengths.
 * The sample and mock stores have no limits and never raise it.
 */
public class TooLongException extends KeyringException {

  private final String attribute;
  private final int limit;

  /**
   * Instantiates a new Too long exception.
   *
   * @param attribute the attribute name
   * @param limit     the store's limit in characters
   */
  public TooLongException(final String attribute, final int limit) {
    super("Attribute '" + attribute + "' is longer than the platform limit of " + limit + " chars");
    this.attribute = attribute;
    this.limit = limit;
  }

  public String attribute() {
    return attribute;
  }

  public int limit() {
    return limit;
  }
}
