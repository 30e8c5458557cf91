package com.codeheadsystems.keyring.exceptions;

/**
 * A caller-supplied value was rejected: a service or user name, a modifier, an attribute
 * update or a search pattern.
 */
public class InvalidException extends KeyringException {

  private final String attribute;
  private final String reason;

  /**
   * Instantiates a new Invalid exception.
   *
   * @param attribute the name of the offending parameter
   * @param reason    why it was rejected
   */
  public InvalidException(final String attribute, final String reason) {
    super("Attribute " + attribute + " is invalid: " + reason);
    this.attribute = attribute;
    this.reason = reason;
  }

  /**
   * Instantiates a new Invalid exception caused by a lower-level failure.
   *
   * @param attribute the name of the offending parameter
   * @param reason    why it was rejected
   * @param cause     the cause
   */
  public InvalidException(final String attribute, final String reason, final Throwable cause) {
    super("Attribute " + attribute + " is invalid: " + reason, cause);
    this.attribute = attribute;
    this.reason = reason;
  }

  public String attribute() {
    return attribute;
  }

  public String reason() {
    return reason;
  }
}
