package com.codeheadsystems.eccsim.exceptions;

/**
 * Thrown when hex input has an odd number of hex digits once non-hex characters are stripped.
 */
public class MalformedHexInputException extends EccSimException {

  /**
   * Instantiates a new Malformed hex input exception.
   *
   * @param message the message
   */
  public MalformedHexInputException(final String message) {
    super(message);
  }
}
