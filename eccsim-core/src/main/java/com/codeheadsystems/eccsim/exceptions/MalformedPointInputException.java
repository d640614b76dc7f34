package com.codeheadsystems.eccsim.exceptions;

/**
 * Thrown when the textual "x,y" form of a point cannot be parsed.
 */
public class MalformedPointInputException extends EccSimException {

  /**
   * Instantiates a new Malformed point input exception.
   *
   * @param message the message
   */
  public MalformedPointInputException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Malformed point input exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public MalformedPointInputException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
