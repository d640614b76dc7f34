package com.codeheadsystems.eccsim.exceptions;

/**
 * Base type for every recoverable error raised by the simulator. All failures are
 * deterministic for a given input, so none of them are worth retrying.
 */
public class EccSimException extends RuntimeException {

  /**
   * Instantiates a new Ecc sim exception.
   *
   * @param message the message
   */
  public EccSimException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Ecc sim exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public EccSimException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
