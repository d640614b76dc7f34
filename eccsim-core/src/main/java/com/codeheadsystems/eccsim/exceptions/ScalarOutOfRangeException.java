package com.codeheadsystems.eccsim.exceptions;

import java.math.BigInteger;

/**
 * Thrown when a private or ephemeral scalar falls outside [1, n-1]. Such scalars are
 * rejected, never clamped.
 */
public class ScalarOutOfRangeException extends EccSimException {

  private final BigInteger scalar;
  private final BigInteger order;

  /**
   * Instantiates a new Scalar out of range exception.
   *
   * @param scalar the rejected scalar
   * @param order  the group order n
   */
  public ScalarOutOfRangeException(final BigInteger scalar, final BigInteger order) {
    super("Scalar out of range [1, " + order.subtract(BigInteger.ONE) + "]: " + scalar);
    this.scalar = scalar;
    this.order = order;
  }

  public BigInteger scalar() {
    return scalar;
  }

  public BigInteger order() {
    return order;
  }
}
