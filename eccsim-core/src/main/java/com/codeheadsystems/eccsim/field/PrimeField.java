package com.codeheadsystems.eccsim.field;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Arithmetic in the integers modulo {@code p}. Every result is normalized into {@code [0, p)}.
 *
 * <p>The modulus is not checked for primality. Everything except {@link #inverse(BigInteger)}
 * works for any modulus; inversion via Fermat's little theorem is only correct when {@code p}
 * is prime.
 *
 * @param p the modulus
 */
public record PrimeField(BigInteger p) {

  private static final BigInteger TWO = BigInteger.TWO;

  public PrimeField {
    Objects.requireNonNull(p, "p");
    if (p.compareTo(TWO) < 0) {
      throw new IllegalArgumentException("Modulus must be at least 2: " + p);
    }
  }

  /**
   * Reduces x modulo p into [0, p), including for negative x.
   *
   * @param x the value
   * @return x mod p
   */
  public BigInteger reduce(final BigInteger x) {
    // BigInteger.mod never returns a negative value.
    return x.mod(p);
  }

  public BigInteger add(final BigInteger x, final BigInteger y) {
    return reduce(x.add(y));
  }

  public BigInteger subtract(final BigInteger x, final BigInteger y) {
    return reduce(x.subtract(y));
  }

  public BigInteger multiply(final BigInteger x, final BigInteger y) {
    return reduce(x.multiply(y));
  }

  /**
   * Modular exponentiation by repeated squaring, scanning the exponent from its low bit.
   *
   * @param base     the base, any integer
   * @param exponent a non-negative exponent
   * @return base^exponent mod p
   */
  public BigInteger power(final BigInteger base, final BigInteger exponent) {
    if (exponent.signum() < 0) {
      throw new IllegalArgumentException("Exponent must be non-negative: " + exponent);
    }
    BigInteger result = reduce(BigInteger.ONE);
    BigInteger b = reduce(base);
    BigInteger e = exponent;
    while (e.signum() > 0) {
      if (e.testBit(0)) {
        result = multiply(result, b);
      }
      b = multiply(b, b);
      e = e.shiftRight(1);
    }
    return result;
  }

  /**
   * Multiplicative inverse as {@code x^(p-2) mod p}.
   *
   * <p>Passthrough contract: there is no zero check. For {@code x ≡ 0} this returns 0, which
   * is not an inverse. Callers must not pass zero, and p must be prime.
   *
   * @param x the value to invert
   * @return the inverse of x modulo p
   */
  public BigInteger inverse(final BigInteger x) {
    return power(x, p.subtract(TWO));
  }
}
