package com.codeheadsystems.eccsim.curve;

import com.codeheadsystems.eccsim.field.PrimeField;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Domain parameters of a short Weierstrass curve {@code y^2 = x^3 + a*x + b (mod p)}.
 *
 * <p>{@code n} is the claimed order of {@code g}. It is trusted, not derived; use
 * {@link CurveGroup#verifyGroupOrder()} to check it. Neither primality of {@code p} nor
 * {@code g} lying on the curve is enforced so that tests can build adversarial parameters.
 *
 * @param p the field prime
 * @param a the a coefficient
 * @param b the b coefficient
 * @param g the base point
 * @param n the asserted order of g
 */
public record CurveParams(BigInteger p, BigInteger a, BigInteger b, Point.Affine g, BigInteger n) {

  /**
   * The fixed toy curve: p=97, a=2, b=3, G=(0,10), n=50. Not configurable at runtime.
   */
  public static final CurveParams TOY_CURVE = new CurveParams(
      BigInteger.valueOf(97),
      BigInteger.valueOf(2),
      BigInteger.valueOf(3),
      Point.of(0, 10),
      BigInteger.valueOf(50)
  );

  public CurveParams {
    Objects.requireNonNull(p, "p");
    Objects.requireNonNull(a, "a");
    Objects.requireNonNull(b, "b");
    Objects.requireNonNull(g, "g");
    Objects.requireNonNull(n, "n");
    if (n.compareTo(BigInteger.TWO) < 0) {
      throw new IllegalArgumentException("Group order must be at least 2: " + n);
    }
  }

  /**
   * Field the curve is defined over. Allocates a new instance; {@link CurveGroup} keeps one.
   *
   * @return the prime field
   */
  public PrimeField field() {
    return new PrimeField(p);
  }

  /**
   * Right-hand side of the curve equation, {@code x^3 + a*x + b mod p}. The caller supplies
   * the field so hot loops reuse one instance.
   *
   * @param field the field over p
   * @param x     the x coordinate
   * @return the reduced value
   */
  public BigInteger rhs(final PrimeField field, final BigInteger x) {
    BigInteger x3 = field.multiply(field.multiply(x, x), x);
    return field.add(field.add(x3, field.multiply(a, x)), b);
  }
}
