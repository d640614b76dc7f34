package com.codeheadsystems.eccsim.curve;

import com.codeheadsystems.eccsim.exceptions.PointNotOnCurveException;
import com.codeheadsystems.eccsim.field.PrimeField;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Chord-and-tangent group law on a short Weierstrass curve.
 *
 * <p>Scalar multiplication is plain double-and-add. It is not constant time: the number of
 * additions leaks the bit pattern of the scalar. This class must never be reused for real keys.
 *
 * @param params the curve parameters
 * @param field  the field, derived from {@code params.p()}
 */
public record CurveGroup(CurveParams params, PrimeField field) {

  private static final BigInteger THREE = BigInteger.valueOf(3);

  public CurveGroup {
    Objects.requireNonNull(params, "params");
    Objects.requireNonNull(field, "field");
    if (!field.p().equals(params.p())) {
      throw new IllegalArgumentException("Field modulus does not match curve prime");
    }
  }

  /**
   * Instantiates a new Curve group.
   *
   * @param params the params
   */
  public CurveGroup(final CurveParams params) {
    this(params, params.field());
  }

  /**
   * The base point G.
   *
   * @return g
   */
  public Point.Affine generator() {
    return params.g();
  }

  /**
   * The identity is on the curve by convention; an affine point is iff both coordinates are
   * field elements in {@code [0, p)} and {@code y^2 = x^3 + a*x + b (mod p)}.
   *
   * <p>Non-canonical coordinates such as {@code (p + x, y)} are rejected rather than reduced:
   * the group law compares coordinates directly and would otherwise miss the
   * mutual-negatives case.
   *
   * @param point the point
   * @return true when the point belongs to the group
   */
  public boolean isOnCurve(final Point point) {
    if (point instanceof Point.Affine affine) {
      return isFieldElement(affine.x())
          && isFieldElement(affine.y())
          && field.multiply(affine.y(), affine.y()).equals(params.rhs(field, affine.x()));
    }
    return true;
  }

  private boolean isFieldElement(final BigInteger value) {
    return value.signum() >= 0 && value.compareTo(field.p()) < 0;
  }

  /**
   * Rejects points that fail {@link #isOnCurve(Point)}. Externally supplied points must pass
   * through here before any arithmetic.
   *
   * @param point the point
   * @return the same point
   * @throws PointNotOnCurveException if the curve equation does not hold
   */
  public Point requireOnCurve(final Point point) {
    Objects.requireNonNull(point, "point");
    if (!isOnCurve(point)) {
      throw new PointNotOnCurveException(point);
    }
    return point;
  }

  public Point negate(final Point point) {
    if (point instanceof Point.Affine affine) {
      return new Point.Affine(affine.x(), field.subtract(BigInteger.ZERO, affine.y()));
    }
    return Point.IDENTITY;
  }

  /**
   * Group addition. Handles the identity on either side, mutual negatives (including doubling
   * a point with y = 0, whose tangent is vertical), secant addition and tangent doubling.
   *
   * @param p the left operand
   * @param q the right operand
   * @return p + q
   */
  public Point add(final Point p, final Point q) {
    if (!(p instanceof Point.Affine pa)) {
      return q;
    }
    if (!(q instanceof Point.Affine qa)) {
      return p;
    }
    if (pa.x().equals(qa.x()) && field.add(pa.y(), qa.y()).signum() == 0) {
      return Point.IDENTITY;
    }
    final BigInteger m;
    if (!pa.equals(qa)) {
      BigInteger dy = field.subtract(qa.y(), pa.y());
      BigInteger dx = field.subtract(qa.x(), pa.x());
      m = field.multiply(dy, field.inverse(dx));
    } else {
      BigInteger num = field.add(field.multiply(THREE, field.multiply(pa.x(), pa.x())), params.a());
      BigInteger den = field.multiply(BigInteger.TWO, pa.y());
      m = field.multiply(num, field.inverse(den));
    }
    BigInteger x3 = field.subtract(field.subtract(field.multiply(m, m), pa.x()), qa.x());
    BigInteger y3 = field.subtract(field.multiply(m, field.subtract(pa.x(), x3)), pa.y());
    return new Point.Affine(x3, y3);
  }

  public Point doublePoint(final Point point) {
    return add(point, point);
  }

  /**
   * Computes k*P by double-and-add from the low bit. k = 0 yields the identity.
   *
   * @param k     a non-negative scalar
   * @param point the point
   * @return k * point
   */
  public Point scalarMultiply(final BigInteger k, final Point point) {
    if (k.signum() < 0) {
      throw new IllegalArgumentException("Scalar must be non-negative: " + k);
    }
    Point result = Point.IDENTITY;
    Point addend = point;
    BigInteger remaining = k;
    while (remaining.signum() > 0) {
      if (remaining.testBit(0)) {
        result = add(result, addend);
      }
      addend = doublePoint(addend);
      remaining = remaining.shiftRight(1);
    }
    return result;
  }

  public Point scalarMultiplyGenerator(final BigInteger k) {
    return scalarMultiply(k, params.g());
  }

  /**
   * Checks the asserted order of G, i.e. that {@code n*G} is the identity. Only a necessary
   * condition: it does not prove n is the smallest such multiple. Never called implicitly.
   *
   * @return true when n*G is the identity
   */
  public boolean verifyGroupOrder() {
    return scalarMultiplyGenerator(params.n()).isIdentity();
  }
}
