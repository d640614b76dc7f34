package com.codeheadsystems.eccsim.curve;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A point of the curve group: either an affine point or the identity (point at infinity).
 * Equality is structural, so two affine points are equal iff their coordinates are.
 */
public sealed interface Point permits Point.Affine, Point.Identity {

  /**
   * The group identity.
   */
  Point IDENTITY = new Identity();

  /**
   * Affine point factory.
   *
   * @param x the x coordinate
   * @param y the y coordinate
   * @return the point
   */
  static Affine of(final long x, final long y) {
    return new Affine(BigInteger.valueOf(x), BigInteger.valueOf(y));
  }

  /**
   * Is identity boolean.
   *
   * @return true for the point at infinity
   */
  default boolean isIdentity() {
    return this instanceof Identity;
  }

  /**
   * A point with coordinates. Being on a particular curve is not checked here; see
   * {@link CurveGroup#isOnCurve(Point)}.
   *
   * @param x the x coordinate
   * @param y the y coordinate
   */
  record Affine(BigInteger x, BigInteger y) implements Point {

    public Affine {
      Objects.requireNonNull(x, "x");
      Objects.requireNonNull(y, "y");
    }

    @Override
    public String toString() {
      return "(" + x + ", " + y + ")";
    }
  }

  /**
   * The point at infinity. Has no coordinates.
   */
  record Identity() implements Point {

    @Override
    public String toString() {
      return "Identity";
    }
  }
}
