package com.codeheadsystems.eccsim.codec;

import com.codeheadsystems.eccsim.curve.Point;
import com.codeheadsystems.eccsim.exceptions.MalformedPointInputException;
import java.math.BigInteger;

/**
 * The {@code "x,y"} text form of a point, as typed into a C1 field. Parsing only checks the
 * syntax; whether the point is on a curve is up to {@link com.codeheadsystems.eccsim.curve.CurveGroup}.
 */
public class PointCodec {

  private static final String IDENTITY_TEXT = "identity";

  private PointCodec() {
  }

  /**
   * Parses {@code "x,y"} with optional whitespace around either coordinate. Coordinates are
   * decimal and must be non-negative. They are not reduced modulo p: {@code "97,10"} stays
   * {@code (97, 10)} and is then refused by {@link com.codeheadsystems.eccsim.curve.CurveGroup#requireOnCurve}.
   * The identity has no textual input form.
   *
   * @param text the text
   * @return the affine point
   * @throws MalformedPointInputException if the text is not two decimal integers
   */
  public static Point.Affine parse(final String text) {
    if (text == null || text.isBlank()) {
      throw new MalformedPointInputException("Point text is empty");
    }
    final String[] parts = text.split(",", -1);
    if (parts.length != 2) {
      throw new MalformedPointInputException("Expected \"x,y\" but got: " + text);
    }
    final BigInteger x = coordinate(parts[0], text);
    final BigInteger y = coordinate(parts[1], text);
    return new Point.Affine(x, y);
  }

  /**
   * Formats a point as {@code "x,y"}, or {@code "identity"} for the point at infinity.
   *
   * @param point the point
   * @return the text
   */
  public static String format(final Point point) {
    if (point instanceof Point.Affine affine) {
      return affine.x() + "," + affine.y();
    }
    return IDENTITY_TEXT;
  }

  private static BigInteger coordinate(final String part, final String text) {
    final String trimmed = part.trim();
    try {
      final BigInteger value = new BigInteger(trimmed);
      if (value.signum() < 0) {
        throw new MalformedPointInputException("Negative coordinate in: " + text);
      }
      return value;
    } catch (NumberFormatException e) {
      throw new MalformedPointInputException("Invalid coordinate \"" + trimmed + "\" in: " + text, e);
    }
  }
}
