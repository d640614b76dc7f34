package com.codeheadsystems.eccsim.curve;

import com.codeheadsystems.eccsim.field.PrimeField;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brute-force listing of the affine points on a curve, for visualizers.
 *
 * <p>This is O(p^2) and is only usable on toy-sized fields.
 */
public class CurveEnumerator {

  private static final Logger log = LoggerFactory.getLogger(CurveEnumerator.class);

  private CurveEnumerator() {
  }

  /**
   * Every affine (x, y) with {@code y^2 = x^3 + a*x + b (mod p)}, ordered by x then y. The
   * identity is never included since it has no coordinates.
   *
   * @param params the curve parameters; only p, a and b are used
   * @return an immutable, ordered list of points
   */
  public static List<Point.Affine> enumeratePoints(final CurveParams params) {
    log.trace("enumeratePoints(p={})", params.p());
    final PrimeField field = params.field();
    final List<Point.Affine> points = new ArrayList<>();
    for (BigInteger x = BigInteger.ZERO; x.compareTo(params.p()) < 0; x = x.add(BigInteger.ONE)) {
      final BigInteger rhs = params.rhs(field, x);
      for (BigInteger y = BigInteger.ZERO; y.compareTo(params.p()) < 0; y = y.add(BigInteger.ONE)) {
        if (field.multiply(y, y).equals(rhs)) {
          points.add(new Point.Affine(x, y));
        }
      }
    }
    log.debug("Enumerated {} affine points for p={}", points.size(), params.p());
    return List.copyOf(points);
  }

  /**
   * The headline numbers shown next to a curve plot.
   *
   * @param params the curve parameters
   * @return the summary
   */
  public static CurveSummary summarize(final CurveParams params) {
    return new CurveSummary(enumeratePoints(params).size(), params.n(), params.p());
  }
}
