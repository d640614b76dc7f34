package com.codeheadsystems.eccsim.exceptions;

import com.codeheadsystems.eccsim.curve.Point;

/**
 * Thrown when an externally supplied point does not satisfy the curve equation.
 */
public class PointNotOnCurveException extends EccSimException {

  private final Point point;

  /**
   * Instantiates a new Point not on curve exception.
   *
   * @param point the offending point
   */
  public PointNotOnCurveException(final Point point) {
    super("Point is not on the curve: " + point);
    this.point = point;
  }

  /**
   * The point that failed the curve check.
   *
   * @return the point
   */
  public Point point() {
    return point;
  }
}
