package com.codeheadsystems.eccsim.curve;

import java.math.BigInteger;

/**
 * Curve statistics for display.
 *
 * @param pointCount number of affine points (identity excluded)
 * @param orderOfG   the asserted order of the base point
 * @param p          the field prime
 */
public record CurveSummary(int pointCount, BigInteger orderOfG, BigInteger p) {
}
