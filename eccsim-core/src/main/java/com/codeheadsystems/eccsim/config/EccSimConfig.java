package com.codeheadsystems.eccsim.config;

import com.codeheadsystems.eccsim.common.RandomProvider;
import com.codeheadsystems.eccsim.curve.CurveParams;
import java.util.Objects;

/**
 * Configuration passed into every manager: the curve and the random source.
 * There is no process-wide state; tests build their own instance.
 */
public record EccSimConfig(CurveParams curveParams, RandomProvider randomProvider) {

  /**
   * The toy curve with an unseeded random source.
   */
  public static final EccSimConfig DEFAULT = new EccSimConfig(CurveParams.TOY_CURVE, new RandomProvider());

  public EccSimConfig {
    Objects.requireNonNull(curveParams, "curveParams");
    Objects.requireNonNull(randomProvider, "randomProvider");
  }

  /**
   * Toy curve with a seeded random source, so generated scalars repeat between runs.
   */
  public static EccSimConfig forTesting(final long seed) {
    return new EccSimConfig(CurveParams.TOY_CURVE, RandomProvider.seeded(seed));
  }

  /**
   * Returns a new config identical to this one but using the given curve.
   */
  public EccSimConfig withCurveParams(final CurveParams params) {
    return new EccSimConfig(params, randomProvider);
  }

  /**
   * Returns a new config identical to this one but using the given {@link RandomProvider}.
   */
  public EccSimConfig withRandomProvider(final RandomProvider provider) {
    return new EccSimConfig(curveParams, provider);
  }
}
