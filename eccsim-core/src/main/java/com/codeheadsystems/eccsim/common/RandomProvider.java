package com.codeheadsystems.eccsim.common;

import java.math.BigInteger;
import java.util.Random;

/**
 * Injectable source of randomness for scalar generation.
 *
 * <p>Wraps an ordinary {@link Random}, not a {@link java.security.SecureRandom}. Scalars drawn
 * here are predictable and must never be used as real keys.
 *
 * @param random the random source
 */
public record RandomProvider(Random random) {

  /**
   * Creates a RandomProvider with an unseeded {@link Random}.
   */
  public RandomProvider() {
    this(new Random());
  }

  /**
   * Creates a RandomProvider whose output is reproducible for a given seed.
   *
   * @param seed the seed
   * @return the random provider
   */
  public static RandomProvider seeded(final long seed) {
    return new RandomProvider(new Random(seed));
  }

  /**
   * Draws uniformly from [1, n-1].
   *
   * @param n the exclusive upper bound, at least 2
   * @return the scalar
   */
  public BigInteger randomScalar(final BigInteger n) {
    if (n.compareTo(BigInteger.TWO) < 0) {
      throw new IllegalArgumentException("Upper bound must be at least 2: " + n);
    }
    final BigInteger range = n.subtract(BigInteger.ONE);
    if (range.bitLength() < Integer.SIZE) {
      return BigInteger.valueOf(1L + random.nextInt(range.intValueExact()));
    }
    // Rejection sampling for ranges beyond int.
    BigInteger candidate;
    do {
      candidate = new BigInteger(range.bitLength(), random);
    } while (candidate.compareTo(range) >= 0);
    return candidate.add(BigInteger.ONE);
  }
}
