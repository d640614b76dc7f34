package com.codeheadsystems.eccsim.agreement;

import com.codeheadsystems.eccsim.common.RandomProvider;
import com.codeheadsystems.eccsim.config.EccSimConfig;
import com.codeheadsystems.eccsim.curve.CurveGroup;
import com.codeheadsystems.eccsim.curve.Point;
import com.codeheadsystems.eccsim.exceptions.PointNotOnCurveException;
import com.codeheadsystems.eccsim.exceptions.ScalarOutOfRangeException;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diffie-Hellman style key agreement on the configured curve.
 *
 * <p>Both parties end up with the same point because {@code k*(d*G) = d*(k*G)}. The sender
 * computes {@code k*Q} and the receiver {@code d*C1}.
 */
public class KeyAgreement {

  private static final Logger log = LoggerFactory.getLogger(KeyAgreement.class);
  private static final long MASK_32 = 0xFFFFFFFFL;

  private final CurveGroup group;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Key agreement.
   *
   * @param config the config
   */
  public KeyAgreement(final EccSimConfig config) {
    log.info("KeyAgreement(p={}, n={})", config.curveParams().p(), config.curveParams().n());
    log.warn("Scalars come from java.util.Random. This is a teaching tool; do not use for real keys.");
    this.group = new CurveGroup(config.curveParams());
    this.randomProvider = config.randomProvider();
  }

  public CurveGroup group() {
    return group;
  }

  /**
   * Uniform scalar in [1, n-1] from a non-cryptographic source.
   *
   * @return the scalar
   */
  public BigInteger generatePrivateScalar() {
    return randomProvider.randomScalar(group.params().n());
  }

  /**
   * Fresh key pair from {@link #generatePrivateScalar()}.
   *
   * @return the key pair
   */
  public KeyPair generateKeyPair() {
    log.trace("generateKeyPair()");
    return keyPair(generatePrivateScalar());
  }

  /**
   * Key pair for a caller-chosen private scalar.
   *
   * @param privateScalar d in [1, n-1]
   * @return the key pair
   */
  public KeyPair keyPair(final BigInteger privateScalar) {
    return new KeyPair(privateScalar, derivePublicKey(privateScalar));
  }

  /**
   * Q = d*G.
   *
   * @param privateScalar d in [1, n-1]
   * @return the public point
   */
  public Point derivePublicKey(final BigInteger privateScalar) {
    validateScalar(privateScalar);
    return group.scalarMultiplyGenerator(privateScalar);
  }

  /**
   * Multiplies the other party's point by our scalar. The point is checked against the curve
   * first.
   *
   * @param scalar     our private or ephemeral scalar
   * @param otherPoint the other party's public or ephemeral point
   * @return the shared point
   * @throws ScalarOutOfRangeException if the scalar is outside [1, n-1]
   * @throws PointNotOnCurveException  if the point fails the curve equation
   */
  public Point deriveSharedSecret(final BigInteger scalar, final Point otherPoint) {
    validateScalar(scalar);
    group.requireOnCurve(otherPoint);
    return group.scalarMultiply(scalar, otherPoint);
  }

  /**
   * Keystream seed from a shared point: {@code x mod 2^32} as an unsigned value.
   *
   * <p>The identity maps to 0. That happens when the product of the two scalars is a multiple
   * of the order of G, and the resulting keystream is the same for every such pair.
   *
   * @param point the shared point
   * @return the seed in [0, 2^32)
   */
  public long seedFromPoint(final Point point) {
    if (point instanceof Point.Affine affine) {
      return affine.x().longValue() & MASK_32;
    }
    log.warn("Shared point is the identity; keystream seed collapses to 0");
    return 0L;
  }

  /**
   * Rejects scalars outside [1, n-1]. Nothing is clamped.
   *
   * @param scalar the scalar
   * @throws ScalarOutOfRangeException if out of range
   */
  public void validateScalar(final BigInteger scalar) {
    final BigInteger n = group.params().n();
    if (scalar == null || scalar.signum() <= 0 || scalar.compareTo(n) >= 0) {
      throw new ScalarOutOfRangeException(scalar, n);
    }
  }
}
