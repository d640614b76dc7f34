package com.codeheadsystems.eccsim.agreement;

import com.codeheadsystems.eccsim.curve.Point;
import java.math.BigInteger;

/**
 * A private scalar and its public point {@code Q = d*G}. Built by {@link KeyAgreement}, which
 * always derives Q from d.
 *
 * @param privateScalar the private scalar d in [1, n-1]
 * @param publicPoint   the public point Q
 */
public record KeyPair(BigInteger privateScalar, Point publicPoint) {

  @Override
  public String toString() {
    return "KeyPair[publicPoint=" + publicPoint + "]";
  }
}
