package com.codeheadsystems.eccsim.common;

/**
 * Byte array helpers shared by the cipher layer.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * XOR two byte arrays of equal length. Applying the same right-hand side twice returns
   * the left-hand side.
   *
   * @param a the a
   * @param b the b
   * @return a new array holding a[i] ^ b[i]
   */
  public static byte[] xor(byte[] a, byte[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException("XOR arrays must have equal length: " + a.length + " vs " + b.length);
    }
    byte[] out = new byte[a.length];
    for (int i = 0; i < a.length; i++) {
      out[i] = (byte) (a[i] ^ b[i]);
    }
    return out;
  }
}
