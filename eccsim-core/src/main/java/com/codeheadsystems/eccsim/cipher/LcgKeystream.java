package com.codeheadsystems.eccsim.cipher;

import com.codeheadsystems.eccsim.common.ByteUtils;

/**
 * Keystream from a 32-bit linear congruential generator
 * ({@code state = state * 1664525 + 1013904223 mod 2^32}), emitting the low byte of each new
 * state.
 *
 * <p>Deterministic and restartable. It is trivially predictable and not a secure keystream.
 */
public class LcgKeystream {

  static final long MULTIPLIER = 1664525L;
  static final long INCREMENT = 1013904223L;
  private static final long MASK_32 = 0xFFFFFFFFL;

  private LcgKeystream() {
  }

  /**
   * Generates {@code length} keystream bytes starting from {@code seed}.
   *
   * @param seed   unsigned 32-bit seed, in [0, 2^32)
   * @param length number of bytes
   * @return the keystream
   */
  public static byte[] generateKeystream(final long seed, final int length) {
    if (seed < 0 || seed > MASK_32) {
      throw new IllegalArgumentException("Seed must be an unsigned 32-bit value: " + seed);
    }
    if (length < 0) {
      throw new IllegalArgumentException("Length must be non-negative: " + length);
    }
    final byte[] out = new byte[length];
    long state = seed;
    for (int i = 0; i < length; i++) {
      // state < 2^32, so the product stays well inside a long.
      state = (state * MULTIPLIER + INCREMENT) & MASK_32;
      out[i] = (byte) (state & 0xFF);
    }
    return out;
  }

  /**
   * XORs the input with the keystream for {@code seed}. Encryption and decryption are the
   * same operation.
   *
   * @param seed  the seed
   * @param input plaintext or ciphertext
   * @return the transformed bytes
   */
  public static byte[] apply(final long seed, final byte[] input) {
    return ByteUtils.xor(input, generateKeystream(seed, input.length));
  }
}
