package com.codeheadsystems.eccsim.ecies;

import com.codeheadsystems.eccsim.codec.HexCodec;
import com.codeheadsystems.eccsim.curve.Point;
import java.util.Arrays;
import java.util.Objects;

/**
 * What crosses the wire after encryption: the ephemeral point {@code C1 = k*G} and the
 * ciphertext. The ephemeral scalar itself is not part of it.
 *
 * @param c1         the ephemeral point
 * @param ciphertext the ciphertext bytes
 */
public record EncryptedMessage(Point c1, byte[] ciphertext) {

  public EncryptedMessage {
    Objects.requireNonNull(c1, "c1");
    ciphertext = ciphertext.clone();
  }

  @Override
  public byte[] ciphertext() {
    return ciphertext.clone();
  }

  /**
   * Ciphertext as lowercase hex.
   *
   * @return the hex string
   */
  public String ciphertextHex() {
    return HexCodec.encode(ciphertext);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EncryptedMessage that)) {
      return false;
    }
    return c1.equals(that.c1) && Arrays.equals(ciphertext, that.ciphertext);
  }

  @Override
  public int hashCode() {
    return 31 * c1.hashCode() + Arrays.hashCode(ciphertext);
  }

  @Override
  public String toString() {
    return "EncryptedMessage[c1=" + c1 + ", ciphertext=" + ciphertextHex() + "]";
  }
}
