package com.codeheadsystems.eccsim.codec;

import com.codeheadsystems.eccsim.exceptions.MalformedHexInputException;
import java.util.regex.Pattern;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bytes to lowercase hex and back.
 *
 * <p>Decoding is lenient about separators: every character that is not a hex digit is removed
 * first, so {@code "de:ad be-ef"} decodes like {@code "deadbeef"}. What remains must hold an
 * even number of digits. An odd count is rejected with {@link MalformedHexInputException}
 * instead of dropping the dangling digit.
 */
public class HexCodec {

  private static final Logger log = LoggerFactory.getLogger(HexCodec.class);
  private static final Pattern NON_HEX = Pattern.compile("[^0-9a-fA-F]");

  private HexCodec() {
  }

  /**
   * Two lowercase hex characters per byte, no separators.
   *
   * @param bytes the bytes
   * @return the hex string
   */
  public static String encode(final byte[] bytes) {
    return Hex.toHexString(bytes);
  }

  /**
   * Strips non-hex characters, then decodes digit pairs.
   *
   * @param text the hex text
   * @return the decoded bytes
   * @throws MalformedHexInputException if an odd number of hex digits remains
   */
  public static byte[] decode(final String text) {
    final String clean = NON_HEX.matcher(text).replaceAll("");
    if (clean.length() != text.length()) {
      log.debug("decode: stripped {} non-hex characters", text.length() - clean.length());
    }
    if (clean.length() % 2 != 0) {
      throw new MalformedHexInputException(
          "Hex input has an odd number of hex digits (" + clean.length() + ") after stripping non-hex characters");
    }
    return Hex.decode(clean);
  }
}
