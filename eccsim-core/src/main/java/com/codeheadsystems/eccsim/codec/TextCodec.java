package com.codeheadsystems.eccsim.codec;

import java.nio.charset.StandardCharsets;

/**
 * UTF-8 text to bytes and back. Malformed byte sequences decode to U+FFFD replacement
 * characters rather than failing.
 */
public class TextCodec {

  private TextCodec() {
  }

  public static byte[] encode(final String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  public static String decode(final byte[] bytes) {
    return new String(bytes, StandardCharsets.UTF_8);
  }
}
