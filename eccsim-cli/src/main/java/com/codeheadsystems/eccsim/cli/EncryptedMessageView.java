package com.codeheadsystems.eccsim.cli;

import com.codeheadsystems.eccsim.codec.PointCodec;
import com.codeheadsystems.eccsim.ecies.EncryptedMessage;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON shape of an encrypted message as printed by {@code encrypt --json}.
 *
 * @param c1         the ephemeral point as "x,y"
 * @param ciphertext the ciphertext as lowercase hex
 */
public record EncryptedMessageView(@JsonProperty("c1") String c1,
                                   @JsonProperty("ciphertext") String ciphertext) {

  public static EncryptedMessageView of(final EncryptedMessage message) {
    return new EncryptedMessageView(PointCodec.format(message.c1()), message.ciphertextHex());
  }
}
